// File: src/main/java/org/lokray/sinter/util/Debug.java
package org.lokray.sinter.util;

public class Debug
{
	/**
	 * Master switch for all debug logging. Off unless configuration turns it on.
	 */
	private static volatile boolean enabled = false;

	private static int indentLevel = 0;

	public static boolean isEnabled()
	{
		return enabled;
	}

	public static void setEnabled(boolean value)
	{
		enabled = value;
		indentLevel = 0;
	}

	/**
	 * Logs a formatted message if debugging is enabled.
	 *
	 * @param format The message format string (e.g., "Resolved class: %s").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (enabled)
		{
			String indent = "  ".repeat(indentLevel);
			System.out.println("[DEBUG] " + indent + String.format(format, args));
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages.
	 */
	public static void indent()
	{
		if (enabled)
		{
			indentLevel++;
		}
	}

	/**
	 * Decreases the indentation level for subsequent log messages.
	 */
	public static void dedent()
	{
		if (enabled)
		{
			indentLevel = Math.max(0, indentLevel - 1);
		}
	}
}
