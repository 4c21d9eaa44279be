// File: src/main/java/org/lokray/sinter/codegen/StringPool.java
package org.lokray.sinter.codegen;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interns string constants as private {@code @.str.N} globals. Equal texts share one global.
 */
class StringPool
{
	private final Map<String, String> names = new LinkedHashMap<>();

	String intern(String text)
	{
		return names.computeIfAbsent(text, t -> "@.str." + names.size());
	}

	void emit(StringBuilder out)
	{
		for (Map.Entry<String, String> entry : names.entrySet())
		{
			byte[] bytes = entry.getKey().getBytes(StandardCharsets.UTF_8);
			out.append(entry.getValue()).append(" = private unnamed_addr constant [").append(bytes.length + 1)
					.append(" x i8] c\"").append(escape(bytes)).append("\\00\"\n");
		}
	}

	static String escape(byte[] bytes)
	{
		StringBuilder sb = new StringBuilder();
		for (byte b : bytes)
		{
			int c = b & 0xFF;
			if (c >= 0x20 && c < 0x7F && c != '"' && c != '\\')
			{
				sb.append((char) c);
			}
			else
			{
				sb.append('\\').append(String.format("%02X", c));
			}
		}
		return sb.toString();
	}
}
