// File: src/main/java/org/lokray/sinter/util/Severity.java
package org.lokray.sinter.util;

public enum Severity
{
	ERROR("Error"),
	WARNING("Warning");

	private final String label;

	Severity(String label)
	{
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}
}
