// File: src/main/java/org/lokray/sinter/semantics/ErrorType.java
package org.lokray.sinter.semantics;

/**
 * Placeholder type for expressions that already produced a diagnostic. Compatible with everything so one
 * mistake is reported once.
 */
public final class ErrorType extends Type
{
	public static final ErrorType INSTANCE = new ErrorType();

	private ErrorType()
	{
		super("<error>");
	}

	@Override
	public boolean isNumeric()
	{
		return true;
	}

	@Override
	public boolean isError()
	{
		return true;
	}
}
