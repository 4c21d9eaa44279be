// File: src/main/java/org/lokray/sinter/util/Diagnostic.java
package org.lokray.sinter.util;

import java.util.Objects;

/**
 * A single compiler message with severity, code and source span.
 */
public final class Diagnostic
{
	private final Severity severity;
	private final DiagnosticCode code;
	private final String message;
	private final SourceSpan span;

	public Diagnostic(Severity severity, DiagnosticCode code, String message, SourceSpan span)
	{
		this.severity = Objects.requireNonNull(severity);
		this.code = Objects.requireNonNull(code);
		this.message = Objects.requireNonNull(message);
		this.span = span != null ? span : SourceSpan.UNKNOWN;
	}

	public Severity getSeverity()
	{
		return severity;
	}

	public DiagnosticCode getCode()
	{
		return code;
	}

	public String getMessage()
	{
		return message;
	}

	public SourceSpan getSpan()
	{
		return span;
	}

	public boolean isError()
	{
		return severity == Severity.ERROR;
	}

	@Override
	public String toString()
	{
		return String.format("[%s] Line %d, Column %d: %s: %s",
				severity.getLabel(), span.getLine(), span.getColumn(), code.getKind(), message);
	}
}
