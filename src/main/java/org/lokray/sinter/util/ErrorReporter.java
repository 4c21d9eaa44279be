// File: src/main/java/org/lokray/sinter/util/ErrorReporter.java
package org.lokray.sinter.util;

import org.lokray.sinter.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one compilation. Stages keep reporting after the first error so the
 * user sees everything a stage can find; the pipeline consults {@link #hasErrors()} between stages.
 */
public class ErrorReporter
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private final boolean echo; // Print each diagnostic to stderr as it arrives
	private int errorCount = 0;

	public ErrorReporter()
	{
		this(false);
	}

	public ErrorReporter(boolean echo)
	{
		this.echo = echo;
	}

	/**
	 * Reports an error at the given token.
	 */
	public void error(DiagnosticCode code, Token token, String message)
	{
		report(Severity.ERROR, code, SourceSpan.of(token), message);
	}

	public void error(DiagnosticCode code, SourceSpan span, String message)
	{
		report(Severity.ERROR, code, span, message);
	}

	public void warning(DiagnosticCode code, Token token, String message)
	{
		report(Severity.WARNING, code, SourceSpan.of(token), message);
	}

	public void report(Severity severity, DiagnosticCode code, SourceSpan span, String message)
	{
		Diagnostic diagnostic = new Diagnostic(severity, code, message, span);
		diagnostics.add(diagnostic);
		if (severity == Severity.ERROR)
		{
			errorCount++;
		}
		if (echo)
		{
			System.err.println(diagnostic);
		}
		Debug.log("%s", diagnostic);
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public List<Diagnostic> getErrors()
	{
		return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
	}

	public List<Diagnostic> getWarnings()
	{
		return diagnostics.stream().filter(d -> !d.isError()).collect(Collectors.toList());
	}

	public List<Diagnostic> byCode(DiagnosticCode code)
	{
		return diagnostics.stream().filter(d -> d.getCode() == code).collect(Collectors.toList());
	}

	public String summary()
	{
		int warnings = diagnostics.size() - errorCount;
		return errorCount + " error(s), " + warnings + " warning(s)";
	}
}
