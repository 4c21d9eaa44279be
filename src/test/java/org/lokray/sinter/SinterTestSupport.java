package org.lokray.sinter;

import org.lokray.sinter.util.CompilerConfig;
import org.lokray.sinter.util.Diagnostic;
import org.lokray.sinter.util.DiagnosticCode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared helpers for tests that drive the whole pipeline from source text.
 */
public final class SinterTestSupport
{
	private SinterTestSupport()
	{
	}

	public static CompilationResult compile(String... lines)
	{
		return new SinterCompiler(new CompilerConfig()).compile(String.join("\n", lines));
	}

	public static List<DiagnosticCode> errorCodes(CompilationResult result)
	{
		return result.getDiagnostics().stream()
				.filter(Diagnostic::isError)
				.map(Diagnostic::getCode)
				.collect(Collectors.toList());
	}

	public static List<DiagnosticCode> warningCodes(CompilationResult result)
	{
		return result.getDiagnostics().stream()
				.filter(d -> !d.isError())
				.map(Diagnostic::getCode)
				.collect(Collectors.toList());
	}
}
