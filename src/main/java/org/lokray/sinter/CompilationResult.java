// File: src/main/java/org/lokray/sinter/CompilationResult.java
package org.lokray.sinter;

import org.lokray.sinter.ast.Program;
import org.lokray.sinter.semantics.SemanticModel;
import org.lokray.sinter.util.Diagnostic;
import org.lokray.sinter.util.Severity;

import java.util.List;

/**
 * What one run of {@link SinterCompiler} produced. The IR is null when errors stopped the pipeline.
 */
public class CompilationResult
{
	private final List<Diagnostic> diagnostics;
	private final Program program;
	private final SemanticModel model;
	private final String ir;

	CompilationResult(List<Diagnostic> diagnostics, Program program, SemanticModel model, String ir)
	{
		this.diagnostics = List.copyOf(diagnostics);
		this.program = program;
		this.model = model;
		this.ir = ir;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	public boolean hasErrors()
	{
		return diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
	}

	public Program getProgram()
	{
		return program;
	}

	public SemanticModel getModel()
	{
		return model;
	}

	public String getIr()
	{
		return ir;
	}

	public boolean isSuccess()
	{
		return ir != null && !hasErrors();
	}
}
