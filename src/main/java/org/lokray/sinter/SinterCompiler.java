// File: src/main/java/org/lokray/sinter/SinterCompiler.java
package org.lokray.sinter;

import org.lokray.sinter.ast.Program;
import org.lokray.sinter.codegen.CodegenException;
import org.lokray.sinter.codegen.IRGenerator;
import org.lokray.sinter.lexer.Lexer;
import org.lokray.sinter.lexer.Token;
import org.lokray.sinter.parser.SinterParser;
import org.lokray.sinter.semantics.ScopeResolver;
import org.lokray.sinter.semantics.SemanticModel;
import org.lokray.sinter.semantics.TypeChecker;
import org.lokray.sinter.semantics.annotations.AnnotationProcessor;
import org.lokray.sinter.semantics.flow.PointerCleanupValidator;
import org.lokray.sinter.util.CompilerConfig;
import org.lokray.sinter.util.Debug;
import org.lokray.sinter.util.DiagnosticCode;
import org.lokray.sinter.util.ErrorReporter;
import org.lokray.sinter.util.SourceSpan;

import java.util.List;

/**
 * Runs the stages in order and stops before the next one as soon as any error has been reported.
 */
public class SinterCompiler
{
	private final CompilerConfig config;

	public SinterCompiler(CompilerConfig config)
	{
		this.config = config;
		Debug.setEnabled(config.isDebugEnabled());
	}

	public CompilationResult compile(String source)
	{
		ErrorReporter errorReporter = new ErrorReporter();
		SemanticModel model = new SemanticModel();

		Debug.log("--- Lexing ---");
		List<Token> tokens = new Lexer(source, errorReporter).scanTokens();
		if (errorReporter.hasErrors())
		{
			return stop(errorReporter, null, model, "lexing");
		}

		Debug.log("--- Parsing ---");
		Program program = new SinterParser(tokens, errorReporter).parse();
		if (program == null || errorReporter.hasErrors())
		{
			return stop(errorReporter, program, model, "parsing");
		}

		Debug.log("--- Scope resolution ---");
		new ScopeResolver(errorReporter, model).resolve(program);
		if (errorReporter.hasErrors())
		{
			return stop(errorReporter, program, model, "scope resolution");
		}

		Debug.log("--- Type checking ---");
		new TypeChecker(errorReporter, model).check(program);
		if (errorReporter.hasErrors())
		{
			return stop(errorReporter, program, model, "type checking");
		}

		Debug.log("--- Annotation processing ---");
		new AnnotationProcessor(errorReporter, model).process(program);
		if (errorReporter.hasErrors())
		{
			return stop(errorReporter, program, model, "annotation processing");
		}

		Debug.log("--- Pointer cleanup validation ---");
		new PointerCleanupValidator(errorReporter, model).validate(program);
		if (errorReporter.hasErrors())
		{
			return stop(errorReporter, program, model, "cleanup validation");
		}

		Debug.log("--- Code generation ---");
		String ir;
		try
		{
			ir = new IRGenerator(model, config).generate(program);
		}
		catch (CodegenException e)
		{
			errorReporter.error(DiagnosticCode.CODEGEN, SourceSpan.UNKNOWN, e.getMessage());
			return stop(errorReporter, program, model, "code generation");
		}
		Debug.log("Compilation succeeded with %d warning(s)", errorReporter.getWarnings().size());
		return new CompilationResult(errorReporter.getDiagnostics(), program, model, ir);
	}

	private static CompilationResult stop(ErrorReporter errorReporter, Program program, SemanticModel model, String stage)
	{
		Debug.log("Stopping after %s: %s", stage, errorReporter.summary());
		return new CompilationResult(errorReporter.getDiagnostics(), program, model, null);
	}
}
