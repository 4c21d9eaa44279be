package org.lokray.sinter.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.sinter.CompilationResult;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.expressions.CallExpression;
import org.lokray.sinter.ast.statements.ExpressionStatement;
import org.lokray.sinter.ast.statements.VariableDeclarationStatement;
import org.lokray.sinter.util.DiagnosticCode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.sinter.SinterTestSupport.compile;
import static org.lokray.sinter.SinterTestSupport.errorCodes;

@Tag("unit")
class TypeCheckerTest
{
	@Test
	void rejectsMismatchedInitializers()
	{
		// Act
		CompilationResult result = compile(
				"function f() {",
				"    var a: int = \"text\";",
				"    var b: double = 1;",
				"    var c: boolean = 1 + 2.5;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsOnly(DiagnosticCode.TYPE_MISMATCH);
		assertThat(errorCodes(result)).hasSizeGreaterThanOrEqualTo(3);
	}

	@Test
	void reportsMissingReturnOnSomePath()
	{
		// Act
		CompilationResult result = compile(
				"function sign(a: int) -> int {",
				"    if (a > 0) { return 1; }",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.MISSING_RETURN);
	}

	@Test
	void acceptsReturnOnEveryBranch()
	{
		// Act
		CompilationResult result = compile(
				"function sign(a: int) -> int {",
				"    if (a > 0) { return 1; } else if (a < 0) { return -1; } else { return 0; }",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
	}

	@Test
	void reportsAccessToPrivateField()
	{
		// Act
		CompilationResult result = compile(
				"class Account {",
				"    var secret: int;",
				"}",
				"function peek(a: Account*) -> int {",
				"    return a.secret;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.INACCESSIBLE_MEMBER);
	}

	@Test
	void reportsIncompleteInterfaceImplementation()
	{
		// Act
		CompilationResult result = compile(
				"interface Shape {",
				"    method area() -> double;",
				"    method name() -> str;",
				"}",
				"class Square implements Shape {",
				"public:",
				"    method area() -> int { return 4; }",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.INTERFACE_CONFORMANCE, DiagnosticCode.INTERFACE_CONFORMANCE);
	}

	@Test
	void reportsBreakOutsideLoop()
	{
		// Act
		CompilationResult result = compile(
				"function f() {",
				"    break;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.TYPE_MISMATCH);
		assertThat(result.getDiagnostics().get(0).getMessage()).contains("'break'");
	}

	@Test
	void reportsUnknownMethod()
	{
		// Act
		CompilationResult result = compile(
				"class Point { }",
				"function f() {",
				"    var p = Point.new();",
				"    p.vanish();",
				"    p.clean();",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNDEFINED_METHOD);
	}

	@Test
	void marksDStringLocalsAndRecordsCallTargets()
	{
		// Act
		CompilationResult result = compile(
				"class Point { }",
				"function f() {",
				"    var n = 1;",
				"    var label = D\"n is {n}\";",
				"    var p = Point.new();",
				"    p.clean();",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		SemanticModel model = result.getModel();
		FunctionDeclaration f = result.getProgram().getFunctions().get(0);
		VariableDeclarationStatement label = (VariableDeclarationStatement) f.getBody().getStatements().get(1);
		VariableDeclarationStatement p = (VariableDeclarationStatement) f.getBody().getStatements().get(2);
		ExpressionStatement clean = (ExpressionStatement) f.getBody().getStatements().get(3);

		assertThat(model.getVariable(label).isDynamicString()).isTrue();
		assertThat(model.getVariable(label).getType()).isEqualTo(PrimitiveType.STR);
		assertThat(model.getCallTarget((CallExpression) p.getInitializer()).getKind()).isEqualTo(CallTarget.Kind.NEW);
		assertThat(model.getCallTarget((CallExpression) clean.getExpression()).getKind()).isEqualTo(CallTarget.Kind.CLEAN);
		assertThat(model.getType(p.getInitializer())).isEqualTo(model.getClass("Point").getPointerType());
	}
}
