package org.lokray.sinter.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.sinter.ast.Program;
import org.lokray.sinter.ast.declarations.ClassDeclaration;
import org.lokray.sinter.ast.declarations.FieldDeclaration;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.declarations.InterfaceDeclaration;
import org.lokray.sinter.ast.declarations.MethodDeclaration;
import org.lokray.sinter.ast.declarations.Visibility;
import org.lokray.sinter.ast.expressions.BinaryExpression;
import org.lokray.sinter.ast.expressions.CallExpression;
import org.lokray.sinter.ast.expressions.DStringExpression;
import org.lokray.sinter.ast.expressions.DotExpression;
import org.lokray.sinter.ast.statements.ReturnStatement;
import org.lokray.sinter.ast.statements.VariableDeclarationStatement;
import org.lokray.sinter.lexer.Lexer;
import org.lokray.sinter.lexer.TokenType;
import org.lokray.sinter.util.DiagnosticCode;
import org.lokray.sinter.util.ErrorReporter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SinterParserTest
{
	private ErrorReporter reporter;

	private Program parse(String... lines)
	{
		reporter = new ErrorReporter();
		return new SinterParser(new Lexer(String.join("\n", lines), reporter).scanTokens(), reporter).parse();
	}

	@Test
	void parsesClassWithSectionsAnnotationsAndMethods()
	{
		// Arrange & Act
		Program program = parse(
				"class Point extends Shape implements Printable, Comparable {",
				"    var hidden: int;",
				"public:",
				"    @attribute(read_only, serializable=true) var x: int = 1;",
				"    method norm() -> int { return x * x; }",
				"    function origin() -> Point* { return Point.new(); }",
				"}");

		// Assert
		assertThat(reporter.hasErrors()).isFalse();
		ClassDeclaration point = program.getClasses().get(0);
		assertThat(point.getSuperclassName().getLexeme()).isEqualTo("Shape");
		assertThat(point.getInterfaceNames()).extracting(t -> t.getLexeme()).containsExactly("Printable", "Comparable");

		FieldDeclaration hidden = point.getFields().get(0);
		FieldDeclaration x = point.getFields().get(1);
		assertThat(hidden.getVisibility()).isEqualTo(Visibility.PRIVATE);
		assertThat(x.getVisibility()).isEqualTo(Visibility.PUBLIC);
		assertThat(x.getAnnotation().isSet("read_only")).isTrue();
		assertThat(x.getAnnotation().isSet("serializable")).isTrue();
		assertThat(x.getAnnotation().isSet("derived")).isFalse();

		MethodDeclaration norm = point.getMethods().get(0);
		MethodDeclaration origin = point.getMethods().get(1);
		assertThat(norm.isStatic()).isFalse();
		assertThat(origin.isStatic()).isTrue();
		assertThat(origin.getReturnType().getPointerDepth()).isEqualTo(1);
	}

	@Test
	void parsesInterfaceSignaturesWithImplicitVoid()
	{
		// Arrange & Act
		Program program = parse(
				"interface Shape extends Named {",
				"    method area() -> double;",
				"    method scale(factor: double);",
				"}");

		// Assert
		assertThat(reporter.hasErrors()).isFalse();
		InterfaceDeclaration shape = program.getInterfaces().get(0);
		assertThat(shape.getSuperInterfaceNames()).extracting(t -> t.getLexeme()).containsExactly("Named");
		assertThat(shape.getMethods()).hasSize(2);
		assertThat(shape.getMethods().get(1).getReturnType().getBaseName()).isEqualTo("void");
		assertThat(shape.getMethods().get(1).getBody()).isNull();
	}

	@Test
	void honoursOperatorPrecedence()
	{
		// Arrange & Act
		Program program = parse("function f() -> boolean { return 1 + 2 * 3 == 7 && true; }");

		// Assert
		ReturnStatement ret = (ReturnStatement) program.getFunctions().get(0).getBody().getStatements().get(0);
		BinaryExpression and = (BinaryExpression) ret.getValue();
		assertThat(and.getOperator().getType()).isEqualTo(TokenType.AMPERSAND_AMPERSAND);
		BinaryExpression equality = (BinaryExpression) and.getLeft();
		assertThat(equality.getOperator().getType()).isEqualTo(TokenType.EQUAL_EQUAL);
		BinaryExpression sum = (BinaryExpression) equality.getLeft();
		assertThat(sum.getOperator().getType()).isEqualTo(TokenType.PLUS);
		assertThat(((BinaryExpression) sum.getRight()).getOperator().getType()).isEqualTo(TokenType.STAR);
	}

	@Test
	void parsesBuiltinCallsAsMemberCalls()
	{
		// Arrange & Act
		Program program = parse(
				"function f() {",
				"    var p = Point.from_json(\"{}\");",
				"    p.clean();",
				"}");

		// Assert
		FunctionDeclaration f = program.getFunctions().get(0);
		VariableDeclarationStatement declaration = (VariableDeclarationStatement) f.getBody().getStatements().get(0);
		CallExpression call = (CallExpression) declaration.getInitializer();
		assertThat(call.getCallee()).isInstanceOf(DotExpression.class);
		assertThat(((DotExpression) call.getCallee()).getMemberName()).isEqualTo("from_json");
		assertThat(call.getArguments()).hasSize(1);
	}

	@Test
	void splitsDStringIntoTextAndPlaceholders()
	{
		// Arrange & Act
		Program program = parse("function f() { var s = D\"a {x} b {{literal}} {y}\"; }");

		// Assert
		VariableDeclarationStatement declaration = (VariableDeclarationStatement) program.getFunctions().get(0).getBody().getStatements().get(0);
		DStringExpression dstring = (DStringExpression) declaration.getInitializer();
		assertThat(dstring.getParts()).filteredOn(DStringExpression.Part::isPlaceholder)
				.extracting(DStringExpression.Part::getText)
				.containsExactly("x", "y");
		assertThat(dstring.getParts()).filteredOn(p -> !p.isPlaceholder())
				.extracting(DStringExpression.Part::getText)
				.anyMatch(text -> text.contains("{literal}"));
	}

	@Test
	void recoversAndReportsSeveralSyntaxErrors()
	{
		// Arrange & Act
		Program program = parse(
				"function broken() {",
				"    var = 3;",
				"    return 1 +;",
				"}",
				"function fine() -> int { return 2; }");

		// Assert
		assertThat(reporter.getErrors()).hasSizeGreaterThanOrEqualTo(2);
		assertThat(reporter.getErrors()).allMatch(d -> d.getCode() == DiagnosticCode.SYNTAX);
		assertThat(program.getFunctions()).extracting(fn -> fn.getNameToken().getLexeme()).contains("fine");
	}
}
