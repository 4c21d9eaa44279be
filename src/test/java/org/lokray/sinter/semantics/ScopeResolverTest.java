package org.lokray.sinter.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.sinter.CompilationResult;
import org.lokray.sinter.util.DiagnosticCode;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.sinter.SinterTestSupport.compile;
import static org.lokray.sinter.SinterTestSupport.errorCodes;

@Tag("unit")
class ScopeResolverTest
{
	@Test
	void reportsUndefinedIdentifierAndType()
	{
		// Act
		CompilationResult result = compile(
				"function f() -> int {",
				"    var p: Missing* = null;",
				"    return y;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsOnly(DiagnosticCode.UNRESOLVED_REFERENCE);
		assertThat(result.getDiagnostics()).extracting(d -> d.getMessage())
				.anyMatch(m -> m.contains("Missing"))
				.anyMatch(m -> m.contains("y"));
		assertThat(result.getIr()).isNull();
	}

	@Test
	void reportsDuplicateFunctionSignature()
	{
		// Act
		CompilationResult result = compile(
				"function f(a: int) -> int { return a; }",
				"function f(b: int) -> int { return b; }");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.DUPLICATE_DECLARATION);
	}

	@Test
	void reportsDuplicateLocalInSameScope()
	{
		// Act
		CompilationResult result = compile(
				"function f() {",
				"    var a = 1;",
				"    var a = 2;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.DUPLICATE_DECLARATION);
	}

	@Test
	void reportsCyclicInheritance()
	{
		// Act
		CompilationResult result = compile(
				"class A extends B { }",
				"class B extends A { }");

		// Assert
		assertThat(errorCodes(result)).contains(DiagnosticCode.CYCLIC_INHERITANCE);
	}

	@Test
	void rejectsRuntimeReservedFunctionNames()
	{
		// Act
		CompilationResult result = compile(
				"function malloc(n: int) -> int { return n; }",
				"function sinter_helper() { }");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.DUPLICATE_DECLARATION, DiagnosticCode.DUPLICATE_DECLARATION);
	}

	@Test
	void manglesOnlyOverloadedNames()
	{
		// Act
		CompilationResult result = compile(
				"function add(a: int, b: int) -> int { return a + b; }",
				"function add(a: double, b: double) -> double { return a + b; }",
				"function single(n: int) -> int { return n; }");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		SemanticModel model = result.getModel();
		assertThat(model.getFunctions("add").getFunctions().stream().map(MethodSymbol::getMangledName).collect(Collectors.toList()))
				.containsExactlyInAnyOrder("add.int.int", "add.double.double");
		assertThat(model.getFunctions("single").getFunctions().get(0).getMangledName()).isEqualTo("single");
	}

	@Test
	void resolvesFieldsThroughSuperclassAndSynthesizesAccessors()
	{
		// Act
		CompilationResult result = compile(
				"class Base {",
				"protected:",
				"    @attribute var count: int = 3;",
				"}",
				"class Derived extends Base {",
				"public:",
				"    method twice() -> int { return count * 2; }",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		ClassSymbol base = result.getModel().getClass("Base");
		assertThat(base.getOwnMethods("getCount")).hasSize(1);
		assertThat(base.getOwnMethods("setCount")).hasSize(1);
		assertThat(base.getOwnMethods("getCount").get(0).isSynthesized()).isTrue();
		assertThat(result.getModel().getClass("Derived").resolveField("count")).isNotNull();
	}

	@Test
	void rejectsClassContainingItselfByValue()
	{
		// Act
		CompilationResult result = compile(
				"class Loop {",
				"    var inner: Loop;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.TYPE_MISMATCH);
	}

	@Test
	void hidesForInductionVariableAfterLoop()
	{
		// Act
		CompilationResult result = compile(
				"function f() -> int {",
				"    var total = 0;",
				"    for (var i = 0; i < 3; i++) {",
				"        total += i;",
				"    }",
				"    return i;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNRESOLVED_REFERENCE);
		assertThat(result.getDiagnostics()).extracting(d -> d.getMessage()).anyMatch(m -> m.contains("'i'"));
	}

	@Test
	void allowsShadowingInNestedBlock()
	{
		// Act
		CompilationResult result = compile(
				"function f(flag: boolean) -> int {",
				"    var x = 1;",
				"    if (flag) {",
				"        var x = 2;",
				"        x = x + 1;",
				"    }",
				"    while (flag) {",
				"        var x = 3;",
				"        break;",
				"    }",
				"    return x;",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
	}

	@Test
	void reportsDuplicateInSameBlockEvenWhenOuterScopeHasName()
	{
		// Act
		CompilationResult result = compile(
				"function f(flag: boolean) {",
				"    var x = 1;",
				"    if (flag) {",
				"        var x = 2;",
				"        var x = 3;",
				"    }",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.DUPLICATE_DECLARATION);
	}

	@Test
	void prefersEnclosingClassFieldOverTopLevelName()
	{
		// Act
		CompilationResult result = compile(
				"function total() -> int { return 1; }",
				"class Meter {",
				"public:",
				"    var total: double = 2.5;",
				"    method doubled() -> double { return total * 2.0; }",
				"}",
				"function outside() -> int { return total(); }");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		assertThat(result.getIr()).contains("define double @Meter.doubled(ptr %this)");
	}

	@Test
	void prefersLocalOverEnclosingClassField()
	{
		// Act
		CompilationResult result = compile(
				"class Meter {",
				"public:",
				"    var total: double = 2.5;",
				"    method label() -> str {",
				"        var total = \"local\";",
				"        return total;",
				"    }",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
	}
}
