package org.lokray.sinter.semantics.flow;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.sinter.CompilationResult;
import org.lokray.sinter.util.DiagnosticCode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.sinter.SinterTestSupport.compile;
import static org.lokray.sinter.SinterTestSupport.errorCodes;

@Tag("unit")
class PointerCleanupValidatorTest
{
	private static final String NODE = "class Node { public: var value: int; }";

	@Test
	void acceptsPointerCleanedOnEveryPath()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function f(flag: boolean) {",
				"    var n = Node.new();",
				"    if (flag) {",
				"        n.clean();",
				"    } else {",
				"        n.value = 2;",
				"        n.clean();",
				"    }",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		assertThat(result.isSuccess()).isTrue();
	}

	@Test
	void reportsPointerLeakedOnOneBranch()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function f(flag: boolean) {",
				"    var n = Node.new();",
				"    if (flag) {",
				"        n.clean();",
				"    }",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNRELEASED_POINTER);
		assertThat(result.getDiagnostics().get(0).getMessage()).contains("'n'").contains("line 3");
	}

	@Test
	void reportsDiscardedAllocation()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function f() {",
				"    Node.new();",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNRELEASED_POINTER);
	}

	@Test
	void reportsUseAfterRelease()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function f() -> int {",
				"    var n = Node.new();",
				"    n.clean();",
				"    return n.value;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.USE_AFTER_RELEASE);
	}

	@Test
	void reportsDoubleRelease()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function f() {",
				"    var n = Node.new();",
				"    n.clean();",
				"    n.clean();",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.DOUBLE_RELEASE);
	}

	@Test
	void reportsReleaseOfBorrowedParameter()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function f(n: Node*) {",
				"    n.clean();",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.RELEASE_OF_UNOWNED);
	}

	@Test
	void transfersOwnershipThroughRelease()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function make() -> Node* {",
				"    var n = Node.new();",
				"    n.value = 7;",
				"    return n.release();",
				"}",
				"function main() {",
				"    var m = make();",
				"    print(m.value);",
				"    m.clean();",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
	}

	@Test
	void reportsOwnedPointerReturnedWithoutRelease()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function make() -> Node* {",
				"    var n = Node.new();",
				"    return n;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNRELEASED_POINTER);
	}

	@Test
	void reportsResultOfOwningFunctionThatIsNeverCleaned()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function make() -> Node* {",
				"    return Node.new();",
				"}",
				"function main() {",
				"    var m = make();",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNRELEASED_POINTER);
	}

	@Test
	void requiresCleanHookToReleasePointerFields()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"class Pair {",
				"    var left: Node*;",
				"    var right: Node*;",
				"public:",
				"    method clean() {",
				"        left.clean();",
				"    }",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNRELEASED_POINTER);
		assertThat(result.getDiagnostics().get(0).getMessage()).contains("Field 'right'");
	}

	@Test
	void tracksOwnershipAcrossLoopIterations()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function f() {",
				"    for (var i = 0; i < 3; i++) {",
				"        var n = Node.new();",
				"        n.clean();",
				"    }",
				"    while (true) {",
				"        var leaked = Node.new();",
				"        break;",
				"    }",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNRELEASED_POINTER);
		assertThat(result.getDiagnostics().get(0).getMessage()).contains("'leaked'");
	}

	@Test
	void reportsEachLeakingSiteOnceAcrossSeveralExits()
	{
		// Act
		CompilationResult result = compile(
				NODE,
				"function f(a: boolean, b: boolean) -> int {",
				"    var n = Node.new();",
				"    var m = Node.new();",
				"    if (a) {",
				"        return 1;",
				"    }",
				"    if (b) {",
				"        m.clean();",
				"        return 2;",
				"    }",
				"    m.clean();",
				"    return 3;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNRELEASED_POINTER, DiagnosticCode.UNRELEASED_POINTER);
		assertThat(result.getDiagnostics()).extracting(d -> d.getMessage())
				.filteredOn(m -> m.contains("'n'")).hasSize(1);
		assertThat(result.getDiagnostics()).extracting(d -> d.getMessage())
				.filteredOn(m -> m.contains("'m'")).hasSize(1);
	}
}
