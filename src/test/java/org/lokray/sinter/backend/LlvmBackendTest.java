package org.lokray.sinter.backend;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.sinter.CompilationResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.lokray.sinter.SinterTestSupport.compile;

@Tag("integration")
class LlvmBackendTest
{
	private final LlvmBackend backend = new LlvmBackend();

	@BeforeAll
	static void requireNativeLlvm()
	{
		assumeTrue(LlvmBackend.isAvailable(), "native LLVM libraries are not available");
	}

	private static String ir(String... lines)
	{
		CompilationResult result = compile(lines);
		assertThat(result.getDiagnostics()).filteredOn(d -> d.isError()).isEmpty();
		return result.getIr();
	}

	@Test
	void acceptsGeneratedModule()
	{
		// Arrange
		String ir = ir(
				"class Point {",
				"public:",
				"    @attribute var x: int = 3;",
				"}",
				"function main() {",
				"    var p = Point.new();",
				"    print(p.getX());",
				"    p.clean();",
				"}");

		// Act
		LlvmBackend.Verification verification = backend.verify(ir);

		// Assert
		assertThat(verification.isValid()).as(verification.getMessage()).isTrue();
	}

	@Test
	void rejectsMalformedIr()
	{
		// Act
		LlvmBackend.Verification verification = backend.verify("define i32 @broken() {\nentry:\n  ret i64 0\n}\n");

		// Assert
		assertThat(verification.isValid()).isFalse();
		assertThat(verification.getMessage()).isNotEmpty();
	}

	@Test
	void runsRecursiveFunction()
	{
		// Arrange
		String ir = ir(
				"function fib(n: int) -> int {",
				"    if (n < 2) { return n; }",
				"    return fib(n - 1) + fib(n - 2);",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runInt("fib", 10)).isEqualTo(55);
			assertThat(session.runInt("fib", 30)).isEqualTo(832040);
		}
	}

	@Test
	void runsIterativeFibonacciWithinIntRange()
	{
		// Arrange
		String ir = ir(
				"function fib(n: int) -> int {",
				"    var a = 0;",
				"    var b = 1;",
				"    for (var i = 0; i < n; i++) {",
				"        var next = a + b;",
				"        a = b;",
				"        b = next;",
				"    }",
				"    return a;",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runInt("fib", 10)).isEqualTo(55);
			assertThat(session.runInt("fib", 40)).isEqualTo(102334155);
		}
	}

	@Test
	void wrapsIntegerOverflow()
	{
		// Arrange
		String ir = ir(
				"function overflow() -> int {",
				"    var a = 2147483647;",
				"    return a + 1;",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runInt("overflow")).isEqualTo(Integer.MIN_VALUE);
		}
	}

	@Test
	void rendersDStringOnlyWhenReferencedValueChanges()
	{
		// Arrange
		String ir = ir(
				"function renders() -> int {",
				"    var n = 1;",
				"    var label = D\"n is {n}\";",
				"    var matches = 0;",
				"    if (label == \"n is 1\") { matches = matches + 1; }",
				"    var again = label;",
				"    n = 2;",
				"    if (label == \"n is 2\") { matches = matches + 1; }",
				"    return matches;",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runInt("renders")).isEqualTo(2);
			assertThat(session.runLong("sinter_dstring_render_count")).isEqualTo(2L);
		}
	}

	@Test
	void followsReferencedVariableAcrossAssignments()
	{
		// Arrange
		String ir = ir(
				"function live() -> str {",
				"    var count: int = 0;",
				"    var msg = D\"The count is: {count}\";",
				"    var seen = 0;",
				"    if (msg == \"The count is: 0\") { seen = seen + 1; }",
				"    count = 5;",
				"    if (msg == \"The count is: 5\") { seen = seen + 1; }",
				"    count = 42;",
				"    if (seen == 2) { return msg; }",
				"    return \"\";",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runString("live")).isEqualTo("The count is: 42");
		}
	}

	@Test
	void keepsEarlierReadAfterReRender()
	{
		// Arrange
		String ir = ir(
				"function earlier() -> str {",
				"    var count: int = 0;",
				"    var msg = D\"The count is: {count}\";",
				"    var first = msg;",
				"    var seen = 0;",
				"    count = 5;",
				"    if (msg == \"The count is: 5\") { seen = seen + 1; }",
				"    count = 42;",
				"    if (msg == \"The count is: 42\") { seen = seen + 1; }",
				"    if (seen == 2) { return first; }",
				"    return \"\";",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runString("earlier")).isEqualTo("The count is: 0");
		}
	}

	@Test
	void routesDerivedFieldReadsThroughMethod()
	{
		// Arrange
		String ir = ir(
				"class Sensor {",
				"public:",
				"    @attribute var temperature: double = 20.0;",
				"    @attribute(derived) var status: str;",
				"    method status() -> str {",
				"        if (temperature > 100.0) { return \"HOT\"; }",
				"        return \"NORMAL\";",
				"    }",
				"}",
				"function hotAfterHeating() -> boolean {",
				"    var sensor = Sensor.new();",
				"    var before = sensor.status;",
				"    sensor.setTemperature(120.0);",
				"    var after = sensor.status;",
				"    sensor.clean();",
				"    return before == \"NORMAL\" && after == \"HOT\";",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runBoolean("hotAfterHeating")).isTrue();
		}
	}

	@Test
	void readsBackWhatItSerialises()
	{
		// Arrange
		String ir = ir(
				"class Account {",
				"public:",
				"    @attribute(serializable) var id: int;",
				"    @attribute(serializable) var owner: str;",
				"    @attribute(serializable) var open: boolean;",
				"}",
				"function roundTrip() -> int {",
				"    var a = Account.from_json(\"{\\\"id\\\": 41, \\\"owner\\\": \\\"ada\\\", \\\"open\\\": true}\");",
				"    var b = Account.from_json(a.as_json());",
				"    var c = Account.from_xml(b.as_xml());",
				"    var result = 0;",
				"    if (c.owner == \"ada\" && c.open) { result = c.id + 1; }",
				"    a.clean();",
				"    b.clean();",
				"    c.clean();",
				"    return result;",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runInt("roundTrip")).isEqualTo(42);
		}
	}

	@Test
	void roundTripsStringsThatNeedEscaping()
	{
		// Arrange
		String ir = ir(
				"class Msg {",
				"public:",
				"    @attribute(serializable) var text: str;",
				"    @attribute(serializable) var n: int;",
				"}",
				"function throughJson() -> int {",
				"    var original = \"say \\\"hi\\\" or \\\\ {not a key}\";",
				"    var a = Msg.new();",
				"    a.text = original;",
				"    a.n = 7;",
				"    var b = Msg.from_json(a.as_json());",
				"    var result = 0;",
				"    if (b.text == original) { result = b.n; }",
				"    a.clean();",
				"    b.clean();",
				"    return result;",
				"}",
				"function throughXml() -> int {",
				"    var original = \"a<b & c>d <n>1</n>\";",
				"    var a = Msg.new();",
				"    a.text = original;",
				"    a.n = 9;",
				"    var b = Msg.from_xml(a.as_xml());",
				"    var result = 0;",
				"    if (b.text == original) { result = b.n; }",
				"    a.clean();",
				"    b.clean();",
				"    return result;",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runInt("throughJson")).isEqualTo(7);
			assertThat(session.runInt("throughXml")).isEqualTo(9);
		}
	}

	@Test
	void dispatchesThroughInterface()
	{
		// Arrange
		String ir = ir(
				"interface Shape {",
				"    method area() -> int;",
				"}",
				"class Square implements Shape {",
				"public:",
				"    var side: int = 3;",
				"    method area() -> int { return side * side; }",
				"}",
				"class Rect implements Shape {",
				"public:",
				"    var w: int = 2;",
				"    var h: int = 5;",
				"    method area() -> int { return w * h; }",
				"}",
				"function measure(s: Shape*) -> int {",
				"    return s.area();",
				"}",
				"function total() -> int {",
				"    var square = Square.new();",
				"    var rect = Rect.new();",
				"    var sum = measure(square) + measure(rect);",
				"    square.clean();",
				"    rect.clean();",
				"    return sum;",
				"}");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThat(session.runInt("total")).isEqualTo(19);
		}
	}

	@Test
	void reportsUnknownFunction()
	{
		// Arrange
		String ir = ir("function one() -> int { return 1; }");

		// Act & Assert
		try (LlvmBackend.JitSession session = backend.jit(ir))
		{
			assertThatThrownBy(() -> session.runInt("two"))
					.isInstanceOf(LlvmBackendException.class)
					.hasMessageContaining("'two'");
		}
	}
}
