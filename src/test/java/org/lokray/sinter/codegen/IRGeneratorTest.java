package org.lokray.sinter.codegen;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.sinter.CompilationResult;
import org.lokray.sinter.SinterCompiler;
import org.lokray.sinter.util.CompilerConfig;

import java.util.HashSet;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.sinter.SinterTestSupport.compile;
import static org.lokray.sinter.SinterTestSupport.errorCodes;

@Tag("unit")
class IRGeneratorTest
{
	private static final Pattern DEFINE = Pattern.compile("^define [^@]*@([^(\\s]+)\\((.*)\\).*\\{$");
	private static final Pattern LABEL = Pattern.compile("^([A-Za-z$._][A-Za-z0-9$._]*):$");
	private static final Pattern VALUE = Pattern.compile("^\\s+%([A-Za-z0-9$._]+) = ");
	private static final Pattern PARAMETER = Pattern.compile("%([A-Za-z0-9$._]+)");

	/**
	 * Labels and local values share one namespace per function, and each may be defined only once.
	 */
	private static void assertLocalNamesUnique(String ir)
	{
		String function = null;
		Set<String> labels = new HashSet<>();
		Set<String> values = new HashSet<>();
		for (String line : ir.split("\n"))
		{
			Matcher header = DEFINE.matcher(line);
			if (header.matches())
			{
				function = header.group(1);
				labels.clear();
				values.clear();
				Matcher parameter = PARAMETER.matcher(header.group(2));
				while (parameter.find())
				{
					values.add(parameter.group(1));
				}
				continue;
			}
			if (function == null)
			{
				continue;
			}
			if (line.equals("}"))
			{
				assertThat(labels).as("labels of @%s", function).doesNotContainAnyElementsOf(values);
				function = null;
				continue;
			}
			Matcher label = LABEL.matcher(line);
			if (label.matches())
			{
				assertThat(labels.add(label.group(1))).as("label %s in @%s", label.group(1), function).isTrue();
				continue;
			}
			Matcher value = VALUE.matcher(line);
			if (value.find())
			{
				assertThat(values.add(value.group(1))).as("value %%%s in @%s", value.group(1), function).isTrue();
			}
		}
	}

	@Test
	void emitsModuleHeaderFromConfiguration()
	{
		// Arrange
		Properties props = new Properties();
		props.setProperty("codegen.module_name", "demo");
		props.setProperty("codegen.target_triple", "x86_64-pc-linux-gnu");

		// Act
		CompilationResult result = new SinterCompiler(new CompilerConfig(props)).compile("function answer() -> int { return 42; }");

		// Assert
		assertThat(result.isSuccess()).isTrue();
		assertThat(result.getIr())
				.startsWith("; ModuleID = 'demo'")
				.contains("source_filename = \"demo\"")
				.contains("target triple = \"x86_64-pc-linux-gnu\"")
				.contains("define i32 @answer()")
				.contains("ret i32 42")
				.contains("declare ptr @malloc(i64)");
	}

	@Test
	void lowersClassToStructAndGeneratedRoutines()
	{
		// Act
		CompilationResult result = compile(
				"class Point {",
				"public:",
				"    @attribute var x: int = 3;",
				"    var y: double;",
				"    method norm() -> int { return x * x; }",
				"}",
				"function run() -> int {",
				"    var p = Point.new();",
				"    var n = p.norm() + p.getX();",
				"    p.clean();",
				"    return n;",
				"}");

		// Assert
		assertThat(result.isSuccess()).isTrue();
		assertThat(result.getIr())
				.contains("%class.Point = type {")
				.contains("define ptr @Point$new()")
				.contains("define void @Point$init(ptr %this)")
				.contains("define void @Point$cleanup(ptr %this)")
				.contains("define i32 @Point.norm(ptr %this)")
				.contains("define i32 @Point.getX(ptr %this)")
				.contains("define void @Point.setX(ptr %this, i32 %value)")
				.contains("call ptr @Point$new()")
				.contains("call void @Point$cleanup(");
	}

	@Test
	void wrapsVoidMainInCEntryPoint()
	{
		// Act
		CompilationResult result = compile(
				"function main() {",
				"    print(\"hello\");",
				"}");

		// Assert
		assertThat(result.isSuccess()).isTrue();
		assertThat(result.getIr())
				.contains("define void @sinter_main()")
				.contains("define i32 @main()")
				.contains("call void @sinter_main()")
				.contains("@printf")
				.contains("c\"hello\\00\"");
	}

	@Test
	void usesSignedIntegerAndOrderedFloatInstructions()
	{
		// Act
		CompilationResult result = compile(
				"function ints(a: int, b: int) -> int { return a / b + a % b; }",
				"function floats(a: double, b: double) -> boolean { return a < b && -a != b; }",
				"function same(a: str, b: str) -> boolean { return a == b; }");

		// Assert
		assertThat(result.isSuccess()).isTrue();
		assertThat(result.getIr())
				.contains("sdiv i32")
				.contains("srem i32")
				.contains("fcmp olt double")
				.contains("fneg double")
				.contains("fcmp une double")
				.contains("phi i1")
				.contains("call i32 @strcmp(");
	}

	@Test
	void emitsInterfaceTablesForImplementingClasses()
	{
		// Act
		CompilationResult result = compile(
				"interface Shape {",
				"    method area() -> int;",
				"}",
				"class Square implements Shape {",
				"public:",
				"    var side: int = 2;",
				"    method area() -> int { return side * side; }",
				"}",
				"function measure(s: Shape*) -> int {",
				"    return s.area();",
				"}");

		// Assert
		assertThat(result.isSuccess()).isTrue();
		assertThat(result.getIr())
				.contains("%itable.Shape = type {")
				.contains("@itable$Square$Shape")
				.contains("@Square.area")
				.contains("define internal ptr @Shape$self(ptr %slot)");
	}

	@Test
	void emitsDStringRuntimeForDynamicLocals()
	{
		// Act
		CompilationResult result = compile(
				"function main() {",
				"    var count = 1;",
				"    var label = D\"count is {count}\";",
				"    print(label);",
				"    count = 2;",
				"    print(label);",
				"}");

		// Assert
		assertThat(result.isSuccess()).isTrue();
		assertThat(result.getIr())
				.contains("%sinter.dstring = type")
				.contains("%sinter.dslot = type")
				.contains("define ptr @sinter_dstring_read(ptr %d)")
				.contains("call ptr @sinter_dstring_read(")
				.contains("define i64 @sinter_dstring_render_count()");
	}

	@Test
	void emitsSerializationOnlyForClassesThatUseIt()
	{
		// Act
		CompilationResult result = compile(
				"class User {",
				"public:",
				"    @attribute(serializable) var id: int;",
				"    @attribute(serializable) var name: str;",
				"}",
				"class Unused {",
				"public:",
				"    @attribute(serializable) var id: int;",
				"}",
				"function main() {",
				"    var u = User.from_json(\"{\\\"id\\\": 4, \\\"name\\\": \\\"ada\\\"}\");",
				"    print(u.as_json());",
				"    print(u.as_xml());",
				"    u.clean();",
				"}");

		// Assert
		assertThat(result.isSuccess()).isTrue();
		assertThat(result.getIr())
				.contains("define ptr @User$from_json(ptr %text)")
				.contains("define ptr @User$as_json(ptr %this)")
				.contains("define ptr @User$as_xml(ptr %this)")
				.doesNotContain("@Unused$as_json");
	}

	@Test
	void keepsBlockLabelsApartFromLocalValues()
	{
		// Act
		CompilationResult result = compile(
				"interface Shape { method area() -> int; }",
				"class Square implements Shape {",
				"public:",
				"    @attribute var side: int = 2;",
				"    method area() -> int { return side * side; }",
				"}",
				"class Note {",
				"public:",
				"    @attribute(serializable) var text: str;",
				"}",
				"function measure(s: Shape*) -> int { return s.area(); }",
				"function walk(limit: int) -> str {",
				"    var dead = 0;",
				"    var nested = 1;",
				"    var stored = D\"walked {dead} of {limit}\";",
				"    while (dead < limit) {",
				"        if (dead > 10 && nested > 0) {",
				"            break;",
				"        }",
				"        dead++;",
				"    }",
				"    for (var done = 0; done < 2; done++) {",
				"        nested += done;",
				"    }",
				"    var square = Square.new();",
				"    var area = measure(square);",
				"    square.clean();",
				"    var note = Note.from_json(\"{\\\"text\\\": \\\"a\\\"}\");",
				"    var back = Note.from_xml(note.as_xml());",
				"    print(back.as_json());",
				"    note.clean();",
				"    back.clean();",
				"    return stored;",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		assertThat(result.getIr())
				.contains("define ptr @sinter_dstring_read(ptr %d)")
				.contains("define ptr @Note$from_json(ptr %text)");
		assertLocalNamesUnique(result.getIr());
	}

	@Test
	void copiesDStringReadsThatOutliveTheStatement()
	{
		// Act
		CompilationResult result = compile(
				"function keep() -> str {",
				"    var count = 0;",
				"    var msg = D\"count is {count}\";",
				"    print(msg);",
				"    var first = msg;",
				"    count = 1;",
				"    return msg;",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		String ir = result.getIr();
		assertThat(ir).contains("define internal ptr @sinter_strdup(ptr %text)");
		String body = ir.substring(ir.indexOf("define ptr @keep()"));
		body = body.substring(0, body.indexOf("\n}\n"));
		// print reads in place, the binding and the return take copies
		assertThat(body.split("call ptr @sinter_dstring_read\\(", -1)).hasSize(4);
		assertThat(body.split("call ptr @sinter_strdup\\(", -1)).hasSize(3);
	}

	@Test
	void escapesStringFieldsWhenSerialising()
	{
		// Act
		CompilationResult result = compile(
				"class Msg {",
				"public:",
				"    @attribute(serializable) var text: str;",
				"}",
				"function main() {",
				"    var m = Msg.from_json(\"{\\\"text\\\": \\\"x\\\"}\");",
				"    var back = Msg.from_xml(m.as_xml());",
				"    print(back.as_json());",
				"    m.clean();",
				"    back.clean();",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		assertThat(result.getIr())
				.contains("call ptr @sinter_json_escape(")
				.contains("call ptr @sinter_xml_escape(")
				.contains("call ptr @sinter_json_read_string(")
				.contains("call ptr @sinter_xml_read_text(");
	}
}
