package org.lokray.sinter.semantics.annotations;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.sinter.CompilationResult;
import org.lokray.sinter.semantics.ClassSymbol;
import org.lokray.sinter.semantics.VariableSymbol;
import org.lokray.sinter.util.DiagnosticCode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.lokray.sinter.SinterTestSupport.compile;
import static org.lokray.sinter.SinterTestSupport.errorCodes;
import static org.lokray.sinter.SinterTestSupport.warningCodes;

@Tag("unit")
class AnnotationProcessorTest
{
	@Test
	void reportsConflictingFlags()
	{
		// Act
		CompilationResult result = compile(
				"class Config {",
				"public:",
				"    @attribute(read_only, write_only) var mode: int;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.CONFLICTING_ANNOTATION);
		assertThat(result.getDiagnostics().get(0).getMessage()).contains("read_only with write_only");
	}

	@Test
	void warnsAboutRedundantFlagsWithoutFailing()
	{
		// Act
		CompilationResult result = compile(
				"class Config {",
				"public:",
				"    @attribute(serializable=false, read_only, read_only) var mode: int;",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		assertThat(warningCodes(result)).containsExactly(DiagnosticCode.REDUNDANT_ANNOTATION, DiagnosticCode.REDUNDANT_ANNOTATION);
		assertThat(result.isSuccess()).isTrue();
	}

	@Test
	void rejectsUnknownFlagAndAnnotation()
	{
		// Act
		CompilationResult result = compile(
				"class Config {",
				"public:",
				"    @attribute(volatile) var mode: int;",
				"    @inject var other: int;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.INVALID_ANNOTATION, DiagnosticCode.INVALID_ANNOTATION);
	}

	@Test
	void requiresMethodBehindDerivedField()
	{
		// Act
		CompilationResult result = compile(
				"class Circle {",
				"public:",
				"    @attribute var radius: double;",
				"    @attribute(derived) var area: double;",
				"    @attribute(derived) var diameter: double;",
				"    method area() -> double { return radius * radius * 3.14; }",
				"    method diameter() -> int { return 2; }",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNSATISFIED_ANNOTATION);
		assertThat(result.getDiagnostics().get(0).getMessage()).contains("diameter() -> double");
	}

	@Test
	void rejectsUserAccessorsThatBreakTheContract()
	{
		// Act
		CompilationResult result = compile(
				"class Counter {",
				"public:",
				"    @attribute(read_only) var hits: int;",
				"    @attribute var total: int;",
				"    method setHits(value: int) { }",
				"    method setTotal(value: str) { }",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.UNSATISFIED_ANNOTATION, DiagnosticCode.UNSATISFIED_ANNOTATION);
	}

	@Test
	void collectsSerializableFieldsAcrossHierarchy()
	{
		// Act
		CompilationResult result = compile(
				"class Entity {",
				"public:",
				"    @attribute(serializable) var id: int;",
				"}",
				"class User extends Entity {",
				"public:",
				"    @attribute(serializable) var name: str;",
				"    @attribute var password: str;",
				"}");

		// Assert
		assertThat(errorCodes(result)).isEmpty();
		ClassSymbol user = result.getModel().getClass("User");
		assertThat(user.getSerialization().getFields()).extracting(VariableSymbol::getName).containsExactlyInAnyOrder("id", "name");
		assertThat(result.getModel().getClass("Entity").getSerialization().getFields()).extracting(VariableSymbol::getName).containsExactly("id");
	}

	@Test
	void rejectsSerializableInterfacePointer()
	{
		// Act
		CompilationResult result = compile(
				"interface Shape { method area() -> double; }",
				"class Drawing {",
				"public:",
				"    @attribute(serializable) var shape: Shape*;",
				"}");

		// Assert
		assertThat(errorCodes(result)).containsExactly(DiagnosticCode.INVALID_ANNOTATION);
	}
}
