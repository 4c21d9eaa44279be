package org.lokray.sinter;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.sinter.util.CompilerConfig;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class MainTest
{
	@TempDir
	Path tempDir;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args)
	{
		return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8),
				new CompilerConfig());
	}

	private Path source(String name, String... lines) throws IOException
	{
		Path file = tempDir.resolve(name);
		Files.writeString(file, String.join("\n", lines), StandardCharsets.UTF_8);
		return file;
	}

	@Test
	void printsUsageWithoutInput()
	{
		// Act
		int code = run();

		// Assert
		assertThat(code).isEqualTo(Main.EXIT_USAGE);
		assertThat(err.toString(StandardCharsets.UTF_8)).contains("Usage: sinterc");
	}

	@Test
	void rejectsUnknownFlagAndMissingValue()
	{
		// Act & Assert
		assertThat(run("--optimise", "a.sn")).isEqualTo(Main.EXIT_USAGE);
		assertThat(run("a.sn", "-o")).isEqualTo(Main.EXIT_USAGE);
		assertThat(err.toString(StandardCharsets.UTF_8)).contains("Unexpected argument '--optimise'").contains("-o needs a value");
	}

	@Test
	void reportsMissingSourceFile()
	{
		// Act
		int code = run(tempDir.resolve("absent.sn").toString());

		// Assert
		assertThat(code).isEqualTo(Main.EXIT_FAILURE);
		assertThat(err.toString(StandardCharsets.UTF_8)).contains("Could not read");
	}

	@Test
	void writesIrNextToSource() throws IOException
	{
		// Arrange
		Path file = source("answer.sn", "function answer() -> int { return 42; }");

		// Act
		int code = run(file.toString());

		// Assert
		assertThat(code).isEqualTo(Main.EXIT_OK);
		Path ll = tempDir.resolve("answer.ll");
		assertThat(ll).exists();
		assertThat(Files.readString(ll)).contains("define i32 @answer()");
		assertThat(err.toString(StandardCharsets.UTF_8)).contains("LLVM IR written to " + ll);
	}

	@Test
	void writesIrToRequestedOutput() throws IOException
	{
		// Arrange
		Path file = source("answer.sn", "function answer() -> int { return 42; }");
		Path target = tempDir.resolve("custom.ll");

		// Act
		int code = run("-o", target.toString(), file.toString());

		// Assert
		assertThat(code).isEqualTo(Main.EXIT_OK);
		assertThat(target).exists();
		assertThat(tempDir.resolve("answer.ll")).doesNotExist();
	}

	@Test
	void emitsIrToStandardOutput() throws IOException
	{
		// Arrange
		Path file = source("answer.sn", "function answer() -> int { return 42; }");

		// Act
		int code = run("--emit-ir", file.toString());

		// Assert
		assertThat(code).isEqualTo(Main.EXIT_OK);
		assertThat(out.toString(StandardCharsets.UTF_8)).contains("define i32 @answer()");
		assertThat(tempDir.resolve("answer.ll")).doesNotExist();
	}

	@Test
	void failsBuildAndEchoesDiagnostics() throws IOException
	{
		// Arrange
		Path file = source("broken.sn",
				"function f() -> int {",
				"    return missing;",
				"}");

		// Act
		int code = run(file.toString());

		// Assert
		assertThat(code).isEqualTo(Main.EXIT_FAILURE);
		assertThat(err.toString(StandardCharsets.UTF_8))
				.contains("UnresolvedReferenceError")
				.contains("Line 2")
				.contains("Build failed with 1 error(s).");
		assertThat(tempDir.resolve("broken.ll")).doesNotExist();
	}
}
