// File: src/main/java/org/lokray/sinter/Main.java
package org.lokray.sinter;

import org.lokray.sinter.backend.LlvmBackend;
import org.lokray.sinter.backend.LlvmBackendException;
import org.lokray.sinter.util.CompilerConfig;
import org.lokray.sinter.util.Diagnostic;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Entry point of {@code sinterc}. Compiles one source file to textual LLVM IR.
 */
public class Main
{
	static final int EXIT_OK = 0;
	static final int EXIT_FAILURE = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: sinterc [--emit-ir] [-o <out.ll>] [--verify] [--run <function>] <file.sn>";

	public static void main(String[] args)
	{
		System.exit(run(args, System.out, System.err));
	}

	public static int run(String[] args, PrintStream out, PrintStream err)
	{
		return run(args, out, err, loadConfiguration(err));
	}

	static int run(String[] args, PrintStream out, PrintStream err, CompilerConfig config)
	{
		boolean emitIr = false;
		boolean verify = false;
		String outputFile = null;
		String runFunction = null;
		String inputFile = null;

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			switch (arg)
			{
				case "--emit-ir":
					emitIr = true;
					break;
				case "--verify":
					verify = true;
					break;
				case "-o":
				case "--run":
					if (i + 1 >= args.length)
					{
						err.println("Error: " + arg + " needs a value.");
						err.println(USAGE);
						return EXIT_USAGE;
					}
					if (arg.equals("-o"))
					{
						outputFile = args[++i];
					}
					else
					{
						runFunction = args[++i];
					}
					break;
				default:
					if (arg.startsWith("-") || inputFile != null)
					{
						err.println("Error: Unexpected argument '" + arg + "'.");
						err.println(USAGE);
						return EXIT_USAGE;
					}
					inputFile = arg;
			}
		}
		if (inputFile == null)
		{
			err.println(USAGE);
			return EXIT_USAGE;
		}

		Path sourcePath = Paths.get(inputFile);
		String source;
		try
		{
			source = Files.readString(sourcePath, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			err.println("Error: Could not read " + sourcePath + ": " + e.getMessage());
			return EXIT_FAILURE;
		}

		CompilationResult result = new SinterCompiler(config).compile(source);
		if (config.isEchoDiagnostics())
		{
			for (Diagnostic diagnostic : result.getDiagnostics())
			{
				err.println(diagnostic);
			}
		}
		if (!result.isSuccess())
		{
			err.println("Build failed with " + result.getDiagnostics().stream().filter(Diagnostic::isError).count() + " error(s).");
			return EXIT_FAILURE;
		}

		String ir = result.getIr();
		if (emitIr && outputFile == null)
		{
			out.print(ir);
		}
		else
		{
			Path target = outputFile != null ? Paths.get(outputFile) : defaultOutput(sourcePath);
			try
			{
				Files.writeString(target, ir, StandardCharsets.UTF_8);
			}
			catch (IOException e)
			{
				err.println("Error: Could not write " + target + ": " + e.getMessage());
				return EXIT_FAILURE;
			}
			err.println("LLVM IR written to " + target);
		}

		// Modules are verified before they are run unless configured otherwise
		boolean shouldVerify = verify || (runFunction != null && config.isVerifyModule());
		if (shouldVerify && !verifyModule(ir, err))
		{
			return EXIT_FAILURE;
		}
		if (runFunction != null)
		{
			return runFunction(ir, runFunction, out, err);
		}
		return EXIT_OK;
	}

	private static Path defaultOutput(Path source)
	{
		String name = source.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String stem = dot > 0 ? name.substring(0, dot) : name;
		return source.resolveSibling(stem + ".ll");
	}

	private static boolean verifyModule(String ir, PrintStream err)
	{
		if (!LlvmBackend.isAvailable())
		{
			err.println("Error: The native LLVM library is not available on this machine.");
			return false;
		}
		LlvmBackend.Verification verification = new LlvmBackend().verify(ir);
		if (!verification.isValid())
		{
			err.println("LLVM Verify Error: " + verification.getMessage());
			return false;
		}
		return true;
	}

	private static int runFunction(String ir, String function, PrintStream out, PrintStream err)
	{
		if (!LlvmBackend.isAvailable())
		{
			err.println("Error: The native LLVM library is not available on this machine.");
			return EXIT_FAILURE;
		}
		try (LlvmBackend.JitSession session = new LlvmBackend().jit(ir))
		{
			out.flush();
			int value = session.runInt(function);
			out.println(value);
			return EXIT_OK;
		}
		catch (LlvmBackendException e)
		{
			err.println("Error: " + e.getMessage());
			return EXIT_FAILURE;
		}
	}

	private static CompilerConfig loadConfiguration(PrintStream err)
	{
		Properties props = new Properties();
		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "sinter", "sinter.conf");
		if (Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
			}
			catch (IOException e)
			{
				err.println("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		return new CompilerConfig(props);
	}
}
