// File: src/main/java/org/lokray/sinter/backend/LlvmBackend.java
package org.lokray.sinter.backend;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMExecutionEngineRef;
import org.bytedeco.llvm.LLVM.LLVMGenericValueRef;
import org.bytedeco.llvm.LLVM.LLVMMemoryBufferRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.lokray.sinter.util.Debug;

import java.nio.charset.StandardCharsets;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Hands emitted IR text to the native LLVM library for verification and in-process execution.
 */
public class LlvmBackend
{
	private static final int OPTIMIZATION_LEVEL = 2;
	private static boolean targetsInitialised = false;

	/**
	 * Outcome of {@link #verify(String)}. The message is empty on success.
	 */
	public static class Verification
	{
		private final boolean valid;
		private final String message;

		Verification(boolean valid, String message)
		{
			this.valid = valid;
			this.message = message;
		}

		public boolean isValid()
		{
			return valid;
		}

		public String getMessage()
		{
			return message;
		}

		@Override
		public String toString()
		{
			return valid ? "valid" : "invalid: " + message;
		}
	}

	/**
	 * Reports whether the native LLVM libraries can be loaded on this machine.
	 */
	public static boolean isAvailable()
	{
		try
		{
			Loader.load(org.bytedeco.llvm.global.LLVM.class);
			return true;
		}
		catch (UnsatisfiedLinkError | NoClassDefFoundError | ExceptionInInitializerError e)
		{
			Debug.log("LLVM natives unavailable: %s", e.getMessage());
			return false;
		}
	}

	public Verification verify(String ir)
	{
		Debug.log("Verifying module with LLVM...");
		LLVMContextRef context = LLVMContextCreate();
		try
		{
			LLVMModuleRef module = parse(context, ir);
			BytePointer error = new BytePointer((Pointer) null);
			boolean broken = LLVMVerifyModule(module, LLVMReturnStatusAction, error) != 0;
			String message = broken ? takeMessage(error) : "";
			LLVMDisposeModule(module);
			Debug.log("LLVM Module verification %s", broken ? "FAILED: " + message : "PASSED.");
			return new Verification(!broken, message);
		}
		catch (LlvmBackendException e)
		{
			return new Verification(false, e.getMessage());
		}
		finally
		{
			LLVMContextDispose(context);
		}
	}

	/**
	 * Compiles the module with MCJIT. The session owns the module and must be closed.
	 *
	 * @throws LlvmBackendException if the IR does not parse or no execution engine can be created.
	 */
	public JitSession jit(String ir)
	{
		initialiseNativeTarget();
		LLVMContextRef context = LLVMContextCreate();
		try
		{
			LLVMModuleRef module = parse(context, ir);
			LLVMExecutionEngineRef engine = new LLVMExecutionEngineRef();
			BytePointer error = new BytePointer((Pointer) null);
			if (LLVMCreateJITCompilerForModule(engine, module, OPTIMIZATION_LEVEL, error) != 0)
			{
				String message = takeMessage(error);
				LLVMDisposeModule(module);
				throw new LlvmBackendException("Could not create execution engine: " + message);
			}
			Debug.log("MCJIT engine created");
			return new JitSession(context, module, engine);
		}
		catch (RuntimeException e)
		{
			LLVMContextDispose(context);
			throw e;
		}
	}

	private static synchronized void initialiseNativeTarget()
	{
		if (targetsInitialised)
		{
			return;
		}
		Debug.log("Initializing native LLVM target...");
		LLVMLinkInMCJIT();
		LLVMInitializeNativeTarget();
		LLVMInitializeNativeAsmPrinter();
		LLVMInitializeNativeAsmParser();
		targetsInitialised = true;
	}

	private static LLVMModuleRef parse(LLVMContextRef context, String ir)
	{
		byte[] bytes = ir.getBytes(StandardCharsets.UTF_8);
		BytePointer text = new BytePointer(bytes.length);
		text.put(bytes);
		// The parser takes ownership of the buffer
		LLVMMemoryBufferRef buffer = LLVMCreateMemoryBufferWithMemoryRangeCopy(text, bytes.length, new BytePointer("sinter.ll"));
		LLVMModuleRef module = new LLVMModuleRef();
		BytePointer error = new BytePointer((Pointer) null);
		if (LLVMParseIRInContext(context, buffer, module, error) != 0)
		{
			throw new LlvmBackendException("Invalid IR: " + takeMessage(error));
		}
		return module;
	}

	private static String takeMessage(BytePointer message)
	{
		if (message.isNull())
		{
			return "";
		}
		String text = message.getString().trim();
		LLVMDisposeMessage(message);
		return text;
	}

	/**
	 * A compiled module whose functions can be called from Java. Only the signatures MCJIT can call without
	 * generated stubs are offered: {@code i32()}, {@code i32(i32)} and zero-argument functions.
	 */
	public static class JitSession implements AutoCloseable
	{
		private final LLVMContextRef context;
		private final LLVMModuleRef module;
		private final LLVMExecutionEngineRef engine;
		private boolean closed;

		JitSession(LLVMContextRef context, LLVMModuleRef module, LLVMExecutionEngineRef engine)
		{
			this.context = context;
			this.module = module;
			this.engine = engine;
		}

		public int runInt(String name, int... arguments)
		{
			if (arguments.length > 1)
			{
				throw new LlvmBackendException("MCJIT can pass at most one int argument, got " + arguments.length + ".");
			}
			LLVMGenericValueRef[] values = new LLVMGenericValueRef[arguments.length];
			for (int i = 0; i < arguments.length; i++)
			{
				values[i] = LLVMCreateGenericValueOfInt(LLVMInt32TypeInContext(context), arguments[i], 1);
			}
			LLVMGenericValueRef result = invoke(name, values);
			int value = (int) LLVMGenericValueToInt(result, 1);
			LLVMDisposeGenericValue(result);
			for (LLVMGenericValueRef argument : values)
			{
				LLVMDisposeGenericValue(argument);
			}
			return value;
		}

		public boolean runBoolean(String name)
		{
			LLVMGenericValueRef result = invoke(name);
			boolean value = LLVMGenericValueToInt(result, 0) != 0;
			LLVMDisposeGenericValue(result);
			return value;
		}

		public long runLong(String name)
		{
			LLVMGenericValueRef result = invoke(name);
			long value = LLVMGenericValueToInt(result, 1);
			LLVMDisposeGenericValue(result);
			return value;
		}

		/**
		 * Calls a function returning a C string and copies the text.
		 */
		public String runString(String name)
		{
			LLVMGenericValueRef result = invoke(name);
			Pointer pointer = LLVMGenericValueToPointer(result);
			LLVMDisposeGenericValue(result);
			if (pointer == null || pointer.isNull())
			{
				return null;
			}
			return new BytePointer(pointer).getString(StandardCharsets.UTF_8);
		}

		private LLVMGenericValueRef invoke(String name, LLVMGenericValueRef... arguments)
		{
			if (closed)
			{
				throw new IllegalStateException("JIT session is closed.");
			}
			LLVMValueRef function = LLVMGetNamedFunction(module, name);
			if (function == null || function.isNull())
			{
				throw new LlvmBackendException("No function named '" + name + "' in the module.");
			}
			Debug.log("Running %s through MCJIT", name);
			return LLVMRunFunction(engine, function, arguments.length, new PointerPointer<>(arguments));
		}

		@Override
		public void close()
		{
			if (closed)
			{
				return;
			}
			closed = true;
			// The engine owns the module
			LLVMDisposeExecutionEngine(engine);
			LLVMContextDispose(context);
		}
	}
}
