// File: src/main/java/org/lokray/sinter/codegen/LlvmTypes.java
package org.lokray.sinter.codegen;

import org.lokray.sinter.semantics.ClassSymbol;
import org.lokray.sinter.semantics.MethodSymbol;
import org.lokray.sinter.semantics.NamedType;
import org.lokray.sinter.semantics.NullType;
import org.lokray.sinter.semantics.PointerType;
import org.lokray.sinter.semantics.PrimitiveType;
import org.lokray.sinter.semantics.Type;

/**
 * Maps Sinter types onto LLVM types and constants.
 */
final class LlvmTypes
{
	// Slot kinds understood by the D-string sampler
	static final int KIND_INT = 0;
	static final int KIND_FLOAT = 1;
	static final int KIND_DOUBLE = 2;
	static final int KIND_BOOLEAN = 3;
	static final int KIND_STR = 4;

	private LlvmTypes()
	{
	}

	static String toLlvm(Type type)
	{
		if (type instanceof PrimitiveType)
		{
			if (type == PrimitiveType.INT)
			{
				return "i32";
			}
			if (type == PrimitiveType.FLOAT)
			{
				return "float";
			}
			if (type == PrimitiveType.DOUBLE)
			{
				return "double";
			}
			if (type == PrimitiveType.BOOLEAN)
			{
				return "i1";
			}
			if (type == PrimitiveType.STR)
			{
				return "ptr";
			}
			return "void";
		}
		if (type instanceof PointerType || type instanceof NullType)
		{
			return "ptr";
		}
		if (type instanceof NamedType)
		{
			ClassSymbol symbol = ((NamedType) type).getSymbol();
			if (symbol.isInterface())
			{
				throw new CodegenException("Interface " + symbol.getName() + " has no value representation.");
			}
			return structName(symbol);
		}
		throw new CodegenException("No LLVM type for '" + type + "'.");
	}

	static String structName(ClassSymbol classSymbol)
	{
		return "%class." + classSymbol.getName();
	}

	/**
	 * Symbol of a user function or method. Methods are prefixed with their class; a {@code void main()} is
	 * renamed so that the module can provide the C entry point itself.
	 */
	static String functionName(MethodSymbol method)
	{
		if (method.getOwnerClass() != null)
		{
			return "@" + method.getOwnerClass().getName() + "." + method.getMangledName();
		}
		if (isVoidMain(method))
		{
			return "@sinter_main";
		}
		return "@" + method.getMangledName();
	}

	static boolean isVoidMain(MethodSymbol method)
	{
		return method.getOwnerClass() == null && method.getName().equals("main") && method.getParameterTypes().isEmpty()
				&& method.getReturnType().isVoid();
	}

	/**
	 * Symbol of a routine the compiler generates for a class, such as {@code @Point$new}. The {@code $} keeps it
	 * apart from user methods.
	 */
	static String routineName(ClassSymbol classSymbol, String routine)
	{
		return "@" + classSymbol.getName() + "$" + routine;
	}

	static String itableName(ClassSymbol iface)
	{
		return "%itable." + iface.getName();
	}

	static boolean isClassValue(Type type)
	{
		return type instanceof NamedType && !((NamedType) type).isInterface();
	}

	/**
	 * @return The class behind a class value or a pointer to one, else null.
	 */
	static ClassSymbol classOf(Type type)
	{
		if (type instanceof NamedType)
		{
			return ((NamedType) type).getSymbol();
		}
		if (type instanceof PointerType)
		{
			return ((PointerType) type).getPointeeClass();
		}
		return null;
	}

	static String intConstant(long value)
	{
		return Long.toString(value);
	}

	/**
	 * LLVM spells floating constants exactly in the hexadecimal form of a double, also for {@code float}.
	 */
	static String floatConstant(double value)
	{
		return "0x" + String.format("%016X", Double.doubleToRawLongBits(value));
	}

	static String singleConstant(float value)
	{
		return floatConstant((double) value);
	}

	static int sampleKind(Type type)
	{
		if (type == PrimitiveType.INT)
		{
			return KIND_INT;
		}
		if (type == PrimitiveType.FLOAT)
		{
			return KIND_FLOAT;
		}
		if (type == PrimitiveType.DOUBLE)
		{
			return KIND_DOUBLE;
		}
		if (type == PrimitiveType.BOOLEAN)
		{
			return KIND_BOOLEAN;
		}
		if (type == PrimitiveType.STR)
		{
			return KIND_STR;
		}
		throw new CodegenException("Type '" + type + "' cannot be observed by a D-string.");
	}
}
