// File: src/main/java/org/lokray/sinter/codegen/FunctionEmitter.java
package org.lokray.sinter.codegen;

import java.util.List;

/**
 * Accumulates the text of one LLVM function. Allocas are collected separately and placed at the top of the entry
 * block; instructions written after a terminator open a fresh, unreachable block.
 */
class FunctionEmitter
{
	private final String header;
	private final StringBuilder allocas = new StringBuilder();
	private final StringBuilder body = new StringBuilder();
	private int tempCounter;
	private int labelCounter;
	private boolean terminated;
	private String currentLabel = "entry";

	/**
	 * @param header The {@code define ...} line without its opening brace.
	 */
	FunctionEmitter(String header)
	{
		this.header = header;
	}

	String temp()
	{
		return "%t" + (tempCounter++);
	}

	/**
	 * A stack slot name derived from a source name, unique within the function. Labels end in a bare number,
	 * slots in {@code addr<n>}, so a local can never share a name with a block.
	 */
	String named(String hint)
	{
		return "%" + hint + ".addr" + (tempCounter++);
	}

	String newLabel(String hint)
	{
		return hint + "." + (labelCounter++);
	}

	String alloca(String type, String hint)
	{
		String register = named(hint);
		allocas.append("  ").append(register).append(" = alloca ").append(type).append('\n');
		return register;
	}

	void emit(String instruction)
	{
		if (terminated)
		{
			startBlock(newLabel("dead"));
		}
		body.append("  ").append(instruction).append('\n');
	}

	/**
	 * Emits {@code <register> = <instruction>} and returns the register.
	 */
	String assign(String instruction)
	{
		String register = temp();
		emit(register + " = " + instruction);
		return register;
	}

	void startBlock(String label)
	{
		if (!terminated)
		{
			// Fall into the new block explicitly
			body.append("  br label %").append(label).append('\n');
		}
		body.append(label).append(":\n");
		currentLabel = label;
		terminated = false;
	}

	/**
	 * The block instructions are currently written to, for {@code phi} operands.
	 */
	String currentLabel()
	{
		return currentLabel;
	}

	void terminate(String instruction)
	{
		emit(instruction);
		terminated = true;
	}

	void branch(String label)
	{
		terminate("br label %" + label);
	}

	void branch(String condition, String whenTrue, String whenFalse)
	{
		terminate("br i1 " + condition + ", label %" + whenTrue + ", label %" + whenFalse);
	}

	boolean isTerminated()
	{
		return terminated;
	}

	/**
	 * Calls a function, returning the result register, or null for {@code void}.
	 */
	String call(String returnType, String callee, List<String> typedArguments)
	{
		String instruction = "call " + returnType + " " + callee + "(" + String.join(", ", typedArguments) + ")";
		if (returnType.equals("void"))
		{
			emit(instruction);
			return null;
		}
		return assign(instruction);
	}

	String load(String type, String address)
	{
		return assign("load " + type + ", ptr " + address);
	}

	void store(String type, String value, String address)
	{
		emit("store " + type + " " + value + ", ptr " + address);
	}

	String gep(String type, String base, String indices)
	{
		return assign("getelementptr inbounds " + type + ", ptr " + base + ", " + indices);
	}

	void finish(StringBuilder out)
	{
		out.append(header).append(" {\nentry:\n").append(allocas).append(body).append("}\n\n");
	}
}
