// File: src/main/java/org/lokray/sinter/codegen/CodegenException.java
package org.lokray.sinter.codegen;

/**
 * Thrown when a construct reaches code generation that the analysis stages should have rejected.
 * The compiler turns it into a fatal diagnostic and emits no module.
 */
public class CodegenException extends RuntimeException
{
	public CodegenException(String message)
	{
		super(message);
	}
}
