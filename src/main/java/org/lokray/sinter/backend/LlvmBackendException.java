// File: src/main/java/org/lokray/sinter/backend/LlvmBackendException.java
package org.lokray.sinter.backend;

/**
 * The native LLVM library rejected a module or could not run it.
 */
public class LlvmBackendException extends RuntimeException
{
	public LlvmBackendException(String message)
	{
		super(message);
	}
}
