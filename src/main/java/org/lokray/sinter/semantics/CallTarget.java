// File: src/main/java/org/lokray/sinter/semantics/CallTarget.java
package org.lokray.sinter.semantics;

/**
 * What a call expression resolved to. Built-in operations have no method symbol.
 */
public class CallTarget
{
	public enum Kind
	{
		NEW,
		FROM_JSON,
		FROM_XML,
		CLEAN,
		RELEASE,
		AS_JSON,
		AS_XML,
		METHOD,
		STATIC_METHOD,
		INTERFACE_METHOD,
		FUNCTION
	}

	private final Kind kind;
	private final MethodSymbol method;
	private final ClassSymbol classSymbol; // The class operated on, or the receiver's static type

	public CallTarget(Kind kind, MethodSymbol method, ClassSymbol classSymbol)
	{
		this.kind = kind;
		this.method = method;
		this.classSymbol = classSymbol;
	}

	public Kind getKind()
	{
		return kind;
	}

	public MethodSymbol getMethod()
	{
		return method;
	}

	public ClassSymbol getClassSymbol()
	{
		return classSymbol;
	}

	/**
	 * Calls that hand a fresh owned pointer to their receiver.
	 */
	public boolean isAllocation()
	{
		return kind == Kind.NEW || kind == Kind.FROM_JSON || kind == Kind.FROM_XML || kind == Kind.RELEASE;
	}

	public boolean isRelease()
	{
		return kind == Kind.CLEAN || kind == Kind.RELEASE;
	}

	@Override
	public String toString()
	{
		return kind + (method != null ? " " + method.signature() : "") + (classSymbol != null ? " on " + classSymbol.getName() : "");
	}
}
