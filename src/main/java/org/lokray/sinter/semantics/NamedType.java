// File: src/main/java/org/lokray/sinter/semantics/NamedType.java
package org.lokray.sinter.semantics;

/**
 * A class or interface type, named nominally after its declaration.
 */
public class NamedType extends Type
{
	private final ClassSymbol symbol;

	public NamedType(ClassSymbol symbol)
	{
		super(symbol.getName());
		this.symbol = symbol;
	}

	public ClassSymbol getSymbol()
	{
		return symbol;
	}

	public boolean isInterface()
	{
		return symbol.isInterface();
	}
}
