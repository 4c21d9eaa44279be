// File: src/main/java/org/lokray/sinter/semantics/OverloadSet.java
package org.lokray.sinter.semantics;

import org.lokray.sinter.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The top-level functions sharing one name.
 */
public class OverloadSet extends Symbol
{
	private final List<MethodSymbol> functions = new ArrayList<>();

	public OverloadSet(String name, Token declarationToken)
	{
		super(name, null, declarationToken);
	}

	public void add(MethodSymbol function)
	{
		functions.add(function);
	}

	public List<MethodSymbol> getFunctions()
	{
		return Collections.unmodifiableList(functions);
	}

	@Override
	public boolean isStatic()
	{
		return true;
	}
}
