// File: src/main/java/org/lokray/sinter/ast/declarations/Parameter.java
package org.lokray.sinter.ast.declarations;

import org.lokray.sinter.ast.TypeNode;
import org.lokray.sinter.lexer.Token;

public class Parameter
{
	private final Token nameToken;
	private final TypeNode type;

	public Parameter(Token nameToken, TypeNode type)
	{
		this.nameToken = nameToken;
		this.type = type;
	}

	public Token getNameToken()
	{
		return nameToken;
	}

	public String getName()
	{
		return nameToken.getLexeme();
	}

	public TypeNode getType()
	{
		return type;
	}

	@Override
	public String toString()
	{
		return getName() + ": " + type;
	}
}
