// File: src/main/java/org/lokray/sinter/ast/TypeNode.java
package org.lokray.sinter.ast;

import org.lokray.sinter.lexer.Token;

/**
 * A type as written in source: a base name followed by zero or more {@code *}.
 */
public class TypeNode
{
	private final Token nameToken;
	private final int pointerDepth;

	public TypeNode(Token nameToken, int pointerDepth)
	{
		this.nameToken = nameToken;
		this.pointerDepth = pointerDepth;
	}

	public Token getNameToken()
	{
		return nameToken;
	}

	public String getBaseName()
	{
		return nameToken.getLexeme();
	}

	public int getPointerDepth()
	{
		return pointerDepth;
	}

	@Override
	public String toString()
	{
		return getBaseName() + "*".repeat(pointerDepth);
	}
}
