// File: src/main/java/org/lokray/sinter/ast/expressions/IdentifierExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

/**
 * AST node for a bare name: a variable, parameter, field, class name or callee.
 */
public class IdentifierExpression implements Expression
{
	private final Token name;

	public IdentifierExpression(Token name)
	{
		this.name = name;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
