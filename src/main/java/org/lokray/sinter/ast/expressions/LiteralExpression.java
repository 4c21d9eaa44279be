// File: src/main/java/org/lokray/sinter/ast/expressions/LiteralExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

/**
 * AST node for a literal: integer, float, double, boolean, string or {@code null}.
 */
public class LiteralExpression implements Expression
{
	private final Token literalToken;
	private final Object value; // Integer, Float, Double, Boolean, String, or null

	public LiteralExpression(Token literalToken, Object value)
	{
		this.literalToken = literalToken;
		this.value = value;
	}

	public Token getLiteralToken()
	{
		return literalToken;
	}

	public Object getValue()
	{
		return value;
	}

	@Override
	public Token getFirstToken()
	{
		return literalToken;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public String toString()
	{
		return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
	}
}
