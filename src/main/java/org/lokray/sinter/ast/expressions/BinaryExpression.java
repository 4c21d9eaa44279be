// File: src/main/java/org/lokray/sinter/ast/expressions/BinaryExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

/**
 * AST node representing a binary operation (e.g., a + b, x == y, c && d).
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operator;
	private final Expression right;

	public BinaryExpression(Expression left, Token operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public Token getFirstToken()
	{
		return left.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getLexeme() + " " + right + ")";
	}
}
