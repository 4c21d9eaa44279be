// File: src/main/java/org/lokray/sinter/ast/expressions/UnaryExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

/**
 * AST node for a prefix operator: {@code -x}, {@code !b}, {@code *p} (dereference) or {@code &v} (address-of).
 */
public class UnaryExpression implements Expression
{
	private final Token operator;
	private final Expression operand;

	public UnaryExpression(Token operator, Expression operand)
	{
		this.operator = operator;
		this.operand = operand;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public Token getFirstToken()
	{
		return operator;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + operator.getLexeme() + operand + ")";
	}
}
