// File: src/main/java/org/lokray/sinter/ast/expressions/PostfixUnaryExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

/**
 * AST node for {@code x++} and {@code x--}; the value is the operand before the update.
 */
public class PostfixUnaryExpression implements Expression
{
	private final Expression operand;
	private final Token operator;

	public PostfixUnaryExpression(Expression operand, Token operator)
	{
		this.operand = operand;
		this.operator = operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	public Token getOperator()
	{
		return operator;
	}

	@Override
	public Token getFirstToken()
	{
		return operand.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPostfixUnaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + operand + operator.getLexeme() + ")";
	}
}
