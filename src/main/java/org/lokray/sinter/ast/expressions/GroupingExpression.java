// File: src/main/java/org/lokray/sinter/ast/expressions/GroupingExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

public class GroupingExpression implements Expression
{
	private final Token leftParen;
	private final Expression expression;

	public GroupingExpression(Token leftParen, Expression expression)
	{
		this.leftParen = leftParen;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public Token getFirstToken()
	{
		return leftParen;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGroupingExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + expression + ")";
	}
}
