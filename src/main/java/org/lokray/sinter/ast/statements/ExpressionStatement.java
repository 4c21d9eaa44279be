// File: src/main/java/org/lokray/sinter/ast/statements/ExpressionStatement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.lexer.Token;

public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public Token getFirstToken()
	{
		return expression.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public String toString()
	{
		return expression + ";";
	}
}
