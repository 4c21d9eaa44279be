// File: src/main/java/org/lokray/sinter/ast/expressions/AssignmentExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

/**
 * AST node for {@code target = value} and the compound forms {@code += -= *= /=}.
 */
public class AssignmentExpression implements Expression
{
	private final Expression target;
	private final Token operator;
	private final Expression value;

	public AssignmentExpression(Expression target, Token operator, Expression value)
	{
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getValue()
	{
		return value;
	}

	public boolean isCompound()
	{
		return !"=".equals(operator.getLexeme());
	}

	@Override
	public Token getFirstToken()
	{
		return target.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + target + " " + operator.getLexeme() + " " + value + ")";
	}
}
