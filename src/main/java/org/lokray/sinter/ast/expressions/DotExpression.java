// File: src/main/java/org/lokray/sinter/ast/expressions/DotExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

/**
 * AST node for member access {@code target.member}. Pointer receivers are dereferenced implicitly.
 */
public class DotExpression implements Expression
{
	private final Expression target;
	private final Token memberName;

	public DotExpression(Expression target, Token memberName)
	{
		this.target = target;
		this.memberName = memberName;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Token getMemberToken()
	{
		return memberName;
	}

	public String getMemberName()
	{
		return memberName.getLexeme();
	}

	@Override
	public Token getFirstToken()
	{
		return target.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDotExpression(this);
	}

	@Override
	public String toString()
	{
		return target + "." + getMemberName();
	}
}
