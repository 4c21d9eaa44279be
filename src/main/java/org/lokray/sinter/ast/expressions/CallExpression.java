// File: src/main/java/org/lokray/sinter/ast/expressions/CallExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * AST node for a call. The callee is an {@link IdentifierExpression} for functions and unqualified methods, or
 * a {@link DotExpression} for {@code receiver.method(...)} and {@code ClassName.new()}.
 */
public class CallExpression implements Expression
{
	private final Expression callee;
	private final Token paren; // The closing parenthesis, for error positions
	private final List<Expression> arguments;

	public CallExpression(Expression callee, Token paren, List<Expression> arguments)
	{
		this.callee = callee;
		this.paren = paren;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public Expression getCallee()
	{
		return callee;
	}

	public Token getParen()
	{
		return paren;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	/**
	 * @return The called name: the identifier or the member after the last dot.
	 */
	public String getCalleeName()
	{
		if (callee instanceof DotExpression)
		{
			return ((DotExpression) callee).getMemberName();
		}
		if (callee instanceof IdentifierExpression)
		{
			return ((IdentifierExpression) callee).getName();
		}
		return null;
	}

	@Override
	public Token getFirstToken()
	{
		return callee.getFirstToken();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public String toString()
	{
		return callee + "(" + arguments + ")";
	}
}
