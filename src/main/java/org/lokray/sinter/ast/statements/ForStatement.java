// File: src/main/java/org/lokray/sinter/ast/statements/ForStatement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.lexer.Token;

/**
 * AST node for a C-style {@code for (init; condition; update) body}. Every part of the header is optional,
 * and the header opens its own scope so the induction variable is invisible after the loop.
 */
public class ForStatement implements Statement
{
	private final Token forKeyword;
	private final Statement initializer;
	private final Expression condition;
	private final Expression update;
	private final Statement body;

	public ForStatement(Token forKeyword, Statement initializer, Expression condition, Expression update, Statement body)
	{
		this.forKeyword = forKeyword;
		this.initializer = initializer;
		this.condition = condition;
		this.update = update;
		this.body = body;
	}

	public Statement getInitializer()
	{
		return initializer;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Expression getUpdate()
	{
		return update;
	}

	public Statement getBody()
	{
		return body;
	}

	@Override
	public Token getFirstToken()
	{
		return forKeyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}

	@Override
	public String toString()
	{
		return "For (" + initializer + "; " + condition + "; " + update + ") " + body;
	}
}
