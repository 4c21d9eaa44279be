// File: src/main/java/org/lokray/sinter/ast/statements/IfStatement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.lexer.Token;

/**
 * AST node representing an 'if-else' statement. The else branch is optional.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;
	private final Expression condition;
	private final Statement thenBranch;
	private final Statement elseBranch; // May be null

	public IfStatement(Token ifKeyword, Expression condition, Statement thenBranch, Statement elseBranch)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getThenBranch()
	{
		return thenBranch;
	}

	public Statement getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public Token getFirstToken()
	{
		return ifKeyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		return "If (" + condition + ") " + thenBranch + (elseBranch != null ? " Else " + elseBranch : "");
	}
}
