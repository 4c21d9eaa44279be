// File: src/main/java/org/lokray/sinter/ast/statements/ReturnStatement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.lexer.Token;

/**
 * AST node representing a 'return' statement, with an optional value.
 */
public class ReturnStatement implements Statement
{
	private final Token keyword;
	private final Expression value;

	public ReturnStatement(Token keyword, Expression value)
	{
		this.keyword = keyword;
		this.value = value;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}

	@Override
	public String toString()
	{
		return "Return " + (value != null ? value : "");
	}
}
