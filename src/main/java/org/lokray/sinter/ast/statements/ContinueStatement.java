// File: src/main/java/org/lokray/sinter/ast/statements/ContinueStatement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

public class ContinueStatement implements Statement
{
	private final Token keyword;

	public ContinueStatement(Token keyword)
	{
		this.keyword = keyword;
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitContinueStatement(this);
	}

	@Override
	public String toString()
	{
		return "Continue";
	}
}
