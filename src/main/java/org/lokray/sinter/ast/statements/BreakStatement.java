// File: src/main/java/org/lokray/sinter/ast/statements/BreakStatement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

public class BreakStatement implements Statement
{
	private final Token keyword;

	public BreakStatement(Token keyword)
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
		return visitor.visitBreakStatement(this);
	}

	@Override
	public String toString()
	{
		return "Break";
	}
}
