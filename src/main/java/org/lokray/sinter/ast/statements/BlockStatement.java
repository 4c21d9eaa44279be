// File: src/main/java/org/lokray/sinter/ast/statements/BlockStatement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * AST node representing a block of statements enclosed in curly braces. Each block opens a scope.
 */
public class BlockStatement implements Statement
{
	private final Token leftBrace;
	private final List<Statement> statements;
	private final Token rightBrace;

	public BlockStatement(Token leftBrace, List<Statement> statements, Token rightBrace)
	{
		this.leftBrace = leftBrace;
		this.statements = Collections.unmodifiableList(statements);
		this.rightBrace = rightBrace;
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	public Token getRightBrace()
	{
		return rightBrace;
	}

	@Override
	public Token getFirstToken()
	{
		return leftBrace;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public String toString()
	{
		return "Block" + statements;
	}
}
