// File: src/main/java/org/lokray/sinter/ast/statements/PrintStatement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.lexer.Token;

/**
 * {@code print(expr);} or {@code println(expr);}
 */
public class PrintStatement implements Statement
{
	private final Token keyword;
	private final Expression expression;

	public PrintStatement(Token keyword, Expression expression)
	{
		this.keyword = keyword;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	public boolean isNewline()
	{
		return "println".equals(keyword.getLexeme());
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPrintStatement(this);
	}

	@Override
	public String toString()
	{
		return keyword.getLexeme() + "(" + expression + ")";
	}
}
