// File: src/main/java/org/lokray/sinter/ast/statements/VariableDeclarationStatement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.TypeNode;
import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.lexer.Token;

/**
 * AST node for {@code var name[: Type] [= initializer];}. A missing type is inferred from the initializer.
 */
public class VariableDeclarationStatement implements Statement
{
	private final Token keyword;
	private final Token nameToken;
	private final TypeNode type;
	private final Expression initializer;

	public VariableDeclarationStatement(Token keyword, Token nameToken, TypeNode type, Expression initializer)
	{
		this.keyword = keyword;
		this.nameToken = nameToken;
		this.type = type;
		this.initializer = initializer;
	}

	public Token getNameToken()
	{
		return nameToken;
	}

	public String getName()
	{
		return nameToken.getLexeme();
	}

	public TypeNode getType()
	{
		return type;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	public boolean isConst()
	{
		return "const".equals(keyword.getLexeme());
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableDeclarationStatement(this);
	}

	@Override
	public String toString()
	{
		return "Var " + getName() + (type != null ? ": " + type : "") + (initializer != null ? " = " + initializer : "");
	}
}
