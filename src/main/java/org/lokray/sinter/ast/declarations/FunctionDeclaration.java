// File: src/main/java/org/lokray/sinter/ast/declarations/FunctionDeclaration.java
package org.lokray.sinter.ast.declarations;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.TypeNode;
import org.lokray.sinter.ast.statements.BlockStatement;
import org.lokray.sinter.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * AST node for a top-level {@code function name(params) -> Type { ... }}. Methods extend it.
 */
public class FunctionDeclaration implements Declaration
{
	private final Token keyword;
	private final Token nameToken;
	private final List<Parameter> parameters;
	private final TypeNode returnType;
	private final BlockStatement body; // Null for interface method signatures

	public FunctionDeclaration(Token keyword, Token nameToken, List<Parameter> parameters, TypeNode returnType, BlockStatement body)
	{
		this.keyword = keyword;
		this.nameToken = nameToken;
		this.parameters = Collections.unmodifiableList(parameters);
		this.returnType = returnType;
		this.body = body;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	@Override
	public Token getNameToken()
	{
		return nameToken;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public TypeNode getReturnType()
	{
		return returnType;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public String toString()
	{
		return keyword.getLexeme() + " " + getName() + parameters + " -> " + returnType;
	}
}
