// File: src/main/java/org/lokray/sinter/ast/declarations/InterfaceDeclaration.java
package org.lokray.sinter.ast.declarations;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * AST node for an interface: method signatures only, optionally extending other interfaces.
 */
public class InterfaceDeclaration implements Declaration
{
	private final Token keyword;
	private final Token nameToken;
	private final List<Token> superInterfaceNames;
	private final List<MethodDeclaration> methods;

	public InterfaceDeclaration(Token keyword, Token nameToken, List<Token> superInterfaceNames, List<MethodDeclaration> methods)
	{
		this.keyword = keyword;
		this.nameToken = nameToken;
		this.superInterfaceNames = Collections.unmodifiableList(superInterfaceNames);
		this.methods = Collections.unmodifiableList(methods);
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

	public List<Token> getSuperInterfaceNames()
	{
		return superInterfaceNames;
	}

	public List<MethodDeclaration> getMethods()
	{
		return methods;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInterfaceDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "interface " + getName();
	}
}
