// File: src/main/java/org/lokray/sinter/ast/declarations/MethodDeclaration.java
package org.lokray.sinter.ast.declarations;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.TypeNode;
import org.lokray.sinter.ast.statements.BlockStatement;
import org.lokray.sinter.lexer.Token;

import java.util.List;

/**
 * AST node for a method of a class or interface. A {@code function} declared inside a class is a static method.
 */
public class MethodDeclaration extends FunctionDeclaration
{
	private final Visibility visibility;
	private final boolean isStatic;

	public MethodDeclaration(Token keyword, Token nameToken, List<Parameter> parameters, TypeNode returnType,
							 BlockStatement body, Visibility visibility, boolean isStatic)
	{
		super(keyword, nameToken, parameters, returnType, body);
		this.visibility = visibility;
		this.isStatic = isStatic;
	}

	public Visibility getVisibility()
	{
		return visibility;
	}

	public boolean isStatic()
	{
		return isStatic;
	}

	public boolean isAbstract()
	{
		return getBody() == null;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMethodDeclaration(this);
	}
}
