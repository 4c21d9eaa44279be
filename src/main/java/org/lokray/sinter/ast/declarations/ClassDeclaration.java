// File: src/main/java/org/lokray/sinter/ast/declarations/ClassDeclaration.java
package org.lokray.sinter.ast.declarations;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * AST node representing a class declaration.
 * Fields and methods keep their declaration order, which fixes the record layout and serialization order.
 */
public class ClassDeclaration implements Declaration
{
	private final Token classKeyword;
	private final Token nameToken;
	private final Token superclassName; // Null when the class has no 'extends'
	private final List<Token> interfaceNames;
	private final List<FieldDeclaration> fields;
	private final List<MethodDeclaration> methods;
	private final Token rightBrace;

	public ClassDeclaration(Token classKeyword, Token nameToken, Token superclassName, List<Token> interfaceNames,
							List<FieldDeclaration> fields, List<MethodDeclaration> methods, Token rightBrace)
	{
		this.classKeyword = classKeyword;
		this.nameToken = nameToken;
		this.superclassName = superclassName;
		this.interfaceNames = Collections.unmodifiableList(interfaceNames);
		this.fields = Collections.unmodifiableList(fields);
		this.methods = Collections.unmodifiableList(methods);
		this.rightBrace = rightBrace;
	}

	public Token getClassKeyword()
	{
		return classKeyword;
	}

	@Override
	public Token getNameToken()
	{
		return nameToken;
	}

	public Token getSuperclassName()
	{
		return superclassName;
	}

	public List<Token> getInterfaceNames()
	{
		return interfaceNames;
	}

	public List<FieldDeclaration> getFields()
	{
		return fields;
	}

	public List<MethodDeclaration> getMethods()
	{
		return methods;
	}

	public Token getRightBrace()
	{
		return rightBrace;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitClassDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "class " + getName() + (superclassName != null ? " extends " + superclassName.getLexeme() : "");
	}
}
