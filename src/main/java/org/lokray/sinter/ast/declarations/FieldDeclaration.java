// File: src/main/java/org/lokray/sinter/ast/declarations/FieldDeclaration.java
package org.lokray.sinter.ast.declarations;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.TypeNode;
import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.lexer.Token;

/**
 * AST node for a class field: {@code [@attribute(...)] var name: Type [= initializer]}.
 */
public class FieldDeclaration implements Declaration
{
	private final Token keyword; // 'var' or 'const'
	private final Token nameToken;
	private final TypeNode type;
	private final Expression initializer; // Constant expression or null
	private final Visibility visibility;
	private final AttributeAnnotation annotation; // Null when the field carries no annotation

	public FieldDeclaration(Token keyword, Token nameToken, TypeNode type, Expression initializer,
							Visibility visibility, AttributeAnnotation annotation)
	{
		this.keyword = keyword;
		this.nameToken = nameToken;
		this.type = type;
		this.initializer = initializer;
		this.visibility = visibility;
		this.annotation = annotation;
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

	public TypeNode getType()
	{
		return type;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	public Visibility getVisibility()
	{
		return visibility;
	}

	public AttributeAnnotation getAnnotation()
	{
		return annotation;
	}

	public boolean isConst()
	{
		return "const".equals(keyword.getLexeme());
	}

	/**
	 * A derived field has no storage; its reads go through the same-named method.
	 */
	public boolean isDerived()
	{
		return annotation != null && annotation.isSet("derived");
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFieldDeclaration(this);
	}

	@Override
	public String toString()
	{
		return (annotation != null ? "@" + annotation.getName() + " " : "") + keyword.getLexeme() + " " + getName() + ": " + type;
	}
}
