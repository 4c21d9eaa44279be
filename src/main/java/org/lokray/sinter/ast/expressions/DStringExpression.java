// File: src/main/java/org/lokray/sinter/ast/expressions/DStringExpression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * AST node for a dynamic string literal {@code D"text {name} text"}. The template is split into literal
 * text parts and placeholder parts naming the variables it reads.
 */
public class DStringExpression implements Expression
{
	/**
	 * A literal run of text, or a {@code {name}} placeholder when {@link #isPlaceholder()} is true.
	 */
	public static class Part
	{
		private final String text;
		private final Token nameToken; // Non-null for placeholders

		private Part(String text, Token nameToken)
		{
			this.text = text;
			this.nameToken = nameToken;
		}

		public static Part text(String text)
		{
			return new Part(text, null);
		}

		public static Part placeholder(Token nameToken)
		{
			return new Part(nameToken.getLexeme(), nameToken);
		}

		public boolean isPlaceholder()
		{
			return nameToken != null;
		}

		public String getText()
		{
			return text;
		}

		public Token getNameToken()
		{
			return nameToken;
		}
	}

	private final Token token;
	private final String template;
	private final List<Part> parts;

	public DStringExpression(Token token, String template, List<Part> parts)
	{
		this.token = token;
		this.template = template;
		this.parts = Collections.unmodifiableList(parts);
	}

	public String getTemplate()
	{
		return template;
	}

	public List<Part> getParts()
	{
		return parts;
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDStringExpression(this);
	}

	@Override
	public String toString()
	{
		return "D\"" + template + "\"";
	}
}
