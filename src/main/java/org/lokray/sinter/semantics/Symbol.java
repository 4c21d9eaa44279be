// File: src/main/java/org/lokray/sinter/semantics/Symbol.java

package org.lokray.sinter.semantics;

import org.lokray.sinter.ast.declarations.Visibility;
import org.lokray.sinter.lexer.Token;

/**
 * Abstract base class for all symbols in the symbol table.
 * A symbol represents a declared entity in the program (e.g., variable, method, class).
 */
public abstract class Symbol
{
	private final String name;
	private Type type;
	private final Token declarationToken; // The token where this symbol was declared
	protected Visibility visibility;

	/**
	 * Constructor for a Symbol.
	 *
	 * @param name             The name of the symbol.
	 * @param type             The type of the symbol.
	 * @param declarationToken The token representing the declaration of this symbol.
	 * @param visibility       The member visibility; top-level and local symbols are public.
	 */
	public Symbol(String name, Type type, Token declarationToken, Visibility visibility)
	{
		this.name = name;
		this.type = type;
		this.declarationToken = declarationToken;
		this.visibility = visibility;
	}

	public Symbol(String name, Type type, Token declarationToken)
	{
		this(name, type, declarationToken, Visibility.PUBLIC);
	}

	public String getName()
	{
		return name;
	}

	public Type getType()
	{
		return type;
	}

	public void setType(Type type)
	{
		this.type = type;
	}

	public Token getDeclarationToken()
	{
		return declarationToken;
	}

	public Visibility getVisibility()
	{
		return visibility;
	}

	/**
	 * Indicates whether this symbol represents a static member (function or class function).
	 */
	public abstract boolean isStatic();

	@Override
	public String toString()
	{
		int line = declarationToken != null ? declarationToken.getLine() : 0;
		return getClass().getSimpleName() + "{" + "name='" + name + '\'' + ", type=" + type + ", line=" + line + ", visibility=" + visibility + '}';
	}
}
