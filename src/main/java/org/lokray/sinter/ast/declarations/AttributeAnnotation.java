// File: src/main/java/org/lokray/sinter/ast/declarations/AttributeAnnotation.java
package org.lokray.sinter.ast.declarations;

import org.lokray.sinter.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * The {@code @attribute(...)} annotation exactly as written on a field. Flag semantics are interpreted by the
 * annotation processor, not here.
 */
public class AttributeAnnotation
{
	/**
	 * One {@code name[=true|false]} entry of the argument list.
	 */
	public static class Argument
	{
		private final Token nameToken;
		private final boolean value;
		private final boolean explicitValue;

		public Argument(Token nameToken, boolean value, boolean explicitValue)
		{
			this.nameToken = nameToken;
			this.value = value;
			this.explicitValue = explicitValue;
		}

		public Token getNameToken()
		{
			return nameToken;
		}

		public String getName()
		{
			return nameToken.getLexeme();
		}

		public boolean getValue()
		{
			return value;
		}

		public boolean hasExplicitValue()
		{
			return explicitValue;
		}
	}

	private final Token atToken;
	private final Token nameToken;
	private final List<Argument> arguments;

	public AttributeAnnotation(Token atToken, Token nameToken, List<Argument> arguments)
	{
		this.atToken = atToken;
		this.nameToken = nameToken;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public Token getAtToken()
	{
		return atToken;
	}

	public Token getNameToken()
	{
		return nameToken;
	}

	public String getName()
	{
		return nameToken.getLexeme();
	}

	public List<Argument> getArguments()
	{
		return arguments;
	}

	/**
	 * @return The value of the last occurrence of {@code flag}, or false if absent.
	 */
	public boolean isSet(String flag)
	{
		boolean result = false;
		for (Argument argument : arguments)
		{
			if (argument.getName().equals(flag))
			{
				result = argument.getValue();
			}
		}
		return result;
	}
}
