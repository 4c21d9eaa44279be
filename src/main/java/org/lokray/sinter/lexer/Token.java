// File: src/main/java/org/lokray/sinter/lexer/Token.java
package org.lokray.sinter.lexer;

/**
 * Represents a single token produced by the Sinter Lexer.
 * Each token encapsulates its type, the actual text (lexeme),
 * and its position in the source file for error reporting.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, INT, PLUS)
	private final String lexeme;     // The actual text of the token (e.g., "count", "123", "+")
	private final Object literal;    // The parsed value of the literal (e.g., Integer 123, String "hello")
	private final int line;
	private final int column;

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type    The TokenType of this token.
	 * @param lexeme  The raw string value of the token from the source code.
	 * @param literal The parsed literal value for literal tokens, null for anything else.
	 * @param line    The line number where this token begins.
	 * @param column  The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, Object literal, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	/**
	 * Creates a token that does not come from source text, such as the name of a synthesized accessor.
	 */
	public static Token synthetic(TokenType type, String lexeme, Token origin)
	{
		int line = origin != null ? origin.line : 0;
		int column = origin != null ? origin.column : 0;
		return new Token(type, lexeme, null, line, column);
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	@Override
	public String toString()
	{
		String literalStr = (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + lexeme + "'" + literalStr + " (Line:" + line + ", Col:" + column + ")";
	}
}
