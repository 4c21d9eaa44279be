// File: src/main/java/org/lokray/sinter/lexer/Lexer.java

package org.lokray.sinter.lexer;

import org.lokray.sinter.util.DiagnosticCode;
import org.lokray.sinter.util.ErrorReporter;
import org.lokray.sinter.util.SourceSpan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads the raw Sinter source code and converts it into a stream of meaningful Tokens.
 */
public class Lexer
{
	private final String source;
	private final List<Token> tokens = new ArrayList<>();
	private final ErrorReporter errorReporter;

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1;
	private int column = 1;

	private int startLine = 1;
	private int startColumn = 1;

	// Static map to store reserved keywords for quick lookup
	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("class", TokenType.CLASS);
		keywords.put("interface", TokenType.INTERFACE);
		keywords.put("function", TokenType.FUNCTION);
		keywords.put("method", TokenType.METHOD);
		keywords.put("extends", TokenType.EXTENDS);
		keywords.put("implements", TokenType.IMPLEMENTS);
		keywords.put("private", TokenType.PRIVATE);
		keywords.put("protected", TokenType.PROTECTED);
		keywords.put("public", TokenType.PUBLIC);
		keywords.put("var", TokenType.VAR);
		keywords.put("const", TokenType.CONST);
		keywords.put("return", TokenType.RETURN);
		keywords.put("if", TokenType.IF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("while", TokenType.WHILE);
		keywords.put("for", TokenType.FOR);
		keywords.put("break", TokenType.BREAK);
		keywords.put("continue", TokenType.CONTINUE);
		keywords.put("null", TokenType.NULL);
		keywords.put("print", TokenType.PRINT);
		keywords.put("println", TokenType.PRINTLN);
		keywords.put("int", TokenType.INT);
		keywords.put("float", TokenType.FLOAT);
		keywords.put("double", TokenType.DOUBLE);
		keywords.put("boolean", TokenType.BOOLEAN);
		keywords.put("str", TokenType.STR);
		keywords.put("void", TokenType.VOID);
		keywords.put("true", TokenType.BOOLEAN_LITERAL);
		keywords.put("false", TokenType.BOOLEAN_LITERAL);
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source        The source code string to tokenize.
	 * @param errorReporter Collector for lexical errors.
	 */
	public Lexer(String source, ErrorReporter errorReporter)
	{
		this.source = source;
		this.errorReporter = errorReporter;
	}

	/**
	 * Scans the entire source code and returns a list of tokens, terminated by an EOF token.
	 */
	public List<Token> scanTokens()
	{
		while (!isAtEnd())
		{
			start = current;
			startLine = line;
			startColumn = column;
			scanToken();
		}

		tokens.add(new Token(TokenType.EOF, "", null, line, column));
		return tokens;
	}

	private void scanToken()
	{
		char c = advance();

		switch (c)
		{
			case '(':
				addToken(TokenType.LEFT_PAREN);
				break;
			case ')':
				addToken(TokenType.RIGHT_PAREN);
				break;
			case '{':
				addToken(TokenType.LEFT_BRACE);
				break;
			case '}':
				addToken(TokenType.RIGHT_BRACE);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case ':':
				addToken(TokenType.COLON);
				break;
			case '.':
				addToken(TokenType.DOT);
				break;
			case '@':
				addToken(TokenType.AT);
				break;

			case '+':
				if (match('+'))
				{
					addToken(TokenType.PLUS_PLUS);
				}
				else if (match('='))
				{
					addToken(TokenType.PLUS_ASSIGN);
				}
				else
				{
					addToken(TokenType.PLUS);
				}
				break;
			case '-':
				if (match('>'))
				{
					addToken(TokenType.ARROW);
				}
				else if (match('-'))
				{
					addToken(TokenType.MINUS_MINUS);
				}
				else if (match('='))
				{
					addToken(TokenType.MINUS_ASSIGN);
				}
				else
				{
					addToken(TokenType.MINUS);
				}
				break;
			case '*':
				addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
				break;
			case '/':
				if (match('='))
				{
					addToken(TokenType.SLASH_ASSIGN);
				}
				else if (match('/'))
				{
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
				}
				else if (match('*'))
				{
					blockComment();
				}
				else
				{
					addToken(TokenType.SLASH);
				}
				break;
			case '%':
				addToken(TokenType.MODULO);
				break;
			case '=':
				addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
				break;
			case '!':
				addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
				break;
			case '<':
				addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
				break;
			case '>':
				addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
				break;
			case '&':
				addToken(match('&') ? TokenType.AMPERSAND_AMPERSAND : TokenType.AMPERSAND);
				break;
			case '|':
				if (match('|'))
				{
					addToken(TokenType.PIPE_PIPE);
				}
				else
				{
					error("Unexpected character '|'. Did you mean '||'?");
					addToken(TokenType.ERROR);
				}
				break;

			case '"':
				scanStringLiteral(TokenType.STRING_LITERAL);
				break;

			case ' ':
			case '\r':
			case '\t':
				break;
			case '\n':
				newLine();
				break;

			default:
				if (c == 'D' && peek() == '"')
				{
					advance(); // Consume the opening quote of D"..."
					scanStringLiteral(TokenType.DSTRING_LITERAL);
				}
				else if (Character.isDigit(c))
				{
					scanNumber();
				}
				else if (Character.isLetter(c) || c == '_')
				{
					scanIdentifier();
				}
				else
				{
					error("Unexpected character '" + c + "'.");
					addToken(TokenType.ERROR);
				}
				break;
		}
	}

	private void blockComment()
	{
		while (!(peek() == '*' && peekNext() == '/') && !isAtEnd())
		{
			if (advance() == '\n')
			{
				newLine();
			}
		}
		if (isAtEnd())
		{
			error("Unterminated multi-line comment.");
			return;
		}
		advance();
		advance();
	}

	private void scanNumber()
	{
		while (Character.isDigit(peek()))
		{
			advance();
		}

		boolean isFloatingPoint = false;
		if (peek() == '.' && Character.isDigit(peekNext()))
		{
			isFloatingPoint = true;
			advance();
			while (Character.isDigit(peek()))
			{
				advance();
			}
		}

		String numberStr = source.substring(start, current);
		if (isFloatingPoint)
		{
			if (peek() == 'f' || peek() == 'F')
			{
				advance();
				addToken(TokenType.FLOAT_LITERAL, Float.parseFloat(numberStr));
			}
			else
			{
				addToken(TokenType.DOUBLE_LITERAL, Double.parseDouble(numberStr));
			}
			return;
		}

		try
		{
			addToken(TokenType.INTEGER_LITERAL, Integer.parseInt(numberStr));
		}
		catch (NumberFormatException e)
		{
			error("Integer literal out of 32-bit range: " + numberStr);
			addToken(TokenType.ERROR);
		}
	}

	/**
	 * Scans a string body after its opening quote. D-strings keep their braces verbatim; the
	 * placeholders are parsed later.
	 */
	private void scanStringLiteral(TokenType type)
	{
		StringBuilder value = new StringBuilder();
		while (peek() != '"' && !isAtEnd())
		{
			char c = advance();
			if (c == '\\')
			{
				if (isAtEnd())
				{
					break;
				}
				char escapeChar = advance();
				switch (escapeChar)
				{
					case 'n':
						value.append('\n');
						break;
					case 't':
						value.append('\t');
						break;
					case '"':
						value.append('"');
						break;
					case '\\':
						value.append('\\');
						break;
					default:
						error("Invalid escape sequence '\\" + escapeChar + "' in string literal.");
						value.append('\\').append(escapeChar);
						break;
				}
			}
			else
			{
				if (c == '\n')
				{
					newLine();
				}
				value.append(c);
			}
		}

		if (isAtEnd())
		{
			error("Unterminated string literal.");
			addToken(TokenType.ERROR);
			return;
		}

		advance(); // Consume the closing '"'
		addToken(type, value.toString());
	}

	private void scanIdentifier()
	{
		while (Character.isLetterOrDigit(peek()) || peek() == '_')
		{
			advance();
		}

		String text = source.substring(start, current);
		TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
		if (type == TokenType.BOOLEAN_LITERAL)
		{
			addToken(type, Boolean.parseBoolean(text));
		}
		else
		{
			addToken(type);
		}
	}

	private char advance()
	{
		char c = source.charAt(current++);
		column++;
		return c;
	}

	private void newLine()
	{
		line++;
		column = 1;
	}

	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, literal, startLine, startColumn));
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}
		current++;
		column++;
		return true;
	}

	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private char peekNext()
	{
		if (current + 1 >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + 1);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private void error(String message)
	{
		errorReporter.error(DiagnosticCode.LEXICAL, new SourceSpan(startLine, startColumn, line, Math.max(startColumn, column - 1)), message);
	}
}
