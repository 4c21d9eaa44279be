package org.lokray.sinter.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.lokray.sinter.util.DiagnosticCode;
import org.lokray.sinter.util.ErrorReporter;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LexerTest
{
	private static List<TokenType> types(List<Token> tokens)
	{
		return tokens.stream().map(Token::getType).collect(Collectors.toList());
	}

	@Test
	void scansDeclarationWithPointerTypeAndArrow()
	{
		// Arrange
		ErrorReporter reporter = new ErrorReporter();
		String source = "function make(n: int) -> Node* { return Node.new(); }";

		// Act
		List<Token> tokens = new Lexer(source, reporter).scanTokens();

		// Assert
		assertThat(reporter.hasErrors()).isFalse();
		assertThat(types(tokens)).containsExactly(
				TokenType.FUNCTION, TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.COLON,
				TokenType.INT, TokenType.RIGHT_PAREN, TokenType.ARROW, TokenType.IDENTIFIER, TokenType.STAR,
				TokenType.LEFT_BRACE, TokenType.RETURN, TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER,
				TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.SEMICOLON, TokenType.RIGHT_BRACE, TokenType.EOF);
	}

	@Test
	void typesNumericLiteralsBySuffix()
	{
		// Arrange
		ErrorReporter reporter = new ErrorReporter();

		// Act
		List<Token> tokens = new Lexer("42 2.5 2.5f", reporter).scanTokens();

		// Assert
		assertThat(types(tokens)).containsExactly(TokenType.INTEGER_LITERAL, TokenType.DOUBLE_LITERAL, TokenType.FLOAT_LITERAL, TokenType.EOF);
		assertThat(tokens.get(0).getLiteral()).isEqualTo(42);
		assertThat(tokens.get(1).getLiteral()).isEqualTo(2.5);
		assertThat(tokens.get(2).getLiteral()).isEqualTo(2.5f);
	}

	@Test
	void keepsDStringTemplateVerbatim()
	{
		// Arrange
		ErrorReporter reporter = new ErrorReporter();

		// Act
		List<Token> tokens = new Lexer("D\"count is {count}\"", reporter).scanTokens();

		// Assert
		assertThat(tokens.get(0).getType()).isEqualTo(TokenType.DSTRING_LITERAL);
		assertThat(tokens.get(0).getLiteral()).isEqualTo("count is {count}");
	}

	@Test
	void decodesEscapesInStringLiterals()
	{
		// Arrange
		ErrorReporter reporter = new ErrorReporter();

		// Act
		List<Token> tokens = new Lexer("\"a\\tb\\n\\\"c\\\"\"", reporter).scanTokens();

		// Assert
		assertThat(tokens.get(0).getLiteral()).isEqualTo("a\tb\n\"c\"");
	}

	@Test
	void skipsCommentsAndTracksLines()
	{
		// Arrange
		ErrorReporter reporter = new ErrorReporter();
		String source = String.join("\n",
				"// header",
				"/* block",
				"   comment */ var x",
				"x++;");

		// Act
		List<Token> tokens = new Lexer(source, reporter).scanTokens();

		// Assert
		assertThat(types(tokens)).containsExactly(TokenType.VAR, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.PLUS_PLUS,
				TokenType.SEMICOLON, TokenType.EOF);
		assertThat(tokens.get(0).getLine()).isEqualTo(3);
		assertThat(tokens.get(2).getLine()).isEqualTo(4);
	}

	@Test
	void reportsUnterminatedStringAndStrayCharacter()
	{
		// Arrange
		ErrorReporter reporter = new ErrorReporter();

		// Act
		new Lexer("var a = # ; \"open", reporter).scanTokens();

		// Assert
		assertThat(reporter.getErrors()).hasSize(2);
		assertThat(reporter.getErrors()).allMatch(d -> d.getCode() == DiagnosticCode.LEXICAL);
	}
}
