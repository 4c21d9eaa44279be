// File: src/main/java/org/lokray/sinter/lexer/TokenType.java
package org.lokray.sinter.lexer;

/**
 * Enumeration of all token kinds of the Sinter language.
 */
public enum TokenType
{
	// Keywords
	CLASS, INTERFACE, FUNCTION, METHOD, EXTENDS, IMPLEMENTS,
	PRIVATE, PROTECTED, PUBLIC,
	VAR, CONST, RETURN, IF, ELSE, WHILE, FOR, BREAK, CONTINUE,
	NULL, PRINT, PRINTLN,

	// Type keywords
	INT, FLOAT, DOUBLE, BOOLEAN, STR, VOID,

	// Literals
	IDENTIFIER,
	INTEGER_LITERAL,
	FLOAT_LITERAL,
	DOUBLE_LITERAL,
	STRING_LITERAL,
	DSTRING_LITERAL, // D"The count is: {count}"
	BOOLEAN_LITERAL,

	// Operators
	PLUS, MINUS, STAR, SLASH, MODULO,
	PLUS_PLUS, MINUS_MINUS,
	ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN,
	EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
	AMPERSAND_AMPERSAND, PIPE_PIPE, BANG,
	AMPERSAND, // address-of
	ARROW,     // ->

	// Punctuation
	LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
	COMMA, SEMICOLON, COLON, DOT,
	AT, // annotation marker

	ERROR,
	EOF
}
