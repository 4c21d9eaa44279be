// File: src/main/java/org/lokray/sinter/parser/SinterParser.java

package org.lokray.sinter.parser;

import org.lokray.sinter.ast.Program;
import org.lokray.sinter.ast.TypeNode;
import org.lokray.sinter.ast.declarations.AttributeAnnotation;
import org.lokray.sinter.ast.declarations.ClassDeclaration;
import org.lokray.sinter.ast.declarations.Declaration;
import org.lokray.sinter.ast.declarations.FieldDeclaration;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.declarations.InterfaceDeclaration;
import org.lokray.sinter.ast.declarations.MethodDeclaration;
import org.lokray.sinter.ast.declarations.Parameter;
import org.lokray.sinter.ast.declarations.Visibility;
import org.lokray.sinter.ast.expressions.AssignmentExpression;
import org.lokray.sinter.ast.expressions.BinaryExpression;
import org.lokray.sinter.ast.expressions.CallExpression;
import org.lokray.sinter.ast.expressions.DStringExpression;
import org.lokray.sinter.ast.expressions.DotExpression;
import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.ast.expressions.GroupingExpression;
import org.lokray.sinter.ast.expressions.IdentifierExpression;
import org.lokray.sinter.ast.expressions.LiteralExpression;
import org.lokray.sinter.ast.expressions.PostfixUnaryExpression;
import org.lokray.sinter.ast.expressions.UnaryExpression;
import org.lokray.sinter.ast.statements.BlockStatement;
import org.lokray.sinter.ast.statements.BreakStatement;
import org.lokray.sinter.ast.statements.ContinueStatement;
import org.lokray.sinter.ast.statements.ExpressionStatement;
import org.lokray.sinter.ast.statements.ForStatement;
import org.lokray.sinter.ast.statements.IfStatement;
import org.lokray.sinter.ast.statements.PrintStatement;
import org.lokray.sinter.ast.statements.ReturnStatement;
import org.lokray.sinter.ast.statements.Statement;
import org.lokray.sinter.ast.statements.VariableDeclarationStatement;
import org.lokray.sinter.ast.statements.WhileStatement;
import org.lokray.sinter.lexer.Token;
import org.lokray.sinter.lexer.TokenType;
import org.lokray.sinter.util.Debug;
import org.lokray.sinter.util.DiagnosticCode;
import org.lokray.sinter.util.ErrorReporter;

import java.util.ArrayList;
import java.util.List;

/**
 * The SinterParser is responsible for performing syntactic analysis.
 * It takes a list of tokens from the lexer and builds an Abstract Syntax Tree (AST)
 * using a recursive-descent approach. After a syntax error it resynchronizes at the next
 * statement or member boundary so that a single run reports as many errors as possible.
 */
public class SinterParser
{
	private final List<Token> tokens;
	private final ErrorReporter errorReporter;
	private int current = 0;

	/**
	 * Constructs a SinterParser.
	 *
	 * @param tokens        The list of tokens produced by the lexer.
	 * @param errorReporter Collector for syntax errors.
	 */
	public SinterParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		this.tokens = tokens;
		this.errorReporter = errorReporter;
	}

	/**
	 * Parses the whole token stream.
	 *
	 * @return The Program node. Declarations that failed to parse are left out.
	 */
	public Program parse()
	{
		Debug.log("Parsing %d tokens", tokens.size());
		List<Declaration> declarations = new ArrayList<>();
		while (!isAtEnd())
		{
			try
			{
				if (check(TokenType.CLASS))
				{
					declarations.add(classDeclaration());
				}
				else if (check(TokenType.INTERFACE))
				{
					declarations.add(interfaceDeclaration());
				}
				else if (check(TokenType.FUNCTION))
				{
					declarations.add(functionDeclaration());
				}
				else
				{
					throw error(peek(), "Expected a class, interface or function declaration at the top level.");
				}
			}
			catch (SyntaxError e)
			{
				synchronizeTopLevel();
			}
		}
		return new Program(declarations);
	}

	// --- Declarations ---

	/**
	 * Grammar: {@code class NAME (extends NAME)? (implements NAME (, NAME)*)? { member* }}
	 */
	private ClassDeclaration classDeclaration() throws SyntaxError
	{
		Token classKeyword = consume(TokenType.CLASS, "Expected 'class'.");
		Token name = consume(TokenType.IDENTIFIER, "Expected class name.");
		Token superclass = null;
		if (match(TokenType.EXTENDS))
		{
			superclass = consume(TokenType.IDENTIFIER, "Expected superclass name after 'extends'.");
		}
		List<Token> interfaces = new ArrayList<>();
		if (match(TokenType.IMPLEMENTS))
		{
			do
			{
				interfaces.add(consume(TokenType.IDENTIFIER, "Expected interface name after 'implements'."));
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.LEFT_BRACE, "Expected '{' before class body.");

		List<FieldDeclaration> fields = new ArrayList<>();
		List<MethodDeclaration> methods = new ArrayList<>();
		Visibility visibility = Visibility.PRIVATE;

		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			try
			{
				if (check(TokenType.PUBLIC, TokenType.PRIVATE, TokenType.PROTECTED) && check(1, TokenType.COLON))
				{
					visibility = visibilityOf(advance());
					advance(); // ':'
				}
				else if (check(TokenType.METHOD))
				{
					methods.add(methodDeclaration(visibility, false));
				}
				else if (check(TokenType.FUNCTION))
				{
					methods.add(methodDeclaration(visibility, true));
				}
				else if (check(TokenType.AT, TokenType.VAR, TokenType.CONST))
				{
					fields.add(fieldDeclaration(visibility));
				}
				else
				{
					throw error(peek(), "Expected a field, method or visibility section in class body.");
				}
			}
			catch (SyntaxError e)
			{
				synchronizeClassBody();
			}
		}
		Token rightBrace = consume(TokenType.RIGHT_BRACE, "Expected '}' after class body.");
		return new ClassDeclaration(classKeyword, name, superclass, interfaces, fields, methods, rightBrace);
	}

	private InterfaceDeclaration interfaceDeclaration() throws SyntaxError
	{
		Token keyword = consume(TokenType.INTERFACE, "Expected 'interface'.");
		Token name = consume(TokenType.IDENTIFIER, "Expected interface name.");
		List<Token> supers = new ArrayList<>();
		if (match(TokenType.EXTENDS))
		{
			do
			{
				supers.add(consume(TokenType.IDENTIFIER, "Expected interface name after 'extends'."));
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.LEFT_BRACE, "Expected '{' before interface body.");
		List<MethodDeclaration> methods = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			try
			{
				Token methodKeyword = consume(TokenType.METHOD, "Interfaces may only declare method signatures.");
				Token methodName = consume(TokenType.IDENTIFIER, "Expected method name.");
				List<Parameter> parameters = parameterList();
				TypeNode returnType = returnType(methodKeyword);
				consume(TokenType.SEMICOLON, "Expected ';' after interface method signature.");
				methods.add(new MethodDeclaration(methodKeyword, methodName, parameters, returnType, null, Visibility.PUBLIC, false));
			}
			catch (SyntaxError e)
			{
				synchronizeClassBody();
			}
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' after interface body.");
		return new InterfaceDeclaration(keyword, name, supers, methods);
	}

	private FunctionDeclaration functionDeclaration() throws SyntaxError
	{
		Token keyword = consume(TokenType.FUNCTION, "Expected 'function'.");
		Token name = consume(TokenType.IDENTIFIER, "Expected function name.");
		List<Parameter> parameters = parameterList();
		TypeNode returnType = returnType(keyword);
		BlockStatement body = blockStatement();
		return new FunctionDeclaration(keyword, name, parameters, returnType, body);
	}

	private MethodDeclaration methodDeclaration(Visibility visibility, boolean isStatic) throws SyntaxError
	{
		Token keyword = advance(); // 'method' or 'function'
		Token name = consume(TokenType.IDENTIFIER, "Expected method name.");
		List<Parameter> parameters = parameterList();
		TypeNode returnType = returnType(keyword);
		BlockStatement body = blockStatement();
		return new MethodDeclaration(keyword, name, parameters, returnType, body, visibility, isStatic);
	}

	/**
	 * Grammar: {@code annotation? (var | const) NAME : TYPE (= EXPRESSION)? ;?}
	 */
	private FieldDeclaration fieldDeclaration(Visibility visibility) throws SyntaxError
	{
		AttributeAnnotation annotation = null;
		if (check(TokenType.AT))
		{
			annotation = annotation();
		}
		Token keyword = consume(new TokenType[]{TokenType.VAR, TokenType.CONST}, "Expected 'var' or 'const' after annotation.");
		Token name = consume(TokenType.IDENTIFIER, "Expected field name.");
		consume(TokenType.COLON, "Expected ':' and a type after field name.");
		TypeNode type = type();
		Expression initializer = null;
		if (match(TokenType.ASSIGN))
		{
			initializer = expression();
		}
		match(TokenType.SEMICOLON);
		return new FieldDeclaration(keyword, name, type, initializer, visibility, annotation);
	}

	/**
	 * Grammar: {@code @ NAME ( '(' NAME (= BOOLEAN)? (, NAME (= BOOLEAN)?)* ')' )?}
	 */
	private AttributeAnnotation annotation() throws SyntaxError
	{
		Token at = consume(TokenType.AT, "Expected '@'.");
		Token name = consume(TokenType.IDENTIFIER, "Expected annotation name after '@'.");
		List<AttributeAnnotation.Argument> arguments = new ArrayList<>();
		if (match(TokenType.LEFT_PAREN))
		{
			if (!check(TokenType.RIGHT_PAREN))
			{
				do
				{
					Token flag = consume(TokenType.IDENTIFIER, "Expected annotation flag name.");
					if (match(TokenType.ASSIGN))
					{
						Token value = consume(TokenType.BOOLEAN_LITERAL, "Annotation flag values must be 'true' or 'false'.");
						arguments.add(new AttributeAnnotation.Argument(flag, (Boolean) value.getLiteral(), true));
					}
					else
					{
						arguments.add(new AttributeAnnotation.Argument(flag, true, false));
					}
				}
				while (match(TokenType.COMMA));
			}
			consume(TokenType.RIGHT_PAREN, "Expected ')' after annotation flags.");
		}
		return new AttributeAnnotation(at, name, arguments);
	}

	private List<Parameter> parameterList() throws SyntaxError
	{
		consume(TokenType.LEFT_PAREN, "Expected '(' before parameter list.");
		List<Parameter> parameters = new ArrayList<>();
		if (!check(TokenType.RIGHT_PAREN))
		{
			do
			{
				Token name = consume(TokenType.IDENTIFIER, "Expected parameter name.");
				consume(TokenType.COLON, "Expected ':' after parameter name.");
				parameters.add(new Parameter(name, type()));
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters.");
		return parameters;
	}

	private TypeNode returnType(Token origin) throws SyntaxError
	{
		if (match(TokenType.ARROW))
		{
			return type();
		}
		return new TypeNode(Token.synthetic(TokenType.VOID, "void", origin), 0);
	}

	/**
	 * Grammar: {@code (int | float | double | boolean | str | void | NAME) '*'*}
	 */
	private TypeNode type() throws SyntaxError
	{
		Token base = consume(new TokenType[]{TokenType.INT, TokenType.FLOAT, TokenType.DOUBLE, TokenType.BOOLEAN,
				TokenType.STR, TokenType.VOID, TokenType.IDENTIFIER}, "Expected a type.");
		int depth = 0;
		while (match(TokenType.STAR))
		{
			depth++;
		}
		return new TypeNode(base, depth);
	}

	// --- Statements ---

	private BlockStatement blockStatement() throws SyntaxError
	{
		Token leftBrace = consume(TokenType.LEFT_BRACE, "Expected '{' before block.");
		List<Statement> statements = new ArrayList<>();
		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			try
			{
				statements.add(statement());
			}
			catch (SyntaxError e)
			{
				synchronize();
			}
		}
		Token rightBrace = consume(TokenType.RIGHT_BRACE, "Expected '}' after block.");
		return new BlockStatement(leftBrace, statements, rightBrace);
	}

	private Statement statement() throws SyntaxError
	{
		if (check(TokenType.LEFT_BRACE))
		{
			return blockStatement();
		}
		if (check(TokenType.VAR, TokenType.CONST))
		{
			Statement declaration = variableDeclaration();
			consume(TokenType.SEMICOLON, "Expected ';' after variable declaration.");
			return declaration;
		}
		if (match(TokenType.IF))
		{
			return ifStatement();
		}
		if (match(TokenType.WHILE))
		{
			Token keyword = previous();
			consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'.");
			Expression condition = expression();
			consume(TokenType.RIGHT_PAREN, "Expected ')' after while condition.");
			return new WhileStatement(keyword, condition, statement());
		}
		if (match(TokenType.FOR))
		{
			return forStatement();
		}
		if (match(TokenType.RETURN))
		{
			Token keyword = previous();
			Expression value = check(TokenType.SEMICOLON) ? null : expression();
			consume(TokenType.SEMICOLON, "Expected ';' after return value.");
			return new ReturnStatement(keyword, value);
		}
		if (match(TokenType.BREAK))
		{
			Token keyword = previous();
			consume(TokenType.SEMICOLON, "Expected ';' after 'break'.");
			return new BreakStatement(keyword);
		}
		if (match(TokenType.CONTINUE))
		{
			Token keyword = previous();
			consume(TokenType.SEMICOLON, "Expected ';' after 'continue'.");
			return new ContinueStatement(keyword);
		}
		if (match(TokenType.PRINT, TokenType.PRINTLN))
		{
			Token keyword = previous();
			consume(TokenType.LEFT_PAREN, "Expected '(' after '" + keyword.getLexeme() + "'.");
			Expression value = expression();
			consume(TokenType.RIGHT_PAREN, "Expected ')' after print argument.");
			consume(TokenType.SEMICOLON, "Expected ';' after print statement.");
			return new PrintStatement(keyword, value);
		}

		Expression expression = expression();
		consume(TokenType.SEMICOLON, "Expected ';' after expression.");
		return new ExpressionStatement(expression);
	}

	/**
	 * Grammar: {@code (var | const) NAME (: TYPE)? (= EXPRESSION)?} without the trailing semicolon, so that
	 * the for-loop header can reuse it.
	 */
	private VariableDeclarationStatement variableDeclaration() throws SyntaxError
	{
		Token keyword = advance();
		Token name = consume(TokenType.IDENTIFIER, "Expected variable name.");
		TypeNode type = null;
		if (match(TokenType.COLON))
		{
			type = type();
		}
		Expression initializer = null;
		if (match(TokenType.ASSIGN))
		{
			initializer = expression();
		}
		if (type == null && initializer == null)
		{
			throw error(name, "Variable '" + name.getLexeme() + "' needs a type or an initializer.");
		}
		return new VariableDeclarationStatement(keyword, name, type, initializer);
	}

	private IfStatement ifStatement() throws SyntaxError
	{
		Token keyword = previous();
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'.");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after if condition.");
		Statement thenBranch = statement();
		Statement elseBranch = null;
		if (match(TokenType.ELSE))
		{
			elseBranch = statement();
		}
		return new IfStatement(keyword, condition, thenBranch, elseBranch);
	}

	private ForStatement forStatement() throws SyntaxError
	{
		Token keyword = previous();
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'for'.");

		Statement initializer = null;
		if (check(TokenType.VAR, TokenType.CONST))
		{
			initializer = variableDeclaration();
		}
		else if (!check(TokenType.SEMICOLON))
		{
			initializer = new ExpressionStatement(expression());
		}
		consume(TokenType.SEMICOLON, "Expected ';' after for-loop initializer.");

		Expression condition = check(TokenType.SEMICOLON) ? null : expression();
		consume(TokenType.SEMICOLON, "Expected ';' after for-loop condition.");

		Expression update = check(TokenType.RIGHT_PAREN) ? null : expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after for-loop clauses.");

		return new ForStatement(keyword, initializer, condition, update, statement());
	}

	// --- Expressions ---

	private Expression expression() throws SyntaxError
	{
		return assignment();
	}

	private Expression assignment() throws SyntaxError
	{
		Expression expr = or();

		if (match(TokenType.ASSIGN, TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.STAR_ASSIGN, TokenType.SLASH_ASSIGN))
		{
			Token operator = previous();
			Expression value = assignment(); // Right-associative

			if (isAssignable(expr))
			{
				return new AssignmentExpression(expr, operator, value);
			}
			throw error(operator, "Invalid assignment target.");
		}
		return expr;
	}

	private Expression or() throws SyntaxError
	{
		Expression expr = and();
		while (match(TokenType.PIPE_PIPE))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, and());
		}
		return expr;
	}

	private Expression and() throws SyntaxError
	{
		Expression expr = equality();
		while (match(TokenType.AMPERSAND_AMPERSAND))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, equality());
		}
		return expr;
	}

	private Expression equality() throws SyntaxError
	{
		Expression expr = comparison();
		while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, comparison());
		}
		return expr;
	}

	private Expression comparison() throws SyntaxError
	{
		Expression expr = additive();
		while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, additive());
		}
		return expr;
	}

	private Expression additive() throws SyntaxError
	{
		Expression expr = multiplicative();
		while (match(TokenType.PLUS, TokenType.MINUS))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, multiplicative());
		}
		return expr;
	}

	private Expression multiplicative() throws SyntaxError
	{
		Expression expr = unary();
		while (match(TokenType.STAR, TokenType.SLASH, TokenType.MODULO))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, unary());
		}
		return expr;
	}

	private Expression unary() throws SyntaxError
	{
		if (match(TokenType.MINUS, TokenType.BANG, TokenType.STAR, TokenType.AMPERSAND))
		{
			Token operator = previous();
			return new UnaryExpression(operator, unary());
		}
		return call();
	}

	private Expression call() throws SyntaxError
	{
		Expression expr = primary();

		while (true)
		{
			if (match(TokenType.DOT))
			{
				Token memberName = consume(TokenType.IDENTIFIER, "Expected member name after '.'.");
				expr = new DotExpression(expr, memberName);
			}
			else if (match(TokenType.LEFT_PAREN))
			{
				List<Expression> arguments = new ArrayList<>();
				if (!check(TokenType.RIGHT_PAREN))
				{
					do
					{
						arguments.add(expression());
					}
					while (match(TokenType.COMMA));
				}
				Token paren = consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments.");
				if (!(expr instanceof IdentifierExpression) && !(expr instanceof DotExpression))
				{
					throw error(paren, "Only named functions and methods can be called.");
				}
				expr = new CallExpression(expr, paren, arguments);
			}
			else if (match(TokenType.PLUS_PLUS, TokenType.MINUS_MINUS))
			{
				Token operator = previous();
				if (!isAssignable(expr))
				{
					throw error(operator, "Invalid target for postfix increment/decrement operator.");
				}
				expr = new PostfixUnaryExpression(expr, operator);
			}
			else
			{
				break;
			}
		}
		return expr;
	}

	private Expression primary() throws SyntaxError
	{
		if (match(TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL, TokenType.DOUBLE_LITERAL,
				TokenType.STRING_LITERAL, TokenType.BOOLEAN_LITERAL))
		{
			return new LiteralExpression(previous(), previous().getLiteral());
		}
		if (match(TokenType.NULL))
		{
			return new LiteralExpression(previous(), null);
		}
		if (match(TokenType.DSTRING_LITERAL))
		{
			return dString(previous());
		}
		if (match(TokenType.IDENTIFIER))
		{
			return new IdentifierExpression(previous());
		}
		if (match(TokenType.LEFT_PAREN))
		{
			Token leftParen = previous();
			Expression inner = expression();
			consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
			return new GroupingExpression(leftParen, inner);
		}
		throw error(peek(), "Expected expression.");
	}

	/**
	 * Splits a D-string body into text and {@code {name}} placeholder parts. {@code {{} and {@code }}} are
	 * literal braces.
	 */
	private DStringExpression dString(Token token) throws SyntaxError
	{
		String template = (String) token.getLiteral();
		List<DStringExpression.Part> parts = new ArrayList<>();
		StringBuilder text = new StringBuilder();
		int i = 0;
		while (i < template.length())
		{
			char c = template.charAt(i);
			if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{')
			{
				text.append('{');
				i += 2;
			}
			else if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}')
			{
				text.append('}');
				i += 2;
			}
			else if (c == '{')
			{
				int close = template.indexOf('}', i);
				String name = close < 0 ? "" : template.substring(i + 1, close);
				if (close < 0 || !name.matches("[A-Za-z_][A-Za-z0-9_]*"))
				{
					throw error(token, "Malformed D-string placeholder near '" + template.substring(i) + "'.");
				}
				if (text.length() > 0)
				{
					parts.add(DStringExpression.Part.text(text.toString()));
					text.setLength(0);
				}
				// Column of the name inside D"...": skip the D, the quote and the brace
				Token nameToken = new Token(TokenType.IDENTIFIER, name, null, token.getLine(), token.getColumn() + 3 + i);
				parts.add(DStringExpression.Part.placeholder(nameToken));
				i = close + 1;
			}
			else if (c == '}')
			{
				throw error(token, "Unmatched '}' in D-string; write '}}' for a literal brace.");
			}
			else
			{
				text.append(c);
				i++;
			}
		}
		if (text.length() > 0)
		{
			parts.add(DStringExpression.Part.text(text.toString()));
		}
		return new DStringExpression(token, template, parts);
	}

	// --- Helpers ---

	private static boolean isAssignable(Expression expr)
	{
		if (expr instanceof IdentifierExpression || expr instanceof DotExpression)
		{
			return true;
		}
		return expr instanceof UnaryExpression && ((UnaryExpression) expr).getOperator().getType() == TokenType.STAR;
	}

	private static Visibility visibilityOf(Token token)
	{
		switch (token.getType())
		{
			case PUBLIC:
				return Visibility.PUBLIC;
			case PROTECTED:
				return Visibility.PROTECTED;
			default:
				return Visibility.PRIVATE;
		}
	}

	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	private Token consume(TokenType type, String message) throws SyntaxError
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	private Token consume(TokenType[] types, String message) throws SyntaxError
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				return advance();
			}
		}
		throw error(peek(), message);
	}

	private boolean check(TokenType... types)
	{
		if (isAtEnd())
		{
			return false;
		}
		for (TokenType type : types)
		{
			if (peek().getType() == type)
			{
				return true;
			}
		}
		return false;
	}

	private boolean check(int offset, TokenType type)
	{
		if (current + offset >= tokens.size())
		{
			return false;
		}
		return tokens.get(current + offset).getType() == type;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	private Token peek()
	{
		return tokens.get(current);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	private SyntaxError error(Token token, String message)
	{
		String where = token.getType() == TokenType.EOF ? "end of input" : "'" + token.getLexeme() + "'";
		errorReporter.error(DiagnosticCode.SYNTAX, token, message + " Found " + where + ".");
		return new SyntaxError();
	}

	/**
	 * Skips tokens until a likely statement boundary.
	 */
	private void synchronize()
	{
		if (check(TokenType.RIGHT_BRACE))
		{
			return; // Leave the closing brace to the enclosing block
		}
		advance();

		while (!isAtEnd())
		{
			if (previous().getType() == TokenType.SEMICOLON)
			{
				return;
			}

			switch (peek().getType())
			{
				case RIGHT_BRACE:
				case VAR:
				case CONST:
				case IF:
				case FOR:
				case WHILE:
				case RETURN:
				case BREAK:
				case CONTINUE:
				case PRINT:
				case PRINTLN:
					return;
				default:
			}
			advance();
		}
	}

	private void synchronizeClassBody()
	{
		if (check(TokenType.RIGHT_BRACE))
		{
			return;
		}
		advance();

		while (!isAtEnd())
		{
			switch (peek().getType())
			{
				case PUBLIC:
				case PRIVATE:
				case PROTECTED:
				case METHOD:
				case FUNCTION:
				case VAR:
				case CONST:
				case AT:
				case RIGHT_BRACE:
					return;
				default:
					advance();
			}
		}
	}

	private void synchronizeTopLevel()
	{
		while (!isAtEnd())
		{
			if (check(TokenType.CLASS, TokenType.INTERFACE, TokenType.FUNCTION))
			{
				return;
			}
			advance();
		}
	}

	private static class SyntaxError extends RuntimeException
	{
	}
}
