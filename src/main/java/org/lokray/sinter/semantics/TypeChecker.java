// File: src/main/java/org/lokray/sinter/semantics/TypeChecker.java
package org.lokray.sinter.semantics;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.Program;
import org.lokray.sinter.ast.declarations.ClassDeclaration;
import org.lokray.sinter.ast.declarations.Declaration;
import org.lokray.sinter.ast.declarations.FieldDeclaration;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.declarations.InterfaceDeclaration;
import org.lokray.sinter.ast.declarations.MethodDeclaration;
import org.lokray.sinter.ast.declarations.Visibility;
import org.lokray.sinter.ast.expressions.*;
import org.lokray.sinter.ast.statements.*;
import org.lokray.sinter.lexer.Token;
import org.lokray.sinter.lexer.TokenType;
import org.lokray.sinter.semantics.flow.ControlFlowGraph;
import org.lokray.sinter.util.Debug;
import org.lokray.sinter.util.DiagnosticCode;
import org.lokray.sinter.util.ErrorReporter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assigns a type to every expression and checks declarations, interface conformance and calls. Relies on the
 * bindings the {@link ScopeResolver} left in the {@link SemanticModel}; member accesses and call targets, which
 * depend on types, are bound here.
 */
public class TypeChecker implements ASTVisitor<Type>
{
	private final ErrorReporter errorReporter;
	private final SemanticModel model;
	private ClassSymbol currentClass;
	private MethodSymbol currentMethod;
	private boolean inStaticContext;
	private int loopDepth;

	public TypeChecker(ErrorReporter errorReporter, SemanticModel model)
	{
		this.errorReporter = errorReporter;
		this.model = model;
	}

	public void check(Program program)
	{
		Debug.log("Type checking %d declaration(s)", program.getDeclarations().size());
		program.accept(this);
	}

	private void error(DiagnosticCode code, Token token, String message)
	{
		errorReporter.error(code, token, message);
	}

	private Type record(Expression expression, Type type)
	{
		model.setType(expression, type);
		return type;
	}

	@Override
	public Type visitProgram(Program program)
	{
		for (Declaration declaration : program.getDeclarations())
		{
			declaration.accept(this);
		}
		return PrimitiveType.VOID;
	}

	// --- Declarations ---

	@Override
	public Type visitClassDeclaration(ClassDeclaration declaration)
	{
		ClassSymbol classSymbol = (ClassSymbol) model.getBinding(declaration);
		if (classSymbol == null)
		{
			return PrimitiveType.VOID;
		}
		Debug.log("Checking class %s", classSymbol.getName());
		Debug.indent();
		currentClass = classSymbol;
		for (FieldDeclaration field : declaration.getFields())
		{
			field.accept(this);
		}
		for (MethodDeclaration method : declaration.getMethods())
		{
			method.accept(this);
		}
		checkOverrides(classSymbol);
		checkCleanHook(classSymbol);
		checkConformance(classSymbol, declaration);
		currentClass = null;
		Debug.dedent();
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitInterfaceDeclaration(InterfaceDeclaration declaration)
	{
		return PrimitiveType.VOID;
	}

	/**
	 * A class conforms to every interface it implements, including the ones those interfaces extend. Interfaces
	 * already satisfied by the superclass are checked with the superclass.
	 */
	private void checkConformance(ClassSymbol classSymbol, ClassDeclaration declaration)
	{
		Set<ClassSymbol> required = new LinkedHashSet<>(classSymbol.getAllInterfaces());
		if (classSymbol.getSuperclass() != null)
		{
			required.removeAll(classSymbol.getSuperclass().getAllInterfaces());
		}
		for (ClassSymbol iface : required)
		{
			Token at = declaration.getInterfaceNames().stream()
					.filter(t -> t.getLexeme().equals(iface.getName()))
					.findFirst()
					.orElse(declaration.getNameToken());
			for (MethodSymbol expected : iface.getInterfaceMethods())
			{
				List<MethodSymbol> candidates = classSymbol.findMethods(expected.getName()).stream()
						.filter(m -> !m.isStatic())
						.collect(Collectors.toList());
				MethodSymbol match = candidates.stream().filter(m -> m.hasSameParameters(expected)).findFirst().orElse(null);
				if (match == null)
				{
					String found = candidates.isEmpty() ? "" : " (found " + candidates.stream().map(MethodSymbol::signature).collect(Collectors.joining(", ")) + ")";
					error(DiagnosticCode.INTERFACE_CONFORMANCE, at,
							"Class " + classSymbol.getName() + " does not implement " + iface.getName() + "." + expected.signature() + found + ".");
				}
				else if (!match.getReturnType().equals(expected.getReturnType()))
				{
					error(DiagnosticCode.INTERFACE_CONFORMANCE, at,
							"Class " + classSymbol.getName() + " implements " + match.signature() + " but " + iface.getName() + " requires " + expected.signature() + ".");
				}
				else if (match.getVisibility() != Visibility.PUBLIC)
				{
					error(DiagnosticCode.INTERFACE_CONFORMANCE, at,
							"Method " + classSymbol.getName() + "." + match.signature() + " implements " + iface.getName() + " and must be public.");
				}
			}
		}
	}

	private void checkOverrides(ClassSymbol classSymbol)
	{
		ClassSymbol superclass = classSymbol.getSuperclass();
		if (superclass == null)
		{
			return;
		}
		for (MethodSymbol own : classSymbol.getAllOwnMethods())
		{
			for (MethodSymbol inherited : superclass.findMethods(own.getName()))
			{
				if (inherited.hasSameParameters(own) && !inherited.getReturnType().equals(own.getReturnType()))
				{
					error(DiagnosticCode.TYPE_MISMATCH, own.getDeclarationToken(),
							"Method " + classSymbol.getName() + "." + own.signature() + " hides " + superclass.getName() + "." + inherited.signature() + " with a different return type.");
				}
			}
		}
	}

	private void checkCleanHook(ClassSymbol classSymbol)
	{
		for (MethodSymbol method : classSymbol.getOwnMethods("clean"))
		{
			if (method.getParameterTypes().isEmpty() && (method.isStatic() || !method.getReturnType().isVoid()))
			{
				error(DiagnosticCode.TYPE_MISMATCH, method.getDeclarationToken(),
						"The cleanup hook " + classSymbol.getName() + ".clean must be an instance method '() -> void'.");
			}
		}
	}

	@Override
	public Type visitFieldDeclaration(FieldDeclaration declaration)
	{
		VariableSymbol field = model.getVariable(declaration);
		Expression initializer = declaration.getInitializer();
		if (field == null || initializer == null)
		{
			if (field != null && declaration.isConst() && !declaration.isDerived())
			{
				error(DiagnosticCode.TYPE_MISMATCH, declaration.getNameToken(), "Constant field '" + declaration.getName() + "' must be initialised.");
			}
			return PrimitiveType.VOID;
		}
		if (declaration.isDerived())
		{
			error(DiagnosticCode.TYPE_MISMATCH, initializer.getFirstToken(), "Derived field '" + declaration.getName() + "' has no storage and cannot be initialised.");
			return PrimitiveType.VOID;
		}
		inStaticContext = true;
		Type initType = initializer.accept(this);
		inStaticContext = false;
		if (!isConstant(initializer))
		{
			error(DiagnosticCode.TYPE_MISMATCH, initializer.getFirstToken(), "Initializer of field '" + declaration.getName() + "' must be a constant.");
		}
		else if (!initType.isAssignableTo(field.getType()))
		{
			error(DiagnosticCode.TYPE_MISMATCH, initializer.getFirstToken(),
					"Cannot initialise field '" + declaration.getName() + "' of type '" + field.getType() + "' with '" + initType + "'.");
		}
		return PrimitiveType.VOID;
	}

	static boolean isConstant(Expression expression)
	{
		if (expression instanceof LiteralExpression)
		{
			return true;
		}
		if (expression instanceof GroupingExpression)
		{
			return isConstant(((GroupingExpression) expression).getExpression());
		}
		if (expression instanceof UnaryExpression)
		{
			TokenType op = ((UnaryExpression) expression).getOperator().getType();
			return (op == TokenType.MINUS || op == TokenType.BANG) && isConstant(((UnaryExpression) expression).getOperand());
		}
		return false;
	}

	@Override
	public Type visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		checkBody(declaration, true);
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitMethodDeclaration(MethodDeclaration declaration)
	{
		checkBody(declaration, declaration.isStatic());
		return PrimitiveType.VOID;
	}

	private void checkBody(FunctionDeclaration declaration, boolean isStatic)
	{
		MethodSymbol method = model.getMethod(declaration);
		if (method == null || declaration.getBody() == null)
		{
			return;
		}
		Debug.log("Checking body of %s", method.signature());
		currentMethod = method;
		inStaticContext = isStatic;
		loopDepth = 0;
		for (Statement statement : declaration.getBody().getStatements())
		{
			statement.accept(this);
		}
		ControlFlowGraph graph = ControlFlowGraph.build(declaration.getBody());
		model.setControlFlowGraph(declaration, graph);
		if (!method.getReturnType().isVoid() && graph.canFallThrough())
		{
			error(DiagnosticCode.MISSING_RETURN, declaration.getBody().getRightBrace(),
					"Function '" + method.getName() + "' must return a value of type '" + method.getReturnType() + "' on every path.");
		}
		currentMethod = null;
		inStaticContext = false;
	}

	// --- Statements ---

	@Override
	public Type visitBlockStatement(BlockStatement statement)
	{
		for (Statement inner : statement.getStatements())
		{
			inner.accept(this);
		}
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		VariableSymbol variable = model.getVariable(statement);
		Expression initializer = statement.getInitializer();
		Type initType = initializer != null ? initializer.accept(this) : null;
		if (variable == null)
		{
			return PrimitiveType.VOID;
		}
		if (statement.isConst() && initializer == null)
		{
			error(DiagnosticCode.TYPE_MISMATCH, statement.getNameToken(), "Constant '" + statement.getName() + "' must be initialised.");
		}
		if (variable.getType() == null && initType != null)
		{
			// var x = e; takes the type of e
			if (initType instanceof NullType || initType.isVoid())
			{
				error(DiagnosticCode.TYPE_MISMATCH, initializer.getFirstToken(),
						"Cannot infer the type of '" + statement.getName() + "' from '" + initType + "'; declare it explicitly.");
				initType = ErrorType.INSTANCE;
			}
			variable.setType(initType);
		}
		else if (initType != null && !initType.isAssignableTo(variable.getType()))
		{
			error(DiagnosticCode.TYPE_MISMATCH, initializer.getFirstToken(),
					"Cannot assign '" + initType + "' to variable '" + statement.getName() + "' of type '" + variable.getType() + "'.");
		}
		if (unwrap(initializer) instanceof DStringExpression)
		{
			variable.setDynamicString(true);
		}
		return PrimitiveType.VOID;
	}

	private static Expression unwrap(Expression expression)
	{
		while (expression instanceof GroupingExpression)
		{
			expression = ((GroupingExpression) expression).getExpression();
		}
		return expression;
	}

	@Override
	public Type visitExpressionStatement(ExpressionStatement statement)
	{
		statement.getExpression().accept(this);
		return PrimitiveType.VOID;
	}

	private void checkCondition(Expression condition, String construct)
	{
		Type type = condition.accept(this);
		if (!type.isError() && type != PrimitiveType.BOOLEAN)
		{
			error(DiagnosticCode.TYPE_MISMATCH, condition.getFirstToken(), construct + " condition must be 'boolean', found '" + type + "'.");
		}
	}

	@Override
	public Type visitIfStatement(IfStatement statement)
	{
		checkCondition(statement.getCondition(), "If");
		statement.getThenBranch().accept(this);
		if (statement.getElseBranch() != null)
		{
			statement.getElseBranch().accept(this);
		}
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitWhileStatement(WhileStatement statement)
	{
		checkCondition(statement.getCondition(), "While");
		loopDepth++;
		statement.getBody().accept(this);
		loopDepth--;
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitForStatement(ForStatement statement)
	{
		if (statement.getInitializer() != null)
		{
			statement.getInitializer().accept(this);
		}
		if (statement.getCondition() != null)
		{
			checkCondition(statement.getCondition(), "For");
		}
		if (statement.getUpdate() != null)
		{
			statement.getUpdate().accept(this);
		}
		loopDepth++;
		statement.getBody().accept(this);
		loopDepth--;
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitReturnStatement(ReturnStatement statement)
	{
		Type expected = currentMethod != null ? currentMethod.getReturnType() : PrimitiveType.VOID;
		if (statement.getValue() == null)
		{
			if (!expected.isVoid() && !expected.isError())
			{
				error(DiagnosticCode.TYPE_MISMATCH, statement.getKeyword(), "Missing return value of type '" + expected + "'.");
			}
			return PrimitiveType.VOID;
		}
		Type actual = statement.getValue().accept(this);
		if (expected.isVoid())
		{
			error(DiagnosticCode.TYPE_MISMATCH, statement.getValue().getFirstToken(), "Cannot return a value from a 'void' function.");
		}
		else if (!actual.isAssignableTo(expected))
		{
			error(DiagnosticCode.TYPE_MISMATCH, statement.getValue().getFirstToken(),
					"Cannot return '" + actual + "' from a function declared to return '" + expected + "'.");
		}
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitBreakStatement(BreakStatement statement)
	{
		if (loopDepth == 0)
		{
			error(DiagnosticCode.TYPE_MISMATCH, statement.getFirstToken(), "'break' outside of a loop.");
		}
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitContinueStatement(ContinueStatement statement)
	{
		if (loopDepth == 0)
		{
			error(DiagnosticCode.TYPE_MISMATCH, statement.getFirstToken(), "'continue' outside of a loop.");
		}
		return PrimitiveType.VOID;
	}

	@Override
	public Type visitPrintStatement(PrintStatement statement)
	{
		Type type = statement.getExpression().accept(this);
		if (!type.isError() && !(type instanceof PrimitiveType && ((PrimitiveType) type).isPrintable()))
		{
			error(DiagnosticCode.TYPE_MISMATCH, statement.getExpression().getFirstToken(), "Cannot print a value of type '" + type + "'.");
		}
		return PrimitiveType.VOID;
	}

	// --- Expressions ---

	@Override
	public Type visitLiteralExpression(LiteralExpression expression)
	{
		Object value = expression.getValue();
		Type type;
		if (value instanceof Integer)
		{
			type = PrimitiveType.INT;
		}
		else if (value instanceof Float)
		{
			type = PrimitiveType.FLOAT;
		}
		else if (value instanceof Double)
		{
			type = PrimitiveType.DOUBLE;
		}
		else if (value instanceof Boolean)
		{
			type = PrimitiveType.BOOLEAN;
		}
		else if (value instanceof String)
		{
			type = PrimitiveType.STR;
		}
		else
		{
			type = NullType.INSTANCE;
		}
		return record(expression, type);
	}

	@Override
	public Type visitDStringExpression(DStringExpression expression)
	{
		for (DStringExpression.Part part : expression.getParts())
		{
			VariableSymbol variable = part.isPlaceholder() ? model.getVariable(part) : null;
			if (variable == null || variable.getType() == null || variable.getType().isError())
			{
				continue;
			}
			Token at = part.getNameToken();
			if (variable.isDerived())
			{
				error(DiagnosticCode.TYPE_MISMATCH, at, "D-string placeholder '{" + variable.getName() + "}' names a derived field, which has no storage to observe.");
			}
			else if (variable.isDynamicString())
			{
				error(DiagnosticCode.TYPE_MISMATCH, at, "D-string placeholder '{" + variable.getName() + "}' cannot name another D-string.");
			}
			else if (!(variable.getType() instanceof PrimitiveType) || variable.getType().isVoid())
			{
				error(DiagnosticCode.TYPE_MISMATCH, at,
						"D-string placeholder '{" + variable.getName() + "}' has type '" + variable.getType() + "'; only int, float, double, boolean and str can be rendered.");
			}
		}
		return record(expression, PrimitiveType.STR);
	}

	@Override
	public Type visitIdentifierExpression(IdentifierExpression expression)
	{
		Symbol symbol = model.getBinding(expression);
		if (symbol instanceof VariableSymbol)
		{
			Type type = symbol.getType();
			return record(expression, type != null ? type : ErrorType.INSTANCE);
		}
		if (symbol instanceof ClassSymbol)
		{
			error(DiagnosticCode.TYPE_MISMATCH, expression.getNameToken(), "Class name '" + expression.getName() + "' is not a value.");
		}
		else if (symbol instanceof OverloadSet)
		{
			error(DiagnosticCode.TYPE_MISMATCH, expression.getNameToken(), "Function '" + expression.getName() + "' is not a value; call it.");
		}
		return record(expression, ErrorType.INSTANCE);
	}

	@Override
	public Type visitBinaryExpression(BinaryExpression expression)
	{
		Type left = expression.getLeft().accept(this);
		Type right = expression.getRight().accept(this);
		Token op = expression.getOperator();
		if (left.isError() || right.isError())
		{
			boolean isArithmetic = isArithmetic(op.getType());
			return record(expression, isArithmetic ? (left.isError() ? right : left) : PrimitiveType.BOOLEAN);
		}
		switch (op.getType())
		{
			case PLUS:
			case MINUS:
			case STAR:
			case SLASH:
			case MODULO:
				if (!left.isNumeric() || !left.equals(right))
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Operator '" + op.getLexeme() + "' needs two operands of the same numeric type, found '" + left + "' and '" + right + "'.");
					return record(expression, ErrorType.INSTANCE);
				}
				return record(expression, left);
			case LESS:
			case LESS_EQUAL:
			case GREATER:
			case GREATER_EQUAL:
				if (!left.isNumeric() || !left.equals(right))
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Operator '" + op.getLexeme() + "' needs two operands of the same numeric type, found '" + left + "' and '" + right + "'.");
				}
				return record(expression, PrimitiveType.BOOLEAN);
			case EQUAL_EQUAL:
			case BANG_EQUAL:
				if (!Type.isEqualityComparable(left, right))
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Cannot compare '" + left + "' with '" + right + "'.");
				}
				return record(expression, PrimitiveType.BOOLEAN);
			case AMPERSAND_AMPERSAND:
			case PIPE_PIPE:
				if (left != PrimitiveType.BOOLEAN || right != PrimitiveType.BOOLEAN)
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Operator '" + op.getLexeme() + "' needs 'boolean' operands, found '" + left + "' and '" + right + "'.");
				}
				return record(expression, PrimitiveType.BOOLEAN);
			default:
				error(DiagnosticCode.TYPE_MISMATCH, op, "Unsupported binary operator '" + op.getLexeme() + "'.");
				return record(expression, ErrorType.INSTANCE);
		}
	}

	private static boolean isArithmetic(TokenType type)
	{
		return type == TokenType.PLUS || type == TokenType.MINUS || type == TokenType.STAR || type == TokenType.SLASH || type == TokenType.MODULO;
	}

	@Override
	public Type visitUnaryExpression(UnaryExpression expression)
	{
		Token op = expression.getOperator();
		Type operand = expression.getOperand().accept(this);
		if (operand.isError())
		{
			return record(expression, ErrorType.INSTANCE);
		}
		switch (op.getType())
		{
			case MINUS:
				if (!operand.isNumeric())
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Unary '-' needs a numeric operand, found '" + operand + "'.");
					return record(expression, ErrorType.INSTANCE);
				}
				return record(expression, operand);
			case BANG:
				if (operand != PrimitiveType.BOOLEAN)
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Operator '!' needs a 'boolean' operand, found '" + operand + "'.");
				}
				return record(expression, PrimitiveType.BOOLEAN);
			case STAR:
				if (!(operand instanceof PointerType))
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Cannot dereference a value of type '" + operand + "'.");
					return record(expression, ErrorType.INSTANCE);
				}
				Type pointee = ((PointerType) operand).getPointee();
				if (pointee instanceof NamedType && ((NamedType) pointee).isInterface())
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Cannot dereference interface pointer '" + operand + "'.");
					return record(expression, ErrorType.INSTANCE);
				}
				return record(expression, pointee);
			case AMPERSAND:
				if (!isAddressable(expression.getOperand()))
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Cannot take the address of this expression; it is not a stored variable.");
					return record(expression, ErrorType.INSTANCE);
				}
				if (!(operand instanceof NamedType))
				{
					error(DiagnosticCode.TYPE_MISMATCH, op, "Cannot take the address of a '" + operand + "' value; only class values may be pointed to.");
					return record(expression, ErrorType.INSTANCE);
				}
				return record(expression, new PointerType(operand));
			default:
				error(DiagnosticCode.TYPE_MISMATCH, op, "Unsupported unary operator '" + op.getLexeme() + "'.");
				return record(expression, ErrorType.INSTANCE);
		}
	}

	private boolean isAddressable(Expression expression)
	{
		expression = unwrap(expression);
		if (expression instanceof IdentifierExpression)
		{
			VariableSymbol variable = model.getVariable(expression);
			return variable != null && !variable.isDerived();
		}
		if (expression instanceof DotExpression)
		{
			VariableSymbol field = model.getVariable(expression);
			return field != null && !field.isDerived();
		}
		return expression instanceof UnaryExpression && ((UnaryExpression) expression).getOperator().getType() == TokenType.STAR;
	}

	/**
	 * Checks the target of an assignment or increment. Reports and returns false when it cannot be written.
	 */
	private boolean checkWritable(Expression target, Token at)
	{
		Expression inner = unwrap(target);
		VariableSymbol variable = (inner instanceof IdentifierExpression || inner instanceof DotExpression) ? model.getVariable(inner) : null;
		if (variable != null)
		{
			if (variable.isDerived())
			{
				error(DiagnosticCode.TYPE_MISMATCH, at, "Cannot assign to derived field '" + variable.getName() + "'; it has no storage.");
				return false;
			}
			if (variable.isConst())
			{
				error(DiagnosticCode.TYPE_MISMATCH, at, "Cannot assign to constant '" + variable.getName() + "'.");
				return false;
			}
			if (variable.isDynamicString())
			{
				error(DiagnosticCode.TYPE_MISMATCH, at, "Cannot assign to D-string '" + variable.getName() + "'; its text follows the variables it references.");
				return false;
			}
			return true;
		}
		if (!isAddressable(inner))
		{
			error(DiagnosticCode.TYPE_MISMATCH, at, "Invalid assignment target.");
			return false;
		}
		return true;
	}

	@Override
	public Type visitPostfixUnaryExpression(PostfixUnaryExpression expression)
	{
		Type operand = expression.getOperand().accept(this);
		if (operand.isError())
		{
			return record(expression, operand);
		}
		if (!operand.isNumeric())
		{
			error(DiagnosticCode.TYPE_MISMATCH, expression.getOperator(), "Operator '" + expression.getOperator().getLexeme() + "' needs a numeric variable, found '" + operand + "'.");
			return record(expression, ErrorType.INSTANCE);
		}
		checkWritable(expression.getOperand(), expression.getOperator());
		return record(expression, operand);
	}

	@Override
	public Type visitAssignmentExpression(AssignmentExpression expression)
	{
		Type target = expression.getTarget().accept(this);
		Type value = expression.getValue().accept(this);
		Token op = expression.getOperator();
		if (!checkWritable(expression.getTarget(), op) || target.isError() || value.isError())
		{
			return record(expression, target);
		}
		if (expression.isCompound())
		{
			if (!target.isNumeric() || !target.equals(value))
			{
				error(DiagnosticCode.TYPE_MISMATCH, op, "Operator '" + op.getLexeme() + "' needs two operands of the same numeric type, found '" + target + "' and '" + value + "'.");
			}
		}
		else if (!value.isAssignableTo(target))
		{
			error(DiagnosticCode.TYPE_MISMATCH, op, "Cannot assign '" + value + "' to '" + target + "'.");
		}
		return record(expression, target);
	}

	@Override
	public Type visitGroupingExpression(GroupingExpression expression)
	{
		return record(expression, expression.getExpression().accept(this));
	}

	// --- Members and calls ---

	/**
	 * The class whose members {@code target.member} refers to. A single pointer level is looked through.
	 */
	private static ClassSymbol memberOwner(Type targetType)
	{
		if (targetType instanceof NamedType)
		{
			return ((NamedType) targetType).getSymbol();
		}
		if (targetType instanceof PointerType)
		{
			return ((PointerType) targetType).getPointeeClass();
		}
		return null;
	}

	private ClassSymbol classReference(Expression expression)
	{
		if (expression instanceof IdentifierExpression && model.getBinding(expression) instanceof ClassSymbol)
		{
			return (ClassSymbol) model.getBinding(expression);
		}
		return null;
	}

	private boolean isAccessible(ClassSymbol owner, Visibility visibility)
	{
		switch (visibility)
		{
			case PUBLIC:
				return true;
			case PROTECTED:
				return currentClass != null && currentClass.isSubtypeOf(owner);
			default:
				return currentClass == owner;
		}
	}

	private void checkAccess(ClassSymbol owner, Symbol member, Token at)
	{
		if (owner != null && !owner.isInterface() && !isAccessible(owner, member.getVisibility()))
		{
			error(DiagnosticCode.INACCESSIBLE_MEMBER, at,
					"'" + member.getName() + "' is " + member.getVisibility().name().toLowerCase() + " in class " + owner.getName() + ".");
		}
	}

	@Override
	public Type visitDotExpression(DotExpression expression)
	{
		Token member = expression.getMemberToken();
		ClassSymbol staticOwner = classReference(expression.getTarget());
		if (staticOwner != null)
		{
			error(DiagnosticCode.UNDEFINED_MEMBER, member, "Class " + staticOwner.getName() + " has no static field '" + member.getLexeme() + "'.");
			return record(expression, ErrorType.INSTANCE);
		}
		Type targetType = expression.getTarget().accept(this);
		if (targetType.isError())
		{
			return record(expression, ErrorType.INSTANCE);
		}
		ClassSymbol owner = memberOwner(targetType);
		if (owner == null || owner.isInterface())
		{
			error(DiagnosticCode.UNDEFINED_MEMBER, member, "Type '" + targetType + "' has no field '" + member.getLexeme() + "'.");
			return record(expression, ErrorType.INSTANCE);
		}
		VariableSymbol field = owner.resolveField(member.getLexeme());
		if (field == null)
		{
			error(DiagnosticCode.UNDEFINED_MEMBER, member, "Class " + owner.getName() + " has no field '" + member.getLexeme() + "'.");
			return record(expression, ErrorType.INSTANCE);
		}
		checkAccess(field.getOwnerClass(), field, member);
		model.bind(expression, field);
		return record(expression, field.getType());
	}

	@Override
	public Type visitCallExpression(CallExpression expression)
	{
		List<Type> argumentTypes = new ArrayList<>();
		for (Expression argument : expression.getArguments())
		{
			argumentTypes.add(argument.accept(this));
		}
		Expression callee = expression.getCallee();
		if (callee instanceof IdentifierExpression)
		{
			return record(expression, unqualifiedCall(expression, ((IdentifierExpression) callee).getNameToken(), argumentTypes));
		}
		if (!(callee instanceof DotExpression))
		{
			error(DiagnosticCode.UNDEFINED_METHOD, expression.getParen(), "Expression is not callable.");
			return record(expression, ErrorType.INSTANCE);
		}
		DotExpression dot = (DotExpression) callee;
		Token name = dot.getMemberToken();
		ClassSymbol staticOwner = classReference(dot.getTarget());
		if (staticOwner != null)
		{
			return record(expression, staticCall(expression, staticOwner, name, argumentTypes));
		}
		Type receiver = dot.getTarget().accept(this);
		if (receiver.isError())
		{
			return record(expression, ErrorType.INSTANCE);
		}
		return record(expression, instanceCall(expression, receiver, name, argumentTypes));
	}

	private Type unqualifiedCall(CallExpression call, Token name, List<Type> argumentTypes)
	{
		if (currentClass != null && !currentClass.findMethods(name.getLexeme()).isEmpty())
		{
			MethodSymbol method = selectOverload(currentClass.findMethods(name.getLexeme()), argumentTypes, name, name.getLexeme());
			if (method == null)
			{
				return ErrorType.INSTANCE;
			}
			checkAccess(method.getOwnerClass(), method, name);
			if (!method.isStatic() && inStaticContext)
			{
				error(DiagnosticCode.TYPE_MISMATCH, name, "Cannot call instance method '" + method.getName() + "' without an instance.");
			}
			CallTarget.Kind kind = method.isStatic() ? CallTarget.Kind.STATIC_METHOD : CallTarget.Kind.METHOD;
			model.setCallTarget(call, new CallTarget(kind, method, currentClass));
			return method.getReturnType();
		}
		OverloadSet functions = model.getFunctions(name.getLexeme());
		if (functions == null)
		{
			error(DiagnosticCode.UNDEFINED_METHOD, name, "Undefined function '" + name.getLexeme() + "'.");
			return ErrorType.INSTANCE;
		}
		MethodSymbol function = selectOverload(functions.getFunctions(), argumentTypes, name, name.getLexeme());
		if (function == null)
		{
			return ErrorType.INSTANCE;
		}
		model.setCallTarget(call, new CallTarget(CallTarget.Kind.FUNCTION, function, null));
		return function.getReturnType();
	}

	private Type staticCall(CallExpression call, ClassSymbol owner, Token name, List<Type> argumentTypes)
	{
		switch (name.getLexeme())
		{
			case "new":
				if (owner.isInterface())
				{
					error(DiagnosticCode.TYPE_MISMATCH, name, "Cannot instantiate interface " + owner.getName() + ".");
					return ErrorType.INSTANCE;
				}
				expectArguments(name, argumentTypes, List.of());
				model.setCallTarget(call, new CallTarget(CallTarget.Kind.NEW, null, owner));
				return owner.getPointerType();
			case "from_json":
			case "from_xml":
				if (owner.isInterface())
				{
					error(DiagnosticCode.UNDEFINED_METHOD, name, "Interface " + owner.getName() + " cannot be deserialised.");
					return ErrorType.INSTANCE;
				}
				expectArguments(name, argumentTypes, List.of(PrimitiveType.STR));
				boolean json = name.getLexeme().equals("from_json");
				model.setCallTarget(call, new CallTarget(json ? CallTarget.Kind.FROM_JSON : CallTarget.Kind.FROM_XML, null, owner));
				model.markSerialized(owner);
				return owner.getPointerType();
			default:
				List<MethodSymbol> functions = owner.findMethods(name.getLexeme()).stream().filter(MethodSymbol::isStatic).collect(Collectors.toList());
				if (functions.isEmpty())
				{
					error(DiagnosticCode.UNDEFINED_METHOD, name, "Class " + owner.getName() + " has no function '" + name.getLexeme() + "'.");
					return ErrorType.INSTANCE;
				}
				MethodSymbol function = selectOverload(functions, argumentTypes, name, owner.getName() + "." + name.getLexeme());
				if (function == null)
				{
					return ErrorType.INSTANCE;
				}
				checkAccess(function.getOwnerClass(), function, name);
				model.setCallTarget(call, new CallTarget(CallTarget.Kind.STATIC_METHOD, function, owner));
				return function.getReturnType();
		}
	}

	private Type instanceCall(CallExpression call, Type receiver, Token name, List<Type> argumentTypes)
	{
		ClassSymbol owner = memberOwner(receiver);
		if (owner == null)
		{
			error(DiagnosticCode.UNDEFINED_METHOD, name, "Type '" + receiver + "' has no method '" + name.getLexeme() + "'.");
			return ErrorType.INSTANCE;
		}
		boolean isPointer = receiver instanceof PointerType;
		String lexeme = name.getLexeme();
		if (isPointer && (lexeme.equals("clean") || lexeme.equals("release")))
		{
			expectArguments(name, argumentTypes, List.of());
			boolean clean = lexeme.equals("clean");
			model.setCallTarget(call, new CallTarget(clean ? CallTarget.Kind.CLEAN : CallTarget.Kind.RELEASE, null, owner));
			return clean ? PrimitiveType.VOID : receiver;
		}
		if ((lexeme.equals("as_json") || lexeme.equals("as_xml")) && !owner.isInterface())
		{
			expectArguments(name, argumentTypes, List.of());
			boolean json = lexeme.equals("as_json");
			model.setCallTarget(call, new CallTarget(json ? CallTarget.Kind.AS_JSON : CallTarget.Kind.AS_XML, null, owner));
			model.markSerialized(owner);
			return PrimitiveType.STR;
		}
		List<MethodSymbol> methods = owner.findMethods(lexeme).stream().filter(m -> !m.isStatic()).collect(Collectors.toList());
		if (methods.isEmpty())
		{
			error(DiagnosticCode.UNDEFINED_METHOD, name, (owner.isInterface() ? "Interface " : "Class ") + owner.getName() + " has no method '" + lexeme + "'.");
			return ErrorType.INSTANCE;
		}
		MethodSymbol method = selectOverload(methods, argumentTypes, name, owner.getName() + "." + lexeme);
		if (method == null)
		{
			return ErrorType.INSTANCE;
		}
		checkAccess(method.getOwnerClass(), method, name);
		CallTarget.Kind kind = owner.isInterface() ? CallTarget.Kind.INTERFACE_METHOD : CallTarget.Kind.METHOD;
		model.setCallTarget(call, new CallTarget(kind, method, owner));
		return method.getReturnType();
	}

	private void expectArguments(Token name, List<Type> actual, List<Type> expected)
	{
		boolean matches = actual.size() == expected.size();
		for (int i = 0; matches && i < actual.size(); i++)
		{
			matches = actual.get(i).isAssignableTo(expected.get(i));
		}
		if (!matches)
		{
			error(DiagnosticCode.UNDEFINED_METHOD, name, "'" + name.getLexeme() + "' expects (" + render(expected) + ") but was called with (" + render(actual) + ").");
		}
	}

	/**
	 * Overload resolution: an exact match on arity and parameter types wins; failing that, a single candidate
	 * accepting the arguments by subtyping. No numeric widening is ever applied.
	 */
	private MethodSymbol selectOverload(List<MethodSymbol> candidates, List<Type> argumentTypes, Token at, String displayName)
	{
		if (argumentTypes.stream().anyMatch(Type::isError))
		{
			return candidates.stream().filter(m -> m.getParameterTypes().size() == argumentTypes.size()).findFirst().orElse(null);
		}
		List<MethodSymbol> exact = candidates.stream().filter(m -> m.matchesExactly(argumentTypes)).collect(Collectors.toList());
		if (exact.size() == 1)
		{
			return exact.get(0);
		}
		List<MethodSymbol> applicable = exact.isEmpty()
				? candidates.stream().filter(m -> m.accepts(argumentTypes)).collect(Collectors.toList())
				: exact;
		if (applicable.size() == 1)
		{
			return applicable.get(0);
		}
		String candidateList = candidates.stream().map(MethodSymbol::signature).collect(Collectors.joining(", "));
		if (applicable.isEmpty())
		{
			error(DiagnosticCode.UNDEFINED_METHOD, at,
					"No overload of '" + displayName + "' accepts (" + render(argumentTypes) + "). Candidates: " + candidateList + ".");
		}
		else
		{
			error(DiagnosticCode.UNDEFINED_METHOD, at,
					"Ambiguous call to '" + displayName + "' with (" + render(argumentTypes) + "). Candidates: "
							+ applicable.stream().map(MethodSymbol::signature).collect(Collectors.joining(", ")) + ".");
		}
		return null;
	}

	private static String render(List<Type> types)
	{
		return types.stream().map(Type::toString).collect(Collectors.joining(", "));
	}
}
