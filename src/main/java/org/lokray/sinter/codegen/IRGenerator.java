// File: src/main/java/org/lokray/sinter/codegen/IRGenerator.java
package org.lokray.sinter.codegen;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.Program;
import org.lokray.sinter.ast.declarations.ClassDeclaration;
import org.lokray.sinter.ast.declarations.Declaration;
import org.lokray.sinter.ast.declarations.FieldDeclaration;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.declarations.InterfaceDeclaration;
import org.lokray.sinter.ast.declarations.MethodDeclaration;
import org.lokray.sinter.ast.declarations.Parameter;
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
import org.lokray.sinter.lexer.TokenType;
import org.lokray.sinter.semantics.CallTarget;
import org.lokray.sinter.semantics.ClassSymbol;
import org.lokray.sinter.semantics.MethodSymbol;
import org.lokray.sinter.semantics.NullType;
import org.lokray.sinter.semantics.PointerType;
import org.lokray.sinter.semantics.PrimitiveType;
import org.lokray.sinter.semantics.SemanticModel;
import org.lokray.sinter.semantics.Type;
import org.lokray.sinter.semantics.VariableSymbol;
import org.lokray.sinter.util.CompilerConfig;
import org.lokray.sinter.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers a checked program to textual LLVM IR.
 * <p>
 * Every expression visit returns the LLVM operand holding its value (a register, a constant or a global), or
 * null for {@code void}. Statements return null. Locals live in entry-block allocas.
 */
public class IRGenerator implements ASTVisitor<String>
{
	private static final List<String> RUNTIME_DECLARATIONS = List.of(
			"declare ptr @malloc(i64)",
			"declare void @free(ptr)",
			"declare i32 @printf(ptr, ...)",
			"declare i32 @snprintf(ptr, i64, ptr, ...)",
			"declare i32 @strcmp(ptr, ptr)",
			"declare i32 @strncmp(ptr, ptr, i64)",
			"declare i64 @strlen(ptr)",
			"declare ptr @strchr(ptr, i32)",
			"declare i64 @strtol(ptr, ptr, i32)",
			"declare double @strtod(ptr, ptr)",
			"declare ptr @memcpy(ptr, ptr, i64)",
			"declare void @exit(i32)");

	private final SemanticModel model;
	private final CompilerConfig config;

	private final StringPool strings = new StringPool();
	private final StringBuilder functions = new StringBuilder();
	private LayoutTable layouts;
	private DispatchTables dispatch;
	private DStringRuntime dstrings;

	// --- Per-function state ---
	private FunctionEmitter emitter;
	private MethodSymbol currentMethod;
	private ClassSymbol currentClass;
	private final Map<VariableSymbol, String> locals = new IdentityHashMap<>();
	private final Deque<String> breakTargets = new ArrayDeque<>();
	private final Deque<String> continueTargets = new ArrayDeque<>();

	public IRGenerator(SemanticModel model, CompilerConfig config)
	{
		this.model = model;
		this.config = config;
	}

	/**
	 * Generates the whole module. The generator is single-use.
	 *
	 * @throws CodegenException if the program uses something with no lowering.
	 */
	public String generate(Program program)
	{
		Debug.log("Starting LLVM IR generation for module '%s'...", config.getModuleName());
		Debug.indent();

		Debug.log("Laying out classes...");
		layouts = new LayoutTable(model.getClasses());
		dispatch = new DispatchTables(model.getClasses(), layouts);
		dstrings = new DStringRuntime(strings);

		Debug.log("Generating function bodies...");
		program.accept(this);
		emitEntryPoint(program);

		StringBuilder serialization = new StringBuilder();
		new SerializationEmitter(layouts, strings, dstrings).emit(SerializationEmitter.closure(model.getSerializedClasses()), serialization);

		StringBuilder out = new StringBuilder();
		out.append("; ModuleID = '").append(config.getModuleName()).append("'\n");
		out.append("source_filename = \"").append(config.getModuleName()).append("\"\n");
		if (!config.getTargetTriple().isEmpty())
		{
			out.append("target triple = \"").append(config.getTargetTriple()).append("\"\n");
		}
		out.append('\n');

		layouts.emitTypes(out);
		dispatch.emitTypes(out);
		dstrings.emitTypes(out);
		out.append('\n');

		// Interning continues while bodies are generated, so the pool goes out last of the generated parts
		StringBuilder tables = new StringBuilder();
		dispatch.emitTables(tables);
		StringBuilder helpers = new StringBuilder();
		dispatch.emitHelpers(helpers);
		StringBuilder runtime = new StringBuilder();
		dstrings.emitRuntime(runtime);

		strings.emit(out);
		out.append(tables).append('\n');
		for (String declaration : RUNTIME_DECLARATIONS)
		{
			out.append(declaration).append('\n');
		}
		out.append('\n');
		out.append(runtime);
		out.append(helpers);
		out.append(functions);
		out.append(serialization);

		Debug.dedent();
		Debug.log("LLVM IR generation COMPLETE.");
		return out.toString();
	}

	/**
	 * A {@code void main()} becomes {@code sinter_main}; the C entry point calls it and exits with 0.
	 */
	private void emitEntryPoint(Program program)
	{
		for (FunctionDeclaration function : program.getFunctions())
		{
			MethodSymbol symbol = model.getMethod(function);
			if (symbol != null && LlvmTypes.isVoidMain(symbol))
			{
				Debug.log("Wrapping void main() in a C entry point");
				FunctionEmitter main = new FunctionEmitter("define i32 @main()");
				main.call("void", LlvmTypes.functionName(symbol), List.of());
				main.terminate("ret i32 0");
				main.finish(functions);
				return;
			}
		}
	}

	/**
	 * The zero-argument method computing derived field {@code field} for a receiver of static type
	 * {@code receiver}. Overrides in subclasses hide the inherited method.
	 */
	static MethodSymbol derivedMethod(ClassSymbol receiver, VariableSymbol field)
	{
		ClassSymbol owner = receiver != null ? receiver : field.getOwnerClass();
		for (MethodSymbol method : owner.findMethods(field.getName()))
		{
			if (!method.isStatic() && method.getParameterTypes().isEmpty())
			{
				return method;
			}
		}
		throw new CodegenException("Derived field '" + field.getName() + "' of " + owner.getName() + " has no method computing it.");
	}

	// ------------------------------------------------------------------
	// Declarations
	// ------------------------------------------------------------------

	@Override
	public String visitProgram(Program program)
	{
		for (Declaration declaration : program.getDeclarations())
		{
			declaration.accept(this);
		}
		return null;
	}

	@Override
	public String visitClassDeclaration(ClassDeclaration declaration)
	{
		ClassSymbol classSymbol = (ClassSymbol) model.getBinding(declaration);
		Debug.log("Generating class %s", classSymbol.getName());
		Debug.indent();
		currentClass = classSymbol;
		emitInit(classSymbol);
		emitNew(classSymbol);
		emitCleanup(classSymbol);
		emitAccessors(classSymbol);
		for (MethodDeclaration method : declaration.getMethods())
		{
			method.accept(this);
		}
		currentClass = null;
		Debug.dedent();
		return null;
	}

	@Override
	public String visitInterfaceDeclaration(InterfaceDeclaration declaration)
	{
		// Tables and helpers are emitted per interface by DispatchTables
		return null;
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		generateBody(model.getMethod(declaration), declaration);
		return null;
	}

	@Override
	public String visitMethodDeclaration(MethodDeclaration declaration)
	{
		if (!declaration.isAbstract())
		{
			generateBody(model.getMethod(declaration), declaration);
		}
		return null;
	}

	@Override
	public String visitFieldDeclaration(FieldDeclaration declaration)
	{
		return null;
	}

	private void generateBody(MethodSymbol method, FunctionDeclaration declaration)
	{
		if (method == null || declaration.getBody() == null)
		{
			return;
		}
		String name = LlvmTypes.functionName(method);
		Debug.log("Generating body of %s", name);
		String returnType = LlvmTypes.toLlvm(method.getReturnType());
		boolean hasThis = method.getOwnerClass() != null && !method.isStatic();

		List<String> parameters = new ArrayList<>();
		if (hasThis)
		{
			parameters.add("ptr %this");
		}
		for (Parameter parameter : declaration.getParameters())
		{
			VariableSymbol symbol = model.getVariable(parameter);
			parameters.add(LlvmTypes.toLlvm(symbol.getType()) + " %arg." + parameter.getName());
		}

		beginFunction(method, "define " + returnType + " " + name + "(" + String.join(", ", parameters) + ")");
		for (Parameter parameter : declaration.getParameters())
		{
			VariableSymbol symbol = model.getVariable(parameter);
			String type = LlvmTypes.toLlvm(symbol.getType());
			String slot = emitter.alloca(type, parameter.getName());
			emitter.store(type, "%arg." + parameter.getName(), slot);
			locals.put(symbol, slot);
		}
		declaration.getBody().accept(this);
		if (!emitter.isTerminated())
		{
			emitter.terminate(method.getReturnType().isVoid() ? "ret void" : "unreachable");
		}
		endFunction();
	}

	private void beginFunction(MethodSymbol method, String header)
	{
		emitter = new FunctionEmitter(header);
		currentMethod = method;
		locals.clear();
		breakTargets.clear();
		continueTargets.clear();
	}

	private void endFunction()
	{
		emitter.finish(functions);
		emitter = null;
		currentMethod = null;
	}

	// --- Generated class routines ---

	private void emitInit(ClassSymbol classSymbol)
	{
		String struct = LlvmTypes.structName(classSymbol);
		beginFunction(null, "define void " + LlvmTypes.routineName(classSymbol, "init") + "(ptr %this)");
		if (classSymbol.getSuperclass() != null)
		{
			emitter.call("void", LlvmTypes.routineName(classSymbol.getSuperclass(), "init"), List.of("ptr %this"));
		}
		for (VariableSymbol field : classSymbol.getOwnFields())
		{
			if (field.isDerived())
			{
				continue;
			}
			String address = emitter.gep(struct, "%this", layouts.fieldPath(classSymbol, field));
			Expression initializer = field.getField() != null ? field.getField().getInitializer() : null;
			if (initializer != null)
			{
				String value = coerce(evaluateDetached(initializer), typeOf(initializer), field.getType());
				emitter.store(LlvmTypes.toLlvm(field.getType()), value, address);
			}
			else
			{
				initialiseDefault(field.getType(), address);
			}
		}
		for (ClassSymbol iface : classSymbol.getAllInterfaces())
		{
			// Subclasses overwrite the tables the superclass stored, so overrides are found through them
			String slot = emitter.gep(struct, "%this", layouts.slotPath(classSymbol, iface));
			emitter.store("ptr", DispatchTables.tableName(classSymbol, iface), slot);
		}
		emitter.terminate("ret void");
		endFunction();
	}

	private void emitNew(ClassSymbol classSymbol)
	{
		beginFunction(null, "define ptr " + LlvmTypes.routineName(classSymbol, "new") + "()");
		String object = emitter.call("ptr", "@malloc", List.of("i64 " + LayoutTable.sizeOf(LlvmTypes.structName(classSymbol))));
		emitter.call("void", LlvmTypes.routineName(classSymbol, "init"), List.of("ptr " + object));
		emitter.terminate("ret ptr " + object);
		endFunction();
	}

	/**
	 * Runs the class's own {@code clean()} hook, then the superclass cleanup. Freeing is left to the caller.
	 */
	private void emitCleanup(ClassSymbol classSymbol)
	{
		beginFunction(null, "define void " + LlvmTypes.routineName(classSymbol, "cleanup") + "(ptr %this)");
		String isNull = emitter.assign("icmp eq ptr %this, null");
		emitter.branch(isNull, "done", "run");
		emitter.startBlock("run");
		MethodSymbol hook = classSymbol.findCleanHook();
		if (hook != null && hook.getOwnerClass() == classSymbol && hook.getReturnType().isVoid())
		{
			emitter.call("void", LlvmTypes.functionName(hook), List.of("ptr %this"));
		}
		if (classSymbol.getSuperclass() != null)
		{
			emitter.call("void", LlvmTypes.routineName(classSymbol.getSuperclass(), "cleanup"), List.of("ptr %this"));
		}
		emitter.branch("done");
		emitter.startBlock("done");
		emitter.terminate("ret void");
		endFunction();
	}

	private void emitAccessors(ClassSymbol classSymbol)
	{
		String struct = LlvmTypes.structName(classSymbol);
		for (MethodSymbol method : classSymbol.getAllOwnMethods())
		{
			if (!method.isSynthesized())
			{
				continue;
			}
			VariableSymbol field = method.getAccessedField();
			String type = LlvmTypes.toLlvm(field.getType());
			String name = LlvmTypes.functionName(method);
			Debug.log("Synthesizing accessor %s", name);
			if (method.getAccessorKind() == MethodSymbol.AccessorKind.GETTER)
			{
				beginFunction(method, "define " + type + " " + name + "(ptr %this)");
				String address = emitter.gep(struct, "%this", layouts.fieldPath(classSymbol, field));
				emitter.terminate("ret " + type + " " + emitter.load(type, address));
			}
			else
			{
				beginFunction(method, "define void " + name + "(ptr %this, " + type + " %value)");
				String address = emitter.gep(struct, "%this", layouts.fieldPath(classSymbol, field));
				emitter.store(type, "%value", address);
				emitter.terminate("ret void");
			}
			endFunction();
		}
	}

	private void initialiseDefault(Type type, String address)
	{
		if (LlvmTypes.isClassValue(type))
		{
			emitter.call("void", LlvmTypes.routineName(LlvmTypes.classOf(type), "init"), List.of("ptr " + address));
			return;
		}
		emitter.store(LlvmTypes.toLlvm(type), zeroValue(type), address);
	}

	private String zeroValue(Type type)
	{
		if (type == PrimitiveType.INT)
		{
			return "0";
		}
		if (type == PrimitiveType.FLOAT || type == PrimitiveType.DOUBLE)
		{
			return "0.0";
		}
		if (type == PrimitiveType.BOOLEAN)
		{
			return "false";
		}
		if (type == PrimitiveType.STR)
		{
			return strings.intern("");
		}
		return "null";
	}

	// ------------------------------------------------------------------
	// Statements
	// ------------------------------------------------------------------

	@Override
	public String visitBlockStatement(BlockStatement statement)
	{
		for (Statement inner : statement.getStatements())
		{
			inner.accept(this);
		}
		return null;
	}

	@Override
	public String visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		VariableSymbol variable = model.getVariable(statement);
		Expression initializer = statement.getInitializer();
		if (variable.isDynamicString())
		{
			String record = emitter.alloca(DStringRuntime.RECORD, statement.getName());
			buildDString((DStringExpression) unwrap(initializer), record);
			locals.put(variable, record);
			return null;
		}
		Type type = variable.getType();
		String slot = locals.get(variable);
		if (slot == null)
		{
			slot = emitter.alloca(LlvmTypes.toLlvm(type), statement.getName());
			locals.put(variable, slot);
		}
		if (initializer != null)
		{
			String value = coerce(evaluateDetached(initializer), typeOf(initializer), type);
			emitter.store(LlvmTypes.toLlvm(type), value, slot);
		}
		else
		{
			initialiseDefault(type, slot);
		}
		return null;
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		evaluate(statement.getExpression());
		return null;
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		String condition = evaluate(statement.getCondition());
		String thenLabel = emitter.newLabel("if.then");
		String elseLabel = statement.getElseBranch() != null ? emitter.newLabel("if.else") : null;
		String endLabel = emitter.newLabel("if.end");

		emitter.branch(condition, thenLabel, elseLabel != null ? elseLabel : endLabel);
		emitter.startBlock(thenLabel);
		statement.getThenBranch().accept(this);
		if (!emitter.isTerminated())
		{
			emitter.branch(endLabel);
		}
		if (elseLabel != null)
		{
			emitter.startBlock(elseLabel);
			statement.getElseBranch().accept(this);
			if (!emitter.isTerminated())
			{
				emitter.branch(endLabel);
			}
		}
		emitter.startBlock(endLabel);
		return null;
	}

	@Override
	public String visitWhileStatement(WhileStatement statement)
	{
		String conditionLabel = emitter.newLabel("while.cond");
		String bodyLabel = emitter.newLabel("while.body");
		String endLabel = emitter.newLabel("while.end");

		emitter.startBlock(conditionLabel);
		String condition = evaluate(statement.getCondition());
		emitter.branch(condition, bodyLabel, endLabel);

		emitter.startBlock(bodyLabel);
		breakTargets.push(endLabel);
		continueTargets.push(conditionLabel);
		statement.getBody().accept(this);
		breakTargets.pop();
		continueTargets.pop();
		if (!emitter.isTerminated())
		{
			emitter.branch(conditionLabel);
		}
		emitter.startBlock(endLabel);
		return null;
	}

	@Override
	public String visitForStatement(ForStatement statement)
	{
		if (statement.getInitializer() != null)
		{
			statement.getInitializer().accept(this);
		}
		String conditionLabel = emitter.newLabel("for.cond");
		String bodyLabel = emitter.newLabel("for.body");
		String updateLabel = emitter.newLabel("for.update");
		String endLabel = emitter.newLabel("for.end");

		emitter.startBlock(conditionLabel);
		if (statement.getCondition() != null)
		{
			emitter.branch(evaluate(statement.getCondition()), bodyLabel, endLabel);
		}
		else
		{
			emitter.branch(bodyLabel);
		}

		emitter.startBlock(bodyLabel);
		breakTargets.push(endLabel);
		continueTargets.push(updateLabel);
		statement.getBody().accept(this);
		breakTargets.pop();
		continueTargets.pop();
		if (!emitter.isTerminated())
		{
			emitter.branch(updateLabel);
		}

		emitter.startBlock(updateLabel);
		if (statement.getUpdate() != null)
		{
			evaluate(statement.getUpdate());
		}
		emitter.branch(conditionLabel);
		emitter.startBlock(endLabel);
		return null;
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		if (statement.getValue() == null)
		{
			emitter.terminate("ret void");
			return null;
		}
		Type returnType = currentMethod.getReturnType();
		String value = coerce(evaluateDetached(statement.getValue()), typeOf(statement.getValue()), returnType);
		emitter.terminate("ret " + LlvmTypes.toLlvm(returnType) + " " + value);
		return null;
	}

	@Override
	public String visitBreakStatement(BreakStatement statement)
	{
		emitter.branch(loopTarget(breakTargets, "break"));
		return null;
	}

	@Override
	public String visitContinueStatement(ContinueStatement statement)
	{
		emitter.branch(loopTarget(continueTargets, "continue"));
		return null;
	}

	private static String loopTarget(Deque<String> targets, String keyword)
	{
		if (targets.isEmpty())
		{
			throw new CodegenException("'" + keyword + "' outside of a loop.");
		}
		return targets.peek();
	}

	@Override
	public String visitPrintStatement(PrintStatement statement)
	{
		Expression expression = statement.getExpression();
		Type type = typeOf(expression);
		String format = DStringRuntime.formatOf(type) + (statement.isNewline() ? "\n" : "");
		String argument = dstrings.formatArgument(emitter, type, evaluate(expression));
		emitter.emit("call i32 (ptr, ...) @printf(ptr " + strings.intern(format) + ", " + argument + ")");
		return null;
	}

	// ------------------------------------------------------------------
	// Expressions
	// ------------------------------------------------------------------

	private String evaluate(Expression expression)
	{
		return expression.accept(this);
	}

	/**
	 * Evaluates a value that is about to be stored, returned or passed on. Reading a D-string variable yields its
	 * cache, which the next re-render frees, so such a read is copied first.
	 */
	private String evaluateDetached(Expression expression)
	{
		String value = evaluate(expression);
		Expression inner = unwrap(expression);
		if (inner instanceof IdentifierExpression)
		{
			VariableSymbol variable = model.getVariable(inner);
			if (variable != null && variable.isDynamicString())
			{
				return DStringRuntime.copy(emitter, value);
			}
		}
		return value;
	}

	private Type typeOf(Expression expression)
	{
		Type type = model.getType(expression);
		if (type == null)
		{
			throw new CodegenException("Expression '" + expression + "' was never typed.");
		}
		return type;
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
	public String visitLiteralExpression(LiteralExpression expression)
	{
		Object value = expression.getValue();
		if (value instanceof Integer)
		{
			return LlvmTypes.intConstant((Integer) value);
		}
		if (value instanceof Float)
		{
			return LlvmTypes.singleConstant((Float) value);
		}
		if (value instanceof Double)
		{
			return LlvmTypes.floatConstant((Double) value);
		}
		if (value instanceof Boolean)
		{
			return ((Boolean) value) ? "true" : "false";
		}
		if (value instanceof String)
		{
			return strings.intern((String) value);
		}
		return "null";
	}

	/**
	 * A D-string used directly as a value is rendered once, from a record that lives only in this frame.
	 */
	@Override
	public String visitDStringExpression(DStringExpression expression)
	{
		String record = emitter.alloca(DStringRuntime.RECORD, "dstring");
		buildDString(expression, record);
		return DStringRuntime.read(emitter, record);
	}

	private void buildDString(DStringExpression expression, String record)
	{
		DStringRuntime.Literal literal = dstrings.compile(expression, part -> model.getVariable(part));
		int count = literal.getVariables().size();
		String slots = count == 0 ? "null" : emitter.alloca("[" + count + " x " + DStringRuntime.SLOT + "]", "dslots");
		List<String> addresses = new ArrayList<>();
		for (VariableSymbol variable : literal.getVariables())
		{
			addresses.add(variableAddress(variable));
		}
		dstrings.initialise(emitter, literal, expression.getTemplate(), record, slots, addresses);
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		VariableSymbol variable = model.getVariable(expression);
		if (variable == null)
		{
			throw new CodegenException("'" + expression.getName() + "' is not a variable.");
		}
		if (variable.isDerived())
		{
			return callDerived(currentClass, variable, "%this");
		}
		if (variable.isDynamicString())
		{
			return DStringRuntime.read(emitter, storageOf(variable));
		}
		return emitter.load(LlvmTypes.toLlvm(variable.getType()), variableAddress(variable));
	}

	private String callDerived(ClassSymbol receiver, VariableSymbol field, String object)
	{
		MethodSymbol method = derivedMethod(receiver, field);
		return emitter.call(LlvmTypes.toLlvm(method.getReturnType()), LlvmTypes.functionName(method), List.of("ptr " + object));
	}

	private String storageOf(VariableSymbol variable)
	{
		String slot = locals.get(variable);
		if (slot == null)
		{
			throw new CodegenException("Variable '" + variable.getName() + "' has no storage in this function.");
		}
		return slot;
	}

	/**
	 * Address of a stored variable: a local slot, or a field of {@code this}.
	 */
	private String variableAddress(VariableSymbol variable)
	{
		if (variable.isField())
		{
			if (currentClass == null)
			{
				throw new CodegenException("Field '" + variable.getName() + "' used outside of its class.");
			}
			return emitter.gep(LlvmTypes.structName(currentClass), "%this", layouts.fieldPath(currentClass, variable));
		}
		return storageOf(variable);
	}

	/**
	 * Address of an assignable expression. Other expressions are spilled to a temporary slot.
	 */
	private String addressOf(Expression expression)
	{
		Expression inner = unwrap(expression);
		if (inner instanceof IdentifierExpression)
		{
			VariableSymbol variable = model.getVariable(inner);
			if (variable != null && !variable.isDerived() && !variable.isDynamicString())
			{
				return variableAddress(variable);
			}
		}
		else if (inner instanceof DotExpression)
		{
			DotExpression dot = (DotExpression) inner;
			VariableSymbol field = model.getVariable(dot);
			if (field != null && !field.isDerived())
			{
				Type targetType = typeOf(dot.getTarget());
				ClassSymbol owner = LlvmTypes.classOf(targetType);
				return emitter.gep(LlvmTypes.structName(owner), objectPointer(dot.getTarget()), layouts.fieldPath(owner, field));
			}
		}
		else if (inner instanceof UnaryExpression && ((UnaryExpression) inner).getOperator().getType() == TokenType.STAR)
		{
			return evaluate(((UnaryExpression) inner).getOperand());
		}
		Type type = typeOf(inner);
		String value = evaluate(inner);
		String spill = emitter.alloca(LlvmTypes.toLlvm(type), "spill");
		emitter.store(LlvmTypes.toLlvm(type), value, spill);
		return spill;
	}

	/**
	 * Pointer to the object a member access works on: the pointer itself, or the address of a class value.
	 */
	private String objectPointer(Expression target)
	{
		return typeOf(target) instanceof PointerType ? evaluate(target) : addressOf(target);
	}

	@Override
	public String visitDotExpression(DotExpression expression)
	{
		VariableSymbol field = model.getVariable(expression);
		if (field == null)
		{
			throw new CodegenException("'" + expression.getMemberName() + "' is not a field.");
		}
		ClassSymbol owner = LlvmTypes.classOf(typeOf(expression.getTarget()));
		String object = objectPointer(expression.getTarget());
		if (field.isDerived())
		{
			return callDerived(owner, field, object);
		}
		String address = emitter.gep(LlvmTypes.structName(owner), object, layouts.fieldPath(owner, field));
		return emitter.load(LlvmTypes.toLlvm(field.getType()), address);
	}

	@Override
	public String visitGroupingExpression(GroupingExpression expression)
	{
		return evaluate(expression.getExpression());
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		TokenType op = expression.getOperator().getType();
		if (op == TokenType.AMPERSAND_AMPERSAND || op == TokenType.PIPE_PIPE)
		{
			return shortCircuit(expression, op == TokenType.AMPERSAND_AMPERSAND);
		}
		Type leftType = typeOf(expression.getLeft());
		Type rightType = typeOf(expression.getRight());
		String left = evaluate(expression.getLeft());
		String right = evaluate(expression.getRight());
		switch (op)
		{
			case EQUAL_EQUAL:
				return equality(left, leftType, right, rightType, false);
			case BANG_EQUAL:
				return equality(left, leftType, right, rightType, true);
			case LESS:
			case LESS_EQUAL:
			case GREATER:
			case GREATER_EQUAL:
				return compare(op, leftType, left, right);
			default:
				return arithmetic(op, leftType, left, right);
		}
	}

	private String shortCircuit(BinaryExpression expression, boolean isAnd)
	{
		String rightLabel = emitter.newLabel(isAnd ? "and.rhs" : "or.rhs");
		String endLabel = emitter.newLabel(isAnd ? "and.end" : "or.end");

		String left = evaluate(expression.getLeft());
		String fromLeft = emitter.currentLabel();
		if (isAnd)
		{
			emitter.branch(left, rightLabel, endLabel);
		}
		else
		{
			emitter.branch(left, endLabel, rightLabel);
		}
		emitter.startBlock(rightLabel);
		String right = evaluate(expression.getRight());
		String fromRight = emitter.currentLabel();
		emitter.branch(endLabel);

		emitter.startBlock(endLabel);
		String shortValue = isAnd ? "false" : "true";
		return emitter.assign("phi i1 [ " + shortValue + ", %" + fromLeft + " ], [ " + right + ", %" + fromRight + " ]");
	}

	/**
	 * Integer arithmetic wraps; division and remainder are signed.
	 */
	private String arithmetic(TokenType op, Type type, String left, String right)
	{
		boolean integral = type == PrimitiveType.INT;
		String instruction;
		switch (op)
		{
			case PLUS:
				instruction = integral ? "add" : "fadd";
				break;
			case MINUS:
				instruction = integral ? "sub" : "fsub";
				break;
			case STAR:
				instruction = integral ? "mul" : "fmul";
				break;
			case SLASH:
				instruction = integral ? "sdiv" : "fdiv";
				break;
			case MODULO:
				instruction = integral ? "srem" : "frem";
				break;
			default:
				throw new CodegenException("Unsupported arithmetic operator " + op + ".");
		}
		return emitter.assign(instruction + " " + LlvmTypes.toLlvm(type) + " " + left + ", " + right);
	}

	private String compare(TokenType op, Type type, String left, String right)
	{
		boolean integral = type == PrimitiveType.INT;
		String predicate;
		switch (op)
		{
			case LESS:
				predicate = integral ? "slt" : "olt";
				break;
			case LESS_EQUAL:
				predicate = integral ? "sle" : "ole";
				break;
			case GREATER:
				predicate = integral ? "sgt" : "ogt";
				break;
			default:
				predicate = integral ? "sge" : "oge";
				break;
		}
		return emitter.assign((integral ? "icmp " : "fcmp ") + predicate + " " + LlvmTypes.toLlvm(type) + " " + left + ", " + right);
	}

	/**
	 * Strings compare by content. Pointers of related types are brought to a common type first.
	 */
	private String equality(String left, Type leftType, String right, Type rightType, boolean negate)
	{
		if (leftType == PrimitiveType.STR && rightType == PrimitiveType.STR)
		{
			String order = emitter.call("i32", "@strcmp", List.of("ptr " + left, "ptr " + right));
			return emitter.assign("icmp " + (negate ? "ne" : "eq") + " i32 " + order + ", 0");
		}
		if (leftType == PrimitiveType.FLOAT || leftType == PrimitiveType.DOUBLE)
		{
			return emitter.assign("fcmp " + (negate ? "une " : "oeq ") + LlvmTypes.toLlvm(leftType) + " " + left + ", " + right);
		}
		if (leftType instanceof PointerType && rightType instanceof PointerType && !leftType.equals(rightType))
		{
			if (leftType.isAssignableTo(rightType))
			{
				left = coerce(left, leftType, rightType);
			}
			else
			{
				right = coerce(right, rightType, leftType);
			}
		}
		String type = leftType instanceof NullType ? LlvmTypes.toLlvm(rightType) : LlvmTypes.toLlvm(leftType);
		return emitter.assign("icmp " + (negate ? "ne " : "eq ") + type + " " + left + ", " + right);
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		TokenType op = expression.getOperator().getType();
		switch (op)
		{
			case AMPERSAND:
				return addressOf(expression.getOperand());
			case STAR:
			{
				String pointer = evaluate(expression.getOperand());
				return emitter.load(LlvmTypes.toLlvm(typeOf(expression)), pointer);
			}
			case BANG:
				return emitter.assign("xor i1 " + evaluate(expression.getOperand()) + ", true");
			case MINUS:
			{
				Type type = typeOf(expression);
				String operand = evaluate(expression.getOperand());
				if (type == PrimitiveType.INT)
				{
					return emitter.assign("sub i32 0, " + operand);
				}
				return emitter.assign("fneg " + LlvmTypes.toLlvm(type) + " " + operand);
			}
			default:
				throw new CodegenException("Unsupported unary operator " + op + ".");
		}
	}

	@Override
	public String visitPostfixUnaryExpression(PostfixUnaryExpression expression)
	{
		Type type = typeOf(expression);
		String llvmType = LlvmTypes.toLlvm(type);
		String address = addressOf(expression.getOperand());
		String old = emitter.load(llvmType, address);
		TokenType op = expression.getOperator().getType() == TokenType.PLUS_PLUS ? TokenType.PLUS : TokenType.MINUS;
		String one = type == PrimitiveType.INT ? "1" : "1.0";
		emitter.store(llvmType, arithmetic(op, type, old, one), address);
		return old;
	}

	@Override
	public String visitAssignmentExpression(AssignmentExpression expression)
	{
		Type targetType = typeOf(expression.getTarget());
		String llvmType = LlvmTypes.toLlvm(targetType);
		String address = addressOf(expression.getTarget());
		String value;
		if (expression.isCompound())
		{
			String old = emitter.load(llvmType, address);
			value = arithmetic(compoundOperator(expression.getOperator().getType()), targetType, old, evaluate(expression.getValue()));
		}
		else
		{
			value = coerce(evaluateDetached(expression.getValue()), typeOf(expression.getValue()), targetType);
		}
		emitter.store(llvmType, value, address);
		return value;
	}

	private static TokenType compoundOperator(TokenType type)
	{
		switch (type)
		{
			case PLUS_ASSIGN:
				return TokenType.PLUS;
			case MINUS_ASSIGN:
				return TokenType.MINUS;
			case STAR_ASSIGN:
				return TokenType.STAR;
			case SLASH_ASSIGN:
				return TokenType.SLASH;
			default:
				throw new CodegenException("Unsupported compound assignment " + type + ".");
		}
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		CallTarget target = model.getCallTarget(expression);
		if (target == null)
		{
			throw new CodegenException("Call to '" + expression.getCalleeName() + "' was never resolved.");
		}
		ClassSymbol classSymbol = target.getClassSymbol();
		Expression receiver = expression.getCallee() instanceof DotExpression ? ((DotExpression) expression.getCallee()).getTarget() : null;
		switch (target.getKind())
		{
			case NEW:
				return emitter.call("ptr", LlvmTypes.routineName(classSymbol, "new"), List.of());
			case FROM_JSON:
			case FROM_XML:
			{
				String text = evaluate(expression.getArguments().get(0));
				String routine = target.getKind() == CallTarget.Kind.FROM_JSON ? "from_json" : "from_xml";
				return emitter.call("ptr", LlvmTypes.routineName(classSymbol, routine), List.of("ptr " + text));
			}
			case AS_JSON:
			case AS_XML:
			{
				String object = objectPointer(receiver);
				String routine = target.getKind() == CallTarget.Kind.AS_JSON ? "as_json" : "as_xml";
				return emitter.call("ptr", LlvmTypes.routineName(classSymbol, routine), List.of("ptr " + object));
			}
			case CLEAN:
			{
				String pointer = evaluate(receiver);
				if (classSymbol.isInterface())
				{
					emitter.call("void", LlvmTypes.routineName(classSymbol, "clean"), List.of("ptr " + pointer));
				}
				else
				{
					emitter.call("void", LlvmTypes.routineName(classSymbol, "cleanup"), List.of("ptr " + pointer));
					emitter.call("void", "@free", List.of("ptr " + pointer));
				}
				return null;
			}
			case RELEASE:
				return evaluate(receiver);
			case METHOD:
			{
				String object = receiver != null ? objectPointer(receiver) : "%this";
				return invoke(target.getMethod(), LlvmTypes.functionName(target.getMethod()), object, expression.getArguments());
			}
			case INTERFACE_METHOD:
				return invokeThroughTable(classSymbol, target.getMethod(), evaluate(receiver), expression.getArguments());
			default:
				return invoke(target.getMethod(), LlvmTypes.functionName(target.getMethod()), null, expression.getArguments());
		}
	}

	private String invoke(MethodSymbol method, String callee, String object, List<Expression> arguments)
	{
		List<String> typed = new ArrayList<>();
		if (object != null)
		{
			typed.add("ptr " + object);
		}
		typed.addAll(arguments(method, arguments));
		return emitter.call(LlvmTypes.toLlvm(method.getReturnType()), callee, typed);
	}

	private List<String> arguments(MethodSymbol method, List<Expression> arguments)
	{
		List<String> typed = new ArrayList<>();
		for (int i = 0; i < arguments.size(); i++)
		{
			Type parameterType = method.getParameterTypes().get(i);
			String value = coerce(evaluateDetached(arguments.get(i)), typeOf(arguments.get(i)), parameterType);
			typed.add(LlvmTypes.toLlvm(parameterType) + " " + value);
		}
		return typed;
	}

	/**
	 * Loads the implementation from the receiver's table and calls it with the recovered object pointer.
	 */
	private String invokeThroughTable(ClassSymbol iface, MethodSymbol method, String slot, List<Expression> arguments)
	{
		String table = LlvmTypes.itableName(iface);
		String itable = emitter.load("ptr", slot);
		String entry = emitter.gep(table, itable, "i32 0, i32 " + DispatchTables.methodSlot(iface, method));
		String function = emitter.load("ptr", entry);
		String object = emitter.call("ptr", LlvmTypes.routineName(iface, "self"), List.of("ptr " + slot));
		List<String> typed = new ArrayList<>();
		typed.add("ptr " + object);
		typed.addAll(arguments(method, arguments));
		return emitter.call(LlvmTypes.toLlvm(method.getReturnType()), function, typed);
	}

	/**
	 * Converts a value to the representation {@code to} expects. Only pointers into interfaces change: a class
	 * pointer moves to the interface's slot, an interface pointer is converted through its table. Null stays null.
	 */
	private String coerce(String value, Type from, Type to)
	{
		if (from == null || to == null || from.equals(to))
		{
			return value;
		}
		if (from instanceof NullType)
		{
			return "null";
		}
		if (!(from instanceof PointerType) || !(to instanceof PointerType))
		{
			return value;
		}
		ClassSymbol source = ((PointerType) from).getPointeeClass();
		ClassSymbol destination = ((PointerType) to).getPointeeClass();
		if (source == null || destination == null || source == destination || !destination.isInterface())
		{
			return value;
		}
		if (source.isInterface())
		{
			return emitter.call("ptr", DispatchTables.conversionName(source, destination), List.of("ptr " + value));
		}
		String slot = emitter.assign("getelementptr " + LlvmTypes.structName(source) + ", ptr " + value + ", " + layouts.slotPath(source, destination));
		String isNull = emitter.assign("icmp eq ptr " + value + ", null");
		return emitter.assign("select i1 " + isNull + ", ptr null, ptr " + slot);
	}
}
