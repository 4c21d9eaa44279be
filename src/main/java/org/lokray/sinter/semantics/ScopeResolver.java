// File: src/main/java/org/lokray/sinter/semantics/ScopeResolver.java
package org.lokray.sinter.semantics;

import org.lokray.sinter.ast.ASTVisitor;
import org.lokray.sinter.ast.Program;
import org.lokray.sinter.ast.TypeNode;
import org.lokray.sinter.ast.declarations.ClassDeclaration;
import org.lokray.sinter.ast.declarations.Declaration;
import org.lokray.sinter.ast.declarations.FieldDeclaration;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.declarations.InterfaceDeclaration;
import org.lokray.sinter.ast.declarations.MethodDeclaration;
import org.lokray.sinter.ast.declarations.Parameter;
import org.lokray.sinter.ast.declarations.Visibility;
import org.lokray.sinter.ast.expressions.*;
import org.lokray.sinter.ast.statements.*;
import org.lokray.sinter.lexer.Token;
import org.lokray.sinter.semantics.annotations.AccessorPolicy;
import org.lokray.sinter.util.Debug;
import org.lokray.sinter.util.DiagnosticCode;
import org.lokray.sinter.util.ErrorReporter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the symbol table with a multi-phase approach:
 * Phase 1: Register every class, interface and function name, so declarations may refer forward.
 * Phase 2: Link superclasses and interfaces, and break inheritance cycles.
 * Phase 3: Define members (fields, methods, synthesised accessors), superclasses first.
 * Phase 4: Walk every body, opening a scope per block and per loop header, and bind each identifier use.
 */
public class ScopeResolver implements ASTVisitor<Void>
{
	// Symbols the generated module defines or imports; user functions may not take these names
	static final Set<String> RESERVED_FUNCTION_NAMES = Set.of(
			"malloc", "free", "printf", "snprintf", "strcmp", "strstr", "strchr", "strtol", "strtod", "strlen", "strncmp", "memcpy", "exit");

	private final ErrorReporter errorReporter;
	private final SemanticModel model;
	private SymbolTable currentScope;
	private ClassSymbol currentClass;
	private boolean inStaticContext;

	private final Map<ClassSymbol, List<Edge>> inheritanceEdges = new LinkedHashMap<>();
	private final Set<ClassSymbol> membersDefined = new HashSet<>();

	/**
	 * An {@code extends} or {@code implements} reference, kept until cycle detection has approved it.
	 */
	private static final class Edge
	{
		final ClassSymbol target;
		final Token reference;
		final boolean isSuperclass;

		Edge(ClassSymbol target, Token reference, boolean isSuperclass)
		{
			this.target = target;
			this.reference = reference;
			this.isSuperclass = isSuperclass;
		}
	}

	public ScopeResolver(ErrorReporter errorReporter, SemanticModel model)
	{
		this.errorReporter = errorReporter;
		this.model = model;
		this.currentScope = model.getGlobalScope();
	}

	public void resolve(Program program)
	{
		Debug.log("Scope resolution: phase 1, declarations");
		Debug.indent();
		declareTopLevel(program);
		Debug.dedent();

		Debug.log("Scope resolution: phase 2, inheritance");
		linkSupertypes(program);
		detectCycles();

		Debug.log("Scope resolution: phase 3, members");
		Debug.indent();
		for (ClassSymbol classSymbol : model.getClasses())
		{
			defineMembers(classSymbol);
		}
		for (FunctionDeclaration function : program.getFunctions())
		{
			defineFunction(function);
		}
		mangleOverloads();
		checkValueContainment();
		Debug.dedent();

		Debug.log("Scope resolution: phase 4, bodies");
		program.accept(this);
	}

	// --- Phase 1 ---

	private void declareTopLevel(Program program)
	{
		SymbolTable global = model.getGlobalScope();
		for (Declaration declaration : program.getDeclarations())
		{
			if (declaration instanceof ClassDeclaration || declaration instanceof InterfaceDeclaration)
			{
				boolean isInterface = declaration instanceof InterfaceDeclaration;
				ClassSymbol classSymbol = new ClassSymbol(declaration.getName(), isInterface, declaration);
				if (define(global, classSymbol, declaration.getNameToken()))
				{
					model.addClass(classSymbol);
					model.bind(declaration, classSymbol);
					Debug.log("Declared %s %s", isInterface ? "interface" : "class", classSymbol.getName());
				}
			}
			else if (declaration instanceof FunctionDeclaration)
			{
				String name = declaration.getName();
				if (RESERVED_FUNCTION_NAMES.contains(name) || name.startsWith("sinter_"))
				{
					errorReporter.error(DiagnosticCode.DUPLICATE_DECLARATION, declaration.getNameToken(),
							"Function name '" + name + "' is reserved by the runtime.");
					continue;
				}
				Symbol existing = global.resolveCurrentScope(name);
				if (existing == null)
				{
					OverloadSet overloads = new OverloadSet(name, declaration.getNameToken());
					global.define(overloads);
					model.addFunctions(overloads);
				}
				else if (!(existing instanceof OverloadSet))
				{
					duplicate(declaration.getNameToken(), name, existing);
				}
			}
		}
	}

	// --- Phase 2 ---

	private void linkSupertypes(Program program)
	{
		for (ClassDeclaration declaration : program.getClasses())
		{
			ClassSymbol classSymbol = (ClassSymbol) model.getBinding(declaration);
			if (classSymbol == null)
			{
				continue;
			}
			List<Edge> edges = new ArrayList<>();
			if (declaration.getSuperclassName() != null)
			{
				ClassSymbol superclass = lookupClass(declaration.getSuperclassName());
				if (superclass != null && superclass.isInterface())
				{
					errorReporter.error(DiagnosticCode.TYPE_MISMATCH, declaration.getSuperclassName(),
							"Class '" + classSymbol.getName() + "' cannot extend interface '" + superclass.getName() + "'; use 'implements'.");
				}
				else if (superclass != null)
				{
					edges.add(new Edge(superclass, declaration.getSuperclassName(), true));
				}
			}
			for (Token name : declaration.getInterfaceNames())
			{
				ClassSymbol iface = lookupClass(name);
				if (iface != null && !iface.isInterface())
				{
					errorReporter.error(DiagnosticCode.TYPE_MISMATCH, name,
							"Class '" + classSymbol.getName() + "' cannot implement class '" + iface.getName() + "'; use 'extends'.");
				}
				else if (iface != null)
				{
					edges.add(new Edge(iface, name, false));
				}
			}
			inheritanceEdges.put(classSymbol, edges);
		}
		for (InterfaceDeclaration declaration : program.getInterfaces())
		{
			ClassSymbol iface = (ClassSymbol) model.getBinding(declaration);
			if (iface == null)
			{
				continue;
			}
			List<Edge> edges = new ArrayList<>();
			for (Token name : declaration.getSuperInterfaceNames())
			{
				ClassSymbol parent = lookupClass(name);
				if (parent != null && !parent.isInterface())
				{
					errorReporter.error(DiagnosticCode.TYPE_MISMATCH, name,
							"Interface '" + iface.getName() + "' cannot extend class '" + parent.getName() + "'.");
				}
				else if (parent != null)
				{
					edges.add(new Edge(parent, name, false));
				}
			}
			inheritanceEdges.put(iface, edges);
		}
	}

	private ClassSymbol lookupClass(Token name)
	{
		Symbol symbol = model.getGlobalScope().resolve(name.getLexeme());
		if (symbol instanceof ClassSymbol)
		{
			return (ClassSymbol) symbol;
		}
		errorReporter.error(DiagnosticCode.UNRESOLVED_REFERENCE, name, "Undefined type '" + name.getLexeme() + "'.");
		return null;
	}

	/**
	 * Depth-first walk with gray/black coloring. An edge into a gray node closes a cycle; it is reported
	 * at the reference that closes it and dropped, so later phases see an acyclic graph.
	 */
	private void detectCycles()
	{
		Set<ClassSymbol> gray = new HashSet<>();
		Set<ClassSymbol> black = new HashSet<>();
		List<ClassSymbol> path = new ArrayList<>();
		for (ClassSymbol classSymbol : inheritanceEdges.keySet())
		{
			if (!black.contains(classSymbol))
			{
				visitInheritance(classSymbol, gray, black, path);
			}
		}
		for (Map.Entry<ClassSymbol, List<Edge>> entry : inheritanceEdges.entrySet())
		{
			for (Edge edge : entry.getValue())
			{
				if (edge.isSuperclass)
				{
					entry.getKey().setSuperclass(edge.target);
				}
				else
				{
					entry.getKey().getInterfaces().add(edge.target);
				}
			}
		}
	}

	private void visitInheritance(ClassSymbol node, Set<ClassSymbol> gray, Set<ClassSymbol> black, List<ClassSymbol> path)
	{
		gray.add(node);
		path.add(node);
		List<Edge> edges = inheritanceEdges.getOrDefault(node, new ArrayList<>());
		for (Edge edge : new ArrayList<>(edges))
		{
			if (gray.contains(edge.target))
			{
				List<ClassSymbol> cycle = path.subList(path.indexOf(edge.target), path.size());
				String rendered = cycle.stream().map(Symbol::getName).collect(Collectors.joining(" -> ")) + " -> " + edge.target.getName();
				errorReporter.error(DiagnosticCode.CYCLIC_INHERITANCE, edge.reference, "Cyclic inheritance: " + rendered + ".");
				edges.remove(edge);
			}
			else if (!black.contains(edge.target))
			{
				visitInheritance(edge.target, gray, black, path);
			}
		}
		path.remove(path.size() - 1);
		gray.remove(node);
		black.add(node);
	}

	// --- Phase 3 ---

	private void defineMembers(ClassSymbol classSymbol)
	{
		if (!membersDefined.add(classSymbol))
		{
			return;
		}
		ClassSymbol superclass = classSymbol.getSuperclass();
		if (superclass != null)
		{
			defineMembers(superclass);
		}
		SymbolTable enclosing = superclass != null ? superclass.getClassScope() : model.getGlobalScope();
		SymbolTable classScope = new SymbolTable(enclosing, "class:" + classSymbol.getName(), classSymbol);
		classSymbol.setClassScope(classScope);
		Debug.log("Defining members of %s", classSymbol.getName());

		if (classSymbol.isInterface())
		{
			InterfaceDeclaration declaration = (InterfaceDeclaration) classSymbol.getDeclaration();
			for (MethodDeclaration method : declaration.getMethods())
			{
				defineMethod(classSymbol, method);
			}
			return;
		}

		ClassDeclaration declaration = (ClassDeclaration) classSymbol.getDeclaration();
		for (FieldDeclaration field : declaration.getFields())
		{
			Type type = resolveType(field.getType(), false);
			VariableSymbol symbol = new VariableSymbol(field, type, classSymbol);
			if (define(classScope, symbol, field.getNameToken()))
			{
				classSymbol.addField(symbol);
				model.bind(field, symbol);
			}
		}
		for (MethodDeclaration method : declaration.getMethods())
		{
			defineMethod(classSymbol, method);
		}
		for (FieldDeclaration field : declaration.getFields())
		{
			VariableSymbol symbol = model.getVariable(field);
			if (symbol == null)
			{
				continue;
			}
			if (!field.isDerived() && !classSymbol.getOwnMethods(field.getName()).isEmpty())
			{
				errorReporter.error(DiagnosticCode.DUPLICATE_DECLARATION, classSymbol.getOwnMethods(field.getName()).get(0).getDeclarationToken(),
						"Method '" + field.getName() + "' clashes with field '" + field.getName() + "' of class " + classSymbol.getName() + ".");
			}
			synthesizeAccessors(classSymbol, field, symbol);
		}
	}

	private void defineMethod(ClassSymbol owner, MethodDeclaration method)
	{
		MethodSymbol symbol = createMethodSymbol(method, method.isStatic(), owner.isInterface() ? Visibility.PUBLIC : method.getVisibility());
		for (MethodSymbol existing : owner.getOwnMethods(symbol.getName()))
		{
			if (existing.hasSameParameters(symbol))
			{
				duplicate(method.getNameToken(), owner.getName() + "." + existing.signature(), existing);
				return;
			}
		}
		owner.defineMethod(symbol);
		model.bind(method, symbol);
	}

	private void synthesizeAccessors(ClassSymbol owner, FieldDeclaration field, VariableSymbol symbol)
	{
		String getter = AccessorPolicy.getterName(field.getName());
		String setter = AccessorPolicy.setterName(field.getName());
		if (AccessorPolicy.wantsGetter(field) && owner.getOwnMethods(getter).isEmpty())
		{
			owner.defineMethod(MethodSymbol.accessor(getter, MethodSymbol.AccessorKind.GETTER, symbol));
			Debug.log("Synthesised %s.%s()", owner.getName(), getter);
		}
		if (AccessorPolicy.wantsSetter(field) && owner.getOwnMethods(setter).isEmpty())
		{
			owner.defineMethod(MethodSymbol.accessor(setter, MethodSymbol.AccessorKind.SETTER, symbol));
			Debug.log("Synthesised %s.%s(value)", owner.getName(), setter);
		}
	}

	private void defineFunction(FunctionDeclaration function)
	{
		OverloadSet overloads = model.getFunctions(function.getName());
		if (overloads == null)
		{
			return; // Reserved or clashing name, already reported
		}
		MethodSymbol symbol = createMethodSymbol(function, true, Visibility.PUBLIC);
		for (MethodSymbol existing : overloads.getFunctions())
		{
			if (existing.hasSameParameters(symbol))
			{
				duplicate(function.getNameToken(), existing.signature(), existing);
				return;
			}
		}
		overloads.add(symbol);
		model.bind(function, symbol);
	}

	private MethodSymbol createMethodSymbol(FunctionDeclaration function, boolean isStatic, Visibility visibility)
	{
		List<Type> parameterTypes = new ArrayList<>();
		List<String> parameterNames = new ArrayList<>();
		for (Parameter parameter : function.getParameters())
		{
			parameterTypes.add(resolveType(parameter.getType(), false));
			parameterNames.add(parameter.getName());
		}
		Type returnType = resolveType(function.getReturnType(), true);
		return new MethodSymbol(function.getName(), returnType, parameterTypes, parameterNames, function.getNameToken(), function, isStatic, visibility);
	}

	/**
	 * Overloads are told apart in the emitted module by their parameter types.
	 */
	private void mangleOverloads()
	{
		for (ClassSymbol classSymbol : model.getClasses())
		{
			Map<String, List<MethodSymbol>> byName = new HashMap<>();
			for (MethodSymbol method : classSymbol.getAllOwnMethods())
			{
				byName.computeIfAbsent(method.getName(), k -> new ArrayList<>()).add(method);
			}
			byName.values().stream().filter(list -> list.size() > 1).forEach(list -> list.forEach(ScopeResolver::mangle));
		}
		for (OverloadSet overloads : model.getAllFunctions())
		{
			if (overloads.getFunctions().size() > 1)
			{
				overloads.getFunctions().forEach(ScopeResolver::mangle);
			}
		}
	}

	private static void mangle(MethodSymbol method)
	{
		StringBuilder name = new StringBuilder(method.getName());
		for (Type parameter : method.getParameterTypes())
		{
			name.append('.').append(parameter.getName().replace("*", "_ptr"));
		}
		method.setMangledName(name.toString());
	}

	/**
	 * A class may not contain itself by value, directly or through the value fields of other classes.
	 */
	private void checkValueContainment()
	{
		for (ClassSymbol classSymbol : model.getClasses())
		{
			for (VariableSymbol field : classSymbol.getOwnFields())
			{
				if (field.getType() instanceof NamedType && !field.isDerived()
						&& containsByValue(((NamedType) field.getType()).getSymbol(), classSymbol, new HashSet<>()))
				{
					errorReporter.error(DiagnosticCode.TYPE_MISMATCH, field.getDeclarationToken(),
							"Field '" + field.getName() + "' makes class " + classSymbol.getName() + " contain itself; use a pointer.");
				}
			}
		}
	}

	private boolean containsByValue(ClassSymbol candidate, ClassSymbol target, Set<ClassSymbol> seen)
	{
		if (candidate == target)
		{
			return true;
		}
		if (!seen.add(candidate))
		{
			return false;
		}
		for (ClassSymbol c : candidate.getHierarchy())
		{
			if (c == target)
			{
				return true;
			}
			for (VariableSymbol field : c.getOwnFields())
			{
				if (field.getType() instanceof NamedType && !field.isDerived()
						&& containsByValue(((NamedType) field.getType()).getSymbol(), target, seen))
				{
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Resolves a written type and records it. Pointers may only point to named types; interfaces may only be used
	 * behind pointers.
	 */
	private Type resolveType(TypeNode node, boolean allowVoid)
	{
		Type base = PrimitiveType.byName(node.getBaseName());
		if (base == null)
		{
			Symbol symbol = model.getGlobalScope().resolve(node.getBaseName());
			if (!(symbol instanceof ClassSymbol))
			{
				errorReporter.error(DiagnosticCode.UNRESOLVED_REFERENCE, node.getNameToken(), "Undefined type '" + node.getBaseName() + "'.");
				model.setResolvedType(node, ErrorType.INSTANCE);
				return ErrorType.INSTANCE;
			}
			base = ((ClassSymbol) symbol).getNamedType();
		}
		Type result = base;
		if (node.getPointerDepth() > 0)
		{
			if (base instanceof PrimitiveType)
			{
				errorReporter.error(DiagnosticCode.TYPE_MISMATCH, node.getNameToken(),
						"Cannot point to primitive type '" + base + "'; only class and interface types may be pointed to.");
				result = ErrorType.INSTANCE;
			}
			else
			{
				for (int i = 0; i < node.getPointerDepth(); i++)
				{
					result = new PointerType(result);
				}
			}
		}
		else if (base.isVoid() && !allowVoid)
		{
			errorReporter.error(DiagnosticCode.TYPE_MISMATCH, node.getNameToken(), "'void' is not a valid variable type.");
			result = ErrorType.INSTANCE;
		}
		else if (base instanceof NamedType && ((NamedType) base).isInterface())
		{
			errorReporter.error(DiagnosticCode.TYPE_MISMATCH, node.getNameToken(),
					"Interface '" + base + "' can only be used behind a pointer ('" + base + "*').");
			result = ErrorType.INSTANCE;
		}
		model.setResolvedType(node, result);
		return result;
	}

	private boolean define(SymbolTable scope, Symbol symbol, Token at)
	{
		try
		{
			scope.define(symbol);
			return true;
		}
		catch (IllegalArgumentException e)
		{
			duplicate(at, symbol.getName(), scope.resolveCurrentScope(symbol.getName()));
			return false;
		}
	}

	private void duplicate(Token at, String what, Symbol existing)
	{
		Token previous = existing != null ? existing.getDeclarationToken() : null;
		String where = previous != null ? " (previously declared at line " + previous.getLine() + ")" : "";
		errorReporter.error(DiagnosticCode.DUPLICATE_DECLARATION, at, "Duplicate declaration of '" + what + "'" + where + ".");
	}

	private void enterScope(String name)
	{
		currentScope = new SymbolTable(currentScope, name);
	}

	private void exitScope()
	{
		currentScope = currentScope.getEnclosingScope();
	}

	// --- Phase 4 ---

	@Override
	public Void visitProgram(Program program)
	{
		for (Declaration declaration : program.getDeclarations())
		{
			declaration.accept(this);
		}
		return null;
	}

	@Override
	public Void visitClassDeclaration(ClassDeclaration declaration)
	{
		ClassSymbol classSymbol = (ClassSymbol) model.getBinding(declaration);
		if (classSymbol == null)
		{
			return null;
		}
		SymbolTable previous = currentScope;
		currentClass = classSymbol;
		currentScope = classSymbol.getClassScope();
		for (FieldDeclaration field : declaration.getFields())
		{
			field.accept(this);
		}
		for (MethodDeclaration method : declaration.getMethods())
		{
			method.accept(this);
		}
		currentScope = previous;
		currentClass = null;
		return null;
	}

	@Override
	public Void visitInterfaceDeclaration(InterfaceDeclaration declaration)
	{
		return null; // Signatures only
	}

	@Override
	public Void visitFieldDeclaration(FieldDeclaration declaration)
	{
		if (declaration.getInitializer() != null)
		{
			inStaticContext = true; // Initializers run before the object exists
			declaration.getInitializer().accept(this);
			inStaticContext = false;
		}
		return null;
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		if (model.getMethod(declaration) == null)
		{
			return null;
		}
		resolveBody(declaration, true);
		return null;
	}

	@Override
	public Void visitMethodDeclaration(MethodDeclaration declaration)
	{
		if (model.getMethod(declaration) == null)
		{
			return null;
		}
		resolveBody(declaration, declaration.isStatic());
		return null;
	}

	private void resolveBody(FunctionDeclaration declaration, boolean isStatic)
	{
		Debug.log("Resolving body of %s%s", currentClass != null ? currentClass.getName() + "." : "", declaration.getName());
		MethodSymbol method = model.getMethod(declaration);
		enterScope("method:" + declaration.getName());
		inStaticContext = isStatic;
		for (int i = 0; i < declaration.getParameters().size(); i++)
		{
			Parameter parameter = declaration.getParameters().get(i);
			VariableSymbol symbol = new VariableSymbol(parameter.getName(), method.getParameterTypes().get(i), parameter.getNameToken(),
					VariableSymbol.Kind.PARAMETER, false);
			if (define(currentScope, symbol, parameter.getNameToken()))
			{
				model.bind(parameter, symbol);
			}
		}
		if (declaration.getBody() != null)
		{
			// The body shares the parameter scope, so a local may not redeclare a parameter
			for (Statement statement : declaration.getBody().getStatements())
			{
				statement.accept(this);
			}
		}
		inStaticContext = false;
		exitScope();
	}

	@Override
	public Void visitBlockStatement(BlockStatement statement)
	{
		enterScope("block");
		for (Statement inner : statement.getStatements())
		{
			inner.accept(this);
		}
		exitScope();
		return null;
	}

	@Override
	public Void visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		Type declared = statement.getType() != null ? resolveType(statement.getType(), false) : null;
		if (statement.getInitializer() != null)
		{
			statement.getInitializer().accept(this); // Before define: the initializer sees the outer binding
		}
		VariableSymbol symbol = new VariableSymbol(statement.getName(), declared, statement.getNameToken(), VariableSymbol.Kind.LOCAL, statement.isConst());
		if (define(currentScope, symbol, statement.getNameToken()))
		{
			model.bind(statement, symbol);
		}
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		statement.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		statement.getCondition().accept(this);
		statement.getThenBranch().accept(this);
		if (statement.getElseBranch() != null)
		{
			statement.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Void visitWhileStatement(WhileStatement statement)
	{
		statement.getCondition().accept(this);
		statement.getBody().accept(this);
		return null;
	}

	@Override
	public Void visitForStatement(ForStatement statement)
	{
		enterScope("for");
		if (statement.getInitializer() != null)
		{
			statement.getInitializer().accept(this);
		}
		if (statement.getCondition() != null)
		{
			statement.getCondition().accept(this);
		}
		if (statement.getUpdate() != null)
		{
			statement.getUpdate().accept(this);
		}
		statement.getBody().accept(this);
		exitScope();
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		if (statement.getValue() != null)
		{
			statement.getValue().accept(this);
		}
		return null;
	}

	@Override
	public Void visitBreakStatement(BreakStatement statement)
	{
		return null;
	}

	@Override
	public Void visitContinueStatement(ContinueStatement statement)
	{
		return null;
	}

	@Override
	public Void visitPrintStatement(PrintStatement statement)
	{
		statement.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		return null;
	}

	@Override
	public Void visitDStringExpression(DStringExpression expression)
	{
		for (DStringExpression.Part part : expression.getParts())
		{
			if (!part.isPlaceholder())
			{
				continue;
			}
			Token name = part.getNameToken();
			Symbol symbol = currentScope.resolve(name.getLexeme());
			if (!(symbol instanceof VariableSymbol))
			{
				errorReporter.error(DiagnosticCode.UNRESOLVED_REFERENCE, name,
						"D-string placeholder '{" + name.getLexeme() + "}' does not name a visible variable.");
				continue;
			}
			if (checkVariableAccess((VariableSymbol) symbol, name))
			{
				model.bind(part, symbol);
			}
		}
		return null;
	}

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		Symbol symbol = currentScope.resolve(expression.getName());
		if (symbol == null)
		{
			errorReporter.error(DiagnosticCode.UNRESOLVED_REFERENCE, expression.getNameToken(), "Undefined identifier '" + expression.getName() + "'.");
			return null;
		}
		if (symbol instanceof VariableSymbol && !checkVariableAccess((VariableSymbol) symbol, expression.getNameToken()))
		{
			return null;
		}
		model.bind(expression, symbol);
		return null;
	}

	/**
	 * Fields are reachable unqualified only from instance methods of the class, and a private field only
	 * from its own class.
	 */
	private boolean checkVariableAccess(VariableSymbol variable, Token use)
	{
		if (!variable.isField())
		{
			return true;
		}
		if (inStaticContext)
		{
			errorReporter.error(DiagnosticCode.UNRESOLVED_REFERENCE, use,
					"Field '" + variable.getName() + "' cannot be used without an instance here.");
			return false;
		}
		if (variable.getVisibility() == Visibility.PRIVATE && variable.getOwnerClass() != currentClass)
		{
			errorReporter.error(DiagnosticCode.INACCESSIBLE_MEMBER, use,
					"Field '" + variable.getName() + "' is private to class " + variable.getOwnerClass().getName() + ".");
			return false;
		}
		return true;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		expression.getLeft().accept(this);
		expression.getRight().accept(this);
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpression expression)
	{
		expression.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visitPostfixUnaryExpression(PostfixUnaryExpression expression)
	{
		expression.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visitAssignmentExpression(AssignmentExpression expression)
	{
		expression.getTarget().accept(this);
		expression.getValue().accept(this);
		return null;
	}

	@Override
	public Void visitCallExpression(CallExpression expression)
	{
		if (expression.getCallee() instanceof IdentifierExpression)
		{
			// Unqualified calls name a method of the enclosing class first, then a top-level function
			Token name = ((IdentifierExpression) expression.getCallee()).getNameToken();
			boolean isMethod = currentClass != null && !currentClass.findMethods(name.getLexeme()).isEmpty();
			if (!isMethod && model.getFunctions(name.getLexeme()) == null)
			{
				errorReporter.error(DiagnosticCode.UNRESOLVED_REFERENCE, name, "Undefined function '" + name.getLexeme() + "'.");
			}
		}
		else
		{
			expression.getCallee().accept(this);
		}
		for (Expression argument : expression.getArguments())
		{
			argument.accept(this);
		}
		return null;
	}

	@Override
	public Void visitDotExpression(DotExpression expression)
	{
		expression.getTarget().accept(this); // Members depend on the target's type; the type checker binds them
		return null;
	}

	@Override
	public Void visitGroupingExpression(GroupingExpression expression)
	{
		expression.getExpression().accept(this);
		return null;
	}
}
