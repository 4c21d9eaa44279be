// File: src/main/java/org/lokray/sinter/semantics/SemanticModel.java

package org.lokray.sinter.semantics;

import org.lokray.sinter.ast.TypeNode;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.expressions.CallExpression;
import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.semantics.flow.ControlFlowGraph;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Everything the analysis stages learn about one compilation unit. The AST is never mutated; facts are kept
 * in side tables keyed by node identity.
 */
public class SemanticModel
{
	private final SymbolTable globalScope = new SymbolTable(null, "global");
	private final Map<String, ClassSymbol> classes = new LinkedHashMap<>();
	private final Map<String, OverloadSet> functions = new LinkedHashMap<>();

	// Identifier uses, declarations, parameters and D-string placeholders -> symbol
	private final Map<Object, Symbol> bindings = new IdentityHashMap<>();
	private final Map<Expression, Type> expressionTypes = new IdentityHashMap<>();
	private final Map<TypeNode, Type> resolvedTypes = new IdentityHashMap<>();
	private final Map<CallExpression, CallTarget> callTargets = new IdentityHashMap<>();
	private final Map<FunctionDeclaration, ControlFlowGraph> controlFlowGraphs = new IdentityHashMap<>();
	private final Set<ClassSymbol> serializedClasses = new LinkedHashSet<>();

	public SymbolTable getGlobalScope()
	{
		return globalScope;
	}

	public void addClass(ClassSymbol classSymbol)
	{
		classes.put(classSymbol.getName(), classSymbol);
	}

	public ClassSymbol getClass(String name)
	{
		return classes.get(name);
	}

	/**
	 * @return Classes and interfaces in declaration order.
	 */
	public Collection<ClassSymbol> getClasses()
	{
		return Collections.unmodifiableCollection(classes.values());
	}

	public void addFunctions(OverloadSet overloads)
	{
		functions.put(overloads.getName(), overloads);
	}

	public OverloadSet getFunctions(String name)
	{
		return functions.get(name);
	}

	public Collection<OverloadSet> getAllFunctions()
	{
		return Collections.unmodifiableCollection(functions.values());
	}

	public void bind(Object node, Symbol symbol)
	{
		bindings.put(node, symbol);
	}

	public Symbol getBinding(Object node)
	{
		return bindings.get(node);
	}

	/**
	 * @return The variable bound to {@code node}, or null if it is unbound or bound to something else.
	 */
	public VariableSymbol getVariable(Object node)
	{
		Symbol symbol = bindings.get(node);
		return symbol instanceof VariableSymbol ? (VariableSymbol) symbol : null;
	}

	public MethodSymbol getMethod(FunctionDeclaration declaration)
	{
		Symbol symbol = bindings.get(declaration);
		return symbol instanceof MethodSymbol ? (MethodSymbol) symbol : null;
	}

	public void setType(Expression expression, Type type)
	{
		expressionTypes.put(expression, type);
	}

	public Type getType(Expression expression)
	{
		return expressionTypes.get(expression);
	}

	public void setResolvedType(TypeNode node, Type type)
	{
		resolvedTypes.put(node, type);
	}

	public Type getResolvedType(TypeNode node)
	{
		return resolvedTypes.get(node);
	}

	public void setCallTarget(CallExpression call, CallTarget target)
	{
		callTargets.put(call, target);
	}

	public CallTarget getCallTarget(CallExpression call)
	{
		return callTargets.get(call);
	}

	public void setControlFlowGraph(FunctionDeclaration function, ControlFlowGraph graph)
	{
		controlFlowGraphs.put(function, graph);
	}

	public ControlFlowGraph getControlFlowGraph(FunctionDeclaration function)
	{
		return controlFlowGraphs.get(function);
	}

	public void markSerialized(ClassSymbol classSymbol)
	{
		serializedClasses.add(classSymbol);
	}

	/**
	 * Classes whose {@code as_json}/{@code as_xml}/{@code from_json}/{@code from_xml} are called directly.
	 */
	public Set<ClassSymbol> getSerializedClasses()
	{
		return Collections.unmodifiableSet(serializedClasses);
	}
}
