// File: src/main/java/org/lokray/sinter/semantics/flow/PointerCleanupValidator.java
package org.lokray.sinter.semantics.flow;

import org.lokray.sinter.ast.ASTNode;
import org.lokray.sinter.ast.Program;
import org.lokray.sinter.ast.declarations.ClassDeclaration;
import org.lokray.sinter.ast.declarations.FieldDeclaration;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.declarations.MethodDeclaration;
import org.lokray.sinter.ast.declarations.Parameter;
import org.lokray.sinter.ast.expressions.*;
import org.lokray.sinter.ast.statements.*;
import org.lokray.sinter.lexer.Token;
import org.lokray.sinter.semantics.CallTarget;
import org.lokray.sinter.semantics.ClassSymbol;
import org.lokray.sinter.semantics.MethodSymbol;
import org.lokray.sinter.semantics.OwnershipState;
import org.lokray.sinter.semantics.PointerType;
import org.lokray.sinter.semantics.SemanticModel;
import org.lokray.sinter.semantics.VariableSymbol;
import org.lokray.sinter.util.Debug;
import org.lokray.sinter.util.DiagnosticCode;
import org.lokray.sinter.util.ErrorReporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Proves that every pointer obtained from an allocation is cleaned or released exactly once on every path.
 * <p>
 * Forward may-analysis over each body's {@link ControlFlowGraph}: per pointer binding, the set of
 * {@link OwnershipState}s it may be in plus the allocation sites it may still own. Join is set union. The analysis
 * runs to a fixed point silently, then one reporting pass walks every reachable block with the converged entry
 * states, so each problem is reported once.
 */
public class PointerCleanupValidator
{
	private final ErrorReporter errorReporter;
	private final SemanticModel model;
	private final Map<MethodSymbol, Boolean> returnsOwnership = new HashMap<>();

	/**
	 * What one binding may be at one program point.
	 */
	private static final class Fact
	{
		final EnumSet<OwnershipState> states;
		final Set<ASTNode> sites; // Allocations the binding may still own

		Fact(EnumSet<OwnershipState> states, Set<ASTNode> sites)
		{
			this.states = states;
			this.sites = sites;
		}

		static Fact of(OwnershipState state, ASTNode site)
		{
			Set<ASTNode> sites = Collections.newSetFromMap(new IdentityHashMap<>());
			if (site != null)
			{
				sites.add(site);
			}
			return new Fact(EnumSet.of(state), sites);
		}

		Fact copy()
		{
			Set<ASTNode> copied = Collections.newSetFromMap(new IdentityHashMap<>());
			copied.addAll(sites);
			return new Fact(EnumSet.copyOf(states), copied);
		}

		boolean mayBeOwned()
		{
			return states.contains(OwnershipState.OWNED);
		}

		@Override
		public boolean equals(Object o)
		{
			if (!(o instanceof Fact))
			{
				return false;
			}
			Fact other = (Fact) o;
			return states.equals(other.states) && sites.size() == other.sites.size() && sites.containsAll(other.sites);
		}

		@Override
		public int hashCode()
		{
			return states.hashCode();
		}
	}

	/**
	 * The facts of every tracked binding at one program point.
	 */
	private static final class State
	{
		final Map<VariableSymbol, Fact> facts = new LinkedHashMap<>();

		State copy()
		{
			State result = new State();
			facts.forEach((k, v) -> result.facts.put(k, v.copy()));
			return result;
		}

		void joinWith(State other)
		{
			other.facts.forEach((symbol, fact) ->
			{
				Fact mine = facts.get(symbol);
				if (mine == null)
				{
					facts.put(symbol, fact.copy());
				}
				else
				{
					mine.states.addAll(fact.states);
					mine.sites.addAll(fact.sites);
				}
			});
		}

		@Override
		public boolean equals(Object o)
		{
			return o instanceof State && facts.equals(((State) o).facts);
		}

		@Override
		public int hashCode()
		{
			return facts.hashCode();
		}
	}

	/**
	 * Per-body analysis context.
	 */
	private final class Analysis
	{
		final String owner;
		boolean reporting;
		final Set<ASTNode> reportedSites = Collections.newSetFromMap(new IdentityHashMap<>());

		Analysis(String owner)
		{
			this.owner = owner;
		}
	}

	public PointerCleanupValidator(ErrorReporter errorReporter, SemanticModel model)
	{
		this.errorReporter = errorReporter;
		this.model = model;
	}

	public void validate(Program program)
	{
		for (FunctionDeclaration function : program.getFunctions())
		{
			validateBody(function, null);
		}
		for (ClassDeclaration declaration : program.getClasses())
		{
			ClassSymbol classSymbol = (ClassSymbol) model.getBinding(declaration);
			for (MethodDeclaration method : declaration.getMethods())
			{
				validateBody(method, classSymbol);
			}
		}
	}

	private void validateBody(FunctionDeclaration declaration, ClassSymbol owner)
	{
		MethodSymbol method = model.getMethod(declaration);
		if (method == null || declaration.getBody() == null)
		{
			return;
		}
		ControlFlowGraph graph = model.getControlFlowGraph(declaration);
		if (graph == null)
		{
			graph = ControlFlowGraph.build(declaration.getBody());
			model.setControlFlowGraph(declaration, graph);
		}
		Analysis analysis = new Analysis(owner != null ? owner.getName() + "." + method.getName() : method.getName());
		Debug.log("Validating pointer cleanup in %s", analysis.owner);
		Debug.indent();

		State initial = new State();
		for (Parameter parameter : declaration.getParameters())
		{
			VariableSymbol symbol = model.getVariable(parameter);
			if (isTracked(symbol))
			{
				initial.facts.put(symbol, Fact.of(OwnershipState.UNOWNED, null));
			}
		}
		if (owner != null && isCleanHook(method))
		{
			// The hook discharges the object's own pointer fields
			for (VariableSymbol field : owner.getOwnFields())
			{
				if (isTracked(field))
				{
					initial.facts.put(field, Fact.of(OwnershipState.OWNED, field.getField()));
				}
			}
		}

		Map<BasicBlock, State> entryStates = solve(graph, initial, analysis);

		analysis.reporting = true;
		for (BasicBlock block : graph.reversePostOrder())
		{
			State in = entryStates.get(block);
			if (in != null)
			{
				transfer(block, in.copy(), analysis);
			}
		}
		State atExit = entryStates.get(graph.getExit());
		if (atExit != null)
		{
			atExit.facts.forEach((symbol, fact) -> reportLeaks(symbol, fact, analysis));
		}
		Debug.dedent();
	}

	private Map<BasicBlock, State> solve(ControlFlowGraph graph, State initial, Analysis analysis)
	{
		List<BasicBlock> order = graph.reversePostOrder();
		Map<BasicBlock, State> in = new HashMap<>();
		Map<BasicBlock, State> out = new HashMap<>();
		boolean changed = true;
		int rounds = 0;
		while (changed)
		{
			changed = false;
			rounds++;
			for (BasicBlock block : order)
			{
				State merged;
				if (block == graph.getEntry())
				{
					merged = initial.copy();
				}
				else
				{
					merged = null;
					for (BasicBlock predecessor : block.getPredecessors())
					{
						State predecessorOut = out.get(predecessor);
						if (predecessorOut == null)
						{
							continue; // Not reached yet
						}
						if (merged == null)
						{
							merged = predecessorOut.copy();
						}
						else
						{
							merged.joinWith(predecessorOut);
						}
					}
				}
				if (merged == null)
				{
					continue;
				}
				if (!merged.equals(in.get(block)))
				{
					in.put(block, merged);
					out.put(block, transfer(block, merged.copy(), analysis));
					changed = true;
				}
			}
		}
		Debug.log("Converged after %d round(s)", rounds);
		return in;
	}

	private State transfer(BasicBlock block, State state, Analysis analysis)
	{
		for (ASTNode element : block.getElements())
		{
			if (element instanceof VariableDeclarationStatement)
			{
				declare((VariableDeclarationStatement) element, state, analysis);
			}
			else if (element instanceof ExpressionStatement)
			{
				Expression expression = ((ExpressionStatement) element).getExpression();
				evaluate(expression, state, analysis);
				checkDiscarded(expression, analysis);
			}
			else if (element instanceof ReturnStatement)
			{
				Expression value = ((ReturnStatement) element).getValue();
				if (value != null)
				{
					evaluate(value, state, analysis);
				}
			}
			else if (element instanceof PrintStatement)
			{
				evaluate(((PrintStatement) element).getExpression(), state, analysis);
			}
			else if (element instanceof Expression)
			{
				evaluate((Expression) element, state, analysis);
			}
		}
		return state;
	}

	private void declare(VariableDeclarationStatement statement, State state, Analysis analysis)
	{
		if (statement.getInitializer() != null)
		{
			evaluate(statement.getInitializer(), state, analysis);
		}
		VariableSymbol symbol = model.getVariable(statement);
		if (!isTracked(symbol))
		{
			return;
		}
		Fact previous = state.facts.get(symbol);
		if (previous != null)
		{
			reportLeaks(symbol, previous, analysis); // Redeclared on a later loop iteration
		}
		state.facts.put(symbol, ownershipOf(statement.getInitializer()));
	}

	/**
	 * The ownership a binding receives from {@code value}: fresh allocations own, everything else borrows.
	 */
	private Fact ownershipOf(Expression value)
	{
		Expression inner = unwrap(value);
		if (inner instanceof CallExpression)
		{
			CallTarget target = model.getCallTarget((CallExpression) inner);
			if (target != null && (target.isAllocation() || (target.getMethod() != null && returnsOwnership(target.getMethod()))))
			{
				return Fact.of(OwnershipState.OWNED, inner);
			}
		}
		return Fact.of(OwnershipState.UNOWNED, null);
	}

	/**
	 * Evaluates an expression left to right, applying releases and assignments and checking uses.
	 */
	private void evaluate(Expression expression, State state, Analysis analysis)
	{
		if (expression instanceof IdentifierExpression)
		{
			use((IdentifierExpression) expression, state, analysis);
		}
		else if (expression instanceof GroupingExpression)
		{
			evaluate(((GroupingExpression) expression).getExpression(), state, analysis);
		}
		else if (expression instanceof BinaryExpression)
		{
			evaluate(((BinaryExpression) expression).getLeft(), state, analysis);
			evaluate(((BinaryExpression) expression).getRight(), state, analysis);
		}
		else if (expression instanceof UnaryExpression)
		{
			evaluate(((UnaryExpression) expression).getOperand(), state, analysis);
		}
		else if (expression instanceof PostfixUnaryExpression)
		{
			evaluate(((PostfixUnaryExpression) expression).getOperand(), state, analysis);
		}
		else if (expression instanceof DotExpression)
		{
			evaluate(((DotExpression) expression).getTarget(), state, analysis);
		}
		else if (expression instanceof AssignmentExpression)
		{
			assign((AssignmentExpression) expression, state, analysis);
		}
		else if (expression instanceof CallExpression)
		{
			call((CallExpression) expression, state, analysis);
		}
	}

	private void use(IdentifierExpression identifier, State state, Analysis analysis)
	{
		VariableSymbol symbol = model.getVariable(identifier);
		Fact fact = symbol != null ? state.facts.get(symbol) : null;
		if (fact != null && fact.states.contains(OwnershipState.RELEASED) && analysis.reporting)
		{
			errorReporter.error(DiagnosticCode.USE_AFTER_RELEASE, identifier.getNameToken(),
					"Pointer '" + symbol.getName() + "' is used after it " + (fact.states.size() == 1 ? "was" : "may have been") + " released.");
		}
	}

	private void assign(AssignmentExpression assignment, State state, Analysis analysis)
	{
		Expression target = unwrap(assignment.getTarget());
		if (!(target instanceof IdentifierExpression))
		{
			evaluate(assignment.getTarget(), state, analysis);
			evaluate(assignment.getValue(), state, analysis);
			return;
		}
		evaluate(assignment.getValue(), state, analysis);
		VariableSymbol symbol = model.getVariable(target);
		Fact previous = symbol != null ? state.facts.get(symbol) : null;
		if (!isTracked(symbol) || previous == null)
		{
			return; // Fields outside the clean() hook are not this body's obligation
		}
		reportLeaks(symbol, previous, analysis);
		state.facts.put(symbol, ownershipOf(assignment.getValue()));
	}

	private void call(CallExpression call, State state, Analysis analysis)
	{
		CallTarget target = model.getCallTarget(call);
		Expression callee = call.getCallee();
		Expression receiver = callee instanceof DotExpression ? unwrap(((DotExpression) callee).getTarget()) : null;
		if (target != null && target.isRelease() && receiver instanceof IdentifierExpression
				&& isTracked(model.getVariable(receiver)) && state.facts.containsKey(model.getVariable(receiver)))
		{
			release((IdentifierExpression) receiver, ((DotExpression) callee).getMemberToken(), state, analysis);
			return;
		}
		if (callee instanceof DotExpression)
		{
			evaluate(((DotExpression) callee).getTarget(), state, analysis);
		}
		for (Expression argument : call.getArguments())
		{
			evaluate(argument, state, analysis); // Arguments are borrowed; ownership does not move
		}
	}

	private void release(IdentifierExpression receiver, Token operation, State state, Analysis analysis)
	{
		VariableSymbol symbol = model.getVariable(receiver);
		Fact fact = state.facts.get(symbol);
		if (analysis.reporting)
		{
			if (fact.states.contains(OwnershipState.RELEASED))
			{
				errorReporter.error(DiagnosticCode.DOUBLE_RELEASE, operation,
						"Pointer '" + symbol.getName() + "' " + (fact.states.size() == 1 ? "was" : "may have been") + " released already.");
			}
			else if (fact.states.equals(EnumSet.of(OwnershipState.UNOWNED)))
			{
				errorReporter.error(DiagnosticCode.RELEASE_OF_UNOWNED, operation,
						"Pointer '" + symbol.getName() + "' does not own its object; only results of new(), from_json(), from_xml() or release() can be released.");
			}
		}
		state.facts.put(symbol, Fact.of(OwnershipState.RELEASED, null));
	}

	/**
	 * An allocation whose result is dropped on the floor can never be released.
	 */
	private void checkDiscarded(Expression expression, Analysis analysis)
	{
		Expression inner = unwrap(expression);
		if (!analysis.reporting || !(inner instanceof CallExpression))
		{
			return;
		}
		CallTarget target = model.getCallTarget((CallExpression) inner);
		if (target != null && target.isAllocation() && target.getKind() != CallTarget.Kind.RELEASE && analysis.reportedSites.add(inner))
		{
			errorReporter.error(DiagnosticCode.UNRELEASED_POINTER, inner.getFirstToken(),
					"The object allocated here in " + analysis.owner + " is discarded and can never be released.");
		}
	}

	private void reportLeaks(VariableSymbol symbol, Fact fact, Analysis analysis)
	{
		if (!analysis.reporting || !fact.mayBeOwned())
		{
			return;
		}
		for (ASTNode site : fact.sites)
		{
			if (!analysis.reportedSites.add(site))
			{
				continue;
			}
			if (site instanceof FieldDeclaration)
			{
				errorReporter.error(DiagnosticCode.UNRELEASED_POINTER, ((FieldDeclaration) site).getNameToken(),
						"Field '" + symbol.getName() + "' is not released by " + analysis.owner + "() on every path.");
			}
			else
			{
				Token at = ((Expression) site).getFirstToken();
				errorReporter.error(DiagnosticCode.UNRELEASED_POINTER, at,
						"Pointer '" + symbol.getName() + "' allocated at line " + at.getLine() + " in " + analysis.owner
								+ " is not released on every path; call " + symbol.getName() + ".clean() or " + symbol.getName() + ".release().");
			}
		}
	}

	private static boolean isTracked(VariableSymbol symbol)
	{
		return symbol != null && symbol.getType() instanceof PointerType && !symbol.isDerived();
	}

	private static boolean isCleanHook(MethodSymbol method)
	{
		return method.getName().equals("clean") && method.getParameterTypes().isEmpty() && !method.isStatic();
	}

	/**
	 * A function hands ownership to its caller when one of its returns yields a fresh allocation,
	 * such as {@code return p.release();} or {@code return Node.new();}.
	 */
	private boolean returnsOwnership(MethodSymbol method)
	{
		Boolean cached = returnsOwnership.get(method);
		if (cached != null)
		{
			return cached;
		}
		returnsOwnership.put(method, false); // Recursion guard
		boolean result = false;
		FunctionDeclaration declaration = method.getDeclaration();
		if (declaration != null && declaration.getBody() != null && method.getReturnType() instanceof PointerType)
		{
			List<ReturnStatement> returns = new ArrayList<>();
			collectReturns(declaration.getBody(), returns);
			for (ReturnStatement statement : returns)
			{
				Expression value = unwrap(statement.getValue());
				if (value instanceof CallExpression)
				{
					CallTarget target = model.getCallTarget((CallExpression) value);
					if (target != null && (target.isAllocation() || (target.getMethod() != null && returnsOwnership(target.getMethod()))))
					{
						result = true;
					}
				}
			}
		}
		returnsOwnership.put(method, result);
		return result;
	}

	private static void collectReturns(Statement statement, List<ReturnStatement> into)
	{
		if (statement instanceof ReturnStatement)
		{
			into.add((ReturnStatement) statement);
		}
		else if (statement instanceof BlockStatement)
		{
			((BlockStatement) statement).getStatements().forEach(s -> collectReturns(s, into));
		}
		else if (statement instanceof IfStatement)
		{
			collectReturns(((IfStatement) statement).getThenBranch(), into);
			if (((IfStatement) statement).getElseBranch() != null)
			{
				collectReturns(((IfStatement) statement).getElseBranch(), into);
			}
		}
		else if (statement instanceof WhileStatement)
		{
			collectReturns(((WhileStatement) statement).getBody(), into);
		}
		else if (statement instanceof ForStatement)
		{
			collectReturns(((ForStatement) statement).getBody(), into);
		}
	}

	private static Expression unwrap(Expression expression)
	{
		while (expression instanceof GroupingExpression)
		{
			expression = ((GroupingExpression) expression).getExpression();
		}
		return expression;
	}
}
