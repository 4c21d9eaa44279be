// File: src/main/java/org/lokray/sinter/semantics/SymbolTable.java
package org.lokray.sinter.semantics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a symbol table for a specific scope in the Sinter language.
 * It maps identifier names to their corresponding Symbol objects.
 * Symbol tables form a tree: global, class (enclosing its superclass's scope), method, block, inner block.
 */
public class SymbolTable
{
	private final Map<String, Symbol> symbols;
	private final SymbolTable enclosingScope; // Reference to the parent scope
	private final String scopeName; // For debugging/identification (e.g., "global", "method:main", "block")
	private final ClassSymbol ownerClass; // Non-null for class scopes

	public SymbolTable(SymbolTable enclosingScope, String scopeName)
	{
		this(enclosingScope, scopeName, null);
	}

	public SymbolTable(SymbolTable enclosingScope, String scopeName, ClassSymbol ownerClass)
	{
		this.symbols = new LinkedHashMap<>();
		this.enclosingScope = enclosingScope;
		this.scopeName = scopeName;
		this.ownerClass = ownerClass;
	}

	/**
	 * Defines a new symbol in the current scope.
	 *
	 * @param symbol The symbol to define.
	 * @throws IllegalArgumentException if a symbol with the same name already exists in this scope.
	 */
	public void define(Symbol symbol)
	{
		if (symbols.containsKey(symbol.getName()))
		{
			throw new IllegalArgumentException("Symbol '" + symbol.getName() + "' already defined in scope '" + scopeName + "'.");
		}
		symbols.put(symbol.getName(), symbol);
	}

	/**
	 * Looks up a symbol, starting from the current scope and moving up to enclosing scopes.
	 *
	 * @param name The name of the symbol to look up.
	 * @return The found Symbol, or null if not found in any enclosing scope.
	 */
	public Symbol resolve(String name)
	{
		for (SymbolTable scope = this; scope != null; scope = scope.enclosingScope)
		{
			Symbol symbol = scope.symbols.get(name);
			if (symbol != null)
			{
				return symbol;
			}
		}
		return null;
	}

	/**
	 * Looks up a symbol only in the current scope.
	 *
	 * @param name The name of the symbol to look up.
	 * @return The found Symbol, or null if not found in this scope.
	 */
	public Symbol resolveCurrentScope(String name)
	{
		return symbols.get(name);
	}

	public SymbolTable getEnclosingScope()
	{
		return enclosingScope;
	}

	public String getScopeName()
	{
		return scopeName;
	}

	public ClassSymbol getOwnerClass()
	{
		return ownerClass;
	}

	public Map<String, Symbol> getSymbols()
	{
		return symbols;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Scope '").append(scopeName).append("':\n");
		for (Map.Entry<String, Symbol> entry : symbols.entrySet())
		{
			sb.append("  ").append(entry.getValue()).append("\n");
		}
		return sb.toString();
	}
}
