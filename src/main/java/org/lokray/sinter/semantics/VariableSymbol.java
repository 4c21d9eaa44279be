// File: src/main/java/org/lokray/sinter/semantics/VariableSymbol.java

package org.lokray.sinter.semantics;

import org.lokray.sinter.ast.declarations.FieldDeclaration;
import org.lokray.sinter.ast.declarations.Visibility;
import org.lokray.sinter.lexer.Token;

/**
 * Represents a variable (local variable, parameter, or field) in the symbol table.
 */
public class VariableSymbol extends Symbol
{
	public enum Kind
	{
		LOCAL,
		PARAMETER,
		FIELD
	}

	private final Kind kind;
	private final boolean isConst;
	private final FieldDeclaration field; // Non-null for fields
	private ClassSymbol ownerClass;
	private boolean dynamicString; // Bound to a D"..." literal

	/**
	 * Constructs a local or parameter symbol. Its type may be null until the initializer has been checked.
	 */
	public VariableSymbol(String name, Type type, Token declarationToken, Kind kind, boolean isConst)
	{
		super(name, type, declarationToken);
		this.kind = kind;
		this.isConst = isConst;
		this.field = null;
	}

	/**
	 * Constructs a field symbol owned by {@code ownerClass}.
	 */
	public VariableSymbol(FieldDeclaration field, Type type, ClassSymbol ownerClass)
	{
		super(field.getName(), type, field.getNameToken(), field.getVisibility());
		this.kind = Kind.FIELD;
		this.isConst = field.isConst();
		this.field = field;
		this.ownerClass = ownerClass;
	}

	public Kind getKind()
	{
		return kind;
	}

	public boolean isField()
	{
		return kind == Kind.FIELD;
	}

	public boolean isParameter()
	{
		return kind == Kind.PARAMETER;
	}

	public boolean isConst()
	{
		return isConst;
	}

	public FieldDeclaration getField()
	{
		return field;
	}

	/**
	 * A derived field has no storage; reading it calls the same-named method.
	 */
	public boolean isDerived()
	{
		return field != null && field.isDerived();
	}

	/**
	 * Gets the owning ClassSymbol for this variable, if it is a field.
	 *
	 * @return The ClassSymbol that owns this variable, or null if it's a local variable or parameter.
	 */
	public ClassSymbol getOwnerClass()
	{
		return ownerClass;
	}

	public boolean isDynamicString()
	{
		return dynamicString;
	}

	public void setDynamicString(boolean dynamicString)
	{
		this.dynamicString = dynamicString;
	}

	@Override
	public boolean isStatic()
	{
		return false;
	}

	@Override
	public String toString()
	{
		return "VariableSymbol{" + "name='" + getName() + '\'' + ", type=" + getType() + ", kind=" + kind + ", const=" + isConst + (ownerClass != null ? ", owner=" + ownerClass.getName() : "") + '}';
	}
}
