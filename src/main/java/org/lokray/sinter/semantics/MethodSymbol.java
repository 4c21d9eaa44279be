// File: src/main/java/org/lokray/sinter/semantics/MethodSymbol.java

package org.lokray.sinter.semantics;

import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.declarations.Visibility;
import org.lokray.sinter.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a function, a method, or an interface method signature.
 * Accessors synthesised for annotated fields are methods with no declaration.
 */
public class MethodSymbol extends Symbol
{
	public enum AccessorKind
	{
		NONE,
		GETTER,
		SETTER
	}

	private final List<Type> parameterTypes;
	private final List<String> parameterNames;
	private final FunctionDeclaration declaration; // Null for synthesised accessors
	private final boolean isStatic;
	private final AccessorKind accessorKind;
	private final VariableSymbol accessedField; // The field behind a synthesised accessor
	private ClassSymbol ownerClass; // Null for top-level functions
	private String mangledName;

	public MethodSymbol(String name, Type returnType, List<Type> parameterTypes, List<String> parameterNames, Token declarationToken,
	                    FunctionDeclaration declaration, boolean isStatic, Visibility visibility)
	{
		this(name, returnType, parameterTypes, parameterNames, declarationToken, declaration, isStatic, visibility, AccessorKind.NONE, null);
	}

	private MethodSymbol(String name, Type returnType, List<Type> parameterTypes, List<String> parameterNames, Token declarationToken,
	                     FunctionDeclaration declaration, boolean isStatic, Visibility visibility, AccessorKind accessorKind, VariableSymbol accessedField)
	{
		super(name, returnType, declarationToken, visibility);
		this.parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
		this.parameterNames = Collections.unmodifiableList(new ArrayList<>(parameterNames));
		this.declaration = declaration;
		this.isStatic = isStatic;
		this.accessorKind = accessorKind;
		this.accessedField = accessedField;
		this.mangledName = name;
	}

	/**
	 * Creates a public accessor for {@code field}: {@code getX() -> T} or {@code setX(value: T)}.
	 */
	public static MethodSymbol accessor(String name, AccessorKind kind, VariableSymbol field)
	{
		Token origin = field.getDeclarationToken();
		if (kind == AccessorKind.GETTER)
		{
			return new MethodSymbol(name, field.getType(), List.of(), List.of(), origin, null, false, Visibility.PUBLIC, kind, field);
		}
		return new MethodSymbol(name, PrimitiveType.VOID, List.of(field.getType()), List.of("value"), origin, null, false, Visibility.PUBLIC, kind, field);
	}

	public Type getReturnType()
	{
		return getType();
	}

	public List<Type> getParameterTypes()
	{
		return parameterTypes;
	}

	public List<String> getParameterNames()
	{
		return parameterNames;
	}

	public FunctionDeclaration getDeclaration()
	{
		return declaration;
	}

	public boolean isAbstract()
	{
		return declaration != null && declaration.getBody() == null;
	}

	public boolean isSynthesized()
	{
		return accessorKind != AccessorKind.NONE;
	}

	public AccessorKind getAccessorKind()
	{
		return accessorKind;
	}

	public VariableSymbol getAccessedField()
	{
		return accessedField;
	}

	@Override
	public boolean isStatic()
	{
		return isStatic;
	}

	public ClassSymbol getOwnerClass()
	{
		return ownerClass;
	}

	public void setOwnerClass(ClassSymbol ownerClass)
	{
		this.ownerClass = ownerClass;
	}

	public String getMangledName()
	{
		return mangledName;
	}

	public void setMangledName(String mangledName)
	{
		this.mangledName = mangledName;
	}

	/**
	 * Checks whether both methods take the same parameter types in the same order.
	 */
	public boolean hasSameParameters(MethodSymbol other)
	{
		return parameterTypes.equals(other.parameterTypes);
	}

	/**
	 * Checks whether the arguments match this signature exactly, with no subtyping.
	 */
	public boolean matchesExactly(List<Type> argumentTypes)
	{
		return parameterTypes.equals(argumentTypes);
	}

	/**
	 * Checks whether every argument is assignable to the corresponding parameter.
	 */
	public boolean accepts(List<Type> argumentTypes)
	{
		if (argumentTypes.size() != parameterTypes.size())
		{
			return false;
		}
		for (int i = 0; i < parameterTypes.size(); i++)
		{
			if (!argumentTypes.get(i).isAssignableTo(parameterTypes.get(i)))
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * Renders the signature for diagnostics, for example {@code getArea() -> double}.
	 */
	public String signature()
	{
		StringBuilder sb = new StringBuilder(getName()).append('(');
		for (int i = 0; i < parameterTypes.size(); i++)
		{
			if (i > 0)
			{
				sb.append(", ");
			}
			sb.append(parameterTypes.get(i));
		}
		return sb.append(") -> ").append(getReturnType()).toString();
	}

	@Override
	public String toString()
	{
		return "MethodSymbol{" + (ownerClass != null ? ownerClass.getName() + "." : "") + signature() + ", static=" + isStatic + ", accessor=" + accessorKind + '}';
	}
}
