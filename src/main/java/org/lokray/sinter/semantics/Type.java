// File: src/main/java/org/lokray/sinter/semantics/Type.java

package org.lokray.sinter.semantics;

/**
 * Abstract base class for all types in the Sinter language:
 * primitives, named class/interface types and pointers to named types.
 */
public abstract class Type
{
	protected final String name;

	public Type(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * Checks whether a value of this type may be stored where {@code target} is expected.
	 * There is no implicit numeric conversion; only identity, nominal subtyping of pointees and null-to-pointer.
	 */
	public boolean isAssignableTo(Type target)
	{
		if (this instanceof ErrorType || target instanceof ErrorType)
		{
			return true; // Already reported; do not cascade
		}
		return this.equals(target);
	}

	public boolean isNumeric()
	{
		return false;
	}

	public boolean isVoid()
	{
		return false;
	}

	public boolean isPointer()
	{
		return false;
	}

	public boolean isError()
	{
		return false;
	}

	/**
	 * Checks if two types may be compared with {@code ==} and {@code !=}.
	 */
	public static boolean isEqualityComparable(Type left, Type right)
	{
		if (left.isError() || right.isError())
		{
			return true;
		}
		if (left.isVoid() || right.isVoid())
		{
			return false;
		}
		if (left.equals(right))
		{
			return !(left instanceof NamedType); // Records are not compared by value
		}
		return left.isAssignableTo(right) || right.isAssignableTo(left);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		return name.equals(((Type) o).name);
	}

	@Override
	public int hashCode()
	{
		return name.hashCode();
	}

	@Override
	public String toString()
	{
		return name;
	}
}
