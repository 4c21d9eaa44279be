// File: src/main/java/org/lokray/sinter/semantics/PointerType.java
package org.lokray.sinter.semantics;

/**
 * {@code T*}. Only named types may be pointed to; the resolver rejects pointers to primitives.
 */
public class PointerType extends Type
{
	private final Type pointee;

	public PointerType(Type pointee)
	{
		super(pointee.getName() + "*");
		this.pointee = pointee;
	}

	public Type getPointee()
	{
		return pointee;
	}

	/**
	 * @return The class or interface behind this pointer, or null for pointer-to-pointer types.
	 */
	public ClassSymbol getPointeeClass()
	{
		return pointee instanceof NamedType ? ((NamedType) pointee).getSymbol() : null;
	}

	@Override
	public boolean isPointer()
	{
		return true;
	}

	@Override
	public boolean isAssignableTo(Type target)
	{
		if (super.isAssignableTo(target))
		{
			return true;
		}
		if (!(target instanceof PointerType))
		{
			return false;
		}
		ClassSymbol from = getPointeeClass();
		ClassSymbol to = ((PointerType) target).getPointeeClass();
		return from != null && to != null && from.isSubtypeOf(to);
	}
}
