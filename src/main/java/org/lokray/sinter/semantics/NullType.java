// File: src/main/java/org/lokray/sinter/semantics/NullType.java
package org.lokray.sinter.semantics;

/**
 * The type of the {@code null} literal; assignable to every pointer type.
 */
public final class NullType extends Type
{
	public static final NullType INSTANCE = new NullType();

	private NullType()
	{
		super("null");
	}

	@Override
	public boolean isAssignableTo(Type target)
	{
		return target.isPointer() || super.isAssignableTo(target);
	}
}
