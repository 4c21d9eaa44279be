// File: src/main/java/org/lokray/sinter/semantics/PrimitiveType.java

package org.lokray.sinter.semantics;

import java.util.Map;

/**
 * Represents the primitive types of the Sinter language.
 */
public final class PrimitiveType extends Type
{
	public static final PrimitiveType INT = new PrimitiveType("int");
	public static final PrimitiveType FLOAT = new PrimitiveType("float");
	public static final PrimitiveType DOUBLE = new PrimitiveType("double");
	public static final PrimitiveType BOOLEAN = new PrimitiveType("boolean");
	public static final PrimitiveType STR = new PrimitiveType("str");
	public static final PrimitiveType VOID = new PrimitiveType("void");

	private static final Map<String, PrimitiveType> BY_NAME = Map.of(
			"int", INT,
			"float", FLOAT,
			"double", DOUBLE,
			"boolean", BOOLEAN,
			"str", STR,
			"void", VOID);

	private PrimitiveType(String name)
	{
		super(name);
	}

	/**
	 * @return The primitive with the given keyword, or null if the name is not a primitive.
	 */
	public static PrimitiveType byName(String name)
	{
		return BY_NAME.get(name);
	}

	@Override
	public boolean isNumeric()
	{
		return this == INT || this == FLOAT || this == DOUBLE;
	}

	@Override
	public boolean isVoid()
	{
		return this == VOID;
	}

	/**
	 * Types a D-string placeholder may reference and {@code print} may write.
	 */
	public boolean isPrintable()
	{
		return this != VOID;
	}
}
