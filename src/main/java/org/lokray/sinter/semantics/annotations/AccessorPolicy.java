// File: src/main/java/org/lokray/sinter/semantics/annotations/AccessorPolicy.java
package org.lokray.sinter.semantics.annotations;

import org.lokray.sinter.ast.declarations.AttributeAnnotation;
import org.lokray.sinter.ast.declarations.FieldDeclaration;

/**
 * Which accessors an {@code @attribute} field obliges its class to expose, and what they are called.
 */
public final class AccessorPolicy
{
	public static final String READ_ONLY = "read_only";
	public static final String WRITE_ONLY = "write_only";
	public static final String DERIVED = "derived";
	public static final String SERIALIZABLE = "serializable";

	private AccessorPolicy()
	{
	}

	public static boolean isKnownFlag(String flag)
	{
		return READ_ONLY.equals(flag) || WRITE_ONLY.equals(flag) || DERIVED.equals(flag) || SERIALIZABLE.equals(flag);
	}

	public static String getterName(String fieldName)
	{
		return "get" + capitalize(fieldName);
	}

	public static String setterName(String fieldName)
	{
		return "set" + capitalize(fieldName);
	}

	/**
	 * A getter is owed unless the field is write-only or derived. Fields without {@code @attribute} owe nothing.
	 */
	public static boolean wantsGetter(FieldDeclaration field)
	{
		AttributeAnnotation annotation = field.getAnnotation();
		return annotation != null && !annotation.isSet(WRITE_ONLY) && !annotation.isSet(DERIVED);
	}

	/**
	 * A setter is owed unless the field is read-only, derived or const.
	 */
	public static boolean wantsSetter(FieldDeclaration field)
	{
		AttributeAnnotation annotation = field.getAnnotation();
		return annotation != null && !annotation.isSet(READ_ONLY) && !annotation.isSet(DERIVED) && !field.isConst();
	}

	public static boolean isSerializable(FieldDeclaration field)
	{
		return field.getAnnotation() != null && field.getAnnotation().isSet(SERIALIZABLE);
	}

	private static String capitalize(String name)
	{
		return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
	}
}
