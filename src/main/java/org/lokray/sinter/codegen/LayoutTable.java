// File: src/main/java/org/lokray/sinter/codegen/LayoutTable.java
package org.lokray.sinter.codegen;

import org.lokray.sinter.semantics.ClassSymbol;
import org.lokray.sinter.semantics.VariableSymbol;
import org.lokray.sinter.util.Debug;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed record layouts of all classes. A class record starts with its superclass record, followed by its own
 * stored fields in declaration order and one pointer slot per interface the superclass does not already carry.
 * Derived fields take no space.
 */
class LayoutTable
{
	static class Layout
	{
		private final ClassSymbol classSymbol;
		private final List<String> elementTypes = new ArrayList<>();
		private final Map<VariableSymbol, Integer> fieldIndices = new LinkedHashMap<>();
		private final Map<ClassSymbol, Integer> slotIndices = new LinkedHashMap<>();

		Layout(ClassSymbol classSymbol)
		{
			this.classSymbol = classSymbol;
		}
	}

	private final Map<ClassSymbol, Layout> layouts = new LinkedHashMap<>();

	LayoutTable(Collection<ClassSymbol> classes)
	{
		for (ClassSymbol classSymbol : classes)
		{
			if (!classSymbol.isInterface())
			{
				layoutOf(classSymbol);
			}
		}
	}

	Layout layoutOf(ClassSymbol classSymbol)
	{
		Layout existing = layouts.get(classSymbol);
		if (existing != null)
		{
			return existing;
		}
		Layout layout = new Layout(classSymbol);
		ClassSymbol superclass = classSymbol.getSuperclass();
		Set<ClassSymbol> inherited = new HashSet<>();
		if (superclass != null)
		{
			layoutOf(superclass);
			layout.elementTypes.add(LlvmTypes.structName(superclass));
			inherited.addAll(superclass.getAllInterfaces());
		}
		for (VariableSymbol field : classSymbol.getOwnFields())
		{
			if (!field.isDerived())
			{
				layout.fieldIndices.put(field, layout.elementTypes.size());
				layout.elementTypes.add(LlvmTypes.toLlvm(field.getType()));
			}
		}
		for (ClassSymbol iface : classSymbol.getAllInterfaces())
		{
			if (!inherited.contains(iface))
			{
				layout.slotIndices.put(iface, layout.elementTypes.size());
				layout.elementTypes.add("ptr");
			}
		}
		Debug.log("Layout of %s: { %s }", classSymbol.getName(), String.join(", ", layout.elementTypes));
		layouts.put(classSymbol, layout);
		return layout;
	}

	/**
	 * GEP indices, after the base pointer, that reach {@code field} inside a record of {@code classSymbol}.
	 */
	String fieldPath(ClassSymbol classSymbol, VariableSymbol field)
	{
		ClassSymbol definer = field.getOwnerClass();
		Integer index = layoutOf(definer).fieldIndices.get(field);
		if (index == null)
		{
			throw new CodegenException("Field '" + field.getName() + "' has no storage in " + definer.getName() + ".");
		}
		return path(classSymbol, definer, index);
	}

	/**
	 * GEP indices that reach the slot holding the interface table for {@code iface}.
	 */
	String slotPath(ClassSymbol classSymbol, ClassSymbol iface)
	{
		for (ClassSymbol c = classSymbol; c != null; c = c.getSuperclass())
		{
			Integer index = layoutOf(c).slotIndices.get(iface);
			if (index != null)
			{
				return path(classSymbol, c, index);
			}
		}
		throw new CodegenException("Class " + classSymbol.getName() + " has no slot for interface " + iface.getName() + ".");
	}

	private static String path(ClassSymbol from, ClassSymbol definer, int index)
	{
		StringBuilder sb = new StringBuilder("i32 0");
		for (ClassSymbol c = from; c != definer; c = c.getSuperclass())
		{
			if (c == null)
			{
				throw new CodegenException(definer.getName() + " is not a superclass of " + from.getName() + ".");
			}
			sb.append(", i32 0");
		}
		return sb.append(", i32 ").append(index).toString();
	}

	/**
	 * {@code i64} byte offset of a member, as a constant expression.
	 */
	static String offsetOf(ClassSymbol classSymbol, String path)
	{
		return "ptrtoint (ptr getelementptr (" + LlvmTypes.structName(classSymbol) + ", ptr null, " + path + ") to i64)";
	}

	static String sizeOf(String type)
	{
		return "ptrtoint (ptr getelementptr (" + type + ", ptr null, i32 1) to i64)";
	}

	void emitTypes(StringBuilder out)
	{
		for (Layout layout : layouts.values())
		{
			out.append(LlvmTypes.structName(layout.classSymbol)).append(" = type { ")
					.append(String.join(", ", layout.elementTypes)).append(layout.elementTypes.isEmpty() ? "}\n" : " }\n");
		}
	}
}
