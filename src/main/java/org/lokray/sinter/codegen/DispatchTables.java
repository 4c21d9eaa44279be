// File: src/main/java/org/lokray/sinter/codegen/DispatchTables.java
package org.lokray.sinter.codegen;

import org.lokray.sinter.semantics.ClassSymbol;
import org.lokray.sinter.semantics.MethodSymbol;
import org.lokray.sinter.util.Debug;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Interface dispatch. An interface pointer points at the interface's slot inside the object; the slot holds the
 * class's table for that interface:
 *
 * <pre>
 * %itable.I = type { i64 offset-to-top, ptr cleanup, i64 slot offset per super-interface..., ptr method... }
 * </pre>
 * <p>
 * Methods follow {@link ClassSymbol#getInterfaceMethods()} order and take the object pointer as {@code this}.
 */
class DispatchTables
{
	private static final int FIRST_SUPER_SLOT = 2;

	private final Collection<ClassSymbol> interfaces = new ArrayList<>();
	private final Collection<ClassSymbol> classes = new ArrayList<>();
	private final LayoutTable layouts;

	DispatchTables(Collection<ClassSymbol> symbols, LayoutTable layouts)
	{
		this.layouts = layouts;
		for (ClassSymbol symbol : symbols)
		{
			(symbol.isInterface() ? interfaces : classes).add(symbol);
		}
	}

	static List<ClassSymbol> superInterfaces(ClassSymbol iface)
	{
		return new ArrayList<>(iface.getAllInterfaces());
	}

	static String tableName(ClassSymbol classSymbol, ClassSymbol iface)
	{
		return "@itable$" + classSymbol.getName() + "$" + iface.getName();
	}

	static int superSlot(ClassSymbol iface, ClassSymbol target)
	{
		int index = superInterfaces(iface).indexOf(target);
		if (index < 0)
		{
			throw new CodegenException("Interface " + iface.getName() + " does not extend " + target.getName() + ".");
		}
		return FIRST_SUPER_SLOT + index;
	}

	static int methodSlot(ClassSymbol iface, MethodSymbol method)
	{
		List<MethodSymbol> methods = iface.getInterfaceMethods();
		for (int i = 0; i < methods.size(); i++)
		{
			MethodSymbol candidate = methods.get(i);
			if (candidate.getName().equals(method.getName()) && candidate.hasSameParameters(method))
			{
				return FIRST_SUPER_SLOT + superInterfaces(iface).size() + i;
			}
		}
		throw new CodegenException("Interface " + iface.getName() + " has no method " + method.signature() + ".");
	}

	/**
	 * The method of {@code classSymbol} that serves {@code required}; own methods hide inherited ones.
	 */
	static MethodSymbol implementation(ClassSymbol classSymbol, MethodSymbol required)
	{
		for (MethodSymbol candidate : classSymbol.findMethods(required.getName()))
		{
			if (!candidate.isStatic() && candidate.hasSameParameters(required))
			{
				return candidate;
			}
		}
		throw new CodegenException("Class " + classSymbol.getName() + " does not implement " + required.signature() + ".");
	}

	void emitTypes(StringBuilder out)
	{
		for (ClassSymbol iface : interfaces)
		{
			List<String> elements = new ArrayList<>();
			elements.add("i64");
			elements.add("ptr");
			superInterfaces(iface).forEach(s -> elements.add("i64"));
			iface.getInterfaceMethods().forEach(m -> elements.add("ptr"));
			out.append(LlvmTypes.itableName(iface)).append(" = type { ").append(String.join(", ", elements)).append(" }\n");
		}
	}

	void emitTables(StringBuilder out)
	{
		for (ClassSymbol classSymbol : classes)
		{
			for (ClassSymbol iface : classSymbol.getAllInterfaces())
			{
				Debug.log("Interface table %s for %s", iface.getName(), classSymbol.getName());
				List<String> entries = new ArrayList<>();
				entries.add("i64 " + LayoutTable.offsetOf(classSymbol, layouts.slotPath(classSymbol, iface)));
				entries.add("ptr " + LlvmTypes.routineName(classSymbol, "cleanup"));
				for (ClassSymbol parent : superInterfaces(iface))
				{
					entries.add("i64 " + LayoutTable.offsetOf(classSymbol, layouts.slotPath(classSymbol, parent)));
				}
				for (MethodSymbol required : iface.getInterfaceMethods())
				{
					entries.add("ptr " + LlvmTypes.functionName(implementation(classSymbol, required)));
				}
				out.append(tableName(classSymbol, iface)).append(" = internal constant ").append(LlvmTypes.itableName(iface))
						.append(" { ").append(String.join(", ", entries)).append(" }\n");
			}
		}
	}

	/**
	 * Per interface: {@code $self} recovers the object pointer, {@code $clean} cleans and frees through the table,
	 * and {@code $to$J} converts to each extended interface. All of them map null to null.
	 */
	void emitHelpers(StringBuilder out)
	{
		for (ClassSymbol iface : interfaces)
		{
			String table = LlvmTypes.itableName(iface);

			FunctionEmitter self = new FunctionEmitter("define internal ptr " + LlvmTypes.routineName(iface, "self") + "(ptr %slot)");
			String isNull = self.assign("icmp eq ptr %slot, null");
			self.branch(isNull, "none", "object");
			self.startBlock("none");
			self.terminate("ret ptr null");
			self.startBlock("object");
			self.terminate("ret ptr " + objectPointer(self, table, "%slot"));
			self.finish(out);

			FunctionEmitter clean = new FunctionEmitter("define internal void " + LlvmTypes.routineName(iface, "clean") + "(ptr %slot)");
			isNull = clean.assign("icmp eq ptr %slot, null");
			clean.branch(isNull, "done", "object");
			clean.startBlock("object");
			String itable = clean.load("ptr", "%slot");
			String object = objectPointer(clean, table, "%slot");
			String cleanupAddress = clean.gep(table, itable, "i32 0, i32 1");
			String cleanup = clean.load("ptr", cleanupAddress);
			clean.call("void", cleanup, List.of("ptr " + object));
			clean.call("void", "@free", List.of("ptr " + object));
			clean.branch("done");
			clean.startBlock("done");
			clean.terminate("ret void");
			clean.finish(out);

			for (ClassSymbol parent : superInterfaces(iface))
			{
				FunctionEmitter convert = new FunctionEmitter("define internal ptr " + conversionName(iface, parent) + "(ptr %slot)");
				isNull = convert.assign("icmp eq ptr %slot, null");
				convert.branch(isNull, "none", "object");
				convert.startBlock("none");
				convert.terminate("ret ptr null");
				convert.startBlock("object");
				itable = convert.load("ptr", "%slot");
				object = objectPointer(convert, table, "%slot");
				String offsetAddress = convert.gep(table, itable, "i32 0, i32 " + superSlot(iface, parent));
				String offset = convert.load("i64", offsetAddress);
				String target = convert.assign("getelementptr inbounds i8, ptr " + object + ", i64 " + offset);
				convert.terminate("ret ptr " + target);
				convert.finish(out);
			}
		}
	}

	static String conversionName(ClassSymbol from, ClassSymbol to)
	{
		return LlvmTypes.routineName(from, "to$" + to.getName());
	}

	/**
	 * Steps back from an interface slot to the start of the object.
	 */
	static String objectPointer(FunctionEmitter emitter, String table, String slot)
	{
		String itable = emitter.load("ptr", slot);
		String offset = emitter.load("i64", emitter.gep(table, itable, "i32 0, i32 0"));
		String back = emitter.assign("sub i64 0, " + offset);
		return emitter.assign("getelementptr inbounds i8, ptr " + slot + ", i64 " + back);
	}
}
