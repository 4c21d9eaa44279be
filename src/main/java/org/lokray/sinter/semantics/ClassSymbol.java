// File: src/main/java/org/lokray/sinter/semantics/ClassSymbol.java
package org.lokray.sinter.semantics;

import org.lokray.sinter.ast.declarations.Declaration;
import org.lokray.sinter.semantics.annotations.SerializationMetadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A class or an interface. Interfaces own only method signatures; their "super types" are the interfaces they extend.
 */
public class ClassSymbol extends Symbol
{
	private final boolean isInterface;
	private final Declaration declaration;
	private final NamedType namedType;
	private SymbolTable classScope; // For fields; encloses the superclass scope
	private ClassSymbol superclass;
	private final List<ClassSymbol> interfaces = new ArrayList<>(); // Directly implemented, or extended for interfaces

	private final Map<String, VariableSymbol> fields = new LinkedHashMap<>();
	// Each name maps to a list of MethodSymbols (for overloading)
	private final Map<String, List<MethodSymbol>> methodsByName = new LinkedHashMap<>();
	private SerializationMetadata serialization;

	public ClassSymbol(String name, boolean isInterface, Declaration declaration)
	{
		super(name, null, declaration.getNameToken());
		this.isInterface = isInterface;
		this.declaration = declaration;
		this.namedType = new NamedType(this);
		setType(namedType);
	}

	public boolean isInterface()
	{
		return isInterface;
	}

	public Declaration getDeclaration()
	{
		return declaration;
	}

	public NamedType getNamedType()
	{
		return namedType;
	}

	public PointerType getPointerType()
	{
		return new PointerType(namedType);
	}

	public SymbolTable getClassScope()
	{
		return classScope;
	}

	public void setClassScope(SymbolTable classScope)
	{
		this.classScope = classScope;
	}

	public ClassSymbol getSuperclass()
	{
		return superclass;
	}

	public void setSuperclass(ClassSymbol superclass)
	{
		this.superclass = superclass;
	}

	public List<ClassSymbol> getInterfaces()
	{
		return interfaces;
	}

	public void addField(VariableSymbol field)
	{
		fields.put(field.getName(), field);
	}

	/**
	 * @return The fields declared by this class itself, in declaration order.
	 */
	public Collection<VariableSymbol> getOwnFields()
	{
		return fields.values();
	}

	/**
	 * Looks a field up in this class, then in its superclasses.
	 */
	public VariableSymbol resolveField(String name)
	{
		for (ClassSymbol c = this; c != null; c = c.superclass)
		{
			VariableSymbol field = c.fields.get(name);
			if (field != null)
			{
				return field;
			}
		}
		return null;
	}

	/**
	 * Defines a method in this class. Overloads share a name.
	 */
	public void defineMethod(MethodSymbol methodSymbol)
	{
		methodSymbol.setOwnerClass(this);
		methodsByName.computeIfAbsent(methodSymbol.getName(), k -> new ArrayList<>()).add(methodSymbol);
	}

	public List<MethodSymbol> getOwnMethods(String name)
	{
		return methodsByName.getOrDefault(name, List.of());
	}

	public List<MethodSymbol> getAllOwnMethods()
	{
		List<MethodSymbol> all = new ArrayList<>();
		methodsByName.values().forEach(all::addAll);
		return all;
	}

	/**
	 * Finds every method called {@code name} visible on this type. An own method hides an inherited method with
	 * the same parameter types. For interfaces, the inherited methods come from the extended interfaces.
	 */
	public List<MethodSymbol> findMethods(String name)
	{
		List<MethodSymbol> result = new ArrayList<>(getOwnMethods(name));
		List<ClassSymbol> supers = new ArrayList<>();
		if (superclass != null)
		{
			supers.add(superclass);
		}
		if (isInterface)
		{
			supers.addAll(interfaces);
		}
		for (ClassSymbol parent : supers)
		{
			for (MethodSymbol inherited : parent.findMethods(name))
			{
				if (result.stream().noneMatch(m -> m.hasSameParameters(inherited)))
				{
					result.add(inherited);
				}
			}
		}
		return result;
	}

	/**
	 * The user-defined cleanup hook {@code clean()}, declared here or inherited.
	 */
	public MethodSymbol findCleanHook()
	{
		for (MethodSymbol method : findMethods("clean"))
		{
			if (method.getParameterTypes().isEmpty() && !method.isStatic() && !method.isSynthesized())
			{
				return method;
			}
		}
		return null;
	}

	/**
	 * The interfaces this type conforms to: direct ones, what they extend, and what the superclass implements.
	 */
	public Set<ClassSymbol> getAllInterfaces()
	{
		Set<ClassSymbol> result = new LinkedHashSet<>();
		collectInterfaces(result);
		return result;
	}

	private void collectInterfaces(Set<ClassSymbol> into)
	{
		if (superclass != null)
		{
			superclass.collectInterfaces(into);
		}
		for (ClassSymbol iface : interfaces)
		{
			if (into.add(iface))
			{
				iface.collectInterfaces(into);
			}
		}
	}

	/**
	 * For an interface, all methods it declares or inherits. Extended interfaces come first, each
	 * in declaration order, and a signature declared twice appears once.
	 */
	public List<MethodSymbol> getInterfaceMethods()
	{
		List<MethodSymbol> result = new ArrayList<>();
		for (ClassSymbol parent : interfaces)
		{
			for (MethodSymbol inherited : parent.getInterfaceMethods())
			{
				addUniqueSignature(result, inherited);
			}
		}
		for (MethodSymbol own : getAllOwnMethods())
		{
			addUniqueSignature(result, own);
		}
		return result;
	}

	private static void addUniqueSignature(List<MethodSymbol> into, MethodSymbol method)
	{
		boolean present = into.stream().anyMatch(m -> m.getName().equals(method.getName()) && m.hasSameParameters(method));
		if (!present)
		{
			into.add(method);
		}
	}

	/**
	 * Nominal subtyping: same symbol, a superclass, or an implemented/extended interface.
	 */
	public boolean isSubtypeOf(ClassSymbol other)
	{
		if (this == other)
		{
			return true;
		}
		for (ClassSymbol c = superclass; c != null; c = c.superclass)
		{
			if (c == other)
			{
				return true;
			}
		}
		return other.isInterface && getAllInterfaces().contains(other);
	}

	/**
	 * @return The chain from the root superclass down to this class.
	 */
	public List<ClassSymbol> getHierarchy()
	{
		List<ClassSymbol> chain = new ArrayList<>();
		for (ClassSymbol c = this; c != null; c = c.superclass)
		{
			chain.add(0, c);
		}
		return chain;
	}

	public SerializationMetadata getSerialization()
	{
		return serialization;
	}

	public void setSerialization(SerializationMetadata serialization)
	{
		this.serialization = serialization;
	}

	@Override
	public boolean isStatic()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return (isInterface ? "InterfaceSymbol{" : "ClassSymbol{") + getName()
				+ (superclass != null ? " extends " + superclass.getName() : "")
				+ ", fields=" + fields.keySet() + ", methods=" + methodsByName.keySet() + '}';
	}
}
