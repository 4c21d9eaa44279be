// File: src/main/java/org/lokray/sinter/semantics/annotations/SerializationMetadata.java
package org.lokray.sinter.semantics.annotations;

import org.lokray.sinter.semantics.ClassSymbol;
import org.lokray.sinter.semantics.VariableSymbol;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The serializable fields of a class, inherited ones first, each group in declaration order. Code generation
 * walks this list for {@code as_json}/{@code as_xml} and, minus derived fields, for the deserialisers.
 */
public class SerializationMetadata
{
	private final ClassSymbol owner;
	private final List<VariableSymbol> fields;

	public SerializationMetadata(ClassSymbol owner, List<VariableSymbol> fields)
	{
		this.owner = owner;
		this.fields = Collections.unmodifiableList(fields);
	}

	public ClassSymbol getOwner()
	{
		return owner;
	}

	public List<VariableSymbol> getFields()
	{
		return fields;
	}

	/**
	 * Fields with storage, which deserialisation reads back.
	 */
	public List<VariableSymbol> getStoredFields()
	{
		return fields.stream().filter(f -> !f.isDerived()).collect(Collectors.toList());
	}

	public boolean isEmpty()
	{
		return fields.isEmpty();
	}

	@Override
	public String toString()
	{
		return owner.getName() + fields.stream().map(VariableSymbol::getName).collect(Collectors.joining(", ", "[", "]"));
	}
}
