// File: src/main/java/org/lokray/sinter/semantics/flow/BasicBlock.java
package org.lokray.sinter.semantics.flow;

import org.lokray.sinter.ast.ASTNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A straight-line run of statements and conditions. Elements are evaluated in order; control leaves only
 * through the successor edges.
 */
public class BasicBlock
{
	private final int id;
	private final String label;
	private final List<ASTNode> elements = new ArrayList<>();
	private final List<BasicBlock> successors = new ArrayList<>();
	private final List<BasicBlock> predecessors = new ArrayList<>();

	BasicBlock(int id, String label)
	{
		this.id = id;
		this.label = label;
	}

	public int getId()
	{
		return id;
	}

	public String getLabel()
	{
		return label;
	}

	void add(ASTNode element)
	{
		elements.add(element);
	}

	void linkTo(BasicBlock successor)
	{
		if (!successors.contains(successor))
		{
			successors.add(successor);
			successor.predecessors.add(this);
		}
	}

	public List<ASTNode> getElements()
	{
		return elements;
	}

	public List<BasicBlock> getSuccessors()
	{
		return successors;
	}

	public List<BasicBlock> getPredecessors()
	{
		return predecessors;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("B").append(id).append(' ').append(label).append(" ->");
		for (BasicBlock successor : successors)
		{
			sb.append(" B").append(successor.id);
		}
		return sb.toString();
	}
}
