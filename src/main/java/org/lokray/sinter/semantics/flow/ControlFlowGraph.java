// File: src/main/java/org/lokray/sinter/semantics/flow/ControlFlowGraph.java
package org.lokray.sinter.semantics.flow;

import org.lokray.sinter.ast.statements.BlockStatement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The control-flow graph of one function body. Every {@code return} and the fall-through end of the body lead
 * to a single exit block. Shared by the missing-return check and the pointer cleanup validator.
 */
public class ControlFlowGraph
{
	private final BasicBlock entry;
	private final BasicBlock exit;
	private final List<BasicBlock> blocks;
	private final BasicBlock fallThrough; // The block that runs off the end of the body, or null
	private final Set<BasicBlock> reachable;

	ControlFlowGraph(BasicBlock entry, BasicBlock exit, List<BasicBlock> blocks, BasicBlock fallThrough)
	{
		this.entry = entry;
		this.exit = exit;
		this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
		this.fallThrough = fallThrough;
		this.reachable = computeReachable();
	}

	public static ControlFlowGraph build(BlockStatement body)
	{
		return new CfgBuilder().build(body);
	}

	public BasicBlock getEntry()
	{
		return entry;
	}

	public BasicBlock getExit()
	{
		return exit;
	}

	public List<BasicBlock> getBlocks()
	{
		return blocks;
	}

	public boolean isReachable(BasicBlock block)
	{
		return reachable.contains(block);
	}

	/**
	 * Checks if control can reach the end of the body without a {@code return}.
	 */
	public boolean canFallThrough()
	{
		return fallThrough != null && reachable.contains(fallThrough);
	}

	/**
	 * Reachable blocks in reverse post-order, so a forward analysis sees most predecessors before their
	 * successors.
	 */
	public List<BasicBlock> reversePostOrder()
	{
		List<BasicBlock> order = new ArrayList<>();
		Set<BasicBlock> visited = new HashSet<>();
		Deque<BasicBlock> stack = new ArrayDeque<>();
		Deque<Integer> nextChild = new ArrayDeque<>();
		stack.push(entry);
		nextChild.push(0);
		visited.add(entry);
		while (!stack.isEmpty())
		{
			BasicBlock top = stack.peek();
			int index = nextChild.pop();
			if (index < top.getSuccessors().size())
			{
				nextChild.push(index + 1);
				BasicBlock child = top.getSuccessors().get(index);
				if (visited.add(child))
				{
					stack.push(child);
					nextChild.push(0);
				}
			}
			else
			{
				stack.pop();
				order.add(top);
			}
		}
		Collections.reverse(order);
		return order;
	}

	private Set<BasicBlock> computeReachable()
	{
		Set<BasicBlock> seen = new LinkedHashSet<>();
		Deque<BasicBlock> work = new ArrayDeque<>();
		work.add(entry);
		seen.add(entry);
		while (!work.isEmpty())
		{
			for (BasicBlock successor : work.poll().getSuccessors())
			{
				if (seen.add(successor))
				{
					work.add(successor);
				}
			}
		}
		return seen;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (BasicBlock block : blocks)
		{
			sb.append(block).append('\n');
		}
		return sb.toString();
	}
}
