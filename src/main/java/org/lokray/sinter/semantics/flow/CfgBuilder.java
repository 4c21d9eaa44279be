// File: src/main/java/org/lokray/sinter/semantics/flow/CfgBuilder.java
package org.lokray.sinter.semantics.flow;

import org.lokray.sinter.ast.expressions.Expression;
import org.lokray.sinter.ast.expressions.LiteralExpression;
import org.lokray.sinter.ast.statements.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lowers a structured body to basic blocks. Each build method takes the block control is in and returns the
 * block control continues in, or null when the statement never completes normally.
 */
class CfgBuilder
{
	private final List<BasicBlock> blocks = new ArrayList<>();
	private final Deque<BasicBlock> breakTargets = new ArrayDeque<>();
	private final Deque<BasicBlock> continueTargets = new ArrayDeque<>();
	private BasicBlock exit;

	ControlFlowGraph build(BlockStatement body)
	{
		BasicBlock entry = newBlock("entry");
		exit = newBlock("exit");
		BasicBlock end = statements(body.getStatements(), entry);
		if (end != null)
		{
			end.linkTo(exit);
		}
		return new ControlFlowGraph(entry, exit, blocks, end);
	}

	private BasicBlock newBlock(String label)
	{
		BasicBlock block = new BasicBlock(blocks.size(), label);
		blocks.add(block);
		return block;
	}

	private BasicBlock statements(List<Statement> statements, BasicBlock current)
	{
		for (Statement statement : statements)
		{
			if (current == null)
			{
				current = newBlock("unreachable"); // No predecessors; ignored by the analyses
			}
			current = statement(statement, current);
		}
		return current;
	}

	private BasicBlock statement(Statement statement, BasicBlock current)
	{
		if (statement instanceof BlockStatement)
		{
			return statements(((BlockStatement) statement).getStatements(), current);
		}
		if (statement instanceof IfStatement)
		{
			return ifStatement((IfStatement) statement, current);
		}
		if (statement instanceof WhileStatement)
		{
			WhileStatement loop = (WhileStatement) statement;
			return loop(loop.getCondition(), null, loop.getBody(), current);
		}
		if (statement instanceof ForStatement)
		{
			ForStatement loop = (ForStatement) statement;
			if (loop.getInitializer() != null)
			{
				current = statement(loop.getInitializer(), current);
			}
			return loop(loop.getCondition(), loop.getUpdate(), loop.getBody(), current);
		}
		if (statement instanceof ReturnStatement)
		{
			current.add(statement);
			current.linkTo(exit);
			return null;
		}
		if (statement instanceof BreakStatement)
		{
			if (!breakTargets.isEmpty())
			{
				current.linkTo(breakTargets.peek());
			}
			return null;
		}
		if (statement instanceof ContinueStatement)
		{
			if (!continueTargets.isEmpty())
			{
				current.linkTo(continueTargets.peek());
			}
			return null;
		}
		current.add(statement);
		return current;
	}

	private BasicBlock ifStatement(IfStatement statement, BasicBlock current)
	{
		current.add(statement.getCondition());
		BasicBlock thenBlock = newBlock("if.then");
		current.linkTo(thenBlock);
		BasicBlock thenEnd = statement(statement.getThenBranch(), thenBlock);

		BasicBlock elseEnd = current;
		if (statement.getElseBranch() != null)
		{
			BasicBlock elseBlock = newBlock("if.else");
			current.linkTo(elseBlock);
			elseEnd = statement(statement.getElseBranch(), elseBlock);
		}
		if (thenEnd == null && elseEnd == null)
		{
			return null;
		}
		BasicBlock join = newBlock("if.end");
		if (thenEnd != null)
		{
			thenEnd.linkTo(join);
		}
		if (elseEnd != null)
		{
			elseEnd.linkTo(join);
		}
		return join;
	}

	/**
	 * while and for share one shape: header (condition), body, optional update, back edge to the header.
	 * A missing or literal-true condition has no exit edge; only {@code break} leaves the loop.
	 */
	private BasicBlock loop(Expression condition, Expression update, Statement body, BasicBlock current)
	{
		BasicBlock header = newBlock("loop.cond");
		current.linkTo(header);
		if (condition != null)
		{
			header.add(condition);
		}
		BasicBlock after = newBlock("loop.end");
		BasicBlock updateBlock = update != null ? newBlock("loop.update") : header;
		if (update != null)
		{
			updateBlock.add(update);
			updateBlock.linkTo(header);
		}

		BasicBlock bodyBlock = newBlock("loop.body");
		header.linkTo(bodyBlock);
		if (!isAlwaysTrue(condition))
		{
			header.linkTo(after);
		}

		breakTargets.push(after);
		continueTargets.push(updateBlock);
		BasicBlock bodyEnd = statement(body, bodyBlock);
		continueTargets.pop();
		breakTargets.pop();
		if (bodyEnd != null)
		{
			bodyEnd.linkTo(updateBlock);
		}
		return after; // Unreachable when nothing links to it; reachability decides
	}

	private static boolean isAlwaysTrue(Expression condition)
	{
		return condition == null
				|| (condition instanceof LiteralExpression && Boolean.TRUE.equals(((LiteralExpression) condition).getValue()));
	}
}
