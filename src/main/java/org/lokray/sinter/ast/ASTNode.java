// File: src/main/java/org/lokray/sinter/ast/ASTNode.java
package org.lokray.sinter.ast;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * Later compiler stages never mutate nodes; they attach their results in side tables keyed by node identity.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);
}
