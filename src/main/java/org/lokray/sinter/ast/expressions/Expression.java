// File: src/main/java/org/lokray/sinter/ast/expressions/Expression.java
package org.lokray.sinter.ast.expressions;

import org.lokray.sinter.ast.ASTNode;
import org.lokray.sinter.lexer.Token;

/**
 * Marker interface for all expression nodes in the AST.
 * Types and symbol bindings live in the semantic model, keyed by node identity.
 */
public interface Expression extends ASTNode
{
	/**
	 * @return The first token of the expression, used to position diagnostics.
	 */
	Token getFirstToken();
}
