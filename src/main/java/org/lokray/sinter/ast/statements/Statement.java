// File: src/main/java/org/lokray/sinter/ast/statements/Statement.java
package org.lokray.sinter.ast.statements;

import org.lokray.sinter.ast.ASTNode;
import org.lokray.sinter.lexer.Token;

/**
 * Marker interface for all statement nodes in the AST.
 */
public interface Statement extends ASTNode
{
	/**
	 * @return The token the statement starts with, used for diagnostics.
	 */
	Token getFirstToken();
}
