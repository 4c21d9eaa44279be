// File: src/main/java/org/lokray/sinter/ast/declarations/Declaration.java
package org.lokray.sinter.ast.declarations;

import org.lokray.sinter.ast.ASTNode;
import org.lokray.sinter.lexer.Token;

/**
 * A named declaration: class, interface, function, method or field.
 */
public interface Declaration extends ASTNode
{
	Token getNameToken();

	default String getName()
	{
		return getNameToken().getLexeme();
	}
}
