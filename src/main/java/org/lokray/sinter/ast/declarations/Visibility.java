// File: src/main/java/org/lokray/sinter/ast/declarations/Visibility.java
package org.lokray.sinter.ast.declarations;

/**
 * Member visibility, taken from the enclosing {@code private:}/{@code protected:}/{@code public:} section.
 */
public enum Visibility
{
	PRIVATE,
	PROTECTED,
	PUBLIC
}
