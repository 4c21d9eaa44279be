// File: src/main/java/org/lokray/sinter/ast/Program.java
package org.lokray.sinter.ast;

import org.lokray.sinter.ast.declarations.ClassDeclaration;
import org.lokray.sinter.ast.declarations.Declaration;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.declarations.InterfaceDeclaration;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The root of the AST: the top-level declarations of one compilation unit, in source order.
 */
public class Program implements ASTNode
{
	private final List<Declaration> declarations;

	public Program(List<Declaration> declarations)
	{
		this.declarations = Collections.unmodifiableList(declarations);
	}

	public List<Declaration> getDeclarations()
	{
		return declarations;
	}

	public List<ClassDeclaration> getClasses()
	{
		return declarations.stream()
				.filter(ClassDeclaration.class::isInstance)
				.map(ClassDeclaration.class::cast)
				.collect(Collectors.toList());
	}

	public List<InterfaceDeclaration> getInterfaces()
	{
		return declarations.stream()
				.filter(InterfaceDeclaration.class::isInstance)
				.map(InterfaceDeclaration.class::cast)
				.collect(Collectors.toList());
	}

	public List<FunctionDeclaration> getFunctions()
	{
		return declarations.stream()
				.filter(FunctionDeclaration.class::isInstance)
				.map(FunctionDeclaration.class::cast)
				.collect(Collectors.toList());
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public String toString()
	{
		return "Program" + declarations;
	}
}
