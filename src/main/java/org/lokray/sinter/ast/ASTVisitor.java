// File: src/main/java/org/lokray/sinter/ast/ASTVisitor.java
package org.lokray.sinter.ast;

import org.lokray.sinter.ast.declarations.ClassDeclaration;
import org.lokray.sinter.ast.declarations.FieldDeclaration;
import org.lokray.sinter.ast.declarations.FunctionDeclaration;
import org.lokray.sinter.ast.declarations.InterfaceDeclaration;
import org.lokray.sinter.ast.declarations.MethodDeclaration;
import org.lokray.sinter.ast.expressions.AssignmentExpression;
import org.lokray.sinter.ast.expressions.BinaryExpression;
import org.lokray.sinter.ast.expressions.CallExpression;
import org.lokray.sinter.ast.expressions.DStringExpression;
import org.lokray.sinter.ast.expressions.DotExpression;
import org.lokray.sinter.ast.expressions.GroupingExpression;
import org.lokray.sinter.ast.expressions.IdentifierExpression;
import org.lokray.sinter.ast.expressions.LiteralExpression;
import org.lokray.sinter.ast.expressions.PostfixUnaryExpression;
import org.lokray.sinter.ast.expressions.UnaryExpression;
import org.lokray.sinter.ast.statements.BlockStatement;
import org.lokray.sinter.ast.statements.BreakStatement;
import org.lokray.sinter.ast.statements.ContinueStatement;
import org.lokray.sinter.ast.statements.ExpressionStatement;
import org.lokray.sinter.ast.statements.ForStatement;
import org.lokray.sinter.ast.statements.IfStatement;
import org.lokray.sinter.ast.statements.PrintStatement;
import org.lokray.sinter.ast.statements.ReturnStatement;
import org.lokray.sinter.ast.statements.VariableDeclarationStatement;
import org.lokray.sinter.ast.statements.WhileStatement;

/**
 * Visitor interface for traversing the Abstract Syntax Tree (AST).
 *
 * @param <R> The return type of the visit methods.
 */
public interface ASTVisitor<R>
{
	R visitProgram(Program program);

	// --- Declarations ---
	R visitClassDeclaration(ClassDeclaration declaration);

	R visitInterfaceDeclaration(InterfaceDeclaration declaration);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitMethodDeclaration(MethodDeclaration declaration);

	R visitFieldDeclaration(FieldDeclaration declaration);

	// --- Statements ---
	R visitBlockStatement(BlockStatement statement);

	R visitVariableDeclarationStatement(VariableDeclarationStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitForStatement(ForStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitBreakStatement(BreakStatement statement);

	R visitContinueStatement(ContinueStatement statement);

	R visitPrintStatement(PrintStatement statement);

	// --- Expressions ---
	R visitLiteralExpression(LiteralExpression expression);

	R visitDStringExpression(DStringExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitBinaryExpression(BinaryExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitPostfixUnaryExpression(PostfixUnaryExpression expression);

	R visitAssignmentExpression(AssignmentExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitDotExpression(DotExpression expression);

	R visitGroupingExpression(GroupingExpression expression);
}
