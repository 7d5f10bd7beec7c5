package com.luashroud.compiler.ast;

import com.luashroud.compiler.ast.expr.*;
import com.luashroud.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface AstVisitor<R, C> {

    // ============ 结构 ============

    R visitTopNode(TopNode node, C context);

    R visitBlock(Block node, C context);

    // ============ 语句 ============

    R visitLocalVariableDeclaration(LocalVariableDeclaration node, C context);

    R visitLocalFunctionDeclaration(LocalFunctionDeclaration node, C context);

    R visitFunctionDeclaration(FunctionDeclaration node, C context);

    R visitAssignmentStatement(AssignmentStatement node, C context);

    R visitCompoundAssignmentStatement(CompoundAssignmentStatement node, C context);

    R visitFunctionCallStatement(FunctionCallStatement node, C context);

    R visitPassSelfFunctionCallStatement(PassSelfFunctionCallStatement node, C context);

    R visitReturnStatement(ReturnStatement node, C context);

    R visitBreakStatement(BreakStatement node, C context);

    R visitContinueStatement(ContinueStatement node, C context);

    R visitDoStatement(DoStatement node, C context);

    R visitWhileStatement(WhileStatement node, C context);

    R visitRepeatStatement(RepeatStatement node, C context);

    R visitForStatement(ForStatement node, C context);

    R visitForInStatement(ForInStatement node, C context);

    R visitIfStatement(IfStatement node, C context);

    // ============ 赋值目标 / 表项 ============

    R visitAssignmentVariable(AssignmentVariable node, C context);

    R visitAssignmentIndexing(AssignmentIndexing node, C context);

    R visitTableEntry(TableEntry node, C context);

    R visitKeyedTableEntry(KeyedTableEntry node, C context);

    // ============ 表达式 ============

    R visitNilExpression(NilExpression node, C context);

    R visitBooleanExpression(BooleanExpression node, C context);

    R visitNumberExpression(NumberExpression node, C context);

    R visitStringExpression(StringExpression node, C context);

    R visitVarargExpression(VarargExpression node, C context);

    R visitVariableExpression(VariableExpression node, C context);

    R visitIndexExpression(IndexExpression node, C context);

    R visitFunctionCallExpression(FunctionCallExpression node, C context);

    R visitPassSelfFunctionCallExpression(PassSelfFunctionCallExpression node, C context);

    R visitFunctionLiteralExpression(FunctionLiteralExpression node, C context);

    R visitTableConstructorExpression(TableConstructorExpression node, C context);

    R visitParenthesisExpression(ParenthesisExpression node, C context);

    R visitBinaryExpression(BinaryExpression node, C context);

    R visitUnaryExpression(UnaryExpression node, C context);
}
