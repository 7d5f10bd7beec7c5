package com.luashroud.compiler.visit;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.FunctionNode;
import com.luashroud.compiler.ast.MalformedTreeException;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.*;
import com.luashroud.compiler.ast.stmt.*;

import java.util.List;

/**
 * 深度优先遍历与原地替换
 *
 * <p>每个结构上持有的子节点恰好访问一次。在每个节点上先运行前序回调；若它返回替换节点，
 * 前序回调不会再作用于替换节点，遍历进入替换节点的子节点，随后对替换节点运行后序回调。
 * 后序回调返回的替换节点是最终结果，不再被遍历。替换节点写回父节点的同一位置，类型必须与该位置相符。</p>
 *
 * <p>遍历会修改树，同一棵树上不能同时进行两次遍历。</p>
 */
public final class AstWalker implements AstVisitor<Void, VisitContext> {

    private final VisitCallback pre;
    private final VisitCallback post;

    private AstWalker(VisitCallback pre, VisitCallback post) {
        this.pre = pre != null ? pre : VisitCallback.NONE;
        this.post = post != null ? post : VisitCallback.NONE;
    }

    /**
     * 遍历整棵树
     *
     * @return 遍历后的根节点（回调可以替换根节点）
     */
    public static TopNode walk(TopNode top, VisitCallback pre, VisitCallback post) {
        AstWalker walker = new AstWalker(pre, post);
        VisitContext context = new VisitContext(top.getGlobalScope(), top.getBody().getScope());
        return walker.visitNode(top, TopNode.class, context);
    }

    /**
     * 从任意节点开始遍历
     *
     * @param scope 节点所在的作用域
     * @return 遍历后的节点
     */
    public static AstNode walk(AstNode node, Scope scope, VisitCallback pre, VisitCallback post) {
        AstWalker walker = new AstWalker(pre, post);
        VisitContext context = new VisitContext(scope, scope);
        return walker.visitNode(node, slotOf(node), context);
    }

    // ============ 核心 ============

    private <T extends AstNode> T visitNode(T node, Class<T> slot, VisitContext context) {
        AstNode current = node;
        VisitResult before = pre.visit(current, context);
        if (before.isReplace()) {
            current = checkSlot(node, before.getReplacement(), slot);
        }
        if (!before.isSkipChildren()) {
            current.accept(this, context);
        }
        VisitResult after = post.visit(current, context);
        if (after.isReplace()) {
            current = checkSlot(node, after.getReplacement(), slot);
        }
        return slot.cast(current);
    }

    private <T extends AstNode> void visitList(List<T> nodes, Class<T> slot, VisitContext context) {
        for (int i = 0; i < nodes.size(); i++) {
            nodes.set(i, visitNode(nodes.get(i), slot, context));
        }
    }

    private Expression visitExpression(Expression expression, VisitContext context) {
        return visitNode(expression, Expression.class, context);
    }

    private Block visitBlockSlot(Block block, VisitContext context) {
        return visitNode(block, Block.class, context);
    }

    private static <T extends AstNode> AstNode checkSlot(AstNode original, AstNode replacement, Class<T> slot) {
        if (!slot.isInstance(replacement)) {
            throw new MalformedTreeException("cannot replace " + original.getKind() + " with "
                    + replacement.getKind() + ": slot requires " + slot.getSimpleName());
        }
        return replacement;
    }

    @SuppressWarnings("unchecked")
    private static Class<AstNode> slotOf(AstNode node) {
        Class<?> slot;
        if (node instanceof Expression) slot = Expression.class;
        else if (node instanceof Statement) slot = Statement.class;
        else if (node instanceof AssignmentTarget) slot = AssignmentTarget.class;
        else if (node instanceof TableField) slot = TableField.class;
        else slot = node.getClass();
        return (Class<AstNode>) slot;
    }

    // 函数参数只能替换为参数节点
    private void visitFunction(FunctionNode function, VisitContext context) {
        context.enterFunction(function);
        List<Expression> args = function.getArgs();
        for (int i = 0; i < args.size(); i++) {
            Expression arg = visitExpression(args.get(i), context);
            if (!(arg instanceof VariableExpression) && !(arg instanceof VarargExpression)) {
                throw new MalformedTreeException("function parameter replaced with " + arg.getKind());
            }
            args.set(i, arg);
        }
        function.setBody(visitBlockSlot(function.getBody(), context));
        context.exitFunction();
    }

    // ============ 结构 ============

    @Override
    public Void visitTopNode(TopNode node, VisitContext context) {
        node.setBody(visitBlockSlot(node.getBody(), context));
        return null;
    }

    @Override
    public Void visitBlock(Block node, VisitContext context) {
        context.pushScope(node.getScope());
        visitList(node.getStatements(), Statement.class, context);
        context.popScope();
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitLocalVariableDeclaration(LocalVariableDeclaration node, VisitContext context) {
        visitList(node.getExpressions(), Expression.class, context);
        return null;
    }

    @Override
    public Void visitLocalFunctionDeclaration(LocalFunctionDeclaration node, VisitContext context) {
        visitFunction(node, context);
        return null;
    }

    @Override
    public Void visitFunctionDeclaration(FunctionDeclaration node, VisitContext context) {
        visitFunction(node, context);
        return null;
    }

    @Override
    public Void visitAssignmentStatement(AssignmentStatement node, VisitContext context) {
        visitList(node.getLhs(), AssignmentTarget.class, context);
        visitList(node.getRhs(), Expression.class, context);
        return null;
    }

    @Override
    public Void visitCompoundAssignmentStatement(CompoundAssignmentStatement node, VisitContext context) {
        node.setTarget(visitNode(node.getTarget(), AssignmentTarget.class, context));
        node.setValue(visitExpression(node.getValue(), context));
        return null;
    }

    @Override
    public Void visitFunctionCallStatement(FunctionCallStatement node, VisitContext context) {
        node.setBase(visitExpression(node.getBase(), context));
        visitList(node.getArgs(), Expression.class, context);
        return null;
    }

    @Override
    public Void visitPassSelfFunctionCallStatement(PassSelfFunctionCallStatement node, VisitContext context) {
        node.setBase(visitExpression(node.getBase(), context));
        visitList(node.getArgs(), Expression.class, context);
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement node, VisitContext context) {
        visitList(node.getArgs(), Expression.class, context);
        return null;
    }

    @Override
    public Void visitBreakStatement(BreakStatement node, VisitContext context) {
        return null;
    }

    @Override
    public Void visitContinueStatement(ContinueStatement node, VisitContext context) {
        return null;
    }

    @Override
    public Void visitDoStatement(DoStatement node, VisitContext context) {
        node.setBody(visitBlockSlot(node.getBody(), context));
        return null;
    }

    @Override
    public Void visitWhileStatement(WhileStatement node, VisitContext context) {
        node.setCondition(visitExpression(node.getCondition(), context));
        node.setBody(visitBlockSlot(node.getBody(), context));
        return null;
    }

    @Override
    public Void visitRepeatStatement(RepeatStatement node, VisitContext context) {
        node.setBody(visitBlockSlot(node.getBody(), context));
        context.pushScope(node.getBody().getScope());
        node.setCondition(visitExpression(node.getCondition(), context));
        context.popScope();
        return null;
    }

    @Override
    public Void visitForStatement(ForStatement node, VisitContext context) {
        node.setInitialValue(visitExpression(node.getInitialValue(), context));
        node.setFinalValue(visitExpression(node.getFinalValue(), context));
        if (node.getIncrementBy() != null) {
            node.setIncrementBy(visitExpression(node.getIncrementBy(), context));
        }
        context.pushScope(node.getScope());
        node.setBody(visitBlockSlot(node.getBody(), context));
        context.popScope();
        return null;
    }

    @Override
    public Void visitForInStatement(ForInStatement node, VisitContext context) {
        visitList(node.getExpressions(), Expression.class, context);
        context.pushScope(node.getScope());
        node.setBody(visitBlockSlot(node.getBody(), context));
        context.popScope();
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatement node, VisitContext context) {
        node.setCondition(visitExpression(node.getCondition(), context));
        node.setBody(visitBlockSlot(node.getBody(), context));
        for (IfStatement.ElseIfClause clause : node.getElseIfs()) {
            clause.setCondition(visitExpression(clause.getCondition(), context));
            clause.setBody(visitBlockSlot(clause.getBody(), context));
        }
        if (node.getElseBody() != null) {
            node.setElseBody(visitBlockSlot(node.getElseBody(), context));
        }
        return null;
    }

    // ============ 赋值目标与表项 ============

    @Override
    public Void visitAssignmentVariable(AssignmentVariable node, VisitContext context) {
        return null;
    }

    @Override
    public Void visitAssignmentIndexing(AssignmentIndexing node, VisitContext context) {
        node.setBase(visitExpression(node.getBase(), context));
        node.setIndex(visitExpression(node.getIndex(), context));
        return null;
    }

    @Override
    public Void visitTableEntry(TableEntry node, VisitContext context) {
        node.setValue(visitExpression(node.getValue(), context));
        return null;
    }

    @Override
    public Void visitKeyedTableEntry(KeyedTableEntry node, VisitContext context) {
        node.setKey(visitExpression(node.getKey(), context));
        node.setValue(visitExpression(node.getValue(), context));
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitNilExpression(NilExpression node, VisitContext context) {
        return null;
    }

    @Override
    public Void visitBooleanExpression(BooleanExpression node, VisitContext context) {
        return null;
    }

    @Override
    public Void visitNumberExpression(NumberExpression node, VisitContext context) {
        return null;
    }

    @Override
    public Void visitStringExpression(StringExpression node, VisitContext context) {
        return null;
    }

    @Override
    public Void visitVarargExpression(VarargExpression node, VisitContext context) {
        return null;
    }

    @Override
    public Void visitVariableExpression(VariableExpression node, VisitContext context) {
        return null;
    }

    @Override
    public Void visitIndexExpression(IndexExpression node, VisitContext context) {
        node.setBase(visitExpression(node.getBase(), context));
        node.setIndex(visitExpression(node.getIndex(), context));
        return null;
    }

    @Override
    public Void visitFunctionCallExpression(FunctionCallExpression node, VisitContext context) {
        node.setBase(visitExpression(node.getBase(), context));
        visitList(node.getArgs(), Expression.class, context);
        return null;
    }

    @Override
    public Void visitPassSelfFunctionCallExpression(PassSelfFunctionCallExpression node, VisitContext context) {
        node.setBase(visitExpression(node.getBase(), context));
        visitList(node.getArgs(), Expression.class, context);
        return null;
    }

    @Override
    public Void visitFunctionLiteralExpression(FunctionLiteralExpression node, VisitContext context) {
        visitFunction(node, context);
        return null;
    }

    @Override
    public Void visitTableConstructorExpression(TableConstructorExpression node, VisitContext context) {
        visitList(node.getEntries(), TableField.class, context);
        return null;
    }

    @Override
    public Void visitParenthesisExpression(ParenthesisExpression node, VisitContext context) {
        node.setExpression(visitExpression(node.getExpression(), context));
        return null;
    }

    @Override
    public Void visitBinaryExpression(BinaryExpression node, VisitContext context) {
        node.setLeft(visitExpression(node.getLeft(), context));
        node.setRight(visitExpression(node.getRight(), context));
        return null;
    }

    @Override
    public Void visitUnaryExpression(UnaryExpression node, VisitContext context) {
        node.setOperand(visitExpression(node.getOperand(), context));
        return null;
    }
}
