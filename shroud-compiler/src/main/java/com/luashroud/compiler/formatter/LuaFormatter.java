package com.luashroud.compiler.formatter;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.*;
import com.luashroud.compiler.ast.stmt.*;
import com.luashroud.compiler.lexer.Lexer;

import java.util.List;

/**
 * Lua 代码格式化器
 *
 * <p>基于 AST 的代码生成，括号按运算符优先级重新计算，变量名取自所在作用域的当前名字。</p>
 */
public class LuaFormatter implements AstVisitor<Void, FormatterContext> {

    private static final int ATOM = 100;

    /**
     * 格式化整棵树
     */
    public static String format(TopNode top, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        top.accept(new LuaFormatter(), ctx);
        return ctx.getOutput();
    }

    /**
     * 格式化单个节点（诊断用）
     */
    public static String format(AstNode node) {
        FormatterContext ctx = new FormatterContext(FormatConfig.inline());
        node.accept(new LuaFormatter(), ctx);
        return ctx.getOutput();
    }

    // ============ 辅助 ============

    private void formatStatements(Block block, FormatterContext ctx) {
        ctx.openBlock();
        for (Statement statement : block.getStatements()) {
            ctx.beginStatement(startsWithParen(statement));
            statement.accept(this, ctx);
            ctx.endStatement();
        }
    }

    /** 缩进的代码块，调用方负责之后的 end / until / else */
    private void formatBody(Block block, FormatterContext ctx) {
        ctx.indent();
        block.accept(this, ctx);
        ctx.dedent();
        ctx.lineBreak();
    }

    private void formatExpression(Expression expression, int minPrecedence, FormatterContext ctx) {
        if (precedenceOf(expression) < minPrecedence) {
            ctx.append("(");
            expression.accept(this, ctx);
            ctx.append(")");
        } else {
            expression.accept(this, ctx);
        }
    }

    private void formatExpression(Expression expression, FormatterContext ctx) {
        expression.accept(this, ctx);
    }

    /** 调用、索引的基表达式必须是前缀表达式，否则加括号 */
    private void formatPrefix(Expression base, FormatterContext ctx) {
        if (isPrefixExpression(base)) {
            base.accept(this, ctx);
        } else {
            ctx.append("(");
            base.accept(this, ctx);
            ctx.append(")");
        }
    }

    private void formatExpressionList(List<? extends Expression> list, FormatterContext ctx) {
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) ctx.comma();
            formatExpression(list.get(i), ctx);
        }
    }

    private void formatArguments(List<Expression> args, FormatterContext ctx) {
        ctx.append("(");
        formatExpressionList(args, ctx);
        ctx.append(")");
    }

    private void formatNames(Scope scope, List<SymbolId> ids, FormatterContext ctx) {
        for (int i = 0; i < ids.size(); i++) {
            if (i > 0) ctx.comma();
            ctx.append(scope.getVariableName(ids.get(i)));
        }
    }

    private void formatFunction(List<Expression> args, Block body, FormatterContext ctx) {
        formatArguments(args, ctx);
        formatBody(body, ctx);
        ctx.append("end");
    }

    private static int precedenceOf(Expression expression) {
        AstKind kind = expression.getKind();
        if (kind.isBinary()) return kind.getPrecedence();
        if (kind.isUnary()) return AstKind.UNARY_PRECEDENCE;
        if (expression instanceof NumberExpression && isNegative(((NumberExpression) expression).getValue())) {
            return AstKind.UNARY_PRECEDENCE;
        }
        return ATOM;
    }

    private static boolean isPrefixExpression(Expression expression) {
        return expression instanceof VariableExpression
                || expression instanceof IndexExpression
                || expression instanceof FunctionCallExpression
                || expression instanceof PassSelfFunctionCallExpression
                || expression instanceof ParenthesisExpression;
    }

    private static boolean startsWithParen(Statement statement) {
        if (statement instanceof FunctionCallStatement) {
            return leftmostNeedsParen(((FunctionCallStatement) statement).getBase());
        }
        if (statement instanceof PassSelfFunctionCallStatement) {
            return leftmostNeedsParen(((PassSelfFunctionCallStatement) statement).getBase());
        }
        AssignmentTarget target = null;
        if (statement instanceof AssignmentStatement) {
            target = ((AssignmentStatement) statement).getLhs().get(0);
        } else if (statement instanceof CompoundAssignmentStatement) {
            target = ((CompoundAssignmentStatement) statement).getTarget();
        }
        return target instanceof AssignmentIndexing && leftmostNeedsParen(((AssignmentIndexing) target).getBase());
    }

    private static boolean leftmostNeedsParen(Expression expression) {
        Expression current = expression;
        while (true) {
            if (current instanceof IndexExpression) {
                current = ((IndexExpression) current).getBase();
            } else if (current instanceof FunctionCallExpression) {
                current = ((FunctionCallExpression) current).getBase();
            } else if (current instanceof PassSelfFunctionCallExpression) {
                current = ((PassSelfFunctionCallExpression) current).getBase();
            } else {
                return !(current instanceof VariableExpression);
            }
        }
    }

    private static boolean isNegative(double value) {
        return value < 0 || (value == 0 && 1 / value < 0);
    }

    /**
     * 数字的源码写法。NaN 与无穷没有字面量，写成除法。
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value)) return "(0/0)";
        if (Double.isInfinite(value)) return value > 0 ? "(1/0)" : "(-1/0)";
        if (isNegative(value)) return "-" + formatNumber(-value);
        if (value == Math.rint(value) && value < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    // ============ 结构 ============

    @Override
    public Void visitTopNode(TopNode node, FormatterContext ctx) {
        node.getBody().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitBlock(Block node, FormatterContext ctx) {
        formatStatements(node, ctx);
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitLocalVariableDeclaration(LocalVariableDeclaration node, FormatterContext ctx) {
        ctx.append("local");
        ctx.space();
        formatNames(node.getScope(), node.getIds(), ctx);
        if (!node.getExpressions().isEmpty()) {
            ctx.operator("=");
            formatExpressionList(node.getExpressions(), ctx);
        }
        return null;
    }

    @Override
    public Void visitLocalFunctionDeclaration(LocalFunctionDeclaration node, FormatterContext ctx) {
        ctx.append("local");
        ctx.space();
        ctx.append("function");
        ctx.space();
        ctx.append(node.getScope().getVariableName(node.getId()));
        formatFunction(node.getArgs(), node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitFunctionDeclaration(FunctionDeclaration node, FormatterContext ctx) {
        ctx.append("function");
        ctx.space();
        ctx.append(node.getScope().getVariableName(node.getId()));
        // 方法定义的 self 已经是显式参数，统一用 . 连接
        for (String index : node.getIndices()) {
            ctx.append(".");
            ctx.append(index);
        }
        formatFunction(node.getArgs(), node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitAssignmentStatement(AssignmentStatement node, FormatterContext ctx) {
        List<AssignmentTarget> lhs = node.getLhs();
        for (int i = 0; i < lhs.size(); i++) {
            if (i > 0) ctx.comma();
            lhs.get(i).accept(this, ctx);
        }
        ctx.operator("=");
        formatExpressionList(node.getRhs(), ctx);
        return null;
    }

    @Override
    public Void visitCompoundAssignmentStatement(CompoundAssignmentStatement node, FormatterContext ctx) {
        node.getTarget().accept(this, ctx);
        ctx.operator(node.getOperator().getOperator() + "=");
        formatExpression(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitFunctionCallStatement(FunctionCallStatement node, FormatterContext ctx) {
        formatPrefix(node.getBase(), ctx);
        formatArguments(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitPassSelfFunctionCallStatement(PassSelfFunctionCallStatement node, FormatterContext ctx) {
        formatPrefix(node.getBase(), ctx);
        ctx.append(":");
        ctx.append(node.getPassSelfFunctionName());
        formatArguments(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement node, FormatterContext ctx) {
        ctx.append("return");
        if (!node.getArgs().isEmpty()) {
            ctx.space();
            formatExpressionList(node.getArgs(), ctx);
        }
        return null;
    }

    @Override
    public Void visitBreakStatement(BreakStatement node, FormatterContext ctx) {
        ctx.append("break");
        return null;
    }

    @Override
    public Void visitContinueStatement(ContinueStatement node, FormatterContext ctx) {
        ctx.append("continue");
        return null;
    }

    @Override
    public Void visitDoStatement(DoStatement node, FormatterContext ctx) {
        ctx.append("do");
        formatBody(node.getBody(), ctx);
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitWhileStatement(WhileStatement node, FormatterContext ctx) {
        ctx.append("while");
        ctx.space();
        formatExpression(node.getCondition(), ctx);
        ctx.space();
        ctx.append("do");
        formatBody(node.getBody(), ctx);
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitRepeatStatement(RepeatStatement node, FormatterContext ctx) {
        ctx.append("repeat");
        formatBody(node.getBody(), ctx);
        ctx.append("until");
        ctx.space();
        formatExpression(node.getCondition(), ctx);
        return null;
    }

    @Override
    public Void visitForStatement(ForStatement node, FormatterContext ctx) {
        ctx.append("for");
        ctx.space();
        ctx.append(node.getScope().getVariableName(node.getId()));
        ctx.operator("=");
        formatExpression(node.getInitialValue(), ctx);
        ctx.comma();
        formatExpression(node.getFinalValue(), ctx);
        if (node.getIncrementBy() != null) {
            ctx.comma();
            formatExpression(node.getIncrementBy(), ctx);
        }
        ctx.space();
        ctx.append("do");
        formatBody(node.getBody(), ctx);
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitForInStatement(ForInStatement node, FormatterContext ctx) {
        ctx.append("for");
        ctx.space();
        formatNames(node.getScope(), node.getIds(), ctx);
        ctx.space();
        ctx.append("in");
        ctx.space();
        formatExpressionList(node.getExpressions(), ctx);
        ctx.space();
        ctx.append("do");
        formatBody(node.getBody(), ctx);
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatement node, FormatterContext ctx) {
        ctx.append("if");
        ctx.space();
        formatExpression(node.getCondition(), ctx);
        ctx.space();
        ctx.append("then");
        formatBody(node.getBody(), ctx);
        for (IfStatement.ElseIfClause clause : node.getElseIfs()) {
            ctx.append("elseif");
            ctx.space();
            formatExpression(clause.getCondition(), ctx);
            ctx.space();
            ctx.append("then");
            formatBody(clause.getBody(), ctx);
        }
        if (node.getElseBody() != null) {
            ctx.append("else");
            formatBody(node.getElseBody(), ctx);
        }
        ctx.append("end");
        return null;
    }

    // ============ 赋值目标与表项 ============

    @Override
    public Void visitAssignmentVariable(AssignmentVariable node, FormatterContext ctx) {
        ctx.append(node.getScope().getVariableName(node.getId()));
        return null;
    }

    @Override
    public Void visitAssignmentIndexing(AssignmentIndexing node, FormatterContext ctx) {
        formatPrefix(node.getBase(), ctx);
        formatIndex(node.getIndex(), ctx);
        return null;
    }

    @Override
    public Void visitTableEntry(TableEntry node, FormatterContext ctx) {
        formatExpression(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitKeyedTableEntry(KeyedTableEntry node, FormatterContext ctx) {
        Expression key = node.getKey();
        if (key instanceof StringExpression && Lexer.isValidName(((StringExpression) key).getValue())) {
            ctx.append(((StringExpression) key).getValue());
        } else {
            ctx.append("[");
            formatExpression(key, ctx);
            ctx.append("]");
        }
        ctx.operator("=");
        formatExpression(node.getValue(), ctx);
        return null;
    }

    private void formatIndex(Expression index, FormatterContext ctx) {
        if (index instanceof StringExpression && Lexer.isValidName(((StringExpression) index).getValue())) {
            ctx.append(".");
            ctx.append(((StringExpression) index).getValue());
        } else {
            ctx.append("[");
            formatExpression(index, ctx);
            ctx.append("]");
        }
    }

    // ============ 表达式 ============

    @Override
    public Void visitNilExpression(NilExpression node, FormatterContext ctx) {
        ctx.append("nil");
        return null;
    }

    @Override
    public Void visitBooleanExpression(BooleanExpression node, FormatterContext ctx) {
        ctx.append(node.getValue() ? "true" : "false");
        return null;
    }

    @Override
    public Void visitNumberExpression(NumberExpression node, FormatterContext ctx) {
        ctx.appendNumber(formatNumber(node.getValue()));
        return null;
    }

    @Override
    public Void visitStringExpression(StringExpression node, FormatterContext ctx) {
        ctx.append(LuaStringUtils.quote(node.getValue()));
        return null;
    }

    @Override
    public Void visitVarargExpression(VarargExpression node, FormatterContext ctx) {
        ctx.append("...");
        return null;
    }

    @Override
    public Void visitVariableExpression(VariableExpression node, FormatterContext ctx) {
        ctx.append(node.getScope().getVariableName(node.getId()));
        return null;
    }

    @Override
    public Void visitIndexExpression(IndexExpression node, FormatterContext ctx) {
        formatPrefix(node.getBase(), ctx);
        formatIndex(node.getIndex(), ctx);
        return null;
    }

    @Override
    public Void visitFunctionCallExpression(FunctionCallExpression node, FormatterContext ctx) {
        formatPrefix(node.getBase(), ctx);
        formatArguments(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitPassSelfFunctionCallExpression(PassSelfFunctionCallExpression node, FormatterContext ctx) {
        formatPrefix(node.getBase(), ctx);
        ctx.append(":");
        ctx.append(node.getPassSelfFunctionName());
        formatArguments(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitFunctionLiteralExpression(FunctionLiteralExpression node, FormatterContext ctx) {
        ctx.append("function");
        formatFunction(node.getArgs(), node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitTableConstructorExpression(TableConstructorExpression node, FormatterContext ctx) {
        ctx.append("{");
        List<TableField> entries = node.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) ctx.comma();
            entries.get(i).accept(this, ctx);
        }
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitParenthesisExpression(ParenthesisExpression node, FormatterContext ctx) {
        ctx.append("(");
        formatExpression(node.getExpression(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitBinaryExpression(BinaryExpression node, FormatterContext ctx) {
        AstKind operator = node.getKind();
        int precedence = operator.getPrecedence();
        boolean right = operator.isRightAssociative();
        formatExpression(node.getLeft(), right ? precedence + 1 : precedence, ctx);
        ctx.operator(operator.getOperator());
        formatExpression(node.getRight(), right ? precedence : precedence + 1, ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpression(UnaryExpression node, FormatterContext ctx) {
        ctx.append(node.getKind().getOperator());
        formatExpression(node.getOperand(), AstKind.UNARY_PRECEDENCE, ctx);
        return null;
    }
}
