package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * 显式括号。对多值表达式（调用、...）而言会截断为单个值，因此不能随意去掉。
 */
public final class ParenthesisExpression extends Expression {
    private Expression expression;

    public ParenthesisExpression(Expression expression, NodeTag... tags) {
        super(AstKind.PARENTHESIS, tags);
        setExpression(expression);
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParenthesisExpression(this, context);
    }
}
