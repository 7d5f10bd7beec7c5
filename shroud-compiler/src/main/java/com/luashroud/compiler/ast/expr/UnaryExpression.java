package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * 一元表达式：not / - / #
 */
public final class UnaryExpression extends Expression {
    private Expression operand;

    public UnaryExpression(AstKind kind, Expression operand, NodeTag... tags) {
        super(checkKind(kind), tags);
        setOperand(operand);
    }

    private static AstKind checkKind(AstKind kind) {
        if (kind == null || !kind.isUnary()) {
            throw new IllegalArgumentException("not a unary kind: " + kind);
        }
        return kind;
    }

    public Expression getOperand() {
        return operand;
    }

    public void setOperand(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpression(this, context);
    }
}
