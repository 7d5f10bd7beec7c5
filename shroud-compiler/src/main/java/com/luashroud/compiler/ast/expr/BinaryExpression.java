package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * 二元表达式，种类决定运算符
 */
public final class BinaryExpression extends Expression {
    private Expression left;
    private Expression right;

    public BinaryExpression(AstKind kind, Expression left, Expression right, NodeTag... tags) {
        super(checkKind(kind), tags);
        setLeft(left);
        setRight(right);
    }

    private static AstKind checkKind(AstKind kind) {
        if (kind == null || !kind.isBinary()) {
            throw new IllegalArgumentException("not a binary kind: " + kind);
        }
        return kind;
    }

    public Expression getLeft() {
        return left;
    }

    public void setLeft(Expression left) {
        this.left = Objects.requireNonNull(left, "left");
    }

    public Expression getRight() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpression(this, context);
    }
}
