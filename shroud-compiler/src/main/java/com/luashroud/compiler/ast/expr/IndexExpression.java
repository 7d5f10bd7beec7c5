package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * base[index]，a.b 解析为 a["b"]
 */
public final class IndexExpression extends Expression {
    private Expression base;
    private Expression index;

    public IndexExpression(Expression base, Expression index, NodeTag... tags) {
        super(AstKind.INDEX, tags);
        setBase(base);
        setIndex(index);
    }

    public Expression getBase() {
        return base;
    }

    public void setBase(Expression base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    public Expression getIndex() {
        return index;
    }

    public void setIndex(Expression index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpression(this, context);
    }
}
