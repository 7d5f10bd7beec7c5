package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * 赋值给 base[index]
 */
public final class AssignmentIndexing extends AssignmentTarget {
    private Expression base;
    private Expression index;

    public AssignmentIndexing(Expression base, Expression index, NodeTag... tags) {
        super(AstKind.ASSIGNMENT_INDEXING, tags);
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
        return visitor.visitAssignmentIndexing(this, context);
    }
}
