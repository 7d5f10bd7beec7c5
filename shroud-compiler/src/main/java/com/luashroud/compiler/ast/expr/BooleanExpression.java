package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

/**
 * true / false
 */
public final class BooleanExpression extends Expression {
    private final boolean value;

    public BooleanExpression(boolean value, NodeTag... tags) {
        super(AstKind.BOOLEAN, tags);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public Object getConstantValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBooleanExpression(this, context);
    }
}
