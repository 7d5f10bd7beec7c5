package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

/**
 * ...
 */
public final class VarargExpression extends Expression {

    public VarargExpression(NodeTag... tags) {
        super(AstKind.VARARG, tags);
    }

    @Override
    public boolean isMultiValued() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarargExpression(this, context);
    }
}
