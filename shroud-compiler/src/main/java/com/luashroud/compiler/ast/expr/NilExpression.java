package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

/**
 * nil
 */
public final class NilExpression extends Expression {

    public NilExpression(NodeTag... tags) {
        super(AstKind.NIL, tags);
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNilExpression(this, context);
    }
}
