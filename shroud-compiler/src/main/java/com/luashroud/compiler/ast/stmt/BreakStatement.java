package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

/**
 * break
 */
public final class BreakStatement extends Statement {

    public BreakStatement(NodeTag... tags) {
        super(AstKind.BREAK_STATEMENT, tags);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStatement(this, context);
    }
}
