package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

/**
 * continue（仅 LuaU）
 */
public final class ContinueStatement extends Statement {

    public ContinueStatement(NodeTag... tags) {
        super(AstKind.CONTINUE_STATEMENT, tags);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContinueStatement(this, context);
    }
}
