package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * do body end
 */
public final class DoStatement extends Statement {
    private Block body;

    public DoStatement(Block body, NodeTag... tags) {
        super(AstKind.DO_STATEMENT, tags);
        setBody(body);
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDoStatement(this, context);
    }
}
