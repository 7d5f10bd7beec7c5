package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.Objects;

/**
 * while condition do body end
 */
public final class WhileStatement extends Statement {
    private Expression condition;
    private Block body;

    public WhileStatement(Expression condition, Block body, NodeTag... tags) {
        super(AstKind.WHILE_STATEMENT, tags);
        setCondition(condition);
        setBody(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStatement(this, context);
    }
}
