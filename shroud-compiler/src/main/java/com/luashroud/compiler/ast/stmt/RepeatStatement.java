package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.Objects;

/**
 * repeat body until condition
 *
 * <p>条件处于循环体作用域内，可以引用循环体中声明的 local。</p>
 */
public final class RepeatStatement extends Statement {
    private Block body;
    private Expression condition;

    public RepeatStatement(Block body, Expression condition, NodeTag... tags) {
        super(AstKind.REPEAT_STATEMENT, tags);
        setBody(body);
        setCondition(condition);
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRepeatStatement(this, context);
    }
}
