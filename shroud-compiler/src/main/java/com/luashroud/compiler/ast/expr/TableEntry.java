package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * 顺序表项 { value }
 */
public final class TableEntry extends TableField {
    private Expression value;

    public TableEntry(Expression value, NodeTag... tags) {
        super(AstKind.TABLE_ENTRY, tags);
        setValue(value);
    }

    @Override
    public Expression getValue() {
        return value;
    }

    @Override
    public void setValue(Expression value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTableEntry(this, context);
    }
}
