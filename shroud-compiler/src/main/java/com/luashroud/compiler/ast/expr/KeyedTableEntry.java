package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * 键值表项 { [key] = value }，name = value 解析为 ["name"] = value
 */
public final class KeyedTableEntry extends TableField {
    private Expression key;
    private Expression value;

    public KeyedTableEntry(Expression key, Expression value, NodeTag... tags) {
        super(AstKind.KEYED_TABLE_ENTRY, tags);
        setKey(key);
        setValue(value);
    }

    public Expression getKey() {
        return key;
    }

    public void setKey(Expression key) {
        this.key = Objects.requireNonNull(key, "key");
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
        return visitor.visitKeyedTableEntry(this, context);
    }
}
