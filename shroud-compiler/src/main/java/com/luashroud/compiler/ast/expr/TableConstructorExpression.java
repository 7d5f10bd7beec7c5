package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.ArrayList;
import java.util.List;

/**
 * 表构造器 { entries }
 */
public final class TableConstructorExpression extends Expression {
    private final List<TableField> entries;

    public TableConstructorExpression(List<? extends TableField> entries, NodeTag... tags) {
        super(AstKind.TABLE_CONSTRUCTOR, tags);
        this.entries = new ArrayList<TableField>(entries);
    }

    public List<TableField> getEntries() {
        return entries;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTableConstructorExpression(this, context);
    }
}
