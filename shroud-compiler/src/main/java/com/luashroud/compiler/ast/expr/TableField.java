package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.NodeTag;

/**
 * 表构造器中的一项
 */
public abstract class TableField extends AstNode {

    protected TableField(AstKind kind, NodeTag... tags) {
        super(kind, tags);
    }

    public abstract Expression getValue();

    public abstract void setValue(Expression value);
}
