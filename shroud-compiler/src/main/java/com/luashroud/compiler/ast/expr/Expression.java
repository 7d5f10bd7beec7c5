package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.NodeTag;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(AstKind kind, NodeTag... tags) {
        super(kind, tags);
    }

    /** 是否为字面常量（nil / boolean / number / string） */
    public boolean isConstant() {
        return false;
    }

    /** 常量值，非常量返回 null */
    public Object getConstantValue() {
        return null;
    }

    /** 是否可能产生多个值（函数调用和 ...） */
    public boolean isMultiValued() {
        return false;
    }
}
