package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

/**
 * 数字字面量（Lua 5.1 数字均为双精度浮点）
 */
public final class NumberExpression extends Expression {
    private final double value;

    public NumberExpression(double value, NodeTag... tags) {
        super(AstKind.NUMBER, tags);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    /** 是否为整数值 */
    public boolean isIntegral() {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public Object getConstantValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumberExpression(this, context);
    }
}
