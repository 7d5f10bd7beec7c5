package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * 字符串字面量。值按字节存储，每个 char 对应一个 0-255 的字节。
 */
public final class StringExpression extends Expression {
    private final String value;

    public StringExpression(String value, NodeTag... tags) {
        super(AstKind.STRING, tags);
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
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
        return visitor.visitStringExpression(this, context);
    }
}
