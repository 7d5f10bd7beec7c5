package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 函数调用表达式 f(args)
 */
public final class FunctionCallExpression extends Expression {
    private Expression base;
    private final List<Expression> args;

    public FunctionCallExpression(Expression base, List<? extends Expression> args, NodeTag... tags) {
        super(AstKind.FUNCTION_CALL, tags);
        setBase(base);
        this.args = new ArrayList<Expression>(args);
    }

    public Expression getBase() {
        return base;
    }

    public void setBase(Expression base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public boolean isMultiValued() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCallExpression(this, context);
    }
}
