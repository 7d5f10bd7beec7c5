package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 方法调用表达式 obj:name(args)
 */
public final class PassSelfFunctionCallExpression extends Expression {
    private Expression base;
    private final String passSelfFunctionName;
    private final List<Expression> args;

    public PassSelfFunctionCallExpression(Expression base, String passSelfFunctionName,
                                          List<? extends Expression> args, NodeTag... tags) {
        super(AstKind.PASS_SELF_FUNCTION_CALL, tags);
        setBase(base);
        this.passSelfFunctionName = Objects.requireNonNull(passSelfFunctionName, "passSelfFunctionName");
        this.args = new ArrayList<Expression>(args);
    }

    public Expression getBase() {
        return base;
    }

    public void setBase(Expression base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    public String getPassSelfFunctionName() {
        return passSelfFunctionName;
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
        return visitor.visitPassSelfFunctionCallExpression(this, context);
    }
}
