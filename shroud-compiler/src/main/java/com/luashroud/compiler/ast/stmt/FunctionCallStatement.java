package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 作为语句的函数调用 f(args)
 */
public final class FunctionCallStatement extends Statement {
    private Expression base;
    private final List<Expression> args;

    public FunctionCallStatement(Expression base, List<? extends Expression> args, NodeTag... tags) {
        super(AstKind.FUNCTION_CALL_STATEMENT, tags);
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
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCallStatement(this, context);
    }
}
