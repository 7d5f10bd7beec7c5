package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * return e1, e2
 */
public final class ReturnStatement extends Statement {
    private final List<Expression> args;

    public ReturnStatement(List<? extends Expression> args, NodeTag... tags) {
        super(AstKind.RETURN_STATEMENT, tags);
        this.args = new ArrayList<Expression>(args);
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStatement(this, context);
    }
}
