package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.ScopeConsistencyException;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * for k, v in exprs do body end
 */
public final class ForInStatement extends Statement {
    private final Scope scope;
    private final List<SymbolId> ids;
    private final List<Expression> expressions;
    private Block body;

    public ForInStatement(Scope scope, List<SymbolId> ids, List<? extends Expression> expressions, Block body,
                          NodeTag... tags) {
        super(AstKind.FOR_IN_STATEMENT, tags);
        this.scope = Objects.requireNonNull(scope, "scope");
        if (ids.isEmpty() || expressions.isEmpty()) {
            throw new IllegalArgumentException("generic for requires variables and expressions");
        }
        for (SymbolId id : ids) {
            if (!scope.isDeclared(id)) {
                throw new ScopeConsistencyException("loop variable " + id + " is not declared in " + scope);
            }
        }
        this.ids = new ArrayList<SymbolId>(ids);
        this.expressions = new ArrayList<Expression>(expressions);
        setBody(body);
    }

    public Scope getScope() {
        return scope;
    }

    public List<SymbolId> getIds() {
        return ids;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForInStatement(this, context);
    }
}
