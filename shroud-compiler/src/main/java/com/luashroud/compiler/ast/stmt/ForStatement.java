package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.ScopeConsistencyException;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.Objects;

/**
 * for id = initial, final[, step] do body end
 *
 * <p>循环变量声明在独立的循环作用域中，循环体作用域是它的子作用域。</p>
 */
public final class ForStatement extends Statement {
    private final Scope scope;
    private final SymbolId id;
    private Expression initialValue;
    private Expression finalValue;
    private Expression incrementBy;
    private Block body;

    public ForStatement(Scope scope, SymbolId id, Expression initialValue, Expression finalValue,
                        Expression incrementBy, Block body, NodeTag... tags) {
        super(AstKind.FOR_STATEMENT, tags);
        this.scope = Objects.requireNonNull(scope, "scope");
        this.id = Objects.requireNonNull(id, "id");
        if (!scope.isDeclared(id)) {
            throw new ScopeConsistencyException("loop variable " + id + " is not declared in " + scope);
        }
        setInitialValue(initialValue);
        setFinalValue(finalValue);
        setIncrementBy(incrementBy);
        setBody(body);
    }

    public Scope getScope() {
        return scope;
    }

    public SymbolId getId() {
        return id;
    }

    public Expression getInitialValue() {
        return initialValue;
    }

    public void setInitialValue(Expression initialValue) {
        this.initialValue = Objects.requireNonNull(initialValue, "initialValue");
    }

    public Expression getFinalValue() {
        return finalValue;
    }

    public void setFinalValue(Expression finalValue) {
        this.finalValue = Objects.requireNonNull(finalValue, "finalValue");
    }

    /** 步长，可以为 null */
    public Expression getIncrementBy() {
        return incrementBy;
    }

    public void setIncrementBy(Expression incrementBy) {
        this.incrementBy = incrementBy;
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStatement(this, context);
    }
}
