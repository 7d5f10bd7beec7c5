package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.ScopeConsistencyException;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * 变量引用：声明该变量的作用域加上符号 id
 */
public final class VariableExpression extends Expression {
    private final Scope scope;
    private final SymbolId id;

    public VariableExpression(Scope scope, SymbolId id, NodeTag... tags) {
        super(AstKind.VARIABLE, tags);
        this.scope = Objects.requireNonNull(scope, "scope");
        this.id = Objects.requireNonNull(id, "id");
        if (!scope.isDeclared(id)) {
            throw new ScopeConsistencyException("variable " + id + " is not declared in " + scope);
        }
    }

    public Scope getScope() {
        return scope;
    }

    public SymbolId getId() {
        return id;
    }

    /** 当前名字（仅用于诊断） */
    public String getName() {
        return scope.getVariableName(id);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableExpression(this, context);
    }
}
