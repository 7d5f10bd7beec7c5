package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.ScopeConsistencyException;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;

import java.util.Objects;

/**
 * 赋值给变量
 */
public final class AssignmentVariable extends AssignmentTarget {
    private final Scope scope;
    private final SymbolId id;

    public AssignmentVariable(Scope scope, SymbolId id, NodeTag... tags) {
        super(AstKind.ASSIGNMENT_VARIABLE, tags);
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

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignmentVariable(this, context);
    }
}
