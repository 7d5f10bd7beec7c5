package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.ScopeConsistencyException;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * local a, b = e1, e2
 *
 * <p>ids 与 expressions 按位置对应；长度可以不同（Lua 的多值调整规则）。</p>
 */
public final class LocalVariableDeclaration extends Statement {
    private final Scope scope;
    private final List<SymbolId> ids;
    private final List<Expression> expressions;

    public LocalVariableDeclaration(Scope scope, List<SymbolId> ids, List<? extends Expression> expressions,
                                    NodeTag... tags) {
        super(AstKind.LOCAL_VARIABLE_DECLARATION, tags);
        this.scope = Objects.requireNonNull(scope, "scope");
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("local declaration requires at least one variable");
        }
        for (SymbolId id : ids) {
            if (!scope.isDeclared(id)) {
                throw new ScopeConsistencyException("variable " + id + " is not declared in " + scope);
            }
        }
        this.ids = new ArrayList<SymbolId>(ids);
        this.expressions = new ArrayList<Expression>(expressions);
    }

    public Scope getScope() {
        return scope;
    }

    public List<SymbolId> getIds() {
        return ids;
    }

    /** 初始化表达式（可变） */
    public List<Expression> getExpressions() {
        return expressions;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLocalVariableDeclaration(this, context);
    }
}
