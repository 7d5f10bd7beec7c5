package com.luashroud.compiler.analysis;

import java.util.Objects;

/**
 * 名字解析结果：声明作用域与符号标识
 */
public final class Binding {
    private final Scope scope;
    private final SymbolId id;

    public Binding(Scope scope, SymbolId id) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.id = Objects.requireNonNull(id, "id");
    }

    public Scope getScope() {
        return scope;
    }

    public SymbolId getId() {
        return id;
    }

    public String getName() {
        return scope.getVariableName(id);
    }

    public boolean isGlobal() {
        return scope.isGlobal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Binding)) return false;
        Binding other = (Binding) o;
        return scope == other.scope && id == other.id;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(scope) + System.identityHashCode(id);
    }

    @Override
    public String toString() {
        return getName() + id;
    }
}
