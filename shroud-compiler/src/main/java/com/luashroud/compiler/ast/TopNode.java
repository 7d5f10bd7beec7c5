package com.luashroud.compiler.ast;

import com.luashroud.compiler.analysis.Scope;

import java.util.Objects;

/**
 * 程序根节点：主代码块加上全局作用域
 */
public final class TopNode extends AstNode {
    private Block body;
    private final Scope globalScope;

    public TopNode(Block body, Scope globalScope) {
        super(AstKind.TOP_NODE);
        this.globalScope = Objects.requireNonNull(globalScope, "globalScope");
        if (!globalScope.isGlobal()) {
            throw new IllegalArgumentException("top node requires a global scope");
        }
        setBody(body);
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        Objects.requireNonNull(body, "body");
        if (body.getScope().getParent() != globalScope) {
            throw new IllegalArgumentException("top-level block scope must be a child of the global scope");
        }
        this.body = body;
    }

    public Scope getGlobalScope() {
        return globalScope;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTopNode(this, context);
    }
}
