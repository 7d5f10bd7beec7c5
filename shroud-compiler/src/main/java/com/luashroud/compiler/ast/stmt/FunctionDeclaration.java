package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.ScopeConsistencyException;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.FunctionNode;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * function base.a.b(args) body end
 *
 * <p>(scope, id) 指向路径起点变量，indices 为其后的字段名。方法形式 {@code function a:b()}
 * 在解析时改写为显式的 self 参数，因此这里不区分冒号。</p>
 */
public final class FunctionDeclaration extends Statement implements FunctionNode {
    private final Scope scope;
    private final SymbolId id;
    private final List<String> indices;
    private final List<Expression> args;
    private Block body;

    public FunctionDeclaration(Scope scope, SymbolId id, List<String> indices, List<? extends Expression> args,
                               Block body, NodeTag... tags) {
        super(AstKind.FUNCTION_DECLARATION, tags);
        this.scope = Objects.requireNonNull(scope, "scope");
        this.id = Objects.requireNonNull(id, "id");
        if (!scope.isDeclared(id)) {
            throw new ScopeConsistencyException("variable " + id + " is not declared in " + scope);
        }
        this.indices = new ArrayList<String>(indices);
        this.args = FunctionNode.checkSignature(args, body);
        this.body = body;
    }

    public Scope getScope() {
        return scope;
    }

    public SymbolId getId() {
        return id;
    }

    /** 字段路径（可变） */
    public List<String> getIndices() {
        return indices;
    }

    @Override
    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public Block getBody() {
        return body;
    }

    @Override
    public void setBody(Block body) {
        FunctionNode.checkSignature(args, body);
        this.body = body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDeclaration(this, context);
    }
}
