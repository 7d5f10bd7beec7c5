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

import java.util.List;
import java.util.Objects;

/**
 * local function name(args) body end
 */
public final class LocalFunctionDeclaration extends Statement implements FunctionNode {
    private final Scope scope;
    private final SymbolId id;
    private final List<Expression> args;
    private Block body;

    public LocalFunctionDeclaration(Scope scope, SymbolId id, List<? extends Expression> args, Block body,
                                    NodeTag... tags) {
        super(AstKind.LOCAL_FUNCTION_DECLARATION, tags);
        this.scope = Objects.requireNonNull(scope, "scope");
        this.id = Objects.requireNonNull(id, "id");
        if (!scope.isDeclared(id)) {
            throw new ScopeConsistencyException("function " + id + " is not declared in " + scope);
        }
        this.args = FunctionNode.checkSignature(args, body);
        this.body = body;
    }

    public Scope getScope() {
        return scope;
    }

    public SymbolId getId() {
        return id;
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
        return visitor.visitLocalFunctionDeclaration(this, context);
    }
}
