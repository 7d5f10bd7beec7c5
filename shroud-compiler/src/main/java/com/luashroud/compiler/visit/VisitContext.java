package com.luashroud.compiler.visit;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.ast.FunctionNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 遍历上下文：当前最内层作用域与外围函数记录
 */
public final class VisitContext {
    private final Scope globalScope;
    private final Deque<Scope> scopes = new ArrayDeque<Scope>();
    private FunctionData functionData;

    VisitContext(Scope scope, Scope topLevelScope) {
        this.globalScope = scope.getGlobalScope();
        this.scopes.push(scope);
        this.functionData = new FunctionData(0, topLevelScope, null, null);
    }

    public Scope getScope() {
        return scopes.peek();
    }

    public Scope getGlobalScope() {
        return globalScope;
    }

    public FunctionData getFunctionData() {
        return functionData;
    }

    /** 外围函数的嵌套深度，顶层为 0 */
    public int getFunctionDepth() {
        return functionData.getDepth();
    }

    void pushScope(Scope scope) {
        scopes.push(scope);
    }

    void popScope() {
        scopes.pop();
    }

    void enterFunction(FunctionNode function) {
        functionData = new FunctionData(functionData.getDepth() + 1, function.getBody().getScope(), function,
                functionData);
        scopes.push(function.getBody().getScope());
    }

    void exitFunction() {
        scopes.pop();
        functionData = functionData.getParent();
    }
}
