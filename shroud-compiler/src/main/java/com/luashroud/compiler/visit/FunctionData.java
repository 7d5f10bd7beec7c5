package com.luashroud.compiler.visit;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.ast.FunctionNode;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 一次遍历中某个外围函数的记录。
 *
 * <p>pass 可以在函数第一条语句处写入属性，在函数体的后序回调中读取（例如“需要在函数开头插入辅助变量”）。
 * 顶层代码对应深度为 0、函数节点为 null 的记录。</p>
 */
public final class FunctionData {
    private final int depth;
    private final Scope scope;
    private final FunctionNode function;
    private final FunctionData parent;
    private final Map<Key<?>, Object> attributes = new IdentityHashMap<Key<?>, Object>();

    FunctionData(int depth, Scope scope, FunctionNode function, FunctionData parent) {
        this.depth = depth;
        this.scope = scope;
        this.function = function;
        this.parent = parent;
    }

    public int getDepth() { return depth; }

    /** 函数体作用域（顶层为主代码块作用域） */
    public Scope getScope() { return scope; }

    public FunctionNode getFunction() { return function; }
    public FunctionData getParent() { return parent; }
    public boolean isTopLevel() { return function == null; }

    @SuppressWarnings("unchecked")
    public <T> T get(Key<T> key) {
        return (T) attributes.get(key);
    }

    public <T> void put(Key<T> key, T value) {
        attributes.put(key, value);
    }

    public <T> T computeIfAbsent(Key<T> key, Supplier<? extends T> factory) {
        T value = get(key);
        if (value == null) {
            value = factory.get();
            attributes.put(key, value);
        }
        return value;
    }

    public boolean has(Key<?> key) {
        return attributes.containsKey(key);
    }

    /**
     * 属性键，按引用区分
     */
    public static final class Key<T> {
        private final String name;

        public Key(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
