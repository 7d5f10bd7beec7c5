package com.luashroud.compiler.ast;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 代码块：有序语句序列及其引入的作用域
 */
public final class Block extends AstNode {
    private final List<Statement> statements;
    private final Scope scope;
    private final boolean functionBlock;

    public Block(List<? extends Statement> statements, Scope scope, NodeTag... tags) {
        this(statements, scope, false, tags);
    }

    public Block(List<? extends Statement> statements, Scope scope, boolean functionBlock, NodeTag... tags) {
        super(AstKind.BLOCK, tags);
        this.scope = Objects.requireNonNull(scope, "block requires a scope");
        this.statements = new ArrayList<Statement>();
        for (Statement statement : statements) {
            this.statements.add(Objects.requireNonNull(statement, "statement"));
        }
        this.functionBlock = functionBlock;
    }

    /** 函数体代码块 */
    public static Block functionBody(List<? extends Statement> statements, Scope scope, NodeTag... tags) {
        return new Block(statements, scope, true, tags);
    }

    /** 语句列表（可变，pass 可直接插入语句） */
    public List<Statement> getStatements() {
        return statements;
    }

    public Statement getStatement(int index) {
        return statements.get(index);
    }

    public void setStatement(int index, Statement statement) {
        statements.set(index, Objects.requireNonNull(statement, "statement"));
    }

    public void addStatement(int index, Statement statement) {
        statements.add(index, Objects.requireNonNull(statement, "statement"));
    }

    public Scope getScope() {
        return scope;
    }

    /** 是否为函数体：涉及局部变量的改写不能跨过函数参数 */
    public boolean isFunctionBlock() {
        return functionBlock;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
