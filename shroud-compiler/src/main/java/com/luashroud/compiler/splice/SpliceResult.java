package com.luashroud.compiler.splice;

import com.luashroud.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 一次拼接的结果
 */
public final class SpliceResult {
    private final List<Statement> statements;
    private final int position;
    private final List<String> unmatchedBindings;

    SpliceResult(List<Statement> statements, int position, List<String> unmatchedBindings) {
        this.statements = Collections.unmodifiableList(statements);
        this.position = position;
        this.unmatchedBindings = Collections.unmodifiableList(unmatchedBindings);
    }

    /** 插入宿主代码块的语句，按原顺序 */
    public List<Statement> getStatements() { return statements; }

    /** 第一条插入语句在宿主代码块中的下标 */
    public int getPosition() { return position; }

    /** 片段中既未声明也未引用的绑定名 */
    public List<String> getUnmatchedBindings() { return unmatchedBindings; }
}
