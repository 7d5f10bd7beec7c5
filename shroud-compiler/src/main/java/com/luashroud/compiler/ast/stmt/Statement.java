package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.NodeTag;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(AstKind kind, NodeTag... tags) {
        super(kind, tags);
    }
}
