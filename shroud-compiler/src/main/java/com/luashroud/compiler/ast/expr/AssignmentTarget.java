package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.NodeTag;

/**
 * 赋值语句左侧的目标：变量或索引
 */
public abstract class AssignmentTarget extends AstNode {

    protected AssignmentTarget(AstKind kind, NodeTag... tags) {
        super(kind, tags);
    }
}
