package com.luashroud.compiler.visit;

import com.luashroud.compiler.ast.AstNode;

/**
 * 遍历回调
 */
@FunctionalInterface
public interface VisitCallback {

    /** 什么也不做 */
    VisitCallback NONE = new VisitCallback() {
        @Override
        public VisitResult visit(AstNode node, VisitContext context) {
            return VisitResult.unchanged();
        }
    };

    VisitResult visit(AstNode node, VisitContext context);
}
