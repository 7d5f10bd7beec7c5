package com.luashroud.compiler.visit;

import com.luashroud.compiler.ast.AstNode;

/**
 * 遍历回调的返回值：不变、替换为另一节点、或跳过子节点（仅前序回调有效）
 */
public final class VisitResult {

    enum Action {
        UNCHANGED,
        REPLACE,
        SKIP_CHILDREN
    }

    private static final VisitResult UNCHANGED = new VisitResult(Action.UNCHANGED, null);
    private static final VisitResult SKIP_CHILDREN = new VisitResult(Action.SKIP_CHILDREN, null);

    private final Action action;
    private final AstNode replacement;

    private VisitResult(Action action, AstNode replacement) {
        this.action = action;
        this.replacement = replacement;
    }

    public static VisitResult unchanged() {
        return UNCHANGED;
    }

    /**
     * 用 replacement 替换当前节点，写回父节点的同一位置
     */
    public static VisitResult replace(AstNode replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("replacement must not be null, use VisitResult.unchanged()");
        }
        return new VisitResult(Action.REPLACE, replacement);
    }

    public static VisitResult skipChildren() {
        return SKIP_CHILDREN;
    }

    Action getAction() {
        return action;
    }

    public boolean isUnchanged() {
        return action == Action.UNCHANGED;
    }

    public boolean isReplace() {
        return action == Action.REPLACE;
    }

    public boolean isSkipChildren() {
        return action == Action.SKIP_CHILDREN;
    }

    public AstNode getReplacement() {
        return replacement;
    }

    @Override
    public String toString() {
        return action == Action.REPLACE ? "REPLACE(" + replacement + ")" : action.name();
    }
}
