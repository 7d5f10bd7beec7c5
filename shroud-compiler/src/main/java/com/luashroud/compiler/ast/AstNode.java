package com.luashroud.compiler.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * AST 节点基类
 *
 * <p>节点按引用区分身份，不做结构相等比较。节点由父容器独占持有，pass 可以把节点移动到新的父节点下，但不能让两个父节点共享同一个节点。</p>
 */
public abstract class AstNode {
    private final AstKind kind;
    private final Set<NodeTag> tags;

    protected AstNode(AstKind kind, NodeTag... tags) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (tags == null || tags.length == 0) {
            this.tags = Collections.emptySet();
        } else {
            this.tags = Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(tags)));
        }
    }

    public AstKind getKind() {
        return kind;
    }

    /** 构造时固定的标记集合（不可变） */
    public Set<NodeTag> getTags() {
        return tags;
    }

    public boolean hasTag(NodeTag tag) {
        return tags.contains(tag);
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return kind.name();
    }
}
