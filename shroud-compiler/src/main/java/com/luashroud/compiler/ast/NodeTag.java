package com.luashroud.compiler.ast;

/**
 * 节点标记，在构造时固定
 */
public enum NodeTag {
    /** 由 pass 生成的节点 */
    GENERATED,
    /** 后续 pass 不应再改写此节点 */
    NO_OBFUSCATION
}
