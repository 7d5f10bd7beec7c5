package com.luashroud.compiler.ast;

/**
 * 树结构不合法：某个 pass 产生了形状错误的树。属于内部错误，不可恢复。
 */
public class MalformedTreeException extends RuntimeException {

    public MalformedTreeException(String message) {
        super(message);
    }

    public MalformedTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
