package com.luashroud.compiler.analysis;

import com.luashroud.compiler.ast.MalformedTreeException;

/**
 * 作用域一致性错误：未声明的名字、越界引用或引用账目不一致。
 *
 * <p>总是表示某个改写产生了非法的语法树。</p>
 */
public class ScopeConsistencyException extends MalformedTreeException {

    public ScopeConsistencyException(String message) {
        super(message);
    }
}
