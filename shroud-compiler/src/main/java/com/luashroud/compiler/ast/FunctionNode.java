package com.luashroud.compiler.ast;

import com.luashroud.compiler.ast.expr.Expression;
import com.luashroud.compiler.ast.expr.VarargExpression;
import com.luashroud.compiler.ast.expr.VariableExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 带参数列表和函数体的节点：函数字面量、local function、function 语句
 */
public interface FunctionNode {

    /** 参数列表：函数体作用域中声明的变量，最后可以跟一个 ... */
    List<Expression> getArgs();

    Block getBody();

    void setBody(Block body);

    /** 参数中是否包含 ... */
    default boolean isVararg() {
        List<Expression> args = getArgs();
        return !args.isEmpty() && args.get(args.size() - 1) instanceof VarargExpression;
    }

    /**
     * 检查参数列表与函数体是否匹配，返回参数列表的可变副本
     */
    static List<Expression> checkSignature(List<? extends Expression> args, Block body) {
        Objects.requireNonNull(body, "function requires a body");
        if (!body.isFunctionBlock()) {
            throw new IllegalArgumentException("function body must be a function block");
        }
        List<Expression> copy = new ArrayList<Expression>(args.size());
        for (int i = 0; i < args.size(); i++) {
            Expression arg = Objects.requireNonNull(args.get(i), "arg");
            if (arg instanceof VarargExpression) {
                if (i != args.size() - 1) {
                    throw new IllegalArgumentException("'...' must be the last parameter");
                }
            } else if (arg instanceof VariableExpression) {
                if (((VariableExpression) arg).getScope() != body.getScope()) {
                    throw new IllegalArgumentException("parameters must be declared in the function body scope");
                }
            } else {
                throw new IllegalArgumentException("invalid parameter node: " + arg.getKind());
            }
            copy.add(arg);
        }
        return copy;
    }
}
