package com.luashroud.pipeline.literal;

import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;
import com.luashroud.compiler.ast.expr.KeyedTableEntry;
import com.luashroud.compiler.ast.expr.NumberExpression;
import com.luashroud.compiler.ast.expr.StringExpression;
import com.luashroud.compiler.ast.expr.TableConstructorExpression;
import com.luashroud.pipeline.PipelineContext;

import java.util.Collections;
import java.util.Locale;

/**
 * 随机字面量，用作无意义的表键或运算数
 */
public final class RandomLiterals {

    public enum Type {
        DICTIONARY,
        NUMBER,
        STRING,
        ANY;

        /** 按设置值（不区分大小写）取类型 */
        public static Type of(String name) {
            return valueOf(name.toUpperCase(Locale.ROOT));
        }
    }

    private RandomLiterals() {
    }

    /**
     * 生成指定类型的随机字面量
     *
     * @param exclude 生成字符串时必须避开的值，可以为 null
     */
    public static Expression create(Type type, PipelineContext context, String exclude) {
        switch (type) {
            case DICTIONARY:
                return dictionary(context);
            case NUMBER:
                return number(context);
            case STRING:
                return string(context, exclude);
            case ANY:
                Type[] concrete = {Type.DICTIONARY, Type.NUMBER, Type.STRING};
                return create(concrete[context.randomInt(0, concrete.length - 1)], context, exclude);
            default:
                throw new IllegalArgumentException("unknown literal type " + type);
        }
    }

    /** {name = n} */
    public static Expression dictionary(PipelineContext context) {
        return new TableConstructorExpression(Collections.singletonList(new KeyedTableEntry(
                new StringExpression(context.randomString(context.randomInt(3, 8)), NodeTag.GENERATED),
                number(context))), NodeTag.GENERATED);
    }

    public static Expression number(PipelineContext context) {
        return new NumberExpression(context.randomInt(-65536, 65536), NodeTag.GENERATED);
    }

    public static Expression string(PipelineContext context, String exclude) {
        String value;
        do {
            value = context.randomString(context.randomInt(2, 10));
        } while (value.equals(exclude));
        return new StringExpression(value, NodeTag.GENERATED);
    }
}
