package com.luashroud.pipeline.step;

import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.BinaryExpression;
import com.luashroud.compiler.ast.expr.Expression;
import com.luashroud.compiler.ast.expr.NumberExpression;
import com.luashroud.compiler.ast.expr.UnaryExpression;
import com.luashroud.compiler.ast.stmt.LocalVariableDeclaration;
import com.luashroud.compiler.visit.AstWalker;
import com.luashroud.compiler.visit.VisitCallback;
import com.luashroud.compiler.visit.VisitResult;
import com.luashroud.pipeline.PipelineContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.luashroud.pipeline.step.StepTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * NumbersToExpressions 单元测试
 */
class NumbersToExpressionsTest {

    private static final double[] VALUES = {0, 1, -7, 42, 1000000, 3.5, -0.25, 2147483647.0, 4294967296.0,
            9007199254540994.0};

    /** 按 Lua 语义求值生成的表达式 */
    private static Object eval(Expression expression) {
        if (expression instanceof NumberExpression) {
            return ((NumberExpression) expression).getValue();
        }
        if (expression instanceof UnaryExpression) {
            UnaryExpression unary = (UnaryExpression) expression;
            switch (unary.getKind()) {
                case NEGATE:
                    return -((Double) eval(unary.getOperand()));
                default:
                    throw new AssertionError("unexpected " + unary.getKind());
            }
        }
        BinaryExpression binary = (BinaryExpression) expression;
        Object left = eval(binary.getLeft());
        switch (binary.getKind()) {
            case AND:
                return truthy(left) ? eval(binary.getRight()) : left;
            case OR:
                return truthy(left) ? left : eval(binary.getRight());
            default:
                break;
        }
        Object right = eval(binary.getRight());
        switch (binary.getKind()) {
            case ADD:
                return (Double) left + (Double) right;
            case SUB:
                return (Double) left - (Double) right;
            case MUL:
                return (Double) left * (Double) right;
            case DIV:
                return (Double) left / (Double) right;
            case EQUALS:
                return ((Double) left).doubleValue() == ((Double) right).doubleValue();
            default:
                throw new AssertionError("unexpected " + binary.getKind());
        }
    }

    private static boolean truthy(Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    private static String source() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < VALUES.length; i++) {
            sb.append("local v").append(i).append(" = ").append(VALUES[i]).append('\n');
        }
        return sb.toString();
    }

    @Test
    @DisplayName("生成的表达式求值等于原数值")
    void testValuePreserved() {
        for (long seed = 0; seed < 20; seed++) {
            PipelineContext context = context(seed);
            TopNode top = parse(context, source());
            top = new NumbersToExpressions(settings(NumbersToExpressions.SETTINGS, null)).apply(top, context);
            verify(context, top);

            for (int i = 0; i < VALUES.length; i++) {
                LocalVariableDeclaration decl = (LocalVariableDeclaration) top.getBody().getStatement(i);
                Expression expression = decl.getExpressions().get(0);
                assertFalse(expression instanceof NumberExpression, "seed " + seed + ", value " + VALUES[i]);
                assertEquals(VALUES[i], (Double) eval(expression), 0.0, "seed " + seed);
            }
        }
    }

    @Test
    @DisplayName("生成的叶子不再被改写")
    void testLeavesTagged() {
        PipelineContext context = context(8);
        TopNode top = parse(context, "local a, b = 12, 34 print(a * b)");
        top = new NumbersToExpressions(settings(NumbersToExpressions.SETTINGS, "{\"MaxDepth\": 3}"))
                .apply(top, context);

        List<AstNode> leaves = new ArrayList<AstNode>();
        AstWalker.walk(top, VisitCallback.NONE, (node, ctx) -> {
            if (node instanceof NumberExpression) {
                leaves.add(node);
            }
            return VisitResult.unchanged();
        });
        assertFalse(leaves.isEmpty());
        for (AstNode leaf : leaves) {
            assertTrue(leaf.hasTag(NodeTag.NO_OBFUSCATION));
            assertTrue(leaf.hasTag(NodeTag.GENERATED));
        }
    }

    @Test
    @DisplayName("不改写带 NO_OBFUSCATION 标记的数字")
    void testSkipsTaggedNumbers() {
        PipelineContext context = context(8);
        TopNode top = parse(context, "local a = 1");
        LocalVariableDeclaration decl = (LocalVariableDeclaration) top.getBody().getStatement(0);
        decl.getExpressions().set(0, new NumberExpression(1, NodeTag.NO_OBFUSCATION));
        top = new NumbersToExpressions(settings(NumbersToExpressions.SETTINGS, null)).apply(top, context);
        assertEquals("local a = 1", verify(context, top));
    }

    @Test
    @DisplayName("概率为 0 时不改动")
    void testZeroTreshold() {
        PipelineContext context = context(1);
        TopNode top = parse(context, "print(1, 2.5)");
        top = new NumbersToExpressions(settings(NumbersToExpressions.SETTINGS, "{\"Treshold\": 0}"))
                .apply(top, context);
        assertEquals("print(1, 2.5)", verify(context, top));
    }
}
