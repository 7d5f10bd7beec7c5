package com.luashroud.pipeline.step;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.BinaryExpression;
import com.luashroud.compiler.ast.expr.Expression;
import com.luashroud.compiler.ast.expr.NumberExpression;
import com.luashroud.compiler.ast.expr.UnaryExpression;
import com.luashroud.compiler.visit.AstWalker;
import com.luashroud.compiler.visit.VisitCallback;
import com.luashroud.compiler.visit.VisitResult;
import com.luashroud.pipeline.AbstractStep;
import com.luashroud.pipeline.PipelineContext;
import com.luashroud.pipeline.config.SettingDescriptor;
import com.luashroud.pipeline.config.StepSettings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 把数字字面量替换为随机生成的等值表达式树
 *
 * <p>整数可以拆成加、减、乘、除；非整数只用不改变数值的形式（恒真分支和双重取负）。
 * 生成的叶子数字带 {@link NodeTag#NO_OBFUSCATION}，之后不再被改写。</p>
 */
public class NumbersToExpressions extends AbstractStep {

    public static final String NAME = "NumbersToExpressions";
    public static final String DESCRIPTION = "Replaces number literals with equivalent arithmetic and logic expressions";
    public static final List<SettingDescriptor> SETTINGS = Collections.unmodifiableList(Arrays.asList(
            SettingDescriptor.number("Treshold", 1, 0.0, 1.0,
                    "Probability that a number literal is replaced"),
            SettingDescriptor.number("InternalTreshold", 0.5, 0.0, 0.8,
                    "Probability that a generated operand is expanded again"),
            SettingDescriptor.integer("MaxDepth", 5, 1, 15,
                    "Maximum nesting depth of generated expressions")
    ));

    // 加减乘除只用于这个范围内的整数，保证中间结果精确
    private static final double SAFE_INTEGER = 1L << 31;

    private enum Generator { ADD, SUB, MUL, DIV, BRANCH, NEGATE }

    private final double treshold;
    private final double internalTreshold;
    private final int maxDepth;

    public NumbersToExpressions(StepSettings settings) {
        super(settings);
        this.treshold = settings.getNumber("Treshold");
        this.internalTreshold = settings.getNumber("InternalTreshold");
        this.maxDepth = settings.getInt("MaxDepth");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return DESCRIPTION;
    }

    @Override
    public TopNode apply(TopNode top, PipelineContext context) {
        VisitCallback post = (node, ctx) -> {
            if (node instanceof NumberExpression && !node.hasTag(NodeTag.NO_OBFUSCATION)) {
                double value = ((NumberExpression) node).getValue();
                if (!Double.isNaN(value) && !Double.isInfinite(value) && context.chance(treshold)) {
                    return VisitResult.replace(create(value, 0, context));
                }
            }
            return VisitResult.unchanged();
        };
        return AstWalker.walk(top, VisitCallback.NONE, post);
    }

    Expression create(double value, int depth, PipelineContext context) {
        if (depth > maxDepth || (depth > 0 && !context.chance(internalTreshold))) {
            return leaf(value);
        }
        List<Generator> generators = new ArrayList<Generator>(Arrays.asList(Generator.values()));
        Collections.shuffle(generators, context.getRandom());
        for (Generator generator : generators) {
            Expression expression = generate(generator, value, depth + 1, context);
            if (expression != null) {
                return expression;
            }
        }
        return leaf(value);
    }

    /** 生成器不适用于该数值时返回 null */
    private Expression generate(Generator generator, double value, int depth, PipelineContext context) {
        boolean exactInteger = value == Math.rint(value) && Math.abs(value) < SAFE_INTEGER && !isNegativeZero(value);
        switch (generator) {
            case ADD: {
                if (!exactInteger) return null;
                int r = context.randomInt(-1000, 1000);
                return new BinaryExpression(AstKind.ADD, create(r, depth, context), create(value - r, depth, context),
                        NodeTag.GENERATED);
            }
            case SUB: {
                if (!exactInteger) return null;
                int r = context.randomInt(-1000, 1000);
                return new BinaryExpression(AstKind.SUB, create(value + r, depth, context), create(r, depth, context),
                        NodeTag.GENERATED);
            }
            case MUL: {
                if (!exactInteger || value == 0) return null;
                int factor = context.randomInt(2, 5);
                if (value % factor != 0) return null;
                return new BinaryExpression(AstKind.MUL, create(factor, depth, context),
                        create(value / factor, depth, context), NodeTag.GENERATED);
            }
            case DIV: {
                if (!exactInteger) return null;
                int factor = context.randomInt(2, 5);
                return new BinaryExpression(AstKind.DIV, create(value * factor, depth, context),
                        create(factor, depth, context), NodeTag.GENERATED);
            }
            case BRANCH: {
                // (c == c) and value or junk
                int c = context.randomInt(1, 100);
                int junk = context.randomInt(-5000, 5000);
                Expression condition = new BinaryExpression(AstKind.EQUALS, create(c, depth, context),
                        create(c, depth, context), NodeTag.GENERATED);
                Expression and = new BinaryExpression(AstKind.AND, condition, create(value, depth, context),
                        NodeTag.GENERATED);
                return new BinaryExpression(AstKind.OR, and, create(junk, depth, context), NodeTag.GENERATED);
            }
            case NEGATE:
                return new UnaryExpression(AstKind.NEGATE,
                        new UnaryExpression(AstKind.NEGATE, create(value, depth, context), NodeTag.GENERATED),
                        NodeTag.GENERATED);
            default:
                throw new IllegalStateException("unknown generator " + generator);
        }
    }

    private static boolean isNegativeZero(double value) {
        return value == 0 && 1 / value < 0;
    }

    private static NumberExpression leaf(double value) {
        return new NumberExpression(value, NodeTag.GENERATED, NodeTag.NO_OBFUSCATION);
    }
}
