package com.luashroud.pipeline.step;

import com.luashroud.compiler.analysis.Binding;
import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.Expression;
import com.luashroud.compiler.ast.expr.FunctionCallExpression;
import com.luashroud.compiler.ast.expr.NumberExpression;
import com.luashroud.compiler.ast.expr.StringExpression;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.splice.TreeSplicer;
import com.luashroud.compiler.visit.AstWalker;
import com.luashroud.compiler.visit.VisitCallback;
import com.luashroud.compiler.visit.VisitResult;
import com.luashroud.pipeline.AbstractStep;
import com.luashroud.pipeline.FragmentTemplates;
import com.luashroud.pipeline.PipelineContext;
import com.luashroud.pipeline.config.SettingDescriptor;
import com.luashroud.pipeline.config.StepSettings;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 加密字符串字面量，运行时由拼接进来的解密函数还原
 *
 * <p>密钥流是线性同余序列 state = (state * a + c) mod 65537，每个字符串有自己的初始状态；
 * 密文字节 = (明文字节 + state) mod 256。</p>
 */
public class EncryptStrings extends AbstractStep {

    private static final Logger LOG = Logger.getLogger(EncryptStrings.class.getName());

    public static final String NAME = "EncryptStrings";
    public static final String DESCRIPTION = "Encrypts string literals and decrypts them at runtime";
    public static final List<SettingDescriptor> SETTINGS = Collections.unmodifiableList(Arrays.asList(
            SettingDescriptor.number("Treshold", 1, 0.0, 1.0,
                    "Probability that a string literal is encrypted")
    ));

    static final int MODULUS = 65537;

    private final double treshold;

    public EncryptStrings(StepSettings settings) {
        super(settings);
        this.treshold = settings.getNumber("Treshold");
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
        Scope root = top.getBody().getScope();
        SymbolId decryptId = root.addVariable();
        int multiplier = 2 * context.randomInt(1, 125) + 1;
        int increment = context.randomInt(1, MODULUS - 1);
        int[] count = {0};

        VisitCallback post = (node, ctx) -> {
            if (!(node instanceof StringExpression) || node.hasTag(NodeTag.NO_OBFUSCATION)
                    || !context.chance(treshold)) {
                return VisitResult.unchanged();
            }
            int seed = context.randomInt(0, MODULUS - 1);
            String encrypted = encrypt(((StringExpression) node).getValue(), seed, multiplier, increment);
            ctx.getScope().addReferenceToHigherScope(root, decryptId);
            count[0]++;
            List<Expression> args = Arrays.<Expression>asList(
                    new StringExpression(encrypted, NodeTag.GENERATED),
                    new NumberExpression(seed, NodeTag.GENERATED, NodeTag.NO_OBFUSCATION));
            return VisitResult.replace(new FunctionCallExpression(new VariableExpression(root, decryptId), args,
                    NodeTag.GENERATED));
        };
        top = AstWalker.walk(top, VisitCallback.NONE, post);

        if (count[0] == 0) {
            root.removeVariable(decryptId);
            return top;
        }
        Map<String, String> values = new HashMap<>();
        values.put("MULTIPLIER", Integer.toString(multiplier));
        values.put("INCREMENT", Integer.toString(increment));
        values.put("MODULUS", Integer.toString(MODULUS));
        context.getSplicer().splice(FragmentTemplates.render("encrypt_strings", values), top.getBody(), 0,
                TreeSplicer.bindings("DECRYPT", new Binding(root, decryptId)));
        LOG.fine("加密了 " + count[0] + " 个字符串");
        return top;
    }

    /**
     * 加密（字符按 ISO-8859-1 字节处理）
     */
    static String encrypt(String plain, int seed, int multiplier, int increment) {
        StringBuilder sb = new StringBuilder(plain.length());
        long state = seed;
        for (int i = 0; i < plain.length(); i++) {
            state = (state * multiplier + increment) % MODULUS;
            sb.append((char) ((plain.charAt(i) + state) & 0xFF));
        }
        return sb.toString();
    }

    /** 与拼接进去的 Lua 解密函数相同的算法 */
    static String decrypt(String cipher, int seed, int multiplier, int increment) {
        StringBuilder sb = new StringBuilder(cipher.length());
        long state = seed;
        for (int i = 0; i < cipher.length(); i++) {
            state = (state * multiplier + increment) % MODULUS;
            sb.append((char) Math.floorMod(cipher.charAt(i) - state, 256));
        }
        return sb.toString();
    }
}
