package com.luashroud.pipeline.step;

import com.luashroud.compiler.analysis.Binding;
import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.BinaryExpression;
import com.luashroud.compiler.ast.expr.Expression;
import com.luashroud.compiler.ast.expr.FunctionCallExpression;
import com.luashroud.compiler.ast.expr.FunctionLiteralExpression;
import com.luashroud.compiler.ast.expr.IndexExpression;
import com.luashroud.compiler.ast.expr.KeyedTableEntry;
import com.luashroud.compiler.ast.expr.NumberExpression;
import com.luashroud.compiler.ast.expr.StringExpression;
import com.luashroud.compiler.ast.expr.TableConstructorExpression;
import com.luashroud.compiler.ast.expr.TableEntry;
import com.luashroud.compiler.ast.expr.TableField;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.ast.stmt.LocalFunctionDeclaration;
import com.luashroud.compiler.ast.stmt.LocalVariableDeclaration;
import com.luashroud.compiler.ast.stmt.ReturnStatement;
import com.luashroud.compiler.ast.stmt.Statement;
import com.luashroud.compiler.splice.SpliceResult;
import com.luashroud.compiler.splice.TreeSplicer;
import com.luashroud.compiler.visit.AstWalker;
import com.luashroud.compiler.visit.FunctionData;
import com.luashroud.compiler.visit.VisitCallback;
import com.luashroud.compiler.visit.VisitContext;
import com.luashroud.compiler.visit.VisitResult;
import com.luashroud.pipeline.AbstractStep;
import com.luashroud.pipeline.FragmentTemplates;
import com.luashroud.pipeline.PipelineContext;
import com.luashroud.pipeline.config.SettingDescriptor;
import com.luashroud.pipeline.config.StepSettings;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 把常量提取到程序开头的数组中，原位置改为通过包装函数按下标读取
 *
 * <ul>
 *   <li>包装函数：{@code local function WRAP(i) return ARR[i + OFFSET] end}，调用处传入 {@code index - OFFSET}</li>
 *   <li>Shuffle：打乱常量顺序；Rotate：数组按随机位移存放，开头的片段把它转回来</li>
 *   <li>Encoding=base64：字符串用打乱的字母表编码，开头的片段解码</li>
 *   <li>局部包装表：函数体开头声明 {@code local W = { k = function(...) return WRAP(p + d) end }}，
 *       函数内的常量改为 {@code W.k(...)}</li>
 * </ul>
 */
public class ConstantArray extends AbstractStep {

    private static final Logger LOG = Logger.getLogger(ConstantArray.class.getName());

    public static final String NAME = "ConstantArray";
    public static final String DESCRIPTION = "Extracts constants into an array at the beginning of the script";
    public static final List<SettingDescriptor> SETTINGS = Collections.unmodifiableList(Arrays.asList(
            SettingDescriptor.number("Treshold", 1, 0.0, 1.0,
                    "Probability that a constant is extracted"),
            SettingDescriptor.bool("StringsOnly", false,
                    "Only extract strings"),
            SettingDescriptor.bool("Shuffle", true,
                    "Shuffle the order of the constants"),
            SettingDescriptor.bool("Rotate", true,
                    "Store the array rotated by a random amount and rotate it back at runtime"),
            SettingDescriptor.number("LocalWrapperTreshold", 1, 0.0, 1.0,
                    "Probability that a function gets its own wrapper table"),
            SettingDescriptor.integer("LocalWrapperCount", 0, 0, 512,
                    "Number of wrapper functions in each local wrapper table"),
            SettingDescriptor.integer("LocalWrapperArgCount", 10, 1, 200,
                    "Number of arguments of each local wrapper function"),
            SettingDescriptor.integer("MaxWrapperOffset", 65535, 0, null,
                    "Maximum offset added to indices passed to wrapper functions"),
            SettingDescriptor.enumeration("Encoding", "base64",
                    "Encoding applied to string constants", "none", "base64")
    ));

    private static final String BASE64_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";
    private static final FunctionData.Key<Run.LocalWrappers> LOCAL_WRAPPERS = new FunctionData.Key<>("constantArray.localWrappers");

    private final double treshold;
    private final boolean stringsOnly;
    private final boolean shuffle;
    private final boolean rotate;
    private final double localWrapperTreshold;
    private final int localWrapperCount;
    private final int localWrapperArgCount;
    private final int maxWrapperOffset;
    private final boolean base64;

    public ConstantArray(StepSettings settings) {
        super(settings);
        this.treshold = settings.getNumber("Treshold");
        this.stringsOnly = settings.getBoolean("StringsOnly");
        this.shuffle = settings.getBoolean("Shuffle");
        this.rotate = settings.getBoolean("Rotate");
        this.localWrapperTreshold = settings.getNumber("LocalWrapperTreshold");
        this.localWrapperCount = settings.getInt("LocalWrapperCount");
        this.localWrapperArgCount = settings.getInt("LocalWrapperArgCount");
        this.maxWrapperOffset = settings.getInt("MaxWrapperOffset");
        this.base64 = "base64".equals(settings.getString("Encoding"));
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
        return new Run(top, context).apply();
    }

    /**
     * 一次执行的状态
     */
    private final class Run {
        private final TopNode top;
        private final PipelineContext context;
        private final Scope root;
        private final Set<AstNode> selected = Collections.newSetFromMap(new IdentityHashMap<AstNode, Boolean>());
        private final List<Object> constants = new ArrayList<>();
        private final Map<Object, Integer> lookup = new HashMap<>();
        private final List<LocalWrappers> localWrappers = new ArrayList<>();
        private SymbolId arrId;
        private SymbolId wrapperId;
        private int wrapperOffset;

        Run(TopNode top, PipelineContext context) {
            this.top = top;
            this.context = context;
            this.root = top.getBody().getScope();
        }

        TopNode apply() {
            collect();
            if (constants.isEmpty()) {
                return top;
            }
            if (shuffle) {
                Collections.shuffle(constants, context.getRandom());
            }
            for (int i = 0; i < constants.size(); i++) {
                lookup.put(constants.get(i), i + 1);
            }
            arrId = root.addVariable();
            wrapperId = root.addVariable();
            wrapperOffset = context.randomInt(-maxWrapperOffset, maxWrapperOffset);

            TopNode result = AstWalker.walk(top, VisitCallback.NONE, this::replace);
            for (LocalWrappers wrappers : localWrappers) {
                if (wrappers.used) {
                    wrappers.function.getFunction().getBody().getStatements().add(0, wrappers.declaration());
                } else {
                    wrappers.scope.removeVariable(wrappers.tableId);
                }
            }
            insertPrelude();
            LOG.fine("提取常量 " + constants.size() + " 个，局部包装表 " + localWrappers.size() + " 个");
            return result;
        }

        // 第一遍：按概率挑选常量
        private void collect() {
            AstWalker.walk(top, (node, ctx) -> {
                Object value = constantOf(node);
                if (value != null && context.chance(treshold)) {
                    selected.add(node);
                    if (!lookup.containsKey(value)) {
                        lookup.put(value, constants.size());
                        constants.add(value);
                    }
                }
                return VisitResult.unchanged();
            }, VisitCallback.NONE);
            lookup.clear();
        }

        private Object constantOf(AstNode node) {
            if (node.hasTag(NodeTag.NO_OBFUSCATION)) {
                return null;
            }
            if (node instanceof StringExpression) {
                return ((StringExpression) node).getValue();
            }
            if (!stringsOnly && node instanceof NumberExpression) {
                return ((NumberExpression) node).getValue();
            }
            return null;
        }

        // 第二遍：把选中的常量换成包装函数调用
        private VisitResult replace(AstNode node, VisitContext ctx) {
            if (!selected.contains(node)) {
                return VisitResult.unchanged();
            }
            int index = lookup.get(constantOf(node)) - wrapperOffset;
            FunctionData function = ctx.getFunctionData();
            if (!function.isTopLevel() && localWrapperCount > 0) {
                LocalWrappers wrappers = function.computeIfAbsent(LOCAL_WRAPPERS, () -> newLocalWrappers(function));
                if (wrappers.enabled) {
                    return VisitResult.replace(wrappers.call(index, ctx.getScope()));
                }
            }
            ctx.getScope().addReferenceToHigherScope(root, wrapperId);
            return VisitResult.replace(new FunctionCallExpression(new VariableExpression(root, wrapperId),
                    Collections.<Expression>singletonList(new NumberExpression(index)), NodeTag.GENERATED));
        }

        private LocalWrappers newLocalWrappers(FunctionData function) {
            LocalWrappers wrappers = new LocalWrappers(function, context.chance(localWrapperTreshold));
            if (wrappers.enabled) {
                wrappers.tableId = wrappers.scope.addVariable();
                Set<String> keys = new HashSet<>();
                for (int i = 0; i < localWrapperCount; i++) {
                    String key;
                    do {
                        key = context.randomString(context.randomInt(4, 10));
                    } while (!keys.add(key));
                    wrappers.entries.add(new LocalWrapper(key,
                            context.randomInt(0, localWrapperArgCount - 1),
                            context.randomInt(-maxWrapperOffset, maxWrapperOffset)));
                }
                localWrappers.add(wrappers);
            }
            return wrappers;
        }

        private void insertPrelude() {
            Block body = top.getBody();
            int size = constants.size();
            int shift = rotate && size > 1 ? context.randomInt(1, size - 1) : 0;

            List<TableField> entries = new ArrayList<>();
            Map<Character, Character> alphabet = base64 ? shuffledAlphabet() : null;
            for (int i = 0; i < size; i++) {
                Object value = constants.get((i + shift) % size);
                Expression expression;
                if (value instanceof String) {
                    String text = alphabet != null ? encode((String) value, alphabet) : (String) value;
                    expression = new StringExpression(text, NodeTag.GENERATED, NodeTag.NO_OBFUSCATION);
                } else {
                    expression = new NumberExpression((Double) value, NodeTag.GENERATED, NodeTag.NO_OBFUSCATION);
                }
                entries.add(new TableEntry(expression));
            }
            body.getStatements().add(0, new LocalVariableDeclaration(root, Collections.singletonList(arrId),
                    Collections.singletonList(new TableConstructorExpression(entries)), NodeTag.GENERATED));

            int position = 1;
            TreeSplicer splicer = context.getSplicer();
            Binding arr = new Binding(root, arrId);
            if (shift > 0) {
                Map<String, String> values = new HashMap<>();
                values.put("LENGTH", Integer.toString(size));
                values.put("SHIFT", Integer.toString(shift));
                SpliceResult result = splicer.splice(FragmentTemplates.render("constant_array_rotate", values),
                        body, position, TreeSplicer.bindings("ARR", arr));
                position += result.getStatements().size();
            }
            if (alphabet != null && hasStrings()) {
                Map<String, String> values = new HashMap<>();
                values.put("LOOKUP", lookupTable(alphabet));
                SpliceResult result = splicer.splice(FragmentTemplates.render("constant_array_base64", values),
                        body, position, TreeSplicer.bindings("ARR", arr));
                position += result.getStatements().size();
            }
            body.getStatements().add(position, wrapperDeclaration());
        }

        private boolean hasStrings() {
            for (Object value : constants) {
                if (value instanceof String) return true;
            }
            return false;
        }

        // local function WRAP(i) return ARR[i + OFFSET] end
        private Statement wrapperDeclaration() {
            Scope scope = new Scope(root);
            SymbolId arg = scope.addVariable();
            scope.addReferenceToHigherScope(scope, arg, 2);
            scope.addReferenceToHigherScope(root, arrId);
            Expression index = offset(new VariableExpression(scope, arg), wrapperOffset);
            Block body = Block.functionBody(Collections.singletonList(new ReturnStatement(Collections.singletonList(
                    new IndexExpression(new VariableExpression(root, arrId), index)))), scope);
            return new LocalFunctionDeclaration(root, wrapperId,
                    Collections.singletonList(new VariableExpression(scope, arg)), body, NodeTag.GENERATED);
        }

        private Map<Character, Character> shuffledAlphabet() {
            List<Character> chars = new ArrayList<>();
            for (char c : BASE64_CHARS.toCharArray()) {
                chars.add(c);
            }
            Collections.shuffle(chars, context.getRandom());
            Map<Character, Character> map = new HashMap<>();
            for (int i = 0; i < BASE64_CHARS.length(); i++) {
                map.put(BASE64_CHARS.charAt(i), chars.get(i));
            }
            return map;
        }

        /**
         * 一个函数的局部包装表
         */
        private final class LocalWrappers {
            final FunctionData function;
            final Scope scope;
            final boolean enabled;
            final List<LocalWrapper> entries = new ArrayList<>();
            SymbolId tableId;
            boolean used;

            LocalWrappers(FunctionData function, boolean enabled) {
                this.function = function;
                this.scope = function.getScope();
                this.enabled = enabled;
            }

            // W.k(a1, ..., aN)，第 argIndex 个参数是真正的下标
            Expression call(int index, Scope usage) {
                used = true;
                LocalWrapper wrapper = entries.get(context.randomInt(0, entries.size() - 1));
                usage.addReferenceToHigherScope(scope, tableId);
                List<Expression> args = new ArrayList<>();
                for (int i = 0; i < localWrapperArgCount; i++) {
                    if (i == wrapper.argIndex) {
                        args.add(new NumberExpression(index - wrapper.offset));
                    } else {
                        args.add(new NumberExpression(context.randomInt(-maxWrapperOffset, maxWrapperOffset),
                                NodeTag.GENERATED, NodeTag.NO_OBFUSCATION));
                    }
                }
                return new FunctionCallExpression(new IndexExpression(new VariableExpression(scope, tableId),
                        new StringExpression(wrapper.key, NodeTag.GENERATED, NodeTag.NO_OBFUSCATION)), args,
                        NodeTag.GENERATED);
            }

            // local W = { k = function(p1, ..., pN) return WRAP(p + d) end, ... }
            Statement declaration() {
                List<TableField> fields = new ArrayList<>();
                for (LocalWrapper wrapper : entries) {
                    Scope fnScope = new Scope(scope);
                    List<Expression> params = new ArrayList<>();
                    SymbolId real = null;
                    for (int i = 0; i < localWrapperArgCount; i++) {
                        SymbolId id = fnScope.addVariable();
                        fnScope.addReferenceToHigherScope(fnScope, id);
                        params.add(new VariableExpression(fnScope, id));
                        if (i == wrapper.argIndex) {
                            real = id;
                        }
                    }
                    fnScope.addReferenceToHigherScope(fnScope, real);
                    fnScope.addReferenceToHigherScope(root, wrapperId);
                    Expression call = new FunctionCallExpression(new VariableExpression(root, wrapperId),
                            Collections.singletonList(offset(new VariableExpression(fnScope, real), wrapper.offset)));
                    Block body = Block.functionBody(Collections.singletonList(
                            new ReturnStatement(Collections.singletonList(call))), fnScope);
                    fields.add(new KeyedTableEntry(new StringExpression(wrapper.key, NodeTag.NO_OBFUSCATION),
                            new FunctionLiteralExpression(params, body)));
                }
                return new LocalVariableDeclaration(scope, Collections.singletonList(tableId),
                        Collections.singletonList(new TableConstructorExpression(fields)), NodeTag.GENERATED);
            }
        }
    }

    private static final class LocalWrapper {
        final String key;
        final int argIndex;
        final int offset;

        LocalWrapper(String key, int argIndex, int offset) {
            this.key = key;
            this.argIndex = argIndex;
            this.offset = offset;
        }
    }

    /** value + offset，负偏移写成减法 */
    private static Expression offset(Expression value, int offset) {
        if (offset < 0) {
            return new BinaryExpression(AstKind.SUB, value, new NumberExpression(-offset), NodeTag.GENERATED);
        }
        return new BinaryExpression(AstKind.ADD, value, new NumberExpression(offset), NodeTag.GENERATED);
    }

    /**
     * 用替换后的字母表做 base64 编码（字符按 ISO-8859-1 字节处理）
     */
    static String encode(String value, Map<Character, Character> alphabet) {
        String standard = Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.ISO_8859_1));
        StringBuilder sb = new StringBuilder(standard.length());
        for (int i = 0; i < standard.length(); i++) {
            char c = standard.charAt(i);
            sb.append(c == '=' ? c : alphabet.get(c));
        }
        return sb.toString();
    }

    /** 解码片段用的 {["x"]=n, ...} 表 */
    static String lookupTable(Map<Character, Character> alphabet) {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < BASE64_CHARS.length(); i++) {
            if (i > 0) sb.append(", ");
            sb.append("[\"").append(alphabet.get(BASE64_CHARS.charAt(i))).append("\"] = ").append(i);
        }
        return sb.append('}').toString();
    }
}
