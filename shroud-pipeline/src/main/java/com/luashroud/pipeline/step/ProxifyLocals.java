package com.luashroud.pipeline.step;

import com.luashroud.compiler.analysis.Binding;
import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.AssignmentIndexing;
import com.luashroud.compiler.ast.expr.AssignmentTarget;
import com.luashroud.compiler.ast.expr.AssignmentVariable;
import com.luashroud.compiler.ast.expr.BinaryExpression;
import com.luashroud.compiler.ast.expr.Expression;
import com.luashroud.compiler.ast.expr.FunctionCallExpression;
import com.luashroud.compiler.ast.expr.FunctionLiteralExpression;
import com.luashroud.compiler.ast.expr.IndexExpression;
import com.luashroud.compiler.ast.expr.KeyedTableEntry;
import com.luashroud.compiler.ast.expr.NilExpression;
import com.luashroud.compiler.ast.expr.StringExpression;
import com.luashroud.compiler.ast.expr.TableConstructorExpression;
import com.luashroud.compiler.ast.expr.TableField;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.ast.stmt.AssignmentStatement;
import com.luashroud.compiler.ast.stmt.FunctionCallStatement;
import com.luashroud.compiler.ast.stmt.FunctionDeclaration;
import com.luashroud.compiler.ast.stmt.LocalVariableDeclaration;
import com.luashroud.compiler.ast.stmt.ReturnStatement;
import com.luashroud.compiler.ast.stmt.Statement;
import com.luashroud.compiler.visit.AstWalker;
import com.luashroud.compiler.visit.VisitCallback;
import com.luashroud.compiler.visit.VisitContext;
import com.luashroud.compiler.visit.VisitResult;
import com.luashroud.pipeline.AbstractStep;
import com.luashroud.pipeline.PipelineContext;
import com.luashroud.pipeline.config.SettingDescriptor;
import com.luashroud.pipeline.config.StepSettings;
import com.luashroud.pipeline.literal.RandomLiterals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 把局部变量包进带元方法的代理表
 *
 * <p>{@code local x = v} 变成 {@code local x = setmetatable({[key] = v}, mt)}：
 * 读取 {@code x} 改写为 {@code x OP literal}（或 {@code x[literal]}），由 mt 中对应的元方法返回
 * {@code rawget(t, key)}；单目标赋值 {@code x = v} 改写为 {@code EMPTY(x OP v)}，由另一个元方法写入；
 * 其余写入直接改为 {@code x[key] = v}。</p>
 *
 * <p>循环变量、参数、local function、多返回值展开得到的变量不做处理。</p>
 */
public class ProxifyLocals extends AbstractStep {

    private static final Logger LOG = Logger.getLogger(ProxifyLocals.class.getName());

    public static final String NAME = "ProxifyLocals";
    public static final String DESCRIPTION = "Wraps local variables in proxy tables that are accessed through metamethods";
    public static final List<SettingDescriptor> SETTINGS = Collections.unmodifiableList(Arrays.asList(
            SettingDescriptor.enumeration("LiteralType", "string",
                    "Type of the random literals used as operands", "dictionary", "number", "string", "any")
    ));

    // 只用二元元方法：5.1 中表的 __len 不会被调用
    private static final Map<AstKind, String> METAMETHODS = new EnumMap<>(AstKind.class);

    static {
        METAMETHODS.put(AstKind.ADD, "__add");
        METAMETHODS.put(AstKind.SUB, "__sub");
        METAMETHODS.put(AstKind.MUL, "__mul");
        METAMETHODS.put(AstKind.DIV, "__div");
        METAMETHODS.put(AstKind.MOD, "__mod");
        METAMETHODS.put(AstKind.POW, "__pow");
        METAMETHODS.put(AstKind.STR_CAT, "__concat");
    }

    private static final String INDEX_METAMETHOD = "__index";

    private final RandomLiterals.Type literalType;

    public ProxifyLocals(StepSettings settings) {
        super(settings);
        this.literalType = RandomLiterals.Type.of(settings.getString("LiteralType"));
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
     * 一个被代理的变量：写入用的元方法、读取用的元方法和表中真正存值的键
     */
    private static final class Proxy {
        final AstKind setOp;
        /** null 表示用 __index 读取 */
        final AstKind getOp;
        final String valueName;

        Proxy(AstKind setOp, AstKind getOp, String valueName) {
            this.setOp = setOp;
            this.getOp = getOp;
            this.valueName = valueName;
        }

        String getMetamethod() {
            return getOp == null ? INDEX_METAMETHOD : METAMETHODS.get(getOp);
        }
    }

    private final class Run {
        private final TopNode top;
        private final PipelineContext context;
        private final Scope root;
        private final Map<SymbolId, Proxy> proxies = new IdentityHashMap<>();
        private SymbolId setmetatableId;
        private SymbolId emptyId;
        private boolean emptyUsed;

        Run(TopNode top, PipelineContext context) {
            this.top = top;
            this.context = context;
            this.root = top.getBody().getScope();
        }

        TopNode apply() {
            collect();
            if (proxies.isEmpty()) {
                return top;
            }
            setmetatableId = root.addVariable();
            emptyId = root.addVariable();

            TopNode result = AstWalker.walk(top, this::pre, this::post);

            List<Statement> statements = result.getBody().getStatements();
            if (emptyUsed) {
                Scope fn = new Scope(root);
                statements.add(0, new LocalVariableDeclaration(root, Collections.singletonList(emptyId),
                        Collections.singletonList(new FunctionLiteralExpression(Collections.<Expression>emptyList(),
                                Block.functionBody(Collections.<Statement>emptyList(), fn))), NodeTag.GENERATED));
            } else {
                root.removeVariable(emptyId);
            }
            Binding setmetatable = root.resolveGlobal("setmetatable");
            root.addReferenceToHigherScope(setmetatable.getScope(), setmetatable.getId());
            statements.add(0, new LocalVariableDeclaration(root, Collections.singletonList(setmetatableId),
                    Collections.singletonList(new VariableExpression(setmetatable.getScope(), setmetatable.getId())),
                    NodeTag.GENERATED));
            LOG.fine("代理了 " + proxies.size() + " 个局部变量");
            return result;
        }

        // 第一遍：登记可以代理的变量，排除作为 function 语句目标的变量
        private void collect() {
            Set<SymbolId> locked = Collections.newSetFromMap(new IdentityHashMap<SymbolId, Boolean>());
            AstWalker.walk(top, (node, ctx) -> {
                if (node instanceof LocalVariableDeclaration && !node.hasTag(NodeTag.NO_OBFUSCATION)) {
                    LocalVariableDeclaration decl = (LocalVariableDeclaration) node;
                    List<SymbolId> ids = decl.getIds();
                    List<Expression> expressions = decl.getExpressions();
                    int limit = ids.size();
                    if (ids.size() > expressions.size() && !expressions.isEmpty()
                            && expressions.get(expressions.size() - 1).isMultiValued()) {
                        limit = expressions.size() - 1;
                    }
                    for (int i = 0; i < limit; i++) {
                        proxies.put(ids.get(i), newProxy());
                    }
                } else if (node instanceof FunctionDeclaration) {
                    FunctionDeclaration decl = (FunctionDeclaration) node;
                    if (!decl.getScope().isGlobal()) {
                        locked.add(decl.getId());
                    }
                }
                return VisitResult.unchanged();
            }, VisitCallback.NONE);
            proxies.keySet().removeAll(locked);
        }

        private Proxy newProxy() {
            List<AstKind> ops = new ArrayList<>(METAMETHODS.keySet());
            AstKind setOp = ops.get(context.randomInt(0, ops.size() - 1));
            ops.remove(setOp);
            ops.add(null);
            AstKind getOp = ops.get(context.randomInt(0, ops.size() - 1));
            return new Proxy(setOp, getOp, context.generateName(context.randomInt(1, 4096)));
        }

        private VisitResult pre(AstNode node, VisitContext ctx) {
            if (!(node instanceof AssignmentStatement) || node.hasTag(NodeTag.NO_OBFUSCATION)) {
                return VisitResult.unchanged();
            }
            AssignmentStatement assignment = (AssignmentStatement) node;
            if (assignment.getLhs().size() != 1 || assignment.getRhs().size() != 1) {
                return VisitResult.unchanged();
            }
            AssignmentTarget target = assignment.getLhs().get(0);
            Proxy proxy = target instanceof AssignmentVariable ? proxies.get(((AssignmentVariable) target).getId()) : null;
            if (proxy == null) {
                return VisitResult.unchanged();
            }
            // x = v  =>  EMPTY(x SETOP v)
            AssignmentVariable variable = (AssignmentVariable) target;
            Expression self = new VariableExpression(variable.getScope(), variable.getId(), NodeTag.NO_OBFUSCATION);
            ctx.getScope().addReferenceToHigherScope(root, emptyId);
            emptyUsed = true;
            return VisitResult.replace(new FunctionCallStatement(new VariableExpression(root, emptyId),
                    Collections.singletonList(new BinaryExpression(proxy.setOp, self, assignment.getRhs().get(0),
                            NodeTag.GENERATED)), NodeTag.GENERATED));
        }

        private VisitResult post(AstNode node, VisitContext ctx) {
            if (node.hasTag(NodeTag.NO_OBFUSCATION)) {
                return VisitResult.unchanged();
            }
            if (node instanceof VariableExpression) {
                Proxy proxy = proxies.get(((VariableExpression) node).getId());
                if (proxy == null) {
                    return VisitResult.unchanged();
                }
                Expression literal = RandomLiterals.create(literalType, context, proxy.valueName);
                if (proxy.getOp == null) {
                    return VisitResult.replace(new IndexExpression((Expression) node, literal, NodeTag.GENERATED));
                }
                return VisitResult.replace(new BinaryExpression(proxy.getOp, (Expression) node, literal,
                        NodeTag.GENERATED));
            }
            if (node instanceof AssignmentVariable) {
                AssignmentVariable variable = (AssignmentVariable) node;
                Proxy proxy = proxies.get(variable.getId());
                if (proxy == null) {
                    return VisitResult.unchanged();
                }
                return VisitResult.replace(new AssignmentIndexing(
                        new VariableExpression(variable.getScope(), variable.getId(), NodeTag.NO_OBFUSCATION),
                        key(proxy), NodeTag.GENERATED));
            }
            if (node instanceof LocalVariableDeclaration) {
                wrapDeclaration((LocalVariableDeclaration) node);
            }
            return VisitResult.unchanged();
        }

        private void wrapDeclaration(LocalVariableDeclaration decl) {
            List<SymbolId> ids = decl.getIds();
            List<Expression> expressions = decl.getExpressions();
            for (int i = 0; i < ids.size(); i++) {
                Proxy proxy = proxies.get(ids.get(i));
                if (proxy == null) {
                    continue;
                }
                while (expressions.size() <= i) {
                    expressions.add(new NilExpression(NodeTag.GENERATED));
                }
                expressions.set(i, wrap(proxy, expressions.get(i), decl.getScope()));
            }
        }

        // SETMT({[key] = value}, {__set = function(t, v) t[key] = v end, __get = function(t, k) return rawget(t, key) end})
        private Expression wrap(Proxy proxy, Expression value, Scope scope) {
            scope.addReferenceToHigherScope(root, setmetatableId);
            Expression data = new TableConstructorExpression(Collections.singletonList(
                    new KeyedTableEntry(key(proxy), value)), NodeTag.GENERATED);

            Scope setterScope = new Scope(scope);
            SymbolId setterTable = parameter(setterScope);
            SymbolId setterValue = parameter(setterScope);
            setterScope.addReferenceToHigherScope(setterScope, setterTable);
            setterScope.addReferenceToHigherScope(setterScope, setterValue);
            Statement store = new AssignmentStatement(
                    Collections.singletonList(new AssignmentIndexing(
                            new VariableExpression(setterScope, setterTable), key(proxy))),
                    Collections.singletonList(new VariableExpression(setterScope, setterValue)));
            Expression setter = new FunctionLiteralExpression(Arrays.<Expression>asList(
                    new VariableExpression(setterScope, setterTable), new VariableExpression(setterScope, setterValue)),
                    Block.functionBody(Collections.singletonList(store), setterScope));

            Scope getterScope = new Scope(scope);
            SymbolId getterTable = parameter(getterScope);
            SymbolId getterKey = parameter(getterScope);
            getterScope.addReferenceToHigherScope(getterScope, getterTable);
            Binding rawget = getterScope.resolveGlobal("rawget");
            getterScope.addReferenceToHigherScope(rawget.getScope(), rawget.getId());
            Statement load = new ReturnStatement(Collections.singletonList(new FunctionCallExpression(
                    new VariableExpression(rawget.getScope(), rawget.getId()),
                    Arrays.<Expression>asList(new VariableExpression(getterScope, getterTable), key(proxy)))));
            Expression getter = new FunctionLiteralExpression(Arrays.<Expression>asList(
                    new VariableExpression(getterScope, getterTable), new VariableExpression(getterScope, getterKey)),
                    Block.functionBody(Collections.singletonList(load), getterScope));

            List<TableField> metatable = new ArrayList<>();
            metatable.add(new KeyedTableEntry(new StringExpression(METAMETHODS.get(proxy.setOp),
                    NodeTag.NO_OBFUSCATION), setter));
            metatable.add(new KeyedTableEntry(new StringExpression(proxy.getMetamethod(),
                    NodeTag.NO_OBFUSCATION), getter));
            return new FunctionCallExpression(new VariableExpression(root, setmetatableId),
                    Arrays.<Expression>asList(data, new TableConstructorExpression(metatable, NodeTag.GENERATED)),
                    NodeTag.GENERATED);
        }

        // 参数本身算一次引用
        private SymbolId parameter(Scope scope) {
            SymbolId id = scope.addVariable();
            scope.addReferenceToHigherScope(scope, id);
            return id;
        }

        /** 存值的键，较长时拆成几段拼接 */
        private Expression key(Proxy proxy) {
            String name = proxy.valueName;
            if (name.length() < 4 || !context.chance(0.5)) {
                return new StringExpression(name, NodeTag.GENERATED);
            }
            int split = context.randomInt(1, name.length() - 1);
            return new BinaryExpression(AstKind.STR_CAT, new StringExpression(name.substring(0, split),
                    NodeTag.GENERATED), new StringExpression(name.substring(split), NodeTag.GENERATED),
                    NodeTag.GENERATED);
        }
    }
}
