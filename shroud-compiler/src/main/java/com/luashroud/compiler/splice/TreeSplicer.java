package com.luashroud.compiler.splice;

import com.luashroud.compiler.analysis.Binding;
import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.ScopeConsistencyException;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.AssignmentVariable;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.ast.stmt.FunctionDeclaration;
import com.luashroud.compiler.ast.stmt.LocalFunctionDeclaration;
import com.luashroud.compiler.ast.stmt.LocalVariableDeclaration;
import com.luashroud.compiler.ast.stmt.Statement;
import com.luashroud.compiler.parser.ParseException;
import com.luashroud.compiler.parser.Parser;
import com.luashroud.compiler.visit.AstWalker;
import com.luashroud.compiler.visit.VisitCallback;
import com.luashroud.compiler.visit.VisitContext;
import com.luashroud.compiler.visit.VisitResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把独立解析的代码片段并入宿主树
 *
 * <p>步骤：解析片段；把片段的顶层作用域挂到宿主代码块的作用域下并改挂全局引用；
 * 按绑定表把导出名和导入名改写为宿主预先分配的符号；把片段顶层作用域并入宿主作用域；
 * 最后把片段的顶层语句按原顺序插入宿主代码块。</p>
 *
 * <ul>
 *   <li>导出：片段顶层声明的名字。声明和全部引用改为宿主符号，片段内的标识被移除。
 *       宿主符号必须声明在宿主代码块的作用域中。</li>
 *   <li>导入：片段中的自由（全局）名字。全部引用改为宿主符号，宿主符号必须对插入位置可见。</li>
 * </ul>
 *
 * <p>不在绑定表中的辅助变量保留片段私有的标识；顶层私有变量与宿主可见的名字同名时改为树中唯一的名字。</p>
 */
public class TreeSplicer {

    private static final Logger LOG = Logger.getLogger(TreeSplicer.class.getName());

    private final Parser parser;

    public TreeSplicer(Parser parser) {
        this.parser = parser;
    }

    public Parser getParser() {
        return parser;
    }

    /**
     * @param fragmentSource 片段源码，使用宿主的方言解析
     * @param hostBlock      插入目标
     * @param position       插入下标，0 表示最前
     * @param bindings       片段中的名字 → 宿主符号
     * @throws ParseException 片段无法解析
     */
    public SpliceResult splice(String fragmentSource, Block hostBlock, int position, Map<String, Binding> bindings) {
        if (position < 0 || position > hostBlock.getStatements().size()) {
            throw new IllegalArgumentException("insert position " + position + " out of range 0.."
                    + hostBlock.getStatements().size());
        }
        TopNode fragment = parser.parse(fragmentSource, "<fragment>");
        Block body = fragment.getBody();
        Scope fragmentScope = body.getScope();
        Scope fragmentRoot = fragment.getGlobalScope();
        Scope hostScope = hostBlock.getScope();
        Scope hostRoot = hostScope.getGlobalScope();

        // 片段驻留前宿主中没有的全局名字；若最终没有引用，挂接后再移除
        Set<String> newGlobals = new HashSet<String>();
        for (SymbolId id : fragmentRoot.getVariables()) {
            String name = fragmentRoot.getVariableName(id);
            if (hostRoot.resolveLocal(name) == null) {
                newGlobals.add(name);
            }
        }

        Map<SymbolId, SymbolId> globals = fragmentScope.attachTo(hostScope);

        Map<SymbolId, Binding> targets = new IdentityHashMap<SymbolId, Binding>();
        for (Map.Entry<SymbolId, SymbolId> e : globals.entrySet()) {
            targets.put(e.getKey(), new Binding(hostRoot, e.getValue()));
        }

        // 导出与导入：需要移动账目的标识
        Map<SymbolId, Binding> exports = new IdentityHashMap<SymbolId, Binding>();
        Map<SymbolId, Binding> imports = new IdentityHashMap<SymbolId, Binding>();
        List<String> unmatched = new ArrayList<String>();
        for (Map.Entry<String, Binding> e : bindings.entrySet()) {
            String name = e.getKey();
            Binding host = e.getValue();
            SymbolId local = fragmentScope.resolveLocal(name);
            SymbolId free = fragmentRoot.resolveLocal(name);
            if (local != null) {
                if (host.getScope() != hostScope) {
                    throw new ScopeConsistencyException("exported binding '" + name
                            + "' must be declared in the host block scope");
                }
                exports.put(local, host);
                targets.put(local, host);
            } else if (free != null && globals.containsKey(free)) {
                if (!host.getScope().isAncestorOf(hostScope)) {
                    throw new ScopeConsistencyException("imported binding '" + name
                            + "' is not visible from the host block");
                }
                imports.put(free, host);
                targets.put(free, host);
            } else {
                unmatched.add(name);
                LOG.warning("片段中没有名字 '" + name + "'，宿主符号 " + host + " 未被使用");
            }
        }

        // 第一遍：改写引用节点，同时把导出与导入的账目移到宿主符号
        AstWalker.walk(body, hostScope, VisitCallback.NONE,
                new ReferenceRebinder(targets, exports, imports, fragmentScope, hostRoot, globals));

        for (SymbolId local : exports.keySet()) {
            fragmentScope.removeVariable(local);
        }
        for (Map.Entry<SymbolId, SymbolId> e : globals.entrySet()) {
            SymbolId hostId = e.getValue();
            String name = hostRoot.getVariableName(hostId);
            if (newGlobals.contains(name) && hostRoot.getReferenceCount(hostId) == 0) {
                hostRoot.removeVariable(hostId);
            }
        }

        // 私有顶层变量与宿主可见的局部或全局名字同名时改名，否则会截获宿主的引用
        for (SymbolId id : fragmentScope.getVariables()) {
            String name = fragmentScope.getVariableName(id);
            if (hostScope.resolve(name) != null || hostRoot.resolveLocal(name) != null) {
                String fresh = hostRoot.uniqueName();
                fragmentScope.renameVariable(id, fresh);
                LOG.fine("片段私有变量 '" + name + "' 与宿主名字冲突，改名为 " + fresh);
            }
        }

        // 第二遍：片段顶层作用域并入宿主作用域后，改写仍指向它的节点
        fragmentScope.mergeIntoParent();
        AstWalker.walk(body, hostScope, VisitCallback.NONE, new DeclarationRebinder(fragmentScope, hostScope, exports));

        List<Statement> statements = new ArrayList<Statement>(body.getStatements());
        hostBlock.getStatements().addAll(position, statements);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("拼接片段：" + statements.size() + " 条语句插入到位置 " + position);
        }
        return new SpliceResult(statements, position, unmatched);
    }

    /** 一次性绑定表构造 */
    public static Map<String, Binding> bindings(Object... nameAndBinding) {
        if (nameAndBinding.length % 2 != 0) {
            throw new IllegalArgumentException("expected name/binding pairs");
        }
        Map<String, Binding> map = new LinkedHashMap<String, Binding>();
        for (int i = 0; i < nameAndBinding.length; i += 2) {
            map.put((String) nameAndBinding[i], (Binding) nameAndBinding[i + 1]);
        }
        return map;
    }

    /**
     * 第一遍：全局引用改到宿主全局作用域，导出/导入引用改到宿主符号
     */
    private static final class ReferenceRebinder implements VisitCallback {
        private final Map<SymbolId, Binding> targets;
        private final Map<SymbolId, Binding> exports;
        private final Map<SymbolId, Binding> imports;
        private final Scope fragmentScope;
        private final Scope hostRoot;
        private final Map<SymbolId, SymbolId> globals;

        ReferenceRebinder(Map<SymbolId, Binding> targets, Map<SymbolId, Binding> exports,
                          Map<SymbolId, Binding> imports, Scope fragmentScope, Scope hostRoot,
                          Map<SymbolId, SymbolId> globals) {
            this.targets = targets;
            this.exports = exports;
            this.imports = imports;
            this.fragmentScope = fragmentScope;
            this.hostRoot = hostRoot;
            this.globals = globals;
        }

        @Override
        public VisitResult visit(AstNode node, VisitContext context) {
            if (node instanceof VariableExpression) {
                VariableExpression variable = (VariableExpression) node;
                Binding target = rebind(variable.getId(), context);
                return target == null ? VisitResult.unchanged()
                        : VisitResult.replace(new VariableExpression(target.getScope(), target.getId(),
                        tagsOf(node)));
            }
            if (node instanceof AssignmentVariable) {
                AssignmentVariable variable = (AssignmentVariable) node;
                Binding target = rebind(variable.getId(), context);
                return target == null ? VisitResult.unchanged()
                        : VisitResult.replace(new AssignmentVariable(target.getScope(), target.getId(),
                        tagsOf(node)));
            }
            if (node instanceof FunctionDeclaration) {
                FunctionDeclaration declaration = (FunctionDeclaration) node;
                // 引用发生在声明所在的作用域，而不是函数体内
                Binding target = rebind(declaration.getId(), context);
                return target == null ? VisitResult.unchanged()
                        : VisitResult.replace(new FunctionDeclaration(target.getScope(), target.getId(),
                        declaration.getIndices(), declaration.getArgs(), declaration.getBody(), tagsOf(node)));
            }
            return VisitResult.unchanged();
        }

        private Binding rebind(SymbolId id, VisitContext context) {
            Binding target = targets.get(id);
            if (target == null) return null;
            Scope usage = context.getScope();
            if (exports.containsKey(id)) {
                usage.removeReferenceToHigherScope(fragmentScope, id);
                usage.addReferenceToHigherScope(target.getScope(), target.getId());
            } else if (imports.containsKey(id)) {
                usage.removeReferenceToHigherScope(hostRoot, globals.get(id));
                usage.addReferenceToHigherScope(target.getScope(), target.getId());
            }
            return target;
        }
    }

    /**
     * 第二遍：声明作用域从片段顶层作用域改为宿主作用域
     */
    private static final class DeclarationRebinder implements VisitCallback {
        private final Scope fragmentScope;
        private final Scope hostScope;
        private final Map<SymbolId, Binding> exports;

        DeclarationRebinder(Scope fragmentScope, Scope hostScope, Map<SymbolId, Binding> exports) {
            this.fragmentScope = fragmentScope;
            this.hostScope = hostScope;
            this.exports = exports;
        }

        @Override
        public VisitResult visit(AstNode node, VisitContext context) {
            if (node instanceof VariableExpression) {
                VariableExpression variable = (VariableExpression) node;
                if (variable.getScope() == fragmentScope) {
                    return VisitResult.replace(new VariableExpression(hostScope, variable.getId(), tagsOf(node)));
                }
            } else if (node instanceof AssignmentVariable) {
                AssignmentVariable variable = (AssignmentVariable) node;
                if (variable.getScope() == fragmentScope) {
                    return VisitResult.replace(new AssignmentVariable(hostScope, variable.getId(), tagsOf(node)));
                }
            } else if (node instanceof FunctionDeclaration) {
                FunctionDeclaration declaration = (FunctionDeclaration) node;
                if (declaration.getScope() == fragmentScope) {
                    return VisitResult.replace(new FunctionDeclaration(hostScope, declaration.getId(),
                            declaration.getIndices(), declaration.getArgs(), declaration.getBody(), tagsOf(node)));
                }
            } else if (node instanceof LocalVariableDeclaration) {
                LocalVariableDeclaration declaration = (LocalVariableDeclaration) node;
                if (declaration.getScope() == fragmentScope) {
                    List<SymbolId> ids = new ArrayList<SymbolId>();
                    for (SymbolId id : declaration.getIds()) {
                        ids.add(exported(id));
                    }
                    return VisitResult.replace(new LocalVariableDeclaration(hostScope, ids,
                            declaration.getExpressions(), tagsOf(node)));
                }
            } else if (node instanceof LocalFunctionDeclaration) {
                LocalFunctionDeclaration declaration = (LocalFunctionDeclaration) node;
                if (declaration.getScope() == fragmentScope) {
                    return VisitResult.replace(new LocalFunctionDeclaration(hostScope, exported(declaration.getId()),
                            declaration.getArgs(), declaration.getBody(), tagsOf(node)));
                }
            }
            return VisitResult.unchanged();
        }

        private SymbolId exported(SymbolId id) {
            Binding host = exports.get(id);
            return host != null ? host.getId() : id;
        }
    }

    private static NodeTag[] tagsOf(AstNode node) {
        return node.getTags().toArray(new NodeTag[0]);
    }
}
