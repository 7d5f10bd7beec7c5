package com.luashroud.compiler.analysis;

import com.luashroud.compiler.ast.AstNode;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.AssignmentVariable;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.ast.stmt.ForInStatement;
import com.luashroud.compiler.ast.stmt.ForStatement;
import com.luashroud.compiler.ast.stmt.FunctionDeclaration;
import com.luashroud.compiler.ast.stmt.LocalFunctionDeclaration;
import com.luashroud.compiler.ast.stmt.LocalVariableDeclaration;
import com.luashroud.compiler.visit.AstWalker;
import com.luashroud.compiler.visit.VisitCallback;
import com.luashroud.compiler.visit.VisitContext;
import com.luashroud.compiler.visit.VisitResult;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 作用域一致性检查
 *
 * <p>重新统计树中的每个变量引用，检查：引用的作用域声明了该标识；声明作用域是使用处作用域或其祖先，
 * 或者是本树的全局作用域；使用处到声明处之间的每一层账目记录的次数不少于实际引用次数。
 * 账目多记是允许的，只会让重命名更保守。</p>
 */
public final class ScopeConsistencyChecker {

    // 作用域 → 声明作用域 → 标识 → 次数
    private final Map<Scope, Map<Scope, Map<SymbolId, Integer>>> expectedHigher =
            new IdentityHashMap<Scope, Map<Scope, Map<SymbolId, Integer>>>();
    private final Map<Scope, Map<SymbolId, Integer>> expectedCounts = new IdentityHashMap<Scope, Map<SymbolId, Integer>>();

    private ScopeConsistencyChecker() {
    }

    /**
     * @throws ScopeConsistencyException 发现第一处不一致
     */
    public static void check(TopNode top) {
        ScopeConsistencyChecker checker = new ScopeConsistencyChecker();
        AstWalker.walk(top, new VisitCallback() {
            @Override
            public VisitResult visit(AstNode node, VisitContext context) {
                checker.visit(node, context);
                return VisitResult.unchanged();
            }
        }, VisitCallback.NONE);
        checker.verifyLedger();
    }

    private void visit(AstNode node, VisitContext context) {
        Scope usage = context.getScope();
        if (node instanceof VariableExpression) {
            VariableExpression variable = (VariableExpression) node;
            reference(node, usage, variable.getScope(), variable.getId(), context);
        } else if (node instanceof AssignmentVariable) {
            AssignmentVariable variable = (AssignmentVariable) node;
            reference(node, usage, variable.getScope(), variable.getId(), context);
        } else if (node instanceof FunctionDeclaration) {
            FunctionDeclaration declaration = (FunctionDeclaration) node;
            reference(node, usage, declaration.getScope(), declaration.getId(), context);
        } else if (node instanceof LocalVariableDeclaration) {
            declaration(node, ((LocalVariableDeclaration) node).getScope(), usage);
        } else if (node instanceof LocalFunctionDeclaration) {
            declaration(node, ((LocalFunctionDeclaration) node).getScope(), usage);
        } else if (node instanceof ForStatement) {
            declaration(node, ((ForStatement) node).getScope().getParent(), usage);
        } else if (node instanceof ForInStatement) {
            declaration(node, ((ForInStatement) node).getScope().getParent(), usage);
        }
    }

    private static void declaration(AstNode node, Scope declared, Scope usage) {
        if (declared != usage) {
            throw new ScopeConsistencyException(node.getKind() + " declares into " + declared
                    + " but appears in " + usage);
        }
    }

    private void reference(AstNode node, Scope usage, Scope declaring, SymbolId id, VisitContext context) {
        if (!declaring.isDeclared(id)) {
            throw new ScopeConsistencyException(node.getKind() + " refers to " + id
                    + " which is not declared in " + declaring);
        }
        if (declaring.isGlobal()) {
            if (declaring != context.getGlobalScope()) {
                throw new ScopeConsistencyException(node.getKind() + " refers to global "
                        + declaring.getVariableName(id) + " of another tree");
            }
        } else if (!declaring.isAncestorOf(usage)) {
            throw new ScopeConsistencyException(node.getKind() + " refers to local "
                    + declaring.getVariableName(id) + id + " outside of its declaring scope " + declaring);
        }
        increment(counts(expectedCounts, declaring), id);
        for (Scope s = usage; s != declaring; s = s.getParent()) {
            Map<Scope, Map<SymbolId, Integer>> byOwner = expectedHigher.get(s);
            if (byOwner == null) {
                byOwner = new IdentityHashMap<Scope, Map<SymbolId, Integer>>();
                expectedHigher.put(s, byOwner);
            }
            increment(counts(byOwner, declaring), id);
        }
    }

    private void verifyLedger() {
        for (Map.Entry<Scope, Map<SymbolId, Integer>> e : expectedCounts.entrySet()) {
            Scope declaring = e.getKey();
            for (Map.Entry<SymbolId, Integer> count : e.getValue().entrySet()) {
                if (declaring.getReferenceCount(count.getKey()) < count.getValue()) {
                    throw new ScopeConsistencyException("reference count of "
                            + declaring.getVariableName(count.getKey()) + count.getKey() + " in " + declaring
                            + " is " + declaring.getReferenceCount(count.getKey())
                            + ", tree contains " + count.getValue());
                }
            }
        }
        for (Map.Entry<Scope, Map<Scope, Map<SymbolId, Integer>>> e : expectedHigher.entrySet()) {
            Scope scope = e.getKey();
            for (Map.Entry<Scope, Map<SymbolId, Integer>> byOwner : e.getValue().entrySet()) {
                Scope owner = byOwner.getKey();
                for (Map.Entry<SymbolId, Integer> count : byOwner.getValue().entrySet()) {
                    int recorded = scope.getHigherReferenceCount(owner, count.getKey());
                    if (recorded < count.getValue()) {
                        throw new ScopeConsistencyException("missing ledger entry: " + scope + " records "
                                + recorded + " references to " + owner.getVariableName(count.getKey())
                                + count.getKey() + ", tree contains " + count.getValue());
                    }
                }
            }
        }
    }

    private static Map<SymbolId, Integer> counts(Map<Scope, Map<SymbolId, Integer>> map, Scope scope) {
        Map<SymbolId, Integer> counts = map.get(scope);
        if (counts == null) {
            counts = new IdentityHashMap<SymbolId, Integer>();
            map.put(scope, counts);
        }
        return counts;
    }

    private static void increment(Map<SymbolId, Integer> counts, SymbolId id) {
        Integer old = counts.get(id);
        counts.put(id, old == null ? 1 : old + 1);
    }
}
