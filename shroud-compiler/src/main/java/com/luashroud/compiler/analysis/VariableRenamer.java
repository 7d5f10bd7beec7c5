package com.luashroud.compiler.analysis;

import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.lexer.Lexer;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * 局部变量重命名
 *
 * <p>从全局作用域向下逐个作用域重命名，父作用域先于子作用域。每个作用域的计数器从 0 开始，
 * 跳过禁用名字：关键字，以及按引用账目本作用域子树引用到的外层变量（含全局变量）的当前名字。
 * 账目准确时，重命名不会让任何引用绑定到别的声明上。</p>
 */
public final class VariableRenamer {

    private final IntFunction<String> generator;
    private final String prefix;

    public VariableRenamer(IntFunction<String> generator, String prefix) {
        this.generator = generator;
        this.prefix = prefix != null ? prefix : "";
    }

    public void rename(TopNode top) {
        rename(top.getGlobalScope());
    }

    public void rename(Scope scope) {
        if (!scope.isGlobal()) {
            renameScope(scope);
        }
        for (Scope child : scope.getChildren()) {
            rename(child);
        }
    }

    private void renameScope(Scope scope) {
        Set<String> forbidden = new HashSet<String>(Lexer.getKeywords());
        for (Map.Entry<Scope, Map<SymbolId, Integer>> e : scope.getHigherReferences().entrySet()) {
            Scope owner = e.getKey();
            for (Map.Entry<SymbolId, Integer> ref : e.getValue().entrySet()) {
                String name = owner.getVariableName(ref.getKey());
                if (ref.getValue() > 0 && name != null) {
                    forbidden.add(name);
                }
            }
        }
        int counter = 0;
        for (SymbolId id : scope.getVariables()) {
            String name;
            do {
                name = prefix + generator.apply(counter++);
            } while (forbidden.contains(name) || !Lexer.isValidName(name));
            scope.renameVariable(id, name);
        }
    }
}
