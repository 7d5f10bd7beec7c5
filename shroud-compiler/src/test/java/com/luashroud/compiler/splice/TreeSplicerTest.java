package com.luashroud.compiler.splice;

import com.luashroud.compiler.analysis.Binding;
import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.ScopeConsistencyChecker;
import com.luashroud.compiler.analysis.ScopeConsistencyException;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.ast.stmt.DoStatement;
import com.luashroud.compiler.ast.stmt.LocalFunctionDeclaration;
import com.luashroud.compiler.ast.stmt.LocalVariableDeclaration;
import com.luashroud.compiler.formatter.LuaFormatter;
import com.luashroud.compiler.lexer.LuaVersion;
import com.luashroud.compiler.parser.ParseException;
import com.luashroud.compiler.parser.Parser;
import com.luashroud.compiler.visit.AstWalker;
import com.luashroud.compiler.visit.VisitCallback;
import com.luashroud.compiler.visit.VisitResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TreeSplicer 单元测试
 */
class TreeSplicerTest {

    private Parser parser;
    private TreeSplicer splicer;

    @BeforeEach
    void setUp() {
        parser = new Parser(LuaVersion.LUA51);
        splicer = new TreeSplicer(parser);
    }

    @Test
    @DisplayName("导入：片段中的自由名字改为宿主局部变量")
    void testImport() {
        TopNode host = parser.parse("local ARR = {1, 2}");
        Scope scope = host.getBody().getScope();
        LocalVariableDeclaration decl = (LocalVariableDeclaration) host.getBody().getStatement(0);
        SymbolId arr = decl.getIds().get(0);

        SpliceResult result = splicer.splice("for i = 1, #ARR do ARR[i] = i end", host.getBody(), 1,
                TreeSplicer.bindings("ARR", new Binding(scope, arr)));

        assertEquals(1, result.getStatements().size());
        assertEquals(1, result.getPosition());
        assertTrue(result.getUnmatchedBindings().isEmpty());
        assertEquals("local ARR = {1, 2}; for i = 1, #ARR do ARR[i] = i end", LuaFormatter.format(host));
        assertEquals(2, scope.getReferenceCount(arr));
        assertNull(host.getGlobalScope().resolveLocal("ARR"));
        ScopeConsistencyChecker.check(host);
    }

    @Test
    @DisplayName("导出：片段顶层声明改为宿主预先分配的符号")
    void testExport() {
        TopNode host = parser.parse("print(1)");
        Scope scope = host.getBody().getScope();
        SymbolId helper = scope.addVariable("helper");

        splicer.splice("local h = function(a) return a + 1 end", host.getBody(), 0,
                TreeSplicer.bindings("h", new Binding(scope, helper)));

        LocalVariableDeclaration decl = (LocalVariableDeclaration) host.getBody().getStatement(0);
        assertSame(helper, decl.getIds().get(0));
        assertSame(scope, decl.getScope());
        assertNull(scope.resolveLocal("h"));
        assertEquals("local helper = function(a) return a + 1 end; print(1)", LuaFormatter.format(host));
        ScopeConsistencyChecker.check(host);
    }

    @Test
    @DisplayName("全局引用并入宿主全局作用域")
    void testGlobalsMerged() {
        TopNode host = parser.parse("print(1)");
        Scope global = host.getGlobalScope();
        SymbolId print = global.resolveLocal("print");

        splicer.splice("print(type(2))", host.getBody(), 1, Collections.<String, Binding>emptyMap());

        assertSame(print, global.resolveLocal("print"));
        assertNotNull(global.resolveLocal("type"));
        assertEquals(2, global.getReferenceCount(print));
        assertEquals("print(1); print(type(2))", LuaFormatter.format(host));
        ScopeConsistencyChecker.check(host);
    }

    @Test
    @DisplayName("片段私有的局部变量保留，并入宿主作用域")
    void testPrivateLocals() {
        TopNode host = parser.parse("local x = 1");
        Scope scope = host.getBody().getScope();

        splicer.splice("local x = 2 print(x)", host.getBody(), 1, Collections.<String, Binding>emptyMap());

        assertEquals(2, scope.getVariables().size());
        LocalVariableDeclaration original = (LocalVariableDeclaration) host.getBody().getStatement(0);
        LocalVariableDeclaration spliced = (LocalVariableDeclaration) host.getBody().getStatement(1);
        assertNotSame(original.getIds().get(0), spliced.getIds().get(0));
        assertSame(scope, spliced.getScope());
        ScopeConsistencyChecker.check(host);
    }

    @Test
    @DisplayName("导出名在片段内的引用改为宿主符号，私有变量保留独立标识")
    void testExportReferencedInsideFragment() {
        TopNode host = parser.parse("print(1)");
        Scope scope = host.getBody().getScope();
        SymbolId hostF = scope.addVariable("walk");

        splicer.splice("local H = 10 local function F(n) if n > 0 then return F(n - 1) end return H end",
                host.getBody(), 0, TreeSplicer.bindings("F", new Binding(scope, hostF)));

        LocalVariableDeclaration hDecl = (LocalVariableDeclaration) host.getBody().getStatement(0);
        LocalFunctionDeclaration fDecl = (LocalFunctionDeclaration) host.getBody().getStatement(1);
        SymbolId h = hDecl.getIds().get(0);
        assertSame(hostF, fDecl.getId());
        assertNotSame(hostF, h);
        assertSame(scope, hDecl.getScope());
        assertTrue(scope.isDeclared(h));
        assertNull(scope.resolveLocal("F"));

        List<VariableExpression> fRefs = new ArrayList<VariableExpression>();
        List<VariableExpression> hRefs = new ArrayList<VariableExpression>();
        AstWalker.walk(host, VisitCallback.NONE, (node, context) -> {
            if (node instanceof VariableExpression) {
                VariableExpression variable = (VariableExpression) node;
                if (variable.getId() == hostF) fRefs.add(variable);
                if (variable.getId() == h) hRefs.add(variable);
            }
            return VisitResult.unchanged();
        });
        assertEquals(1, fRefs.size());
        assertEquals(1, hRefs.size());
        assertSame(scope, fRefs.get(0).getScope());
        assertSame(scope, hRefs.get(0).getScope());
        String output = LuaFormatter.format(host);
        assertTrue(output.startsWith("local H = 10; local function walk(n) "));
        assertTrue(output.contains("return walk(n - 1)"));
        assertTrue(output.endsWith("; print(1)"));
        ScopeConsistencyChecker.check(host);
    }

    @Test
    @DisplayName("私有变量与宿主局部变量同名时改名，宿主引用的绑定不变")
    void testPrivateLocalCollidesWithHostLocal() {
        TopNode host = parser.parse("local x = 1 print(x)");
        Scope scope = host.getBody().getScope();
        SymbolId hostX = ((LocalVariableDeclaration) host.getBody().getStatement(0)).getIds().get(0);

        splicer.splice("local x = 2", host.getBody(), 1, Collections.<String, Binding>emptyMap());

        SymbolId spliced = ((LocalVariableDeclaration) host.getBody().getStatement(1)).getIds().get(0);
        String name = scope.getVariableName(spliced);
        assertNotEquals("x", name);
        assertEquals("x", scope.getVariableName(hostX));
        assertSame(hostX, scope.resolveLocal("x"));
        assertEquals("local x = 1; local " + name + " = 2; print(x)", LuaFormatter.format(host));
        ScopeConsistencyChecker.check(host);
    }

    @Test
    @DisplayName("私有变量与宿主全局名字同名时改名")
    void testPrivateLocalCollidesWithHostGlobal() {
        TopNode host = parser.parse("print(1)");
        Scope scope = host.getBody().getScope();

        splicer.splice("local print = 3", host.getBody(), 0, Collections.<String, Binding>emptyMap());

        SymbolId spliced = ((LocalVariableDeclaration) host.getBody().getStatement(0)).getIds().get(0);
        String name = scope.getVariableName(spliced);
        assertNotEquals("print", name);
        assertEquals("local " + name + " = 3; print(1)", LuaFormatter.format(host));
        ScopeConsistencyChecker.check(host);
    }

    @Test
    @DisplayName("插入到函数体内，导入外层变量")
    void testSpliceIntoFunction() {
        TopNode host = parser.parse("local k = 3 local function f() end");
        Scope root = host.getBody().getScope();
        SymbolId k = ((LocalVariableDeclaration) host.getBody().getStatement(0)).getIds().get(0);
        LocalFunctionDeclaration f = (LocalFunctionDeclaration) host.getBody().getStatement(1);

        splicer.splice("return K * 2", f.getBody(), 0, TreeSplicer.bindings("K", new Binding(root, k)));

        assertEquals(1, f.getBody().getScope().getHigherReferenceCount(root, k));
        assertEquals("local k = 3; local function f() return k * 2 end", LuaFormatter.format(host));
        ScopeConsistencyChecker.check(host);
    }

    @Test
    @DisplayName("没有用到的绑定记录在结果中")
    void testUnmatched() {
        TopNode host = parser.parse("");
        Scope scope = host.getBody().getScope();
        SymbolId unused = scope.addVariable("unused");
        SpliceResult result = splicer.splice("print(1)", host.getBody(), 0,
                TreeSplicer.bindings("missing", new Binding(scope, unused)));
        assertEquals(Collections.singletonList("missing"), result.getUnmatchedBindings());
    }

    @Test
    @DisplayName("导出符号必须声明在宿主代码块的作用域中")
    void testExportScopeMismatch() {
        TopNode host = parser.parse("do end");
        Scope outer = host.getBody().getScope();
        SymbolId id = outer.addVariable("v");
        DoStatement block = (DoStatement) host.getBody().getStatement(0);
        assertThrows(ScopeConsistencyException.class, () -> splicer.splice("local v = 1", block.getBody(), 0,
                TreeSplicer.bindings("v", new Binding(outer, id))));
    }

    @Test
    @DisplayName("插入位置越界与片段语法错误")
    void testInvalidInput() {
        TopNode host = parser.parse("print(1)");
        assertThrows(IllegalArgumentException.class, () -> splicer.splice("print(2)", host.getBody(), 2,
                Collections.<String, Binding>emptyMap()));
        assertThrows(ParseException.class, () -> splicer.splice("local = ", host.getBody(), 0,
                Collections.<String, Binding>emptyMap()));
        assertEquals(1, host.getBody().getStatements().size());
    }

    @Test
    @DisplayName("绑定表参数必须成对")
    void testBindingsPairs() {
        assertThrows(IllegalArgumentException.class, () -> TreeSplicer.bindings("a"));
    }
}
