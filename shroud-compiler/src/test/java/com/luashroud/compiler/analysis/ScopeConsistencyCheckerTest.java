package com.luashroud.compiler.analysis;

import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.NumberExpression;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.ast.stmt.DoStatement;
import com.luashroud.compiler.ast.stmt.FunctionCallStatement;
import com.luashroud.compiler.ast.stmt.LocalVariableDeclaration;
import com.luashroud.compiler.lexer.LuaVersion;
import com.luashroud.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScopeConsistencyChecker 单元测试
 */
class ScopeConsistencyCheckerTest {

    private TopNode parse(String source) {
        return new Parser(LuaVersion.LUA51).parse(source);
    }

    @Test
    @DisplayName("解析器产出的树是一致的")
    void testParsedTreeIsConsistent() {
        assertDoesNotThrow(() -> ScopeConsistencyChecker.check(parse(
                "local a, b = 1 local function f(x, ...) return x + a, ... end "
                        + "function g.h:m() return self end for i = 1, 3 do a = a + i end "
                        + "for k, v in pairs({}) do print(k, v) end repeat local r = 1 until r "
                        + "while b do b = nil end if a then elseif b then else end")));
    }

    @Test
    @DisplayName("账目少记时失败")
    void testMissingLedgerEntry() {
        TopNode top = parse("local x = 1 do print(x) end");
        Scope root = top.getBody().getScope();
        SymbolId x = ((LocalVariableDeclaration) top.getBody().getStatement(0)).getIds().get(0);
        Scope inner = ((DoStatement) top.getBody().getStatement(1)).getBody().getScope();
        inner.removeReferenceToHigherScope(root, x);

        ScopeConsistencyException e = assertThrows(ScopeConsistencyException.class,
                () -> ScopeConsistencyChecker.check(top));
        assertTrue(e.getMessage().contains("reference count") || e.getMessage().contains("ledger"), e.getMessage());
    }

    @Test
    @DisplayName("账目多记是允许的")
    void testOverCountingAllowed() {
        TopNode top = parse("local x = 1 do print(x) end");
        Scope root = top.getBody().getScope();
        SymbolId x = ((LocalVariableDeclaration) top.getBody().getStatement(0)).getIds().get(0);
        Scope inner = ((DoStatement) top.getBody().getStatement(1)).getBody().getScope();
        inner.addReferenceToHigherScope(root, x, 5);
        assertDoesNotThrow(() -> ScopeConsistencyChecker.check(top));
    }

    @Test
    @DisplayName("在声明作用域之外引用局部变量时失败")
    void testReferenceOutsideDeclaringScope() {
        TopNode top = parse("do local y = 1 end print(0)");
        DoStatement block = (DoStatement) top.getBody().getStatement(0);
        Scope inner = block.getBody().getScope();
        SymbolId y = ((LocalVariableDeclaration) block.getBody().getStatement(0)).getIds().get(0);
        FunctionCallStatement call = (FunctionCallStatement) top.getBody().getStatement(1);
        call.getArgs().set(0, new VariableExpression(inner, y));

        assertThrows(ScopeConsistencyException.class, () -> ScopeConsistencyChecker.check(top));
    }

    @Test
    @DisplayName("声明语句出现在别的作用域中时失败")
    void testDeclarationInWrongScope() {
        TopNode top = parse("do end");
        Scope inner = ((DoStatement) top.getBody().getStatement(0)).getBody().getScope();
        SymbolId z = inner.addVariable("z");
        top.getBody().getStatements().add(new LocalVariableDeclaration(inner, Collections.singletonList(z),
                Collections.singletonList(new NumberExpression(1))));

        assertThrows(ScopeConsistencyException.class, () -> ScopeConsistencyChecker.check(top));
    }

    @Test
    @DisplayName("引用另一棵树的全局变量时失败")
    void testForeignGlobal() {
        TopNode top = parse("print(1)");
        TopNode other = parse("print(2)");
        Scope otherGlobal = other.getGlobalScope();
        FunctionCallStatement call = (FunctionCallStatement) top.getBody().getStatement(0);
        call.setBase(new VariableExpression(otherGlobal, otherGlobal.resolveLocal("print")));

        assertThrows(ScopeConsistencyException.class, () -> ScopeConsistencyChecker.check(top));
    }
}
