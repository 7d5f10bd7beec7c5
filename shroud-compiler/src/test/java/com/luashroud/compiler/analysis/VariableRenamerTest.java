package com.luashroud.compiler.analysis;

import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.formatter.LuaFormatter;
import com.luashroud.compiler.lexer.LuaVersion;
import com.luashroud.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.*;

/**
 * VariableRenamer 单元测试
 */
class VariableRenamerTest {

    private static final IntFunction<String> LETTERS = i -> String.valueOf((char) ('a' + i));

    private String rename(String source, IntFunction<String> generator, String prefix) {
        TopNode top = new Parser(LuaVersion.LUA51).parse(source);
        new VariableRenamer(generator, prefix).rename(top);
        ScopeConsistencyChecker.check(top);
        return LuaFormatter.format(top);
    }

    @Test
    @DisplayName("按声明顺序重命名，全局名字不变")
    void testBasicRename() {
        assertEquals("local a = 1; local b = a; print(b)",
                rename("local x = 1 local y = x print(y)", LETTERS, null));
    }

    @Test
    @DisplayName("内层作用域避开它引用到的外层名字")
    void testAvoidCapturedNames() {
        assertEquals("local a = 1; local function b() local b = 2; return a + b end",
                rename("local one = 1 local function f() local two = 2 return one + two end", LETTERS, null));
    }

    @Test
    @DisplayName("避开被引用的全局名字")
    void testAvoidGlobals() {
        IntFunction<String> generator = i -> i == 0 ? "print" : "q" + i;
        assertEquals("local function q1() print(1); local q1 = 1 end",
                rename("local function f() print(1) local p = 1 end", generator, null));
    }

    @Test
    @DisplayName("跳过关键字")
    void testSkipKeywords() {
        IntFunction<String> generator = i -> i == 0 ? "end" : "v" + i;
        assertEquals("local v1 = 1", rename("local x = 1", generator, null));
    }

    @Test
    @DisplayName("前缀")
    void testPrefix() {
        assertEquals("local _a, _b = 1, 2", rename("local x, y = 1, 2", LETTERS, "_"));
    }

    @Test
    @DisplayName("参数与循环变量也被重命名")
    void testParametersAndLoops() {
        assertEquals("local function a(a, b) for a = a, b do print(a) end end",
                rename("local function sum(from, to) for i = from, to do print(i) end end", LETTERS, null));
    }

    @Test
    @DisplayName("同一作用域的重复声明得到不同名字")
    void testRedeclaration() {
        assertEquals("local a = 1; local b = a",
                rename("local x = 1 local x = x", LETTERS, null));
    }
}
