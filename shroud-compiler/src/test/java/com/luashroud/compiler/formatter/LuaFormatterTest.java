package com.luashroud.compiler.formatter;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.BinaryExpression;
import com.luashroud.compiler.ast.expr.NumberExpression;
import com.luashroud.compiler.ast.expr.StringExpression;
import com.luashroud.compiler.ast.expr.UnaryExpression;
import com.luashroud.compiler.lexer.LuaVersion;
import com.luashroud.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LuaFormatter 单元测试
 */
class LuaFormatterTest {

    private TopNode parse(String source) {
        return new Parser(LuaVersion.LUA51).parse(source);
    }

    private String inline(String source) {
        return LuaFormatter.format(parse(source), FormatConfig.inline());
    }

    private String pretty(String source) {
        return LuaFormatter.format(parse(source), FormatConfig.pretty());
    }

    private String compact(String source) {
        return LuaFormatter.format(parse(source), FormatConfig.compact());
    }

    // ============ 输出风格 ============

    @Nested
    @DisplayName("输出风格")
    class StyleTests {

        @Test
        @DisplayName("inline：语句之间用分号和空格分隔")
        void testInline() {
            assertEquals("local a = 2; print(a)", inline("local a = 2\nprint(a)"));
        }

        @Test
        @DisplayName("pretty：换行并缩进")
        void testPretty() {
            assertEquals("if x then\n    y()\nend", pretty("if x then y() end"));
            assertEquals("while a do\n    if b then\n        break\n    end\nend",
                    pretty("while a do if b then break end end"));
        }

        @Test
        @DisplayName("compact：去掉可省略的空白")
        void testCompact() {
            assertEquals("local a=2;print(a)", compact("local a = 2 print(a)"));
            assertEquals("for i=1,10 do f(i)end", compact("for i = 1, 10 do f(i) end"));
        }

        @Test
        @DisplayName("Tab 缩进与缩进宽度")
        void testIndentOptions() {
            FormatConfig tabs = FormatConfig.pretty();
            tabs.setUseSpaces(false);
            assertEquals("do\n\tf()\nend", LuaFormatter.format(parse("do f() end"), tabs));

            FormatConfig two = FormatConfig.pretty();
            two.setIndentSize(2);
            assertEquals("do\n  f()\nend", LuaFormatter.format(parse("do f() end"), two));
        }

        @Test
        @DisplayName("以括号开头的语句前加分号")
        void testLeadingParen() {
            assertEquals("f()\n;(g or h)()", pretty("f(); (g or h)()"));
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("按优先级补括号")
        void testParentheses() {
            assertEquals("local x = (1 + 2) * 3", inline("local x = (1 + 2) * 3"));
            assertEquals("local x = 1 + 2 * 3", inline("local x = 1 + (2 * 3)"));
            assertEquals("local x = (2 ^ 3) ^ 2", inline("local x = (2 ^ 3) ^ 2"));
            assertEquals("local x = 2 ^ 3 ^ 2", inline("local x = 2 ^ (3 ^ 2)"));
            assertEquals("local x = 1 - (2 - 3)", inline("local x = 1 - (2 - 3)"));
            assertEquals("local x = -(a + b)", inline("local x = -(a + b)"));
        }

        @Test
        @DisplayName("生成的节点也按优先级输出")
        void testGeneratedPrecedence() {
            BinaryExpression product = new BinaryExpression(AstKind.MUL,
                    new BinaryExpression(AstKind.ADD, new NumberExpression(1), new NumberExpression(2)),
                    new NumberExpression(3));
            assertEquals("(1 + 2) * 3", LuaFormatter.format(product));
            UnaryExpression negate = new UnaryExpression(AstKind.NEGATE, new NumberExpression(-1));
            assertEquals("- -1", LuaFormatter.format(negate));
        }

        @Test
        @DisplayName("多值表达式的括号保留")
        void testMultiValueParenthesis() {
            assertEquals("return (f())", inline("return (f())"));
        }

        @Test
        @DisplayName("数字字面量")
        void testNumbers() {
            assertEquals("42", LuaFormatter.format(new NumberExpression(42)));
            assertEquals("0.5", LuaFormatter.format(new NumberExpression(0.5)));
            assertEquals("(0/0)", LuaFormatter.format(new NumberExpression(Double.NaN)));
            assertEquals("(1/0)", LuaFormatter.format(new NumberExpression(Double.POSITIVE_INFINITY)));
            assertEquals("local x = 255", inline("local x = 0xff"));
        }

        @Test
        @DisplayName("数字与 .. 之间保留空格")
        void testNumberConcat() {
            assertEquals("local s=1 .. 2", compact("local s = 1 .. 2"));
        }

        @Test
        @DisplayName("字符串转义")
        void testStrings() {
            assertEquals("\"a\\\"b\\n\"", LuaFormatter.format(new StringExpression("a\"b\n")));
            assertEquals("\"\\000\\255\"", LuaFormatter.format(new StringExpression("\u0000\u00ff")));
            assertEquals("local s = \"x\"", inline("local s = [[x]]"));
        }

        @Test
        @DisplayName("合法名字的键用点号或裸名字")
        void testIndexing() {
            assertEquals("local t = {a = 1, [\"b c\"] = 2, [\"end\"] = 3}",
                    inline("local t = {a = 1, [\"b c\"] = 2, [\"end\"] = 3}"));
            assertEquals("x = t.a[\"end\"]", inline("x = t[\"a\"][\"end\"]"));
        }

        @Test
        @DisplayName("方法调用与方法定义")
        void testMethods() {
            assertEquals("obj:m(1)", inline("obj:m(1)"));
            assertEquals("function t.m(self, x) return self end", inline("function t:m(x) return self end"));
        }

        @Test
        @DisplayName("字符串和表作为调用的基表达式时加括号")
        void testPrefixParen() {
            assertEquals("local n = (\"x\"):len()", inline("local n = (\"x\"):len()"));
        }
    }

    // ============ 往返 ============

    @Nested
    @DisplayName("往返")
    class RoundTripTests {

        @Test
        @DisplayName("格式化结果可以重新解析并得到相同输出")
        void testReparse() {
            String source = "local function fib(n) if n < 2 then return n end return fib(n - 1) + fib(n - 2) end\n"
                    + "local t = {1, 2, k = \"v\"} for k, v in pairs(t) do print(k, v) end\n"
                    + "repeat local done = true until done\n"
                    + "local s = not a and b or #t .. \"x\"";
            for (FormatConfig config : new FormatConfig[]{FormatConfig.pretty(), FormatConfig.compact(),
                    FormatConfig.inline()}) {
                String first = LuaFormatter.format(parse(source), config);
                String second = LuaFormatter.format(parse(first), config);
                assertEquals(first, second);
            }
        }
    }
}
