package com.luashroud.pipeline.step;

import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.FunctionCallExpression;
import com.luashroud.compiler.ast.expr.NumberExpression;
import com.luashroud.compiler.ast.expr.StringExpression;
import com.luashroud.compiler.ast.expr.TableConstructorExpression;
import com.luashroud.compiler.ast.expr.TableEntry;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.ast.stmt.DoStatement;
import com.luashroud.compiler.ast.stmt.ForInStatement;
import com.luashroud.compiler.ast.stmt.FunctionCallStatement;
import com.luashroud.compiler.ast.stmt.LocalFunctionDeclaration;
import com.luashroud.compiler.ast.stmt.LocalVariableDeclaration;
import com.luashroud.pipeline.PipelineContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.luashroud.pipeline.step.StepTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ConstantArray 单元测试
 */
class ConstantArrayTest {

    private static final String BASE64_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    private static Map<Character, Character> identityAlphabet() {
        Map<Character, Character> alphabet = new HashMap<Character, Character>();
        for (char c : BASE64_CHARS.toCharArray()) {
            alphabet.put(c, c);
        }
        return alphabet;
    }

    private static TopNode apply(PipelineContext context, String source, String settings) {
        TopNode top = parse(context, source);
        return new ConstantArray(settings(ConstantArray.SETTINGS, settings)).apply(top, context);
    }

    // ============ 编码 ============

    @Nested
    @DisplayName("base64 编码")
    class EncodingTests {

        @Test
        @DisplayName("标准字母表与 java.util.Base64 一致")
        void testIdentityAlphabet() {
            assertEquals("TWFu", ConstantArray.encode("Man", identityAlphabet()));
            assertEquals("TWE=", ConstantArray.encode("Ma", identityAlphabet()));
            assertEquals("TQ==", ConstantArray.encode("M", identityAlphabet()));
            assertEquals("", ConstantArray.encode("", identityAlphabet()));
        }

        @Test
        @DisplayName("替换字母表，填充符不变")
        void testSwappedAlphabet() {
            Map<Character, Character> alphabet = identityAlphabet();
            alphabet.put('T', 'x');
            alphabet.put('x', 'T');
            assertEquals("xQ==", ConstantArray.encode("M", alphabet));
        }

        @Test
        @DisplayName("解码查找表")
        void testLookupTable() {
            String table = ConstantArray.lookupTable(identityAlphabet());
            assertTrue(table.startsWith("{[\"A\"] = 0, [\"B\"] = 1"));
            assertTrue(table.endsWith("[\"/\"] = 63}"));
        }
    }

    // ============ 改写 ============

    @Nested
    @DisplayName("改写")
    class ApplyTests {

        @Test
        @DisplayName("不打乱、不旋转、不编码时的开头结构")
        void testPlainPrelude() {
            PipelineContext context = context(5);
            TopNode top = apply(context, "print(\"a\", \"b\", \"a\")",
                    "{\"Shuffle\": false, \"Rotate\": false, \"Encoding\": \"none\"}");
            verify(context, top);

            assertEquals(3, top.getBody().getStatements().size());
            LocalVariableDeclaration arr = (LocalVariableDeclaration) top.getBody().getStatement(0);
            TableConstructorExpression table = (TableConstructorExpression) arr.getExpressions().get(0);
            assertEquals(2, table.getEntries().size());
            assertEquals("a", ((StringExpression) ((TableEntry) table.getEntries().get(0)).getValue()).getValue());
            assertEquals("b", ((StringExpression) ((TableEntry) table.getEntries().get(1)).getValue()).getValue());
            assertTrue(((TableEntry) table.getEntries().get(0)).getValue().hasTag(NodeTag.NO_OBFUSCATION));

            LocalFunctionDeclaration wrap = (LocalFunctionDeclaration) top.getBody().getStatement(1);
            FunctionCallStatement print = (FunctionCallStatement) top.getBody().getStatement(2);
            assertEquals(3, print.getArgs().size());
            for (int i = 0; i < 3; i++) {
                FunctionCallExpression call = (FunctionCallExpression) print.getArgs().get(i);
                assertSame(wrap.getId(), ((VariableExpression) call.getBase()).getId());
                assertTrue(call.getArgs().get(0) instanceof NumberExpression);
            }
            // 相同的常量得到相同的下标
            assertEquals(((NumberExpression) ((FunctionCallExpression) print.getArgs().get(0)).getArgs().get(0)).getValue(),
                    ((NumberExpression) ((FunctionCallExpression) print.getArgs().get(2)).getArgs().get(0)).getValue());
        }

        @Test
        @DisplayName("默认设置插入旋转与解码片段")
        void testDefaultPrelude() {
            PipelineContext context = context(9);
            TopNode top = apply(context, "print(\"hello\", \"world\", 42)", null);
            String output = verify(context, top);

            assertFalse(output.contains("hello"));
            assertFalse(output.contains("world"));
            assertEquals(5, top.getBody().getStatements().size());
            assertTrue(top.getBody().getStatement(0) instanceof LocalVariableDeclaration);
            assertTrue(top.getBody().getStatement(1) instanceof ForInStatement);
            assertTrue(top.getBody().getStatement(2) instanceof DoStatement);
            assertTrue(top.getBody().getStatement(3) instanceof LocalFunctionDeclaration);
        }

        @Test
        @DisplayName("StringsOnly 不提取数字")
        void testStringsOnly() {
            PipelineContext context = context(2);
            TopNode top = apply(context, "local x = 10 local s = \"str\"",
                    "{\"StringsOnly\": true, \"Rotate\": false, \"Encoding\": \"none\"}");
            String output = verify(context, top);

            assertTrue(output.contains("local x = 10"));
            LocalVariableDeclaration arr = (LocalVariableDeclaration) top.getBody().getStatement(0);
            assertEquals(1, ((TableConstructorExpression) arr.getExpressions().get(0)).getEntries().size());
        }

        @Test
        @DisplayName("函数内使用局部包装表")
        void testLocalWrappers() {
            PipelineContext context = context(4);
            TopNode top = apply(context, "local function f() return \"x\", \"y\" end print(f())",
                    "{\"LocalWrapperCount\": 3, \"LocalWrapperArgCount\": 4, \"Encoding\": \"none\"}");
            verify(context, top);

            LocalFunctionDeclaration f = null;
            for (int i = 0; i < top.getBody().getStatements().size(); i++) {
                if (top.getBody().getStatement(i) instanceof LocalFunctionDeclaration) {
                    f = (LocalFunctionDeclaration) top.getBody().getStatement(i);
                }
            }
            assertNotNull(f);
            LocalVariableDeclaration wrappers = (LocalVariableDeclaration) f.getBody().getStatement(0);
            TableConstructorExpression table = (TableConstructorExpression) wrappers.getExpressions().get(0);
            assertEquals(3, table.getEntries().size());
        }

        @Test
        @DisplayName("概率为 0 时不改动")
        void testZeroTreshold() {
            PipelineContext context = context(1);
            TopNode top = apply(context, "print(\"a\", 1)", "{\"Treshold\": 0}");
            assertEquals("print(\"a\", 1)", verify(context, top));
        }
    }
}
