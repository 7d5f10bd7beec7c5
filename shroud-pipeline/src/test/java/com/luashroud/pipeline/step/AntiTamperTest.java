package com.luashroud.pipeline.step;

import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.stmt.DoStatement;
import com.luashroud.pipeline.PipelineContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.luashroud.pipeline.step.StepTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * AntiTamper 单元测试
 */
class AntiTamperTest {

    private static final String SOURCE = "local x = 1 print(x)";

    @Test
    @DisplayName("开头插入一个 do 代码块")
    void testApply() {
        PipelineContext context = context(3);
        TopNode top = parse(context, SOURCE);
        top = new AntiTamper(settings(AntiTamper.SETTINGS, null)).apply(top, context);

        String output = verify(context, top);
        assertEquals(3, top.getBody().getStatements().size());
        assertTrue(top.getBody().getStatement(0) instanceof DoStatement);
        assertTrue(output.contains("debug"));
        assertTrue(output.endsWith("local x = 1; print(x)"));
    }

    @Test
    @DisplayName("UseDebug=false 时不使用 debug 库")
    void testWithoutDebug() {
        PipelineContext context = context(3);
        TopNode top = parse(context, SOURCE);
        top = new AntiTamper(settings(AntiTamper.SETTINGS, "{\"UseDebug\": false}")).apply(top, context);

        String output = verify(context, top);
        assertTrue(top.getBody().getStatement(0) instanceof DoStatement);
        assertFalse(output.contains("debug"));
    }

    @Test
    @DisplayName("格式化输出时跳过")
    void testSkippedWhenPrettyPrinting() {
        PipelineContext context = prettyContext(3);
        TopNode top = parse(context, SOURCE);
        TopNode result = new AntiTamper(settings(AntiTamper.SETTINGS, null)).apply(top, context);

        assertSame(top, result);
        assertEquals("local x = 1; print(x)", verify(context, result));
    }
}
