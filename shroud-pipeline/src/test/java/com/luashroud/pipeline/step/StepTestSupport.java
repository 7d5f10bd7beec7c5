package com.luashroud.pipeline.step;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.luashroud.compiler.analysis.ScopeConsistencyChecker;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.formatter.FormatConfig;
import com.luashroud.compiler.formatter.LuaFormatter;
import com.luashroud.pipeline.PipelineContext;
import com.luashroud.pipeline.config.PipelineConfig;
import com.luashroud.pipeline.config.SettingDescriptor;
import com.luashroud.pipeline.config.StepSettings;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 步骤测试的公共方法
 */
final class StepTestSupport {

    private StepTestSupport() {}

    static PipelineContext context(long seed) {
        return new PipelineContext(new PipelineConfig(), seed);
    }

    static PipelineContext prettyContext(long seed) {
        PipelineConfig config = new PipelineConfig();
        config.setPrettyPrint(true);
        return new PipelineContext(config, seed);
    }

    static StepSettings settings(List<SettingDescriptor> schema, String json) {
        JsonObject object = json == null ? null : JsonParser.parseString(json).getAsJsonObject();
        return StepSettings.resolve(schema, object);
    }

    static TopNode parse(PipelineContext context, String source) {
        return context.newParser().parse(source);
    }

    /**
     * 检查作用域账目，并确认输出能被重新解析
     *
     * @return 单行格式的输出
     */
    static String verify(PipelineContext context, TopNode top) {
        ScopeConsistencyChecker.check(top);
        String pretty = LuaFormatter.format(top, FormatConfig.pretty());
        String compact = LuaFormatter.format(top, FormatConfig.compact());
        assertDoesNotThrow(() -> context.newParser().parse(pretty));
        assertDoesNotThrow(() -> context.newParser().parse(compact));
        return LuaFormatter.format(top);
    }
}
