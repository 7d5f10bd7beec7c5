package com.luashroud.pipeline.config;

import com.google.gson.JsonObject;
import com.luashroud.compiler.lexer.LuaVersion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PipelineConfig 与 Presets 单元测试
 */
class PipelineConfigTest {

    // ============ 解析 ============

    @Nested
    @DisplayName("解析")
    class ParseTests {

        @Test
        @DisplayName("空对象取默认值")
        void testDefaults() {
            PipelineConfig config = PipelineConfig.fromJson("{}");
            assertEquals(LuaVersion.LUA51, config.getLuaVersion());
            assertFalse(config.isPrettyPrint());
            assertNull(config.getSeed());
            assertEquals("", config.getVarNamePrefix());
            assertEquals("MangledShuffled", config.getNameGenerator());
            assertTrue(config.isRenameVariables());
            assertFalse(config.isVerifyScopes());
            assertTrue(config.getSteps().isEmpty());
        }

        @Test
        @DisplayName("读取全部字段")
        void testFullConfig() {
            PipelineConfig config = PipelineConfig.fromJson("{\"luaVersion\": \"luau\", \"prettyPrint\": true, "
                    + "\"seed\": 42, \"varNamePrefix\": \"_\", \"nameGenerator\": \"il\", \"renameVariables\": false, "
                    + "\"verifyScopes\": true, \"steps\": [{\"name\": \"EncryptStrings\", "
                    + "\"settings\": {\"Treshold\": 0.5}}, {\"name\": \"AntiTamper\"}]}");
            assertEquals(LuaVersion.LUAU, config.getLuaVersion());
            assertTrue(config.isPrettyPrint());
            assertEquals(Long.valueOf(42), config.getSeed());
            assertEquals("_", config.getVarNamePrefix());
            assertFalse(config.isRenameVariables());
            assertTrue(config.isVerifyScopes());
            assertEquals(2, config.getSteps().size());
            assertEquals("EncryptStrings", config.getSteps().get(0).getName());
            assertEquals(0.5, config.getSteps().get(0).getSettings().get("Treshold").getAsDouble());
            assertNull(config.getSteps().get(1).getSettings());
        }

        @Test
        @DisplayName("无效的 JSON 与取值")
        void testInvalid() {
            assertThrows(SettingsException.class, () -> PipelineConfig.fromJson("{"));
            assertThrows(SettingsException.class, () -> PipelineConfig.fromJson(""));
            SettingsException version = assertThrows(SettingsException.class,
                    () -> PipelineConfig.fromJson("{\"luaVersion\": \"Lua53\"}"));
            assertTrue(version.getMessage().contains("Lua53"));
            assertThrows(SettingsException.class, () -> PipelineConfig.fromJson("{\"nameGenerator\": \"Emoji\"}"));
            assertThrows(SettingsException.class, () -> PipelineConfig.fromJson("{\"steps\": [{}]}"));
        }

        @Test
        @DisplayName("写出后再读入得到相同配置")
        void testToJson() {
            PipelineConfig config = new PipelineConfig();
            config.setSeed(7L);
            config.setLuaVersion(LuaVersion.LUAU);
            JsonObject settings = new JsonObject();
            settings.addProperty("UseDebug", false);
            config.addStep("AntiTamper", settings);

            PipelineConfig read = PipelineConfig.fromJson(config.toJson());
            assertEquals(Long.valueOf(7), read.getSeed());
            assertEquals(LuaVersion.LUAU, read.getLuaVersion());
            assertFalse(read.getSteps().get(0).getSettings().get("UseDebug").getAsBoolean());
        }

        @Test
        @DisplayName("从文件读取")
        void testLoad(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("config.json");
            Files.write(file, "{\"seed\": 3, \"prettyPrint\": true}".getBytes(StandardCharsets.UTF_8));
            PipelineConfig config = PipelineConfig.load(file);
            assertEquals(Long.valueOf(3), config.getSeed());
            assertTrue(config.isPrettyPrint());
        }
    }

    // ============ 复制 ============

    @Test
    @DisplayName("copy 是深复制")
    void testCopy() {
        PipelineConfig config = PipelineConfig.fromJson(
                "{\"seed\": 1, \"steps\": [{\"name\": \"ConstantArray\", \"settings\": {\"Shuffle\": true}}]}");
        PipelineConfig copy = config.copy();
        copy.setSeed(2L);
        copy.getSteps().get(0).getSettings().addProperty("Shuffle", false);
        copy.addStep("AntiTamper", null);

        assertEquals(Long.valueOf(1), config.getSeed());
        assertTrue(config.getSteps().get(0).getSettings().get("Shuffle").getAsBoolean());
        assertEquals(1, config.getSteps().size());
        assertEquals(2, copy.getSteps().size());
    }

    // ============ 预设 ============

    @Nested
    @DisplayName("预设")
    class PresetTests {

        @Test
        @DisplayName("内置四个预设")
        void testNames() {
            assertTrue(Presets.names().containsAll(Arrays.asList("Minify", "Weak", "Medium", "Strong")));
        }

        @Test
        @DisplayName("名字不区分大小写，每次返回新的副本")
        void testLookup() {
            assertTrue(Presets.has("strong"));
            PipelineConfig first = Presets.get("MEDIUM");
            first.getSteps().clear();
            PipelineConfig second = Presets.get("Medium");
            assertEquals(4, second.getSteps().size());
            assertEquals("EncryptStrings", second.getSteps().get(0).getName());
        }

        @Test
        @DisplayName("Minify 没有步骤")
        void testMinify() {
            assertTrue(Presets.get("Minify").getSteps().isEmpty());
            assertTrue(Presets.get("Minify").isRenameVariables());
        }

        @Test
        @DisplayName("未知预设")
        void testUnknown() {
            SettingsException e = assertThrows(SettingsException.class, () -> Presets.get("Extreme"));
            assertTrue(e.getMessage().contains("Extreme"));
            assertFalse(Presets.has("Extreme"));
        }
    }
}
