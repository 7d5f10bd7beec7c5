package com.luashroud.pipeline;

import com.google.gson.JsonObject;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.pipeline.config.SettingDescriptor;
import com.luashroud.pipeline.config.SettingsException;
import com.luashroud.pipeline.config.StepSettings;
import com.luashroud.pipeline.step.ConstantArray;
import com.luashroud.pipeline.step.EncryptStrings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StepRegistry 单元测试
 */
class StepRegistryTest {

    @Test
    @DisplayName("内置五个步骤，保持注册顺序")
    void testBuiltin() {
        StepRegistry registry = StepRegistry.builtin();
        List<String> names = new ArrayList<String>();
        for (StepRegistry.Entry entry : registry.getEntries()) {
            names.add(entry.getName());
            assertFalse(entry.getDescription().isEmpty());
        }
        assertEquals(5, names.size());
        assertEquals("EncryptStrings", names.get(0));
        assertTrue(names.contains("NumbersToExpressions"));
        assertTrue(registry.has("ProxifyLocals"));
        assertFalse(registry.has("Vmify"));
    }

    @Test
    @DisplayName("按名字创建步骤并解析设置")
    void testCreate() {
        JsonObject settings = new JsonObject();
        settings.addProperty("Treshold", 0.5);
        Step step = StepRegistry.builtin().create("ConstantArray", settings);
        assertTrue(step instanceof ConstantArray);
        assertEquals(0.5, ((AbstractStep) step).getSettings().getNumber("Treshold"));
        assertTrue(((AbstractStep) step).getSettings().getBoolean("Shuffle"));

        Step defaults = StepRegistry.builtin().create("EncryptStrings", null);
        assertTrue(defaults instanceof EncryptStrings);
        assertEquals("EncryptStrings", defaults.getName());
    }

    @Test
    @DisplayName("设置错误时带上步骤名")
    void testInvalidSettings() {
        JsonObject settings = new JsonObject();
        settings.addProperty("Treshold", 2);
        SettingsException e = assertThrows(SettingsException.class,
                () -> StepRegistry.builtin().create("EncryptStrings", settings));
        assertTrue(e.getMessage().startsWith("step 'EncryptStrings': "), e.getMessage());
    }

    @Test
    @DisplayName("未知的步骤")
    void testUnknownStep() {
        SettingsException e = assertThrows(SettingsException.class,
                () -> StepRegistry.builtin().create("Vmify", null));
        assertTrue(e.getMessage().contains("Vmify"));
    }

    @Test
    @DisplayName("注册自定义步骤，名字不能重复")
    void testRegister() {
        StepRegistry registry = new StepRegistry();
        List<SettingDescriptor> schema = Collections.singletonList(
                SettingDescriptor.bool("Enabled", true, "flag"));
        registry.register("Identity", "does nothing", schema, IdentityStep::new);
        assertTrue(registry.create("Identity", null) instanceof IdentityStep);
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("Identity", "again", schema, IdentityStep::new));
    }

    static class IdentityStep extends AbstractStep {

        IdentityStep(StepSettings settings) {
            super(settings);
        }

        @Override
        public String getName() {
            return "Identity";
        }

        @Override
        public String getDescription() {
            return "does nothing";
        }

        @Override
        public TopNode apply(TopNode top, PipelineContext context) {
            return top;
        }
    }
}
