package com.luashroud.pipeline.config;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StepSettings 单元测试
 */
class StepSettingsTest {

    private static final List<SettingDescriptor> SCHEMA = Arrays.asList(
            SettingDescriptor.number("Treshold", 1, 0.0, 1.0, "probability"),
            SettingDescriptor.integer("Count", 4, 0, 10, "count"),
            SettingDescriptor.bool("Enabled", true, "flag"),
            SettingDescriptor.enumeration("Mode", "fast", "mode", "fast", "slow"),
            SettingDescriptor.string("Label", "x", "label"));

    private static JsonObject json(String text) {
        return JsonParser.parseString(text).getAsJsonObject();
    }

    @Test
    @DisplayName("未给出的设置取默认值")
    void testDefaults() {
        StepSettings settings = StepSettings.defaults(SCHEMA);
        assertEquals(1.0, settings.getNumber("Treshold"));
        assertEquals(4, settings.getInt("Count"));
        assertTrue(settings.getBoolean("Enabled"));
        assertEquals("fast", settings.getString("Mode"));
        assertEquals("x", settings.getString("Label"));
        assertEquals(5, settings.asMap().size());
    }

    @Test
    @DisplayName("给出的设置覆盖默认值")
    void testOverride() {
        StepSettings settings = StepSettings.resolve(SCHEMA,
                json("{\"Treshold\": 0.25, \"Count\": 7, \"Enabled\": false, \"Label\": \"y\"}"));
        assertEquals(0.25, settings.getNumber("Treshold"));
        assertEquals(7, settings.getInt("Count"));
        assertFalse(settings.getBoolean("Enabled"));
        assertEquals("y", settings.getString("Label"));
    }

    @Test
    @DisplayName("枚举值不区分大小写，结果取声明中的写法")
    void testEnumCaseInsensitive() {
        assertEquals("slow", StepSettings.resolve(SCHEMA, json("{\"Mode\": \"SLOW\"}")).getString("Mode"));
        SettingsException e = assertThrows(SettingsException.class,
                () -> StepSettings.resolve(SCHEMA, json("{\"Mode\": \"medium\"}")));
        assertTrue(e.getMessage().contains("medium"));
    }

    @Test
    @DisplayName("类型不符时失败")
    void testWrongType() {
        assertThrows(SettingsException.class, () -> StepSettings.resolve(SCHEMA, json("{\"Treshold\": \"high\"}")));
        assertThrows(SettingsException.class, () -> StepSettings.resolve(SCHEMA, json("{\"Enabled\": 1}")));
        assertThrows(SettingsException.class, () -> StepSettings.resolve(SCHEMA, json("{\"Label\": 3}")));
        assertThrows(SettingsException.class, () -> StepSettings.resolve(SCHEMA, json("{\"Count\": 2.5}")));
        assertThrows(SettingsException.class, () -> StepSettings.resolve(SCHEMA, json("{\"Count\": [1]}")));
    }

    @Test
    @DisplayName("越界时失败")
    void testOutOfRange() {
        SettingsException e = assertThrows(SettingsException.class,
                () -> StepSettings.resolve(SCHEMA, json("{\"Treshold\": 1.5}")));
        assertTrue(e.getMessage().contains("Treshold (number, 0..1, default 1.0)"), e.getMessage());
        assertThrows(SettingsException.class, () -> StepSettings.resolve(SCHEMA, json("{\"Count\": -1}")));
        assertEquals(10, StepSettings.resolve(SCHEMA, json("{\"Count\": 10}")).getInt("Count"));
    }

    @Test
    @DisplayName("未知的设置名失败")
    void testUnknownSetting() {
        SettingsException e = assertThrows(SettingsException.class,
                () -> StepSettings.resolve(SCHEMA, json("{\"Threshold\": 0.5}")));
        assertTrue(e.getMessage().contains("Threshold"));
    }

    @Test
    @DisplayName("读取未声明的设置抛出 IllegalArgumentException")
    void testMissingGetter() {
        assertThrows(IllegalArgumentException.class, () -> StepSettings.defaults(SCHEMA).getInt("Nope"));
    }
}
