package com.luashroud.pipeline.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按声明校验并补全默认值后的步骤设置
 */
public final class StepSettings {

    private final Map<String, Object> values;

    private StepSettings(Map<String, Object> values) {
        this.values = values;
    }

    /** 全部取默认值 */
    public static StepSettings defaults(List<SettingDescriptor> schema) {
        return resolve(schema, null);
    }

    /**
     * 校验 JSON 设置并补全默认值
     *
     * @param json 可以为 null
     * @throws SettingsException 未知的设置、类型不符或越界
     */
    public static StepSettings resolve(List<SettingDescriptor> schema, JsonObject json) {
        Map<String, SettingDescriptor> byName = new LinkedHashMap<String, SettingDescriptor>();
        for (SettingDescriptor descriptor : schema) {
            byName.put(descriptor.getName(), descriptor);
        }
        Map<String, Object> values = new LinkedHashMap<String, Object>();
        for (SettingDescriptor descriptor : schema) {
            values.put(descriptor.getName(), descriptor.getDefaultValue());
        }
        if (json != null) {
            for (Map.Entry<String, JsonElement> e : json.entrySet()) {
                SettingDescriptor descriptor = byName.get(e.getKey());
                if (descriptor == null) {
                    throw new SettingsException("unknown setting '" + e.getKey() + "', expected one of " + byName.keySet());
                }
                values.put(descriptor.getName(), convert(descriptor, e.getValue()));
            }
        }
        return new StepSettings(Collections.unmodifiableMap(values));
    }

    private static Object convert(SettingDescriptor descriptor, JsonElement element) {
        String name = descriptor.getName();
        if (element == null || !element.isJsonPrimitive()) {
            throw new SettingsException("setting '" + name + "' must be a " + descriptor.getType().getDisplayName());
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        switch (descriptor.getType()) {
            case NUMBER: {
                double value = requireNumber(name, primitive);
                checkRange(descriptor, value);
                return value;
            }
            case INTEGER: {
                double value = requireNumber(name, primitive);
                if (value != Math.rint(value)) {
                    throw new SettingsException("setting '" + name + "' must be an integer, got " + value);
                }
                checkRange(descriptor, value);
                return (int) value;
            }
            case BOOLEAN:
                if (!primitive.isBoolean()) {
                    throw new SettingsException("setting '" + name + "' must be a boolean");
                }
                return primitive.getAsBoolean();
            case ENUM: {
                if (!primitive.isString()) {
                    throw new SettingsException("setting '" + name + "' must be one of " + descriptor.getValues());
                }
                String value = primitive.getAsString();
                for (String option : descriptor.getValues()) {
                    if (option.equalsIgnoreCase(value)) {
                        return option;
                    }
                }
                throw new SettingsException("setting '" + name + "' must be one of " + descriptor.getValues()
                        + ", got '" + value + "'");
            }
            case STRING:
                if (!primitive.isString()) {
                    throw new SettingsException("setting '" + name + "' must be a string");
                }
                return primitive.getAsString();
            default:
                throw new IllegalStateException("unknown setting type " + descriptor.getType());
        }
    }

    private static double requireNumber(String name, JsonPrimitive primitive) {
        if (!primitive.isNumber()) {
            throw new SettingsException("setting '" + name + "' must be a number");
        }
        return primitive.getAsDouble();
    }

    private static void checkRange(SettingDescriptor descriptor, double value) {
        if ((descriptor.getMin() != null && value < descriptor.getMin())
                || (descriptor.getMax() != null && value > descriptor.getMax())) {
            throw new SettingsException("setting '" + descriptor.getName() + "' out of range: " + descriptor);
        }
    }

    // ============ 取值 ============

    public double getNumber(String name) {
        return ((Number) get(name)).doubleValue();
    }

    public int getInt(String name) {
        return ((Number) get(name)).intValue();
    }

    public boolean getBoolean(String name) {
        return (Boolean) get(name);
    }

    public String getString(String name) {
        return (String) get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("no setting named '" + name + "'");
        }
        return values.get(name);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
