package com.luashroud.pipeline.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 单个步骤设置的声明：名字、类型、默认值、范围和说明
 */
public final class SettingDescriptor {
    private final String name;
    private final SettingType type;
    private final Object defaultValue;
    private final Double min;
    private final Double max;
    private final List<String> values;
    private final String description;

    private SettingDescriptor(String name, SettingType type, Object defaultValue, Double min, Double max,
                              List<String> values, String description) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.min = min;
        this.max = max;
        this.values = values;
        this.description = description;
    }

    public static SettingDescriptor number(String name, double defaultValue, Double min, Double max, String description) {
        return new SettingDescriptor(name, SettingType.NUMBER, defaultValue, min, max,
                Collections.<String>emptyList(), description);
    }

    public static SettingDescriptor integer(String name, int defaultValue, Integer min, Integer max, String description) {
        return new SettingDescriptor(name, SettingType.INTEGER, defaultValue,
                min != null ? Double.valueOf(min) : null, max != null ? Double.valueOf(max) : null,
                Collections.<String>emptyList(), description);
    }

    public static SettingDescriptor bool(String name, boolean defaultValue, String description) {
        return new SettingDescriptor(name, SettingType.BOOLEAN, defaultValue, null, null,
                Collections.<String>emptyList(), description);
    }

    public static SettingDescriptor enumeration(String name, String defaultValue, String description, String... values) {
        List<String> list = Collections.unmodifiableList(new ArrayList<String>(Arrays.asList(values)));
        if (!list.contains(defaultValue)) {
            throw new IllegalArgumentException("default '" + defaultValue + "' is not one of " + list);
        }
        return new SettingDescriptor(name, SettingType.ENUM, defaultValue, null, null, list, description);
    }

    public static SettingDescriptor string(String name, String defaultValue, String description) {
        return new SettingDescriptor(name, SettingType.STRING, defaultValue, null, null,
                Collections.<String>emptyList(), description);
    }

    public String getName() { return name; }
    public SettingType getType() { return type; }
    public Object getDefaultValue() { return defaultValue; }
    /** 下界（含），无界时为 null */
    public Double getMin() { return min; }
    /** 上界（含），无界时为 null */
    public Double getMax() { return max; }
    /** ENUM 的可选值 */
    public List<String> getValues() { return values; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" (").append(type.getDisplayName());
        if (type == SettingType.ENUM) {
            sb.append(' ').append(values);
        }
        if (min != null || max != null) {
            sb.append(", ").append(min != null ? format(min) : "-inf")
              .append("..").append(max != null ? format(max) : "inf");
        }
        sb.append(", default ").append(defaultValue).append(')');
        return sb.toString();
    }

    private static String format(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
