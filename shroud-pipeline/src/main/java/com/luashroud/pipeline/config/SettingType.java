package com.luashroud.pipeline.config;

/**
 * 步骤设置的取值类型
 */
public enum SettingType {
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    ENUM("enum"),
    STRING("string");

    private final String displayName;

    SettingType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
