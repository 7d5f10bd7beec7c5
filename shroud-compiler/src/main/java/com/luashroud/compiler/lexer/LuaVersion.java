package com.luashroud.compiler.lexer;

/**
 * 源语言方言
 */
public enum LuaVersion {
    LUA51("Lua51"),
    /** Roblox LuaU：continue、复合赋值、二进制字面量与数字分隔符 */
    LUAU("LuaU");

    private final String displayName;

    LuaVersion(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isLuaU() {
        return this == LUAU;
    }

    /** 按名字查找，忽略大小写；未知名字返回 null */
    public static LuaVersion fromName(String name) {
        if (name == null) return null;
        for (LuaVersion v : values()) {
            if (v.displayName.equalsIgnoreCase(name) || v.name().equalsIgnoreCase(name)) {
                return v;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
