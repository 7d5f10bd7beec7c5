package com.luashroud.compiler.formatter;

/**
 * Lua 字符串字面量转义
 */
public final class LuaStringUtils {

    private LuaStringUtils() {}

    /**
     * 转义字符串内容（用于双引号包裹的字符串）。不可打印字节一律写成三位十进制转义，
     * 后面紧跟数字时也不会被误读。
     */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c >= 32 && c < 127) {
                        sb.append(c);
                    } else {
                        int b = c & 0xFF;
                        sb.append('\\');
                        if (b < 100) sb.append('0');
                        if (b < 10) sb.append('0');
                        sb.append(b);
                    }
            }
        }
        return sb.toString();
    }

    public static String quote(String s) {
        return "\"" + escapeString(s) + "\"";
    }
}
