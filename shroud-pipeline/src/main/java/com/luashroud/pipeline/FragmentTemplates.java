package com.luashroud.pipeline;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 以 classpath 资源形式保存的 Lua 片段（fragments/NAME.lua），用 ${KEY} 作占位符
 */
public final class FragmentTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Z0-9_]+)}");
    private static final Map<String, String> cache = new ConcurrentHashMap<>();

    private FragmentTemplates() {}

    /**
     * 读取片段原文（ISO-8859-1，与词法分析器的字节语义一致）
     */
    public static String load(String name) {
        return cache.computeIfAbsent(name, FragmentTemplates::read);
    }

    /**
     * 读取片段并替换全部占位符
     *
     * @throws IllegalArgumentException 占位符没有对应的值
     */
    public static String render(String name, Map<String, String> values) {
        String template = load(name);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = values.get(key);
            if (value == null) {
                throw new IllegalArgumentException("fragment '" + name + "' has no value for ${" + key + "}");
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String read(String name) {
        String path = "/fragments/" + name + ".lua";
        try (InputStream in = FragmentTemplates.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalArgumentException("no fragment named '" + name + "'");
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[4096];
            int n;
            while ((n = in.read(buffer)) != -1) {
                out.write(buffer, 0, n);
            }
            return new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new IllegalStateException("cannot read fragment " + path, e);
        }
    }
}
