package com.luashroud.pipeline.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 内置预设，从 classpath 上的 presets.json 加载
 */
public final class Presets {

    private static final String RESOURCE = "/presets.json";

    private static volatile Map<String, String> presets;

    private Presets() {}

    public static Set<String> names() {
        return Collections.unmodifiableSet(all().keySet());
    }

    public static boolean has(String name) {
        return find(name) != null;
    }

    /**
     * 获取预设配置（每次返回新的副本，名字不区分大小写）
     *
     * @throws SettingsException 没有该预设
     */
    public static PipelineConfig get(String name) {
        String json = find(name);
        if (json == null) {
            throw new SettingsException("unknown preset '" + name + "', expected one of " + names());
        }
        return PipelineConfig.fromJson(json);
    }

    private static String find(String name) {
        for (Map.Entry<String, String> e : all().entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    private static Map<String, String> all() {
        Map<String, String> result = presets;
        if (result == null) {
            synchronized (Presets.class) {
                result = presets;
                if (result == null) {
                    result = load();
                    presets = result;
                }
            }
        }
        return result;
    }

    private static Map<String, String> load() {
        InputStream in = Presets.class.getResourceAsStream(RESOURCE);
        if (in == null) {
            throw new IllegalStateException("missing resource " + RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();
            Map<String, String> map = new LinkedHashMap<String, String>();
            for (Map.Entry<String, JsonElement> e : root.entrySet()) {
                map.put(e.getKey(), e.getValue().toString());
            }
            return Collections.unmodifiableMap(map);
        } catch (IOException e) {
            throw new IllegalStateException("cannot read " + RESOURCE, e);
        }
    }
}
