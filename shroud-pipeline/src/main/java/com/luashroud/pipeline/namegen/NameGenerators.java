package com.luashroud.pipeline.namegen;

import com.luashroud.pipeline.config.SettingsException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 按名字创建名字生成器
 */
public final class NameGenerators {

    private static final Map<String, Supplier<NameGenerator>> generators = new LinkedHashMap<>();

    static {
        generators.put("Mangled", MangledNameGenerator::new);
        generators.put("MangledShuffled", MangledShuffledNameGenerator::new);
        generators.put("Il", IlNameGenerator::new);
        generators.put("Number", NumberNameGenerator::new);
    }

    private NameGenerators() {}

    public static Set<String> names() {
        return Collections.unmodifiableSet(generators.keySet());
    }

    public static boolean isKnown(String name) {
        return lookup(name) != null;
    }

    /**
     * @throws SettingsException 未知的生成器
     */
    public static NameGenerator create(String name) {
        Supplier<NameGenerator> supplier = lookup(name);
        if (supplier == null) {
            throw new SettingsException("unknown name generator '" + name + "', expected one of " + names());
        }
        return supplier.get();
    }

    private static Supplier<NameGenerator> lookup(String name) {
        if (name == null) return null;
        for (Map.Entry<String, Supplier<NameGenerator>> e : generators.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }
}
