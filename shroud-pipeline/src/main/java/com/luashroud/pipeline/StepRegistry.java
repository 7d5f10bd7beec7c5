package com.luashroud.pipeline;

import com.google.gson.JsonObject;
import com.luashroud.pipeline.config.SettingDescriptor;
import com.luashroud.pipeline.config.SettingsException;
import com.luashroud.pipeline.config.StepSettings;
import com.luashroud.pipeline.step.AntiTamper;
import com.luashroud.pipeline.step.ConstantArray;
import com.luashroud.pipeline.step.EncryptStrings;
import com.luashroud.pipeline.step.NumbersToExpressions;
import com.luashroud.pipeline.step.ProxifyLocals;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 步骤注册表：名字 → 设置声明 + 工厂
 */
public final class StepRegistry {

    /**
     * 注册项
     */
    public static final class Entry {
        private final String name;
        private final String description;
        private final List<SettingDescriptor> schema;
        private final Function<StepSettings, Step> factory;

        Entry(String name, String description, List<SettingDescriptor> schema, Function<StepSettings, Step> factory) {
            this.name = name;
            this.description = description;
            this.schema = Collections.unmodifiableList(new ArrayList<SettingDescriptor>(schema));
            this.factory = factory;
        }

        public String getName() { return name; }
        public String getDescription() { return description; }
        public List<SettingDescriptor> getSchema() { return schema; }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * 内置步骤
     */
    public static StepRegistry builtin() {
        StepRegistry registry = new StepRegistry();
        registry.register(EncryptStrings.NAME, EncryptStrings.DESCRIPTION, EncryptStrings.SETTINGS, EncryptStrings::new);
        registry.register(AntiTamper.NAME, AntiTamper.DESCRIPTION, AntiTamper.SETTINGS, AntiTamper::new);
        registry.register(ProxifyLocals.NAME, ProxifyLocals.DESCRIPTION, ProxifyLocals.SETTINGS, ProxifyLocals::new);
        registry.register(ConstantArray.NAME, ConstantArray.DESCRIPTION, ConstantArray.SETTINGS, ConstantArray::new);
        registry.register(NumbersToExpressions.NAME, NumbersToExpressions.DESCRIPTION, NumbersToExpressions.SETTINGS,
                NumbersToExpressions::new);
        return registry;
    }

    public void register(String name, String description, List<SettingDescriptor> schema,
                         Function<StepSettings, Step> factory) {
        if (entries.containsKey(name)) {
            throw new IllegalArgumentException("step already registered: " + name);
        }
        entries.put(name, new Entry(name, description, schema, factory));
    }

    public boolean has(String name) {
        return entries.containsKey(name);
    }

    public Collection<Entry> getEntries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /**
     * @throws SettingsException 未知的步骤
     */
    public Entry getEntry(String name) {
        Entry entry = entries.get(name);
        if (entry == null) {
            throw new SettingsException("unknown step '" + name + "', expected one of " + entries.keySet());
        }
        return entry;
    }

    /**
     * 校验设置并创建步骤
     *
     * @param settings 可以为 null（全部取默认值）
     * @throws SettingsException 未知的步骤或设置无效
     */
    public Step create(String name, JsonObject settings) {
        Entry entry = getEntry(name);
        StepSettings resolved;
        try {
            resolved = StepSettings.resolve(entry.schema, settings);
        } catch (SettingsException e) {
            throw new SettingsException("step '" + name + "': " + e.getMessage(), e);
        }
        return entry.factory.apply(resolved);
    }
}
