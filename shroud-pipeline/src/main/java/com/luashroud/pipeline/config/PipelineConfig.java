package com.luashroud.pipeline.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.luashroud.compiler.lexer.LuaVersion;
import com.luashroud.pipeline.namegen.NameGenerators;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 流水线配置（JSON）
 *
 * <pre>
 * {
 *   "luaVersion": "Lua51",
 *   "prettyPrint": false,
 *   "seed": 42,
 *   "varNamePrefix": "",
 *   "nameGenerator": "MangledShuffled",
 *   "renameVariables": true,
 *   "verifyScopes": false,
 *   "steps": [ { "name": "ConstantArray", "settings": { "Treshold": 1 } } ]
 * }
 * </pre>
 */
public class PipelineConfig {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private String luaVersion = LuaVersion.LUA51.getDisplayName();
    private boolean prettyPrint = false;
    /** null 表示每次运行随机 */
    private Long seed;
    private String varNamePrefix = "";
    private String nameGenerator = "MangledShuffled";
    private boolean renameVariables = true;
    private boolean verifyScopes = false;
    private List<StepConfig> steps = new ArrayList<StepConfig>();

    /**
     * 单个步骤：名字加可选设置
     */
    public static class StepConfig {
        private String name;
        private JsonObject settings;

        public StepConfig() {
        }

        public StepConfig(String name, JsonObject settings) {
            this.name = name;
            this.settings = settings;
        }

        public String getName() { return name; }
        public JsonObject getSettings() { return settings; }

        StepConfig copy() {
            return new StepConfig(name, settings != null ? settings.deepCopy() : null);
        }
    }

    // ============ 读写 ============

    /**
     * 解析并校验 JSON 配置
     *
     * @throws SettingsException JSON 无效或取值不合法
     */
    public static PipelineConfig fromJson(String json) {
        PipelineConfig config;
        try {
            config = GSON.fromJson(json, PipelineConfig.class);
        } catch (JsonParseException e) {
            throw new SettingsException("invalid configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new SettingsException("empty configuration");
        }
        if (config.steps == null) {
            config.steps = new ArrayList<StepConfig>();
        }
        config.validate();
        return config;
    }

    public static PipelineConfig load(Path path) throws IOException {
        return fromJson(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * 校验方言、名字生成器和步骤列表；步骤自身的设置由 {@link com.luashroud.pipeline.StepRegistry} 校验
     */
    public void validate() {
        if (LuaVersion.fromName(luaVersion) == null) {
            throw new SettingsException("unknown luaVersion '" + luaVersion + "', expected Lua51 or LuaU");
        }
        if (!NameGenerators.isKnown(nameGenerator)) {
            throw new SettingsException("unknown nameGenerator '" + nameGenerator + "', expected one of "
                    + NameGenerators.names());
        }
        if (varNamePrefix == null) {
            varNamePrefix = "";
        }
        for (StepConfig step : steps) {
            if (step == null || step.getName() == null || step.getName().isEmpty()) {
                throw new SettingsException("every step requires a name");
            }
        }
    }

    public PipelineConfig copy() {
        PipelineConfig copy = new PipelineConfig();
        copy.luaVersion = luaVersion;
        copy.prettyPrint = prettyPrint;
        copy.seed = seed;
        copy.varNamePrefix = varNamePrefix;
        copy.nameGenerator = nameGenerator;
        copy.renameVariables = renameVariables;
        copy.verifyScopes = verifyScopes;
        for (StepConfig step : steps) {
            copy.steps.add(step.copy());
        }
        return copy;
    }

    // ============ 属性 ============

    public LuaVersion getLuaVersion() {
        LuaVersion version = LuaVersion.fromName(luaVersion);
        if (version == null) {
            throw new SettingsException("unknown luaVersion '" + luaVersion + "'");
        }
        return version;
    }

    public void setLuaVersion(LuaVersion version) {
        this.luaVersion = version.getDisplayName();
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public void setPrettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public String getVarNamePrefix() {
        return varNamePrefix;
    }

    public void setVarNamePrefix(String varNamePrefix) {
        this.varNamePrefix = varNamePrefix != null ? varNamePrefix : "";
    }

    public String getNameGenerator() {
        return nameGenerator;
    }

    public void setNameGenerator(String nameGenerator) {
        this.nameGenerator = nameGenerator;
    }

    public boolean isRenameVariables() {
        return renameVariables;
    }

    public void setRenameVariables(boolean renameVariables) {
        this.renameVariables = renameVariables;
    }

    public boolean isVerifyScopes() {
        return verifyScopes;
    }

    public void setVerifyScopes(boolean verifyScopes) {
        this.verifyScopes = verifyScopes;
    }

    public List<StepConfig> getSteps() {
        return steps;
    }

    public void addStep(String name, JsonObject settings) {
        steps.add(new StepConfig(name, settings));
    }
}
