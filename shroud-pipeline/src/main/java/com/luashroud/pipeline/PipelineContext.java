package com.luashroud.pipeline;

import com.luashroud.compiler.lexer.LuaVersion;
import com.luashroud.compiler.parser.Parser;
import com.luashroud.compiler.splice.TreeSplicer;
import com.luashroud.pipeline.config.PipelineConfig;
import com.luashroud.pipeline.namegen.NameGenerator;
import com.luashroud.pipeline.namegen.NameGenerators;

import java.util.Random;

/**
 * 一次流水线运行的共享状态：种子随机数、名字生成器、方言和拼接器
 */
public class PipelineContext {

    private static final String NAME_CHARS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final PipelineConfig config;
    private final long seed;
    private final Random random;
    private final NameGenerator nameGenerator;
    private final TreeSplicer splicer;

    public PipelineContext(PipelineConfig config, long seed) {
        this.config = config;
        this.seed = seed;
        this.random = new Random(seed);
        this.nameGenerator = NameGenerators.create(config.getNameGenerator());
        this.nameGenerator.prepare(random);
        this.splicer = new TreeSplicer(newParser());
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public long getSeed() {
        return seed;
    }

    public Random getRandom() {
        return random;
    }

    /** [min, max] 内的随机整数 */
    public int randomInt(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("empty range " + min + ".." + max);
        }
        return min + (int) (random.nextDouble() * ((long) max - min + 1));
    }

    /** 按概率返回 true，probability 取 [0, 1] */
    public boolean chance(double probability) {
        return random.nextDouble() < probability;
    }

    /** 只含字母的随机串，用作表键或全局标记 */
    public String randomString(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(NAME_CHARS.charAt(random.nextInt(NAME_CHARS.length())));
        }
        return sb.toString();
    }

    public NameGenerator getNameGenerator() {
        return nameGenerator;
    }

    public String generateName(int id) {
        return nameGenerator.generateName(id);
    }

    public LuaVersion getLuaVersion() {
        return config.getLuaVersion();
    }

    /** 与输入同方言的新解析器，片段解析用 */
    public Parser newParser() {
        return new Parser(getLuaVersion());
    }

    public TreeSplicer getSplicer() {
        return splicer;
    }

    public boolean isPrettyPrint() {
        return config.isPrettyPrint();
    }
}
