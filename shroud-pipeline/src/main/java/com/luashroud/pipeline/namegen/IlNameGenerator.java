package com.luashroud.pipeline.namegen;

import java.util.Random;

/**
 * 只由 I、l、1 组成的难以辨认的名字，如 lI1lIl
 */
public class IlNameGenerator implements NameGenerator {

    private static final int MIN_LENGTH = 6;

    private char[] startChars = {'I', 'l'};
    private char[] chars = {'I', 'l', '1'};
    // 加上偏移使名字至少 MIN_LENGTH 个字符
    private long offset = minimumOffset();

    @Override
    public void prepare(Random random) {
        startChars = MangledShuffledNameGenerator.shuffle(new char[]{'I', 'l'}, random);
        chars = MangledShuffledNameGenerator.shuffle(new char[]{'I', 'l', '1'}, random);
        offset = minimumOffset() + random.nextInt(1000);
    }

    @Override
    public String generateName(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative: " + id);
        }
        return MangledNameGenerator.encode(id + offset, startChars, chars);
    }

    private static long minimumOffset() {
        long value = 2;
        for (int i = 2; i < MIN_LENGTH; i++) {
            value *= 3;
        }
        return value;
    }
}
