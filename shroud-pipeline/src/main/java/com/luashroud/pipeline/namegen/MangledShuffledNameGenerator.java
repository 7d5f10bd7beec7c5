package com.luashroud.pipeline.namegen;

import java.util.Random;

/**
 * 与 {@link MangledNameGenerator} 相同，但字符顺序按种子打乱
 */
public class MangledShuffledNameGenerator extends MangledNameGenerator {

    @Override
    public void prepare(Random random) {
        startChars = shuffle(START_CHARS.toCharArray(), random);
        chars = shuffle(CHARS.toCharArray(), random);
    }

    static char[] shuffle(char[] array, Random random) {
        for (int i = array.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            char tmp = array[i];
            array[i] = array[j];
            array[j] = tmp;
        }
        return array;
    }
}
