package com.luashroud.pipeline.namegen;

import java.util.Random;

/**
 * 把非负整数映射为 Lua 名字。不同的 id 必须得到不同的名字。
 */
public interface NameGenerator {

    String generateName(int id);

    /** 每次运行前调用一次，用种子随机数打乱内部状态 */
    default void prepare(Random random) {
    }
}
