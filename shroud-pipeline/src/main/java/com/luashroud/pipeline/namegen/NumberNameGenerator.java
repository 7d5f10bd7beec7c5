package com.luashroud.pipeline.namegen;

/**
 * _1, _2, ... 形式的名字，便于调试
 */
public class NumberNameGenerator implements NameGenerator {

    @Override
    public String generateName(int id) {
        return "_" + id;
    }
}
