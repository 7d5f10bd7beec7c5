package com.luashroud.pipeline.namegen;

/**
 * 短名字：a, b, ..., Z, ab, bb, ...（首字符不含数字和下划线）
 */
public class MangledNameGenerator implements NameGenerator {

    static final String START_CHARS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String CHARS = START_CHARS + "_0123456789";

    protected char[] startChars = START_CHARS.toCharArray();
    protected char[] chars = CHARS.toCharArray();

    @Override
    public String generateName(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative: " + id);
        }
        return encode(id, startChars, chars);
    }

    /** 首位取 start 进制，其余位取 digits 进制，不同 id 得到不同的串 */
    static String encode(long id, char[] start, char[] digits) {
        StringBuilder sb = new StringBuilder();
        sb.append(start[(int) (id % start.length)]);
        long rest = id / start.length;
        while (rest > 0) {
            sb.append(digits[(int) (rest % digits.length)]);
            rest /= digits.length;
        }
        return sb.toString();
    }
}
