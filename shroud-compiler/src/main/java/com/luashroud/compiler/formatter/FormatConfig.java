package com.luashroud.compiler.formatter;

/**
 * 代码格式化配置
 */
public class FormatConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    private boolean lineBreaks = true;
    private boolean spaceAroundOperators = true;

    public FormatConfig() {
    }

    /** 多行输出，带缩进 */
    public static FormatConfig pretty() {
        return new FormatConfig();
    }

    /** 单行输出，尽量少的空白，语句之间用 ; 分隔 */
    public static FormatConfig compact() {
        FormatConfig config = new FormatConfig();
        config.setLineBreaks(false);
        config.setSpaceAroundOperators(false);
        return config;
    }

    /** 单行输出，语句之间用 "; " 分隔，运算符两侧保留空格 */
    public static FormatConfig inline() {
        FormatConfig config = new FormatConfig();
        config.setLineBreaks(false);
        return config;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    public boolean isLineBreaks() {
        return lineBreaks;
    }

    public void setLineBreaks(boolean lineBreaks) {
        this.lineBreaks = lineBreaks;
    }

    public boolean isSpaceAroundOperators() {
        return spaceAroundOperators;
    }

    public void setSpaceAroundOperators(boolean spaceAroundOperators) {
        this.spaceAroundOperators = spaceAroundOperators;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
