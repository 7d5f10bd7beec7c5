package com.luashroud.compiler.formatter;

/**
 * 格式化上下文，跟踪输出缓冲区、缩进层级和语句分隔
 *
 * <p>追加文本时检查与上一个字符是否会粘连成别的词法单元（如 {@code - -x} 变成注释、{@code 1 ..x} 变成畸形数字），需要时插入空格。</p>
 */
public class FormatterContext {
    private final StringBuilder output = new StringBuilder();
    private final FormatConfig config;
    private int indentLevel = 0;
    private boolean atLineStart = true;
    private boolean lastWasNumber = false;
    private boolean afterStatement = false;

    public FormatterContext(FormatConfig config) {
        this.config = config;
    }

    public FormatConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进与粘连）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        } else if (output.length() > 0 && needsSpace(output.charAt(output.length() - 1), text.charAt(0))) {
            output.append(' ');
        }
        output.append(text);
        lastWasNumber = false;
    }

    public void appendNumber(String text) {
        append(text);
        lastWasNumber = true;
    }

    private boolean needsSpace(char last, char first) {
        if (last == ' ' || last == '\n') return false;
        if (isWordChar(last) && isWordChar(first)) return true;
        if (last == '-' && first == '-') return true;
        if (last == '.' && (first == '.' || Character.isDigit(first))) return true;
        return lastWasNumber && first == '.';
    }

    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    /**
     * 二元运算符、赋值号等：按配置决定两侧是否留空格
     */
    public void operator(String op) {
        if (config.isSpaceAroundOperators()) {
            space();
            append(op);
            space();
        } else {
            append(op);
        }
    }

    public void comma() {
        append(",");
        if (config.isSpaceAroundOperators()) {
            space();
        }
    }

    /**
     * 追加空格
     */
    public void space() {
        if (atLineStart) return;
        output.append(' ');
    }

    /**
     * 换行；单行模式下 inline 输出一个空格，compact 不输出（粘连由 append 处理）
     */
    public void lineBreak() {
        if (output.length() == 0) return;
        if (config.isLineBreaks()) {
            output.append("\n");
            atLineStart = true;
        } else if (config.isSpaceAroundOperators()) {
            space();
        }
    }

    /** 进入代码块：下一条语句是块内第一条 */
    public void openBlock() {
        afterStatement = false;
    }

    /**
     * 开始一条语句
     *
     * @param startsWithParen 语句以 ( 开头，需要与上一条语句显式分隔
     */
    public void beginStatement(boolean startsWithParen) {
        if (config.isLineBreaks()) {
            lineBreak();
            if (startsWithParen && output.length() > 0) {
                append(";");
            }
        } else if (afterStatement) {
            append(";");
            if (config.isSpaceAroundOperators()) {
                space();
            }
        } else {
            lineBreak();
        }
    }

    public void endStatement() {
        afterStatement = true;
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    private String indentString() {
        if (!config.isLineBreaks()) return "";
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }
}
