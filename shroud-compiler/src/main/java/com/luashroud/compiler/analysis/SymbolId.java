package com.luashroud.compiler.analysis;

/**
 * 符号标识
 *
 * <p>不透明句柄，按引用比较。重命名只改变表面名字，不改变标识。序号取自所属语法树的计数器，仅用于诊断和默认名字。</p>
 */
public final class SymbolId {
    private final int serial;

    SymbolId(int serial) {
        this.serial = serial;
    }

    public int getSerial() {
        return serial;
    }

    @Override
    public String toString() {
        return "#" + serial;
    }
}
