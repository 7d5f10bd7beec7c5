package com.luashroud.compiler.parser;

import com.luashroud.compiler.lexer.Token;
import com.luashroud.compiler.lexer.TokenType;

/**
 * 语法错误。解析失败时不返回任何部分结果。
 */
public class ParseException extends RuntimeException {
    private final String fileName;
    private final int line;
    private final int column;
    private final String near;

    public ParseException(String message, Token token, String fileName) {
        super(message);
        this.fileName = fileName;
        this.line = token.getLine();
        this.column = token.getColumn();
        this.near = token.is(TokenType.EOF) ? "<eof>" : token.getLexeme();
    }

    public ParseException(String message, int line, int column) {
        super(message);
        this.fileName = null;
        this.line = line;
        this.column = column;
        this.near = null;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (fileName != null) {
            sb.append(fileName).append(':');
        }
        sb.append(line).append(':').append(column).append(": ");
        sb.append(super.getMessage());
        if (near != null) {
            sb.append(" near '").append(near).append('\'');
        }
        return sb.toString();
    }
}
