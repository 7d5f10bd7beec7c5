package com.luashroud.compiler.lexer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lua 词法分析器
 *
 * <p>源码按字节串处理：每个 char 对应一个字节（ISO-8859-1）。词法错误产生 ERROR 单元，由语法分析器报告。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final LuaVersion version;
    private final List<Token> tokens = new ArrayList<Token>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;
    private static final Set<String> RESERVED;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();
        map.put("and", TokenType.KW_AND);
        map.put("break", TokenType.KW_BREAK);
        map.put("do", TokenType.KW_DO);
        map.put("else", TokenType.KW_ELSE);
        map.put("elseif", TokenType.KW_ELSEIF);
        map.put("end", TokenType.KW_END);
        map.put("false", TokenType.KW_FALSE);
        map.put("for", TokenType.KW_FOR);
        map.put("function", TokenType.KW_FUNCTION);
        map.put("if", TokenType.KW_IF);
        map.put("in", TokenType.KW_IN);
        map.put("local", TokenType.KW_LOCAL);
        map.put("nil", TokenType.KW_NIL);
        map.put("not", TokenType.KW_NOT);
        map.put("or", TokenType.KW_OR);
        map.put("repeat", TokenType.KW_REPEAT);
        map.put("return", TokenType.KW_RETURN);
        map.put("then", TokenType.KW_THEN);
        map.put("true", TokenType.KW_TRUE);
        map.put("until", TokenType.KW_UNTIL);
        map.put("while", TokenType.KW_WHILE);
        KEYWORDS = Collections.unmodifiableMap(map);

        Set<String> reserved = new LinkedHashSet<String>(map.keySet());
        reserved.add("continue");
        RESERVED = Collections.unmodifiableSet(reserved);
    }

    /** 不能用作变量名的单词（包含 LuaU 的 continue） */
    public static Set<String> getKeywords() {
        return RESERVED;
    }

    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty() || RESERVED.contains(name)) return false;
        if (!isAlpha(name.charAt(0))) return false;
        for (int i = 1; i < name.length(); i++) {
            if (!isAlphaNumeric(name.charAt(i))) return false;
        }
        return true;
    }

    public Lexer(String source, String fileName, LuaVersion version) {
        this.source = source;
        this.fileName = fileName;
        this.version = version;
    }

    public Lexer(String source, LuaVersion version) {
        this(source, "<input>", version);
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) break;
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ':': addToken(TokenType.COLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case '#': addToken(TokenType.HASH); break;

            case '+': addToken(compound() ? TokenType.PLUS_ASSIGN : TokenType.PLUS); break;
            case '-': addToken(compound() ? TokenType.MINUS_ASSIGN : TokenType.MINUS); break;
            case '*': addToken(compound() ? TokenType.MUL_ASSIGN : TokenType.MUL); break;
            case '/': addToken(compound() ? TokenType.DIV_ASSIGN : TokenType.DIV); break;
            case '%': addToken(compound() ? TokenType.MOD_ASSIGN : TokenType.MOD); break;
            case '^': addToken(compound() ? TokenType.POW_ASSIGN : TokenType.POW); break;

            case '=': addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN); break;
            case '<': addToken(match('=') ? TokenType.LE : TokenType.LT); break;
            case '>': addToken(match('=') ? TokenType.GE : TokenType.GT); break;
            case '~':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("unexpected character '~'");
                }
                break;

            case '.':
                if (match('.')) {
                    if (match('.')) {
                        addToken(TokenType.ELLIPSIS);
                    } else {
                        addToken(compound() ? TokenType.CONCAT_ASSIGN : TokenType.CONCAT);
                    }
                } else if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '[': {
                int level = longBracketLevel();
                if (level >= 0) {
                    String value = longBracket(level, "string");
                    if (value != null) addToken(TokenType.STRING, value);
                } else {
                    addToken(TokenType.LBRACKET);
                }
                break;
            }

            case '"':
            case '\'':
                string(c);
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("unexpected character '" + printable(c) + "'");
                }
                break;
        }
    }

    // LuaU 复合赋值运算符的 '=' 后缀
    private boolean compound() {
        return version.isLuaU() && match('=');
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                advance();
                newLine();
            } else if (c == ' ' || c == '\r' || c == '\t' || c == '\f' || c == 0x0B) {
                advance();
            } else if (c == '-' && peekNext() == '-') {
                start = current;
                startLine = line;
                startColumn = column;
                advance();
                advance();
                comment();
            } else {
                break;
            }
        }
    }

    private void comment() {
        if (peek() == '[') {
            int save = current;
            int saveColumn = column;
            advance();
            int level = longBracketLevel();
            if (level >= 0) {
                longBracket(level, "comment");
                return;
            }
            current = save;
            column = saveColumn;
        }
        while (!isAtEnd() && peek() != '\n') advance();
    }

    /**
     * 已消费开头的 '['，检查后续是否为 {@code =*[}。是则消费并返回等号个数，否则不消费并返回 -1。
     */
    private int longBracketLevel() {
        int i = current;
        int level = 0;
        while (i < source.length() && source.charAt(i) == '=') {
            level++;
            i++;
        }
        if (i < source.length() && source.charAt(i) == '[') {
            while (current <= i) advance();
            return level;
        }
        return -1;
    }

    private String longBracket(int level, String what) {
        // 紧跟开括号的换行不属于内容
        if (peek() == '\r') advance();
        if (peek() == '\n') {
            advance();
            newLine();
        }
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd()) {
            char c = advance();
            if (c == ']') {
                int i = current;
                int closing = 0;
                while (i < source.length() && source.charAt(i) == '=') {
                    closing++;
                    i++;
                }
                if (closing == level && i < source.length() && source.charAt(i) == ']') {
                    while (current <= i) advance();
                    return sb.toString();
                }
            }
            if (c == '\n') newLine();
            sb.append(c);
        }
        error("unfinished long " + what);
        return null;
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                error("unfinished string");
                return;
            }
            char c = advance();
            if (c == quote) break;
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd()) {
                error("unfinished string");
                return;
            }
            char e = advance();
            switch (e) {
                case 'a': sb.append('\u0007'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case 'n': sb.append('\n'); break;
                case 'r': sb.append('\r'); break;
                case 't': sb.append('\t'); break;
                case 'v': sb.append('\u000B'); break;
                case '\\': sb.append('\\'); break;
                case '"': sb.append('"'); break;
                case '\'': sb.append('\''); break;
                case '\n':
                    newLine();
                    sb.append('\n');
                    break;
                case 'x': {
                    int value = 0;
                    for (int i = 0; i < 2; i++) {
                        int digit = Character.digit(peek(), 16);
                        if (digit < 0) {
                            error("hexadecimal digit expected in escape sequence");
                            return;
                        }
                        advance();
                        value = value * 16 + digit;
                    }
                    sb.append((char) value);
                    break;
                }
                case 'z':
                    while (!isAtEnd() && Character.isWhitespace(peek())) {
                        if (advance() == '\n') newLine();
                    }
                    break;
                default:
                    if (isDigit(e)) {
                        int value = e - '0';
                        for (int i = 0; i < 2 && isDigit(peek()); i++) {
                            value = value * 10 + (advance() - '0');
                        }
                        if (value > 255) {
                            error("decimal escape too large");
                            return;
                        }
                        sb.append((char) value);
                    } else {
                        error("invalid escape sequence '\\" + printable(e) + "'");
                        return;
                    }
                    break;
            }
        }
        addToken(TokenType.STRING, sb.toString());
    }

    private void number() {
        String text;
        double value;
        char first = source.charAt(start);
        char second = start + 1 < source.length() ? source.charAt(start + 1) : '\0';
        if (first == '0' && (second == 'x' || second == 'X')) {
            advance();
            text = digits(16);
            value = text.isEmpty() ? Double.NaN : new BigInteger(text, 16).doubleValue();
        } else if (first == '0' && (second == 'b' || second == 'B') && version.isLuaU()) {
            advance();
            text = digits(2);
            value = text.isEmpty() ? Double.NaN : new BigInteger(text, 2).doubleValue();
        } else {
            StringBuilder sb = new StringBuilder();
            sb.append(first);
            sb.append(digits(10));
            if (first != '.' && peek() == '.') {
                sb.append(advance());
                sb.append(digits(10));
            }
            if (peek() == 'e' || peek() == 'E') {
                sb.append(advance());
                if (peek() == '+' || peek() == '-') sb.append(advance());
                String exponent = digits(10);
                if (exponent.isEmpty()) {
                    error("malformed number near '" + source.substring(start, current) + "'");
                    return;
                }
                sb.append(exponent);
            }
            text = sb.toString();
            value = parseDecimal(text);
        }
        if (Double.isNaN(value) || isAlphaNumeric(peek()) || peek() == '.') {
            while (isAlphaNumeric(peek()) || peek() == '.') advance();
            error("malformed number near '" + source.substring(start, current) + "'");
            return;
        }
        addToken(TokenType.NUMBER, value);
    }

    private static double parseDecimal(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    // 读取一串数字；LuaU 允许 '_' 分隔
    private String digits(int radix) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd()) {
            char c = peek();
            if (Character.digit(c, radix) >= 0 && c < 128) {
                sb.append(advance());
            } else if (c == '_' && version.isLuaU()) {
                advance();
            } else {
                break;
            }
        }
        return sb.toString();
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null && version.isLuaU() && text.equals("continue")) {
            type = TokenType.KW_CONTINUE;
        }
        addToken(type != null ? type : TokenType.NAME);
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static String printable(char c) {
        return c >= 32 && c < 127 ? String.valueOf(c) : "\\" + (int) c;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(start, current), literal, startLine, startColumn));
    }

    private void error(String message) {
        tokens.add(new Token(TokenType.ERROR, source.substring(start, Math.min(current, source.length())),
                message, startLine, startColumn));
    }
}
