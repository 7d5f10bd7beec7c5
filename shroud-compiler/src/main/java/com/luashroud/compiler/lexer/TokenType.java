package com.luashroud.compiler.lexer;

/**
 * Lua 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER,
    STRING,

    // === 标识符 ===
    NAME,

    // === 关键词 ===
    KW_AND, KW_BREAK, KW_DO, KW_ELSE, KW_ELSEIF, KW_END,
    KW_FALSE, KW_FOR, KW_FUNCTION, KW_IF, KW_IN, KW_LOCAL,
    KW_NIL, KW_NOT, KW_OR, KW_REPEAT, KW_RETURN, KW_THEN,
    KW_TRUE, KW_UNTIL, KW_WHILE,
    KW_CONTINUE,            // 仅 LuaU

    // === 运算符 ===
    PLUS, MINUS, MUL, DIV, MOD, POW, HASH,
    CONCAT,                 // ..
    EQ, NE, LT, LE, GT, GE,
    ASSIGN,

    // === 复合赋值（仅 LuaU） ===
    PLUS_ASSIGN, MINUS_ASSIGN, MUL_ASSIGN, DIV_ASSIGN,
    MOD_ASSIGN, POW_ASSIGN, CONCAT_ASSIGN,

    // === 分隔符 ===
    LPAREN, RPAREN, LBRACE, RBRACE, LBRACKET, RBRACKET,
    SEMICOLON, COLON, COMMA, DOT,
    ELLIPSIS,               // ...

    // === 特殊 ===
    ERROR,
    EOF
}
