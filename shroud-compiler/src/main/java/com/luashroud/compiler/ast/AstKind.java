package com.luashroud.compiler.ast;

/**
 * 节点种类（封闭集合）
 */
public enum AstKind {
    // 结构
    TOP_NODE(Category.STRUCTURE),
    BLOCK(Category.STRUCTURE),

    // 语句
    LOCAL_VARIABLE_DECLARATION(Category.STATEMENT),
    LOCAL_FUNCTION_DECLARATION(Category.STATEMENT),
    FUNCTION_DECLARATION(Category.STATEMENT),
    ASSIGNMENT_STATEMENT(Category.STATEMENT),
    COMPOUND_ASSIGNMENT_STATEMENT(Category.STATEMENT),
    FUNCTION_CALL_STATEMENT(Category.STATEMENT),
    PASS_SELF_FUNCTION_CALL_STATEMENT(Category.STATEMENT),
    RETURN_STATEMENT(Category.STATEMENT),
    BREAK_STATEMENT(Category.STATEMENT),
    CONTINUE_STATEMENT(Category.STATEMENT),
    DO_STATEMENT(Category.STATEMENT),
    WHILE_STATEMENT(Category.STATEMENT),
    REPEAT_STATEMENT(Category.STATEMENT),
    FOR_STATEMENT(Category.STATEMENT),
    FOR_IN_STATEMENT(Category.STATEMENT),
    IF_STATEMENT(Category.STATEMENT),

    // 赋值目标
    ASSIGNMENT_VARIABLE(Category.ASSIGNMENT_TARGET),
    ASSIGNMENT_INDEXING(Category.ASSIGNMENT_TARGET),

    // 表项
    TABLE_ENTRY(Category.TABLE_ENTRY),
    KEYED_TABLE_ENTRY(Category.TABLE_ENTRY),

    // 原子表达式
    NIL(Category.EXPRESSION),
    BOOLEAN(Category.EXPRESSION),
    NUMBER(Category.EXPRESSION),
    STRING(Category.EXPRESSION),
    VARARG(Category.EXPRESSION),
    VARIABLE(Category.EXPRESSION),
    INDEX(Category.EXPRESSION),
    FUNCTION_CALL(Category.EXPRESSION),
    PASS_SELF_FUNCTION_CALL(Category.EXPRESSION),
    FUNCTION_LITERAL(Category.EXPRESSION),
    TABLE_CONSTRUCTOR(Category.EXPRESSION),
    PARENTHESIS(Category.EXPRESSION),

    // 二元运算，优先级取自 Lua 5.1 手册
    OR(Category.BINARY, "or", 1),
    AND(Category.BINARY, "and", 2),
    LESS_THAN(Category.BINARY, "<", 3),
    GREATER_THAN(Category.BINARY, ">", 3),
    LESS_THAN_OR_EQUALS(Category.BINARY, "<=", 3),
    GREATER_THAN_OR_EQUALS(Category.BINARY, ">=", 3),
    NOT_EQUALS(Category.BINARY, "~=", 3),
    EQUALS(Category.BINARY, "==", 3),
    STR_CAT(Category.BINARY, "..", 4),
    ADD(Category.BINARY, "+", 5),
    SUB(Category.BINARY, "-", 5),
    MUL(Category.BINARY, "*", 6),
    DIV(Category.BINARY, "/", 6),
    MOD(Category.BINARY, "%", 6),
    POW(Category.BINARY, "^", 8),

    // 一元运算
    NOT(Category.UNARY, "not", 7),
    NEGATE(Category.UNARY, "-", 7),
    LEN(Category.UNARY, "#", 7);

    /** 一元运算符的优先级 */
    public static final int UNARY_PRECEDENCE = 7;

    public enum Category {
        STRUCTURE,
        STATEMENT,
        EXPRESSION,
        BINARY,
        UNARY,
        ASSIGNMENT_TARGET,
        TABLE_ENTRY
    }

    private final Category category;
    private final String operator;
    private final int precedence;

    AstKind(Category category) {
        this(category, null, 0);
    }

    AstKind(Category category, String operator, int precedence) {
        this.category = category;
        this.operator = operator;
        this.precedence = precedence;
    }

    public Category getCategory() {
        return category;
    }

    /** 运算符在源码中的写法，非运算符返回 null */
    public String getOperator() {
        return operator;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isBinary() {
        return category == Category.BINARY;
    }

    public boolean isUnary() {
        return category == Category.UNARY;
    }

    /** 右结合：.. 和 ^ */
    public boolean isRightAssociative() {
        return this == STR_CAT || this == POW;
    }

    /** 可用于 LuaU 复合赋值（+= 等）的运算 */
    public boolean isArithmetic() {
        switch (this) {
            case ADD:
            case SUB:
            case MUL:
            case DIV:
            case MOD:
            case POW:
            case STR_CAT:
                return true;
            default:
                return false;
        }
    }
}
