package com.luashroud.compiler.parser;

import com.luashroud.compiler.analysis.Binding;
import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.TopNode;
import com.luashroud.compiler.ast.expr.AssignmentVariable;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.lexer.Lexer;
import com.luashroud.compiler.lexer.LuaVersion;
import com.luashroud.compiler.lexer.Token;
import com.luashroud.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Lua 语法分析器（递归下降）
 *
 * <p>解析的同时建立作用域并登记引用账目：每个变量引用节点都对应一次
 * {@link Scope#addReferenceToHigherScope} 调用。同一个实例可以反复调用 {@link #parse}，但不能并发使用。</p>
 */
public class Parser {

    final LuaVersion version;

    // 单次解析的状态
    String fileName;
    private List<Token> tokens;
    private int position;
    Token current;
    Token previous;
    Scope scope;
    Scope globalScope;
    // 每层函数是否允许 ...
    private final Deque<Boolean> varargStack = new ArrayDeque<Boolean>();

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(LuaVersion version) {
        this.version = version;
    }

    public LuaVersion getVersion() {
        return version;
    }

    public TopNode parse(String source) {
        return parse(source, "<input>");
    }

    /**
     * 解析完整的程序
     *
     * @throws ParseException 词法或语法错误
     */
    public TopNode parse(String source, String fileName) {
        this.fileName = fileName;
        this.tokens = new Lexer(source, fileName, version).scanTokens();
        this.position = 0;
        this.previous = null;
        this.current = null;
        this.varargStack.clear();
        advance();

        globalScope = Scope.newGlobal();
        scope = globalScope;
        Scope bodyScope = new Scope(globalScope);
        varargStack.push(Boolean.TRUE); // 主代码块可以使用 ...
        Block body = stmtParser.parseBlock(bodyScope, false);
        varargStack.pop();
        if (!check(TokenType.EOF)) {
            throw error("'<eof>' expected");
        }
        return new TopNode(body, globalScope);
    }

    // ============ 基础方法 ============

    Token advance() {
        previous = current;
        current = tokens.get(position);
        if (position < tokens.size() - 1) {
            position++;
        }
        if (current.is(TokenType.ERROR)) {
            throw new ParseException((String) current.getLiteral(), current, fileName);
        }
        return previous;
    }

    /** 查看当前 token 之后的 token */
    Token peek() {
        return tokens.get(position);
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    Token expect(TokenType type, String what) {
        if (check(type)) {
            return advance();
        }
        throw error("'" + what + "' expected");
    }

    /** 期望闭合的 token；跨行时在错误中指出开头所在行 */
    Token expectClosing(TokenType type, String what, String opener, Token openToken) {
        if (check(type)) {
            return advance();
        }
        if (openToken.getLine() == current.getLine()) {
            throw error("'" + what + "' expected");
        }
        throw error("'" + what + "' expected (to close '" + opener + "' at line " + openToken.getLine() + ")");
    }

    String expectName() {
        return expect(TokenType.NAME, "<name>").getLexeme();
    }

    ParseException error(String message) {
        return new ParseException(message, current, fileName);
    }

    // ============ 作用域 ============

    void pushScope(Scope newScope) {
        scope = newScope;
    }

    void popScope(Scope outer) {
        scope = outer;
    }

    void pushFunction(boolean vararg) {
        varargStack.push(vararg);
    }

    void popFunction() {
        varargStack.pop();
    }

    boolean isVarargAllowed() {
        return varargStack.peek();
    }

    /** 名字解析：局部变量优先，否则驻留为全局变量 */
    Binding resolveName(String name) {
        Binding binding = scope.resolve(name);
        if (binding == null) {
            binding = scope.resolveGlobal(name);
        }
        return binding;
    }

    /** 变量引用节点，同时登记账目 */
    VariableExpression variable(String name) {
        Binding binding = resolveName(name);
        scope.addReferenceToHigherScope(binding.getScope(), binding.getId());
        return new VariableExpression(binding.getScope(), binding.getId());
    }

    /** 把已解析的变量引用转为赋值目标，引用次数不变 */
    static AssignmentVariable toAssignmentVariable(VariableExpression expression) {
        return new AssignmentVariable(expression.getScope(), expression.getId());
    }
}
