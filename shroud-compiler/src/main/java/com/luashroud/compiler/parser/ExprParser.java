package com.luashroud.compiler.parser;

import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.expr.BinaryExpression;
import com.luashroud.compiler.ast.expr.BooleanExpression;
import com.luashroud.compiler.ast.expr.Expression;
import com.luashroud.compiler.ast.expr.FunctionCallExpression;
import com.luashroud.compiler.ast.expr.FunctionLiteralExpression;
import com.luashroud.compiler.ast.expr.IndexExpression;
import com.luashroud.compiler.ast.expr.KeyedTableEntry;
import com.luashroud.compiler.ast.expr.NilExpression;
import com.luashroud.compiler.ast.expr.NumberExpression;
import com.luashroud.compiler.ast.expr.ParenthesisExpression;
import com.luashroud.compiler.ast.expr.PassSelfFunctionCallExpression;
import com.luashroud.compiler.ast.expr.StringExpression;
import com.luashroud.compiler.ast.expr.TableConstructorExpression;
import com.luashroud.compiler.ast.expr.TableEntry;
import com.luashroud.compiler.ast.expr.TableField;
import com.luashroud.compiler.ast.expr.UnaryExpression;
import com.luashroud.compiler.ast.expr.VarargExpression;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.lexer.Token;
import com.luashroud.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.luashroud.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 */
class ExprParser {

    // 二元运算左右绑定力 = 优先级 * 2，右结合运算右侧减一
    private static final int UNARY_LIMIT = AstKind.UNARY_PRECEDENCE * 2;

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseSubExpression(0);
    }

    List<Expression> parseExpressionList() {
        List<Expression> list = new ArrayList<Expression>();
        list.add(parseExpression());
        while (parser.match(COMMA)) {
            list.add(parseExpression());
        }
        return list;
    }

    private Expression parseSubExpression(int limit) {
        Expression left;
        AstKind unary = unaryOperator(parser.current.getType());
        if (unary != null) {
            parser.advance();
            left = new UnaryExpression(unary, parseSubExpression(UNARY_LIMIT));
        } else {
            left = parseSimpleExpression();
        }
        AstKind binary = binaryOperator(parser.current.getType());
        while (binary != null && binary.getPrecedence() * 2 > limit) {
            parser.advance();
            int rightLimit = binary.getPrecedence() * 2 - (binary.isRightAssociative() ? 1 : 0);
            Expression right = parseSubExpression(rightLimit);
            left = new BinaryExpression(binary, left, right);
            binary = binaryOperator(parser.current.getType());
        }
        return left;
    }

    private Expression parseSimpleExpression() {
        Token token = parser.current;
        switch (token.getType()) {
            case NUMBER:
                parser.advance();
                return new NumberExpression((Double) token.getLiteral());
            case STRING:
                parser.advance();
                return new StringExpression((String) token.getLiteral());
            case KW_NIL:
                parser.advance();
                return new NilExpression();
            case KW_TRUE:
                parser.advance();
                return new BooleanExpression(true);
            case KW_FALSE:
                parser.advance();
                return new BooleanExpression(false);
            case ELLIPSIS:
                if (!parser.isVarargAllowed()) {
                    throw parser.error("cannot use '...' outside a vararg function");
                }
                parser.advance();
                return new VarargExpression();
            case LBRACE:
                return parseTableConstructor();
            case KW_FUNCTION: {
                Token functionToken = parser.advance();
                FunctionBody function = parseFunctionBody(Collections.<String>emptyList(), functionToken);
                return new FunctionLiteralExpression(function.args, function.body);
            }
            default:
                return parseSuffixedExpression();
        }
    }

    private Expression parsePrimaryExpression() {
        if (parser.check(NAME)) {
            return parser.variable(parser.advance().getLexeme());
        }
        if (parser.check(LPAREN)) {
            Token open = parser.advance();
            Expression inner = parseExpression();
            parser.expectClosing(RPAREN, ")", "(", open);
            // 括号只在截断多值时有语义，其余由格式化器按优先级重新加上
            if (inner.isMultiValued()) {
                return new ParenthesisExpression(inner);
            }
            return inner;
        }
        throw parser.error("unexpected symbol");
    }

    /** primaryexp { '.' NAME | '[' exp ']' | ':' NAME args | args } */
    Expression parseSuffixedExpression() {
        Expression expression = parsePrimaryExpression();
        while (true) {
            switch (parser.current.getType()) {
                case DOT:
                    parser.advance();
                    expression = new IndexExpression(expression, new StringExpression(parser.expectName()));
                    break;
                case LBRACKET: {
                    Token open = parser.advance();
                    Expression index = parseExpression();
                    parser.expectClosing(RBRACKET, "]", "[", open);
                    expression = new IndexExpression(expression, index);
                    break;
                }
                case COLON: {
                    parser.advance();
                    String name = parser.expectName();
                    expression = new PassSelfFunctionCallExpression(expression, name, parseCallArguments());
                    break;
                }
                case LPAREN:
                case STRING:
                case LBRACE:
                    expression = new FunctionCallExpression(expression, parseCallArguments());
                    break;
                default:
                    return expression;
            }
        }
    }

    private List<Expression> parseCallArguments() {
        if (parser.check(STRING)) {
            Token token = parser.advance();
            return Collections.<Expression>singletonList(new StringExpression((String) token.getLiteral()));
        }
        if (parser.check(LBRACE)) {
            return Collections.<Expression>singletonList(parseTableConstructor());
        }
        if (!parser.check(LPAREN)) {
            throw parser.error("function arguments expected");
        }
        Token open = parser.advance();
        List<Expression> args;
        if (parser.check(RPAREN)) {
            args = new ArrayList<Expression>();
        } else {
            args = parseExpressionList();
        }
        parser.expectClosing(RPAREN, ")", "(", open);
        return args;
    }

    private TableConstructorExpression parseTableConstructor() {
        Token open = parser.expect(LBRACE, "{");
        List<TableField> entries = new ArrayList<TableField>();
        while (!parser.check(RBRACE)) {
            if (parser.check(LBRACKET)) {
                parser.advance();
                Expression key = parseExpression();
                parser.expect(RBRACKET, "]");
                parser.expect(ASSIGN, "=");
                entries.add(new KeyedTableEntry(key, parseExpression()));
            } else if (parser.check(NAME) && parser.peek().is(ASSIGN)) {
                String name = parser.advance().getLexeme();
                parser.advance();
                entries.add(new KeyedTableEntry(new StringExpression(name), parseExpression()));
            } else {
                entries.add(new TableEntry(parseExpression()));
            }
            if (!parser.match(COMMA) && !parser.match(SEMICOLON)) {
                break;
            }
        }
        parser.expectClosing(RBRACE, "}", "{", open);
        return new TableConstructorExpression(entries);
    }

    /**
     * 解析 (params) block end，参数声明在新的函数体作用域中
     *
     * @param implicitParams 隐式参数（方法定义的 self）
     */
    FunctionBody parseFunctionBody(List<String> implicitParams, Token functionToken) {
        Scope outer = parser.scope;
        Scope bodyScope = new Scope(outer);
        parser.pushScope(bodyScope);

        List<Expression> args = new ArrayList<Expression>();
        for (String name : implicitParams) {
            args.add(parameter(bodyScope, name));
        }
        boolean vararg = false;
        parser.expect(LPAREN, "(");
        if (!parser.check(RPAREN)) {
            do {
                if (parser.check(ELLIPSIS)) {
                    parser.advance();
                    args.add(new VarargExpression());
                    vararg = true;
                    break;
                }
                args.add(parameter(bodyScope, parser.expectName()));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, ")");

        parser.pushFunction(vararg);
        Block body = parser.stmtParser.parseBlock(bodyScope, true);
        parser.popFunction();
        parser.expectClosing(KW_END, "end", "function", functionToken);
        parser.popScope(outer);
        return new FunctionBody(args, body);
    }

    // 参数同时记作函数体作用域内的一次引用
    private static VariableExpression parameter(Scope bodyScope, String name) {
        VariableExpression arg = new VariableExpression(bodyScope, bodyScope.addVariable(name));
        bodyScope.addReferenceToHigherScope(bodyScope, arg.getId());
        return arg;
    }

    static final class FunctionBody {
        final List<Expression> args;
        final Block body;

        FunctionBody(List<Expression> args, Block body) {
            this.args = args;
            this.body = body;
        }
    }

    static AstKind unaryOperator(TokenType type) {
        switch (type) {
            case KW_NOT: return AstKind.NOT;
            case MINUS: return AstKind.NEGATE;
            case HASH: return AstKind.LEN;
            default: return null;
        }
    }

    static AstKind binaryOperator(TokenType type) {
        switch (type) {
            case KW_OR: return AstKind.OR;
            case KW_AND: return AstKind.AND;
            case LT: return AstKind.LESS_THAN;
            case GT: return AstKind.GREATER_THAN;
            case LE: return AstKind.LESS_THAN_OR_EQUALS;
            case GE: return AstKind.GREATER_THAN_OR_EQUALS;
            case NE: return AstKind.NOT_EQUALS;
            case EQ: return AstKind.EQUALS;
            case CONCAT: return AstKind.STR_CAT;
            case PLUS: return AstKind.ADD;
            case MINUS: return AstKind.SUB;
            case MUL: return AstKind.MUL;
            case DIV: return AstKind.DIV;
            case MOD: return AstKind.MOD;
            case POW: return AstKind.POW;
            default: return null;
        }
    }
}
