package com.luashroud.compiler.parser;

import com.luashroud.compiler.analysis.Binding;
import com.luashroud.compiler.analysis.Scope;
import com.luashroud.compiler.analysis.SymbolId;
import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.expr.AssignmentIndexing;
import com.luashroud.compiler.ast.expr.AssignmentTarget;
import com.luashroud.compiler.ast.expr.Expression;
import com.luashroud.compiler.ast.expr.FunctionCallExpression;
import com.luashroud.compiler.ast.expr.IndexExpression;
import com.luashroud.compiler.ast.expr.PassSelfFunctionCallExpression;
import com.luashroud.compiler.ast.expr.VariableExpression;
import com.luashroud.compiler.ast.stmt.AssignmentStatement;
import com.luashroud.compiler.ast.stmt.BreakStatement;
import com.luashroud.compiler.ast.stmt.CompoundAssignmentStatement;
import com.luashroud.compiler.ast.stmt.ContinueStatement;
import com.luashroud.compiler.ast.stmt.DoStatement;
import com.luashroud.compiler.ast.stmt.ForInStatement;
import com.luashroud.compiler.ast.stmt.ForStatement;
import com.luashroud.compiler.ast.stmt.FunctionCallStatement;
import com.luashroud.compiler.ast.stmt.FunctionDeclaration;
import com.luashroud.compiler.ast.stmt.IfStatement;
import com.luashroud.compiler.ast.stmt.LocalFunctionDeclaration;
import com.luashroud.compiler.ast.stmt.LocalVariableDeclaration;
import com.luashroud.compiler.ast.stmt.PassSelfFunctionCallStatement;
import com.luashroud.compiler.ast.stmt.RepeatStatement;
import com.luashroud.compiler.ast.stmt.ReturnStatement;
import com.luashroud.compiler.ast.stmt.Statement;
import com.luashroud.compiler.ast.stmt.WhileStatement;
import com.luashroud.compiler.lexer.Token;
import com.luashroud.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.luashroud.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 在给定作用域中解析语句序列，直到块结束符。不消费结束符。
     */
    Block parseBlock(Scope blockScope, boolean functionBlock) {
        Scope outer = parser.scope;
        parser.pushScope(blockScope);
        List<Statement> statements = parseStatements();
        parser.popScope(outer);
        return new Block(statements, blockScope, functionBlock);
    }

    private List<Statement> parseStatements() {
        List<Statement> statements = new ArrayList<Statement>();
        while (!isBlockEnd()) {
            if (parser.match(SEMICOLON)) {
                continue;
            }
            if (parser.check(KW_RETURN)) {
                statements.add(parseReturn());
                break; // return 必须是代码块的最后一条语句
            }
            statements.add(parseStatement());
        }
        return statements;
    }

    private boolean isBlockEnd() {
        return parser.checkAny(EOF, KW_END, KW_ELSE, KW_ELSEIF, KW_UNTIL);
    }

    private Statement parseStatement() {
        Token token = parser.current;
        switch (token.getType()) {
            case KW_IF:
                return parseIf();
            case KW_WHILE:
                return parseWhile();
            case KW_DO: {
                parser.advance();
                Block body = parseBlock(new Scope(parser.scope), false);
                parser.expectClosing(KW_END, "end", "do", token);
                return new DoStatement(body);
            }
            case KW_FOR:
                return parseFor();
            case KW_REPEAT:
                return parseRepeat();
            case KW_FUNCTION:
                return parseFunctionDeclaration();
            case KW_LOCAL:
                parser.advance();
                if (parser.check(KW_FUNCTION)) {
                    return parseLocalFunction();
                }
                return parseLocal();
            case KW_BREAK:
                parser.advance();
                return new BreakStatement();
            case KW_CONTINUE:
                parser.advance();
                return new ContinueStatement();
            default:
                return parseExpressionStatement();
        }
    }

    private ReturnStatement parseReturn() {
        parser.expect(KW_RETURN, "return");
        List<Expression> args;
        if (isBlockEnd() || parser.check(SEMICOLON)) {
            args = new ArrayList<Expression>();
        } else {
            args = parser.exprParser.parseExpressionList();
        }
        parser.match(SEMICOLON);
        return new ReturnStatement(args);
    }

    private IfStatement parseIf() {
        Token ifToken = parser.advance();
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(KW_THEN, "then");
        Block body = parseBlock(new Scope(parser.scope), false);
        List<IfStatement.ElseIfClause> elseIfs = new ArrayList<IfStatement.ElseIfClause>();
        Block elseBody = null;
        while (parser.match(KW_ELSEIF)) {
            Expression elseIfCondition = parser.exprParser.parseExpression();
            parser.expect(KW_THEN, "then");
            elseIfs.add(new IfStatement.ElseIfClause(elseIfCondition, parseBlock(new Scope(parser.scope), false)));
        }
        if (parser.match(KW_ELSE)) {
            elseBody = parseBlock(new Scope(parser.scope), false);
        }
        parser.expectClosing(KW_END, "end", "if", ifToken);
        return new IfStatement(condition, body, elseIfs, elseBody);
    }

    private WhileStatement parseWhile() {
        Token whileToken = parser.advance();
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(KW_DO, "do");
        Block body = parseBlock(new Scope(parser.scope), false);
        parser.expectClosing(KW_END, "end", "while", whileToken);
        return new WhileStatement(condition, body);
    }

    // until 条件处于循环体作用域内
    private RepeatStatement parseRepeat() {
        Token repeatToken = parser.advance();
        Scope outer = parser.scope;
        Scope bodyScope = new Scope(outer);
        parser.pushScope(bodyScope);
        List<Statement> statements = parseStatements();
        parser.expectClosing(KW_UNTIL, "until", "repeat", repeatToken);
        Expression condition = parser.exprParser.parseExpression();
        parser.popScope(outer);
        return new RepeatStatement(new Block(statements, bodyScope), condition);
    }

    private Statement parseFor() {
        Token forToken = parser.advance();
        String first = parser.expectName();
        Scope outer = parser.scope;
        if (parser.match(ASSIGN)) {
            Expression initialValue = parser.exprParser.parseExpression();
            parser.expect(COMMA, ",");
            Expression finalValue = parser.exprParser.parseExpression();
            Expression incrementBy = null;
            if (parser.match(COMMA)) {
                incrementBy = parser.exprParser.parseExpression();
            }
            parser.expect(KW_DO, "do");
            Scope loopScope = new Scope(outer);
            SymbolId id = loopScope.addVariable(first);
            Block body = parseBlock(new Scope(loopScope), false);
            parser.expectClosing(KW_END, "end", "for", forToken);
            return new ForStatement(loopScope, id, initialValue, finalValue, incrementBy, body);
        }

        List<String> names = new ArrayList<String>();
        names.add(first);
        while (parser.match(COMMA)) {
            names.add(parser.expectName());
        }
        if (!parser.check(KW_IN)) {
            throw parser.error("'=' or 'in' expected");
        }
        parser.advance();
        List<Expression> expressions = parser.exprParser.parseExpressionList();
        parser.expect(KW_DO, "do");
        Scope loopScope = new Scope(outer);
        List<SymbolId> ids = new ArrayList<SymbolId>();
        for (String name : names) {
            ids.add(loopScope.addVariable(name));
        }
        Block body = parseBlock(new Scope(loopScope), false);
        parser.expectClosing(KW_END, "end", "for", forToken);
        return new ForInStatement(loopScope, ids, expressions, body);
    }

    /** function a.b.c:m() 改写为带显式 self 参数的字段路径 */
    private FunctionDeclaration parseFunctionDeclaration() {
        Token functionToken = parser.advance();
        String baseName = parser.expectName();
        Binding base = parser.resolveName(baseName);
        parser.scope.addReferenceToHigherScope(base.getScope(), base.getId());

        List<String> indices = new ArrayList<String>();
        List<String> implicitParams = Collections.emptyList();
        while (parser.match(DOT)) {
            indices.add(parser.expectName());
        }
        if (parser.match(COLON)) {
            indices.add(parser.expectName());
            implicitParams = Collections.singletonList("self");
        }
        ExprParser.FunctionBody function = parser.exprParser.parseFunctionBody(implicitParams, functionToken);
        return new FunctionDeclaration(base.getScope(), base.getId(), indices, function.args, function.body);
    }

    // 名字先于函数体声明，函数体内可以递归引用
    private LocalFunctionDeclaration parseLocalFunction() {
        Token functionToken = parser.advance();
        String name = parser.expectName();
        Scope declaring = parser.scope;
        SymbolId id = declaring.addVariable(name);
        ExprParser.FunctionBody function = parser.exprParser.parseFunctionBody(
                Collections.<String>emptyList(), functionToken);
        return new LocalFunctionDeclaration(declaring, id, function.args, function.body);
    }

    // 初始化表达式在变量声明之前解析：local x = x 引用的是外层 x
    private LocalVariableDeclaration parseLocal() {
        List<String> names = new ArrayList<String>();
        do {
            names.add(parser.expectName());
        } while (parser.match(COMMA));
        List<Expression> expressions = new ArrayList<Expression>();
        if (parser.match(ASSIGN)) {
            expressions = parser.exprParser.parseExpressionList();
        }
        Scope declaring = parser.scope;
        List<SymbolId> ids = new ArrayList<SymbolId>();
        for (String name : names) {
            ids.add(declaring.addVariable(name));
        }
        return new LocalVariableDeclaration(declaring, ids, expressions);
    }

    private Statement parseExpressionStatement() {
        Token start = parser.current;
        Expression expression = parser.exprParser.parseSuffixedExpression();

        if (parser.checkAny(ASSIGN, COMMA)) {
            List<AssignmentTarget> targets = new ArrayList<AssignmentTarget>();
            targets.add(toAssignmentTarget(expression, start));
            while (parser.match(COMMA)) {
                Token next = parser.current;
                targets.add(toAssignmentTarget(parser.exprParser.parseSuffixedExpression(), next));
            }
            parser.expect(ASSIGN, "=");
            return new AssignmentStatement(targets, parser.exprParser.parseExpressionList());
        }

        AstKind compound = compoundOperator(parser.current.getType());
        if (compound != null) {
            parser.advance();
            AssignmentTarget target = toAssignmentTarget(expression, start);
            return new CompoundAssignmentStatement(compound, target, parser.exprParser.parseExpression());
        }

        if (expression instanceof FunctionCallExpression) {
            FunctionCallExpression call = (FunctionCallExpression) expression;
            return new FunctionCallStatement(call.getBase(), call.getArgs());
        }
        if (expression instanceof PassSelfFunctionCallExpression) {
            PassSelfFunctionCallExpression call = (PassSelfFunctionCallExpression) expression;
            return new PassSelfFunctionCallStatement(call.getBase(), call.getPassSelfFunctionName(), call.getArgs());
        }
        throw new ParseException("syntax error", start, parser.fileName);
    }

    private AssignmentTarget toAssignmentTarget(Expression expression, Token start) {
        if (expression instanceof VariableExpression) {
            return Parser.toAssignmentVariable((VariableExpression) expression);
        }
        if (expression instanceof IndexExpression) {
            IndexExpression index = (IndexExpression) expression;
            return new AssignmentIndexing(index.getBase(), index.getIndex());
        }
        throw new ParseException("cannot assign to this expression", start, parser.fileName);
    }

    private static AstKind compoundOperator(TokenType type) {
        switch (type) {
            case PLUS_ASSIGN: return AstKind.ADD;
            case MINUS_ASSIGN: return AstKind.SUB;
            case MUL_ASSIGN: return AstKind.MUL;
            case DIV_ASSIGN: return AstKind.DIV;
            case MOD_ASSIGN: return AstKind.MOD;
            case POW_ASSIGN: return AstKind.POW;
            case CONCAT_ASSIGN: return AstKind.STR_CAT;
            default: return null;
        }
    }
}
