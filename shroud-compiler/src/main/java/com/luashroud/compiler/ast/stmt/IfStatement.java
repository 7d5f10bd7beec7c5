package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * if c then b elseif c2 then b2 else b3 end
 */
public final class IfStatement extends Statement {
    private Expression condition;
    private Block body;
    private final List<ElseIfClause> elseIfs;
    private Block elseBody;

    public IfStatement(Expression condition, Block body, List<ElseIfClause> elseIfs, Block elseBody,
                       NodeTag... tags) {
        super(AstKind.IF_STATEMENT, tags);
        setCondition(condition);
        setBody(body);
        this.elseIfs = new ArrayList<ElseIfClause>(elseIfs);
        this.elseBody = elseBody;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    public List<ElseIfClause> getElseIfs() {
        return elseIfs;
    }

    /** else 分支，可以为 null */
    public Block getElseBody() {
        return elseBody;
    }

    public void setElseBody(Block elseBody) {
        this.elseBody = elseBody;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStatement(this, context);
    }

    /**
     * elseif 分支，不是独立节点，其条件与代码块归 IfStatement 所有
     */
    public static final class ElseIfClause {
        private Expression condition;
        private Block body;

        public ElseIfClause(Expression condition, Block body) {
            setCondition(condition);
            setBody(body);
        }

        public Expression getCondition() {
            return condition;
        }

        public void setCondition(Expression condition) {
            this.condition = Objects.requireNonNull(condition, "condition");
        }

        public Block getBody() {
            return body;
        }

        public void setBody(Block body) {
            this.body = Objects.requireNonNull(body, "body");
        }
    }
}
