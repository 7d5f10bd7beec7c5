package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.AssignmentTarget;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * t1, t2 = e1, e2
 */
public final class AssignmentStatement extends Statement {
    private final List<AssignmentTarget> lhs;
    private final List<Expression> rhs;

    public AssignmentStatement(List<? extends AssignmentTarget> lhs, List<? extends Expression> rhs,
                               NodeTag... tags) {
        super(AstKind.ASSIGNMENT_STATEMENT, tags);
        if (lhs.isEmpty() || rhs.isEmpty()) {
            throw new IllegalArgumentException("assignment requires at least one target and one value");
        }
        this.lhs = new ArrayList<AssignmentTarget>(lhs);
        this.rhs = new ArrayList<Expression>(rhs);
    }

    public List<AssignmentTarget> getLhs() {
        return lhs;
    }

    public List<Expression> getRhs() {
        return rhs;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignmentStatement(this, context);
    }
}
