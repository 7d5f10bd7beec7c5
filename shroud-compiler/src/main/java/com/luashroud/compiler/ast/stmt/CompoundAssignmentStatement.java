package com.luashroud.compiler.ast.stmt;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.NodeTag;
import com.luashroud.compiler.ast.expr.AssignmentTarget;
import com.luashroud.compiler.ast.expr.Expression;

import java.util.Objects;

/**
 * LuaU 复合赋值 target op= value
 */
public final class CompoundAssignmentStatement extends Statement {
    private final AstKind operator;
    private AssignmentTarget target;
    private Expression value;

    public CompoundAssignmentStatement(AstKind operator, AssignmentTarget target, Expression value,
                                       NodeTag... tags) {
        super(AstKind.COMPOUND_ASSIGNMENT_STATEMENT, tags);
        if (operator == null || !operator.isArithmetic()) {
            throw new IllegalArgumentException("not a compound assignment operator: " + operator);
        }
        this.operator = operator;
        setTarget(target);
        setValue(value);
    }

    public AstKind getOperator() {
        return operator;
    }

    public AssignmentTarget getTarget() {
        return target;
    }

    public void setTarget(AssignmentTarget target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompoundAssignmentStatement(this, context);
    }
}
