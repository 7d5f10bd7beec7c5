package com.luashroud.compiler.ast.expr;

import com.luashroud.compiler.ast.AstKind;
import com.luashroud.compiler.ast.AstVisitor;
import com.luashroud.compiler.ast.Block;
import com.luashroud.compiler.ast.FunctionNode;
import com.luashroud.compiler.ast.NodeTag;

import java.util.List;

/**
 * 函数字面量 function(args) body end
 */
public final class FunctionLiteralExpression extends Expression implements FunctionNode {
    private final List<Expression> args;
    private Block body;

    public FunctionLiteralExpression(List<? extends Expression> args, Block body, NodeTag... tags) {
        super(AstKind.FUNCTION_LITERAL, tags);
        this.args = FunctionNode.checkSignature(args, body);
        this.body = body;
    }

    @Override
    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public Block getBody() {
        return body;
    }

    @Override
    public void setBody(Block body) {
        FunctionNode.checkSignature(args, body);
        this.body = body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionLiteralExpression(this, context);
    }
}
