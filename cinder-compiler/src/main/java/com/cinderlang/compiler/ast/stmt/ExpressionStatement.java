package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;
import com.cinderlang.compiler.ast.expr.Expression;

/**
 * 表达式语句
 */
public class ExpressionStatement extends Statement {
    private final Expression expression;

    public ExpressionStatement(SourceSpan span, Expression expression) {
        super(span);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStatement(this, context);
    }
}
