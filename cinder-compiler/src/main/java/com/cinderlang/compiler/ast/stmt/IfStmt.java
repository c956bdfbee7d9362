package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;
import com.cinderlang.compiler.ast.expr.Expression;

/**
 * If 语句（无 else 分支）
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block body;

    public IfStmt(SourceSpan span, Expression condition, Block body) {
        super(span);
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
