package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;
import com.cinderlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * Switch 语句
 */
public class SwitchStmt extends Statement {
    private final Expression expression;
    private final List<SwitchCase> cases;

    public SwitchStmt(SourceSpan span, Expression expression, List<SwitchCase> cases) {
        super(span);
        this.expression = expression;
        this.cases = cases;
    }

    public Expression getExpression() {
        return expression;
    }

    public List<SwitchCase> getCases() {
        return cases;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchStmt(this, context);
    }
}
