package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;
import com.cinderlang.compiler.ast.expr.Expression;
import com.cinderlang.compiler.ast.expr.Identifier;

import java.util.List;

/**
 * 赋值语句：a, b := value
 */
public class Assignment extends Statement {
    private final List<Identifier> variableNames;
    private final Expression value;

    public Assignment(SourceSpan span, List<Identifier> variableNames, Expression value) {
        super(span);
        this.variableNames = variableNames;
        this.value = value;
    }

    public List<Identifier> getVariableNames() {
        return variableNames;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignment(this, context);
    }
}
