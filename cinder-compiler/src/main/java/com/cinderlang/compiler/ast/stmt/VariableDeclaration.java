package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;
import com.cinderlang.compiler.ast.TypedName;
import com.cinderlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 变量声明：let a, b := value
 */
public class VariableDeclaration extends Statement {
    private final List<TypedName> variables;
    private final Expression value;  // 可选

    public VariableDeclaration(SourceSpan span, List<TypedName> variables, Expression value) {
        super(span);
        this.variables = variables;
        this.value = value;
    }

    public List<TypedName> getVariables() {
        return variables;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableDeclaration(this, context);
    }
}
