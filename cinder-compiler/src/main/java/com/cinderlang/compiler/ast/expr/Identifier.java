package com.cinderlang.compiler.ast.expr;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;

/**
 * 标识符表达式
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceSpan span, String name) {
        super(span);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
