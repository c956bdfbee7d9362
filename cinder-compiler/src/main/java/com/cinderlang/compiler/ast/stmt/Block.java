package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 代码块
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceSpan span, List<Statement> statements) {
        super(span);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
