package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {

    public BreakStmt(SourceSpan span) {
        super(span);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
