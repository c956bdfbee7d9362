package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;

/**
 * Leave 语句
 */
public class LeaveStmt extends Statement {

    public LeaveStmt(SourceSpan span) {
        super(span);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLeaveStmt(this, context);
    }
}
