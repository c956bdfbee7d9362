package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;
import com.cinderlang.compiler.ast.expr.Expression;

/**
 * For 循环：for { pre } condition { post } { body }
 */
public class ForLoop extends Statement {
    private final Block pre;
    private final Expression condition;
    private final Block post;
    private final Block body;

    public ForLoop(SourceSpan span, Block pre, Expression condition, Block post, Block body) {
        super(span);
        this.pre = pre;
        this.condition = condition;
        this.post = post;
        this.body = body;
    }

    public Block getPre() {
        return pre;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getPost() {
        return post;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForLoop(this, context);
    }
}
