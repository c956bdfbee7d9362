package com.cinderlang.compiler.ast;

/**
 * AST 节点基类
 */
public abstract class AstNode {
    protected final SourceSpan span;

    protected AstNode(SourceSpan span) {
        this.span = span;
    }

    /** 来源区间，可能为 null */
    public SourceSpan getSpan() {
        return span;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
