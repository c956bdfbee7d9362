package com.cinderlang.compiler.ast.expr;

import com.cinderlang.compiler.ast.AstNode;
import com.cinderlang.compiler.ast.SourceSpan;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceSpan span) {
        super(span);
    }
}
