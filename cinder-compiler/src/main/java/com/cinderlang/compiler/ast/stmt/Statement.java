package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstNode;
import com.cinderlang.compiler.ast.SourceSpan;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceSpan span) {
        super(span);
    }
}
