package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.expr.Literal;

/**
 * Switch 分支：value 为 null 表示 default 分支
 */
public final class SwitchCase {
    private final Literal value;
    private final Block body;

    public SwitchCase(Literal value, Block body) {
        this.value = value;
        this.body = body;
    }

    public Literal getValue() {
        return value;
    }

    public boolean isDefault() {
        return value == null;
    }

    public Block getBody() {
        return body;
    }
}
