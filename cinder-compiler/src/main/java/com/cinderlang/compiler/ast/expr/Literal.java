package com.cinderlang.compiler.ast.expr;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;

/**
 * 字面量表达式
 *
 * <p>value 保存字面量文本：数值为十进制或 0x 十六进制文本，布尔为 "true"/"false"，
 * 字符串为未转义的原始内容。</p>
 */
public class Literal extends Expression {
    private final LiteralKind kind;
    private final String value;
    private final String type;  // 可选

    public Literal(SourceSpan span, LiteralKind kind, String value, String type) {
        super(span);
        this.kind = kind;
        this.value = value;
        this.type = type;
    }

    public Literal(SourceSpan span, LiteralKind kind, String value) {
        this(span, kind, value, null);
    }

    public LiteralKind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public String getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NUMBER,
        BOOLEAN,
        STRING
    }
}
