package com.cinderlang.compiler.ast;

/**
 * 带可选类型的名称（变量声明、函数参数、返回变量）
 */
public final class TypedName {
    private final SourceSpan span;
    private final String name;
    private final String type;  // 可选

    public TypedName(SourceSpan span, String name, String type) {
        this.span = span;
        this.name = name;
        this.type = type;
    }

    public TypedName(String name, String type) {
        this(null, name, type);
    }

    public TypedName(String name) {
        this(null, name, null);
    }

    public SourceSpan getSpan() {
        return span;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }
}
