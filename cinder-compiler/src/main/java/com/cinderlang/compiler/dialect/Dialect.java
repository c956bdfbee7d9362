package com.cinderlang.compiler.dialect;

/**
 * IL 方言视图：只读地暴露默认类型名与布尔类型名（均可能为空字符串）。
 */
public final class Dialect {
    private static final Dialect UNTYPED = new Dialect("", "");
    private static final Dialect TYPED = new Dialect("u256", "bool");

    private final String defaultType;
    private final String boolType;

    private Dialect(String defaultType, String boolType) {
        this.defaultType = defaultType;
        this.boolType = boolType;
    }

    /** 无类型方言：没有默认类型，也没有布尔类型 */
    public static Dialect untyped() {
        return UNTYPED;
    }

    /** 类型化方言：默认 u256，布尔 bool */
    public static Dialect typed() {
        return TYPED;
    }

    public static Dialect of(String defaultType, String boolType) {
        return new Dialect(defaultType != null ? defaultType : "", boolType != null ? boolType : "");
    }

    public String getDefaultType() {
        return defaultType;
    }

    public String getBoolType() {
        return boolType;
    }

    public boolean hasDefaultType() {
        return !defaultType.isEmpty();
    }

    @Override
    public String toString() {
        return "Dialect(default=" + defaultType + ", bool=" + boolType + ")";
    }
}
