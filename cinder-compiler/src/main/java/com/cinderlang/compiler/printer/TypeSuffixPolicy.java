package com.cinderlang.compiler.printer;

import com.cinderlang.compiler.dialect.Dialect;

/**
 * 类型后缀省略规则
 */
public class TypeSuffixPolicy {
    private final Dialect dialect;

    public TypeSuffixPolicy(Dialect dialect) {
        this.dialect = dialect;
    }

    /**
     * 计算类型后缀
     *
     * @param type          声明的类型名，可为 null
     * @param isBoolLiteral 是否为布尔字面量
     * @return {@code ":type"} 或空串
     */
    public String suffix(String type, boolean isBoolLiteral) {
        if (dialect == null || type == null || type.isEmpty()) {
            return "";
        }
        if (!isBoolLiteral && type.equals(dialect.getDefaultType())) {
            return "";
        }
        // 方言没有默认类型时，布尔字面量必须保留类型后缀
        if (isBoolLiteral && type.equals(dialect.getBoolType()) && dialect.hasDefaultType()) {
            return "";
        }
        return ":" + type;
    }
}
