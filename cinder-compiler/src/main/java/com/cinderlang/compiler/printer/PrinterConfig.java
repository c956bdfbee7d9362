package com.cinderlang.compiler.printer;

import com.cinderlang.compiler.dialect.Dialect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * IL 打印配置
 */
public class PrinterConfig {
    private Dialect dialect;
    private Map<String, Integer> sourceIndices = Collections.emptyMap();

    public PrinterConfig() {
    }

    /** 方言，null 表示未知方言（不输出任何类型后缀） */
    public Dialect getDialect() {
        return dialect;
    }

    public void setDialect(Dialect dialect) {
        this.dialect = dialect;
    }

    /** 源文件名 → 源索引表，只读副本 */
    public Map<String, Integer> getSourceIndices() {
        return sourceIndices;
    }

    /**
     * 设置源索引表。空表表示不输出任何 @src 注释。
     */
    public void setSourceIndices(Map<String, Integer> sourceIndices) {
        if (sourceIndices == null || sourceIndices.isEmpty()) {
            this.sourceIndices = Collections.emptyMap();
        } else {
            this.sourceIndices = Collections.unmodifiableMap(new LinkedHashMap<>(sourceIndices));
        }
    }
}
