package com.cinderlang.compiler.json;

import com.cinderlang.compiler.ast.stmt.Block;
import com.cinderlang.compiler.dialect.Dialect;
import com.cinderlang.compiler.printer.PrinterConfig;

import java.util.Map;

/**
 * JSON 文档读取结果：根代码块、方言与源索引表
 */
public final class AstDocument {
    private final Block root;
    private final Dialect dialect;
    private final Map<String, Integer> sourceIndices;

    public AstDocument(Block root, Dialect dialect, Map<String, Integer> sourceIndices) {
        this.root = root;
        this.dialect = dialect;
        this.sourceIndices = sourceIndices;
    }

    public Block getRoot() {
        return root;
    }

    /** 文档未声明方言时为 {@link Dialect#untyped()} */
    public Dialect getDialect() {
        return dialect;
    }

    public Map<String, Integer> getSourceIndices() {
        return sourceIndices;
    }

    /** 按文档内容生成打印配置 */
    public PrinterConfig toPrinterConfig() {
        PrinterConfig config = new PrinterConfig();
        config.setDialect(dialect);
        config.setSourceIndices(sourceIndices);
        return config;
    }
}
