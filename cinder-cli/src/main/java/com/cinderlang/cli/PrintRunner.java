package com.cinderlang.cli;

import com.cinderlang.compiler.dialect.Dialect;
import com.cinderlang.compiler.json.AstDocument;
import com.cinderlang.compiler.json.AstJsonReader;
import com.cinderlang.compiler.printer.IrPrinter;
import com.cinderlang.compiler.printer.PrinterConfig;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 读取 JSON AST 并打印为 IL 文本
 */
public class PrintRunner {
    private static final Logger LOG = Logger.getLogger(PrintRunner.class.getName());

    private Dialect dialect;
    private Map<String, Integer> sourceOverrides = Collections.emptyMap();
    private boolean suppressAnnotations;

    /** 覆盖文档声明的方言，null 表示沿用文档 */
    public void setDialect(Dialect dialect) {
        this.dialect = dialect;
    }

    /**
     * @throws IllegalArgumentException 索引为负数
     */
    public void setSourceOverrides(Map<String, Integer> sourceOverrides) {
        if (sourceOverrides == null) {
            this.sourceOverrides = Collections.emptyMap();
            return;
        }
        for (Map.Entry<String, Integer> entry : sourceOverrides.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("源索引不能为负数 - " + entry.getKey() + "=" + entry.getValue());
            }
        }
        this.sourceOverrides = sourceOverrides;
    }

    public void setSuppressAnnotations(boolean suppressAnnotations) {
        this.suppressAnnotations = suppressAnnotations;
    }

    /**
     * 读取文件并返回打印结果
     */
    public String render(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("文件不存在 - " + file);
        }
        LOG.fine("读取 " + file);

        AstDocument document;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            document = new AstJsonReader().read(reader);
        }

        PrinterConfig config = buildConfig(document);
        String text = new IrPrinter(config).print(document.getRoot());
        LOG.fine("打印完成: " + text.length() + " 个字符");
        return text;
    }

    public void write(Path output, String text) throws IOException {
        Files.write(output, (text + "\n").getBytes(StandardCharsets.UTF_8));
        LOG.info("已写入: " + output);
    }

    PrinterConfig buildConfig(AstDocument document) {
        PrinterConfig config = document.toPrinterConfig();
        if (dialect != null) {
            config.setDialect(dialect);
        }
        if (suppressAnnotations) {
            config.setSourceIndices(Collections.<String, Integer>emptyMap());
        } else if (!sourceOverrides.isEmpty()) {
            Map<String, Integer> merged = new LinkedHashMap<>(config.getSourceIndices());
            merged.putAll(sourceOverrides);
            config.setSourceIndices(merged);
        }
        return config;
    }

    /**
     * 解析命令行方言参数
     *
     * @throws IllegalArgumentException 未知方言名
     */
    static Dialect resolveDialect(String name, String defaultType, String boolType) {
        if (name == null) {
            if (defaultType != null || boolType != null) {
                return Dialect.of(defaultType, boolType);
            }
            return null;
        }
        switch (name.toLowerCase()) {
            case "untyped": return Dialect.untyped();
            case "typed":   return Dialect.typed();
            case "custom":  return Dialect.of(defaultType, boolType);
            default:
                throw new IllegalArgumentException("未知方言 '" + name + "'（可选: untyped, typed, custom）");
        }
    }
}
