package com.cinderlang.compiler.printer;

import com.cinderlang.compiler.ast.SourceSpan;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 来源注释生成器
 *
 * <p>语句位置输出单行注释 {@code /// @src idx:start:end} 加换行，
 * 表达式位置输出同样内容的块注释加一个空格，以便内联在下一个 token 之前。
 * 与上一次输出的区间相同时不重复输出。</p>
 */
public class ProvenanceAnnotator {
    private static final Logger LOG = Logger.getLogger(ProvenanceAnnotator.class.getName());

    private final Map<String, Integer> sourceIndices;

    public ProvenanceAnnotator(Map<String, Integer> sourceIndices) {
        this.sourceIndices = sourceIndices;
    }

    /**
     * 生成来源注释
     *
     * @param span      节点的来源区间，可为 null
     * @param statement 是否为语句位置
     * @param ctx       当前打印上下文（记录最近输出的区间）
     * @return 注释文本，不需要注释时返回空串
     */
    public String annotate(SourceSpan span, boolean statement, PrinterContext ctx) {
        if (span == null || sourceIndices.isEmpty() || span.equals(ctx.getLastEmittedSpan())) {
            return "";
        }

        Integer index = sourceIndices.get(span.getSourceName());
        if (index == null) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("未知源文件，跳过来源注释: " + span.getSourceName());
            }
            return "";
        }

        ctx.setLastEmittedSpan(span);

        String payload = index + ":" + span.getStart() + ":" + span.getEnd();
        return statement
                ? "/// @src " + payload + "\n"
                : "/** @src " + payload + " */ ";
    }
}
