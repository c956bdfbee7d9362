package com.cinderlang.compiler.ast;

import com.cinderlang.compiler.Invariants;

import java.util.Objects;

/**
 * 源码区间（来源信息）：原始源文件名 + 字节偏移 [start, end)
 *
 * <p>相等性即区间同一性：源文件名与两个偏移都相同。</p>
 */
public final class SourceSpan {
    private final String sourceName;
    private final int start;
    private final int end;

    public SourceSpan(String sourceName, int start, int end) {
        Invariants.checkNotNull(sourceName, "Source span without source name.");
        Invariants.check(start >= 0, "Negative source span start: " + start);
        Invariants.check(start <= end, "Source span start " + start + " exceeds end " + end);
        this.sourceName = sourceName;
        this.start = start;
        this.end = end;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return start == that.start && end == that.end && sourceName.equals(that.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, start, end);
    }

    @Override
    public String toString() {
        return sourceName + ":" + start + ":" + end;
    }
}
