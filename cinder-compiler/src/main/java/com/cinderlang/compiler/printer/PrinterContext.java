package com.cinderlang.compiler.printer;

import com.cinderlang.compiler.ast.SourceSpan;

/**
 * 打印上下文，跟踪一次打印过程中的遍历状态：
 * 表达式嵌套深度与最近输出的来源区间。
 *
 * <p>每次 {@link IrPrinter#print} 调用创建一个新实例，不跨调用共享。</p>
 */
public class PrinterContext {
    private int expressionDepth = 0;
    private SourceSpan lastEmittedSpan;

    public void enterExpression() {
        expressionDepth++;
    }

    public void exitExpression() {
        expressionDepth--;
    }

    public int getExpressionDepth() {
        return expressionDepth;
    }

    /** 深度为 0 即语句位置 */
    public boolean isInsideExpression() {
        return expressionDepth > 0;
    }

    public SourceSpan getLastEmittedSpan() {
        return lastEmittedSpan;
    }

    public void setLastEmittedSpan(SourceSpan span) {
        this.lastEmittedSpan = span;
    }
}
