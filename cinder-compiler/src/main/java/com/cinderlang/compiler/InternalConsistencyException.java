package com.cinderlang.compiler;

/**
 * 内部一致性错误
 *
 * <p>上游阶段本应保证的不变量被破坏时抛出（非法字面量、空名称、缺失子节点、表达式深度失衡）。
 * 不可恢复：当前打印操作立即终止，不产生部分输出。</p>
 */
public class InternalConsistencyException extends RuntimeException {

    public InternalConsistencyException(String message) {
        super(message);
    }
}
