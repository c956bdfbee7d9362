package com.cinderlang.compiler;

/**
 * 内部断言工具，失败时抛出 {@link InternalConsistencyException}。
 */
public final class Invariants {

    private Invariants() {}

    public static void check(boolean condition, String message) {
        if (!condition) {
            throw new InternalConsistencyException(message);
        }
    }

    public static <T> T checkNotNull(T value, String message) {
        if (value == null) {
            throw new InternalConsistencyException(message);
        }
        return value;
    }
}
