package com.cinderlang.compiler.printer;

/**
 * 排版策略：根据已渲染的子节点文本决定单行或多行布局。
 */
public final class LayoutPolicy {

    /** 代码块单行输出的长度上限（不含） */
    public static final int BLOCK_INLINE_LIMIT = 30;

    /** for 循环头部（pre + condition + post）单行输出的长度上限（不含） */
    public static final int FOR_HEADER_INLINE_LIMIT = 60;

    public static final String INDENT = "    ";

    private LayoutPolicy() {}

    public static boolean isSingleLine(String text) {
        return text.indexOf('\n') < 0;
    }

    /**
     * 将非空代码块的语句体排版为 {@code { body }} 或多行缩进形式
     */
    public static String layoutBlock(String body) {
        if (body.length() < BLOCK_INLINE_LIMIT && isSingleLine(body)) {
            return "{ " + body + " }";
        }
        return "{\n" + INDENT + indent(body) + "\n}";
    }

    /** if 条件与代码块之间的分隔符 */
    public static char ifBodyDelimiter(String body) {
        return isSingleLine(body) ? ' ' : '\n';
    }

    /** for 循环头部三段之间的分隔符 */
    public static char forHeaderDelimiter(String pre, String condition, String post) {
        if (pre.length() + condition.length() + post.length() < FOR_HEADER_INLINE_LIMIT
                && isSingleLine(pre) && isSingleLine(post)) {
            return ' ';
        }
        return '\n';
    }

    /** 每个换行后追加一级缩进 */
    public static String indent(String text) {
        return text.replace("\n", "\n" + INDENT);
    }
}
