package com.cinderlang.compiler.printer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.cinderlang.compiler.ast.AstFactory.repeat;
import static org.assertj.core.api.Assertions.*;

@DisplayName("LayoutPolicy 测试")
class LayoutPolicyTest {

    @Test
    @DisplayName("代码块：29 个字符单行，30 个字符多行")
    void testBlockThreshold() {
        String short29 = repeat('a', 29);
        String long30 = repeat('a', 30);

        assertThat(LayoutPolicy.layoutBlock(short29)).isEqualTo("{ " + short29 + " }");
        assertThat(LayoutPolicy.layoutBlock(long30)).isEqualTo("{\n    " + long30 + "\n}");
    }

    @Test
    @DisplayName("代码块：含换行总是多行并缩进")
    void testBlockWithNewline() {
        assertThat(LayoutPolicy.layoutBlock("a\nb")).isEqualTo("{\n    a\n    b\n}");
    }

    @Test
    @DisplayName("for 头部：59 个字符单行，60 个字符换行")
    void testForHeaderThreshold() {
        assertThat(LayoutPolicy.forHeaderDelimiter(repeat('p', 20), repeat('c', 19), repeat('q', 20))).isEqualTo(' ');
        assertThat(LayoutPolicy.forHeaderDelimiter(repeat('p', 20), repeat('c', 20), repeat('q', 20))).isEqualTo('\n');
    }

    @Test
    @DisplayName("for 头部：pre 或 post 含换行时换行，condition 不参与换行判断")
    void testForHeaderNewlines() {
        assertThat(LayoutPolicy.forHeaderDelimiter("{\n}", "c", "{ }")).isEqualTo('\n');
        assertThat(LayoutPolicy.forHeaderDelimiter("{ }", "c", "{\n}")).isEqualTo('\n');
        assertThat(LayoutPolicy.forHeaderDelimiter("{ }", "/// x\nc", "{ }")).isEqualTo(' ');
    }

    @Test
    @DisplayName("if 分隔符只取决于是否含换行")
    void testIfDelimiter() {
        assertThat(LayoutPolicy.ifBodyDelimiter("{ " + repeat('x', 200) + " }")).isEqualTo(' ');
        assertThat(LayoutPolicy.ifBodyDelimiter("{\n    x\n}")).isEqualTo('\n');
    }

    @Test
    @DisplayName("缩进按换行替换")
    void testIndent() {
        assertThat(LayoutPolicy.indent("a\nb\n    c")).isEqualTo("a\n    b\n        c");
        assertThat(LayoutPolicy.indent("abc")).isEqualTo("abc");
    }
}
