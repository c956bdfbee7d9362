package com.cinderlang.compiler.printer;

/**
 * Cinder IL 字面量文本工具：字符串转义/反转义与数值字面量校验
 */
public final class CinderStringUtils {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private CinderStringUtils() {}

    /** 转义字符串内容并用双引号包裹 */
    public static String escapeAndQuote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append("\\x").append(HEX[(c >> 4) & 0xf]).append(HEX[c & 0xf]);
                    } else if (c > 0x7e) {
                        sb.append("\\u")
                                .append(HEX[(c >> 12) & 0xf]).append(HEX[(c >> 8) & 0xf])
                                .append(HEX[(c >> 4) & 0xf]).append(HEX[c & 0xf]);
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * 反转义：escapeAndQuote 的逆操作（输入不含外层引号）。
     *
     * @throws IllegalArgumentException 遇到无法识别的转义序列
     */
    public static String unescape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i++);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i >= s.length()) {
                throw new IllegalArgumentException("字符串以未完成的转义结尾");
            }
            char e = s.charAt(i++);
            switch (e) {
                case '\\': sb.append('\\'); break;
                case '"': sb.append('"'); break;
                case '\'': sb.append('\''); break;
                case 'n': sb.append('\n'); break;
                case 'r': sb.append('\r'); break;
                case 't': sb.append('\t'); break;
                case 'x':
                    sb.append((char) parseHex(s, i, 2));
                    i += 2;
                    break;
                case 'u':
                    sb.append((char) parseHex(s, i, 4));
                    i += 4;
                    break;
                default:
                    throw new IllegalArgumentException("无法识别的转义序列: \\" + e);
            }
        }
        return sb.toString();
    }

    private static int parseHex(String s, int from, int digits) {
        if (from + digits > s.length()) {
            throw new IllegalArgumentException("转义序列长度不足: " + s.substring(from - 2));
        }
        int value = 0;
        for (int k = from; k < from + digits; k++) {
            char c = s.charAt(k);
            if (!isHexDigit(c)) {
                throw new IllegalArgumentException("非法十六进制数字: " + c);
            }
            value = value * 16 + Character.digit(c, 16);
        }
        return value;
    }

    /** 十进制数值：0 或不以 0 开头的数字串 */
    public static boolean isValidDecimal(String s) {
        if (s == null || s.isEmpty()) {
            return false;
        }
        if (s.equals("0")) {
            return true;
        }
        if (s.charAt(0) == '0') {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /** 十六进制数值：0x 后跟至少一位十六进制数字 */
    public static boolean isValidHex(String s) {
        if (s == null || s.length() < 3 || !s.startsWith("0x")) {
            return false;
        }
        for (int i = 2; i < s.length(); i++) {
            if (!isHexDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
