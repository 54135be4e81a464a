package org.stepmcp.step;

/**
 * STEP 字符串解码（{@link StepStringEscaper} 的逆过程）。
 * <p>
 * 支持的形式：
 * <ul>
 *   <li>{@code ''}：单引号</li>
 *   <li>{@code \X\hh}：单字节（0x00-0xFF）</li>
 *   <li>{@code \X2\....\X0\}：每 4 位十六进制一个 UTF-16 code unit</li>
 *   <li>{@code \X4\........\X0\}：每 8 位十六进制一个码点</li>
 * </ul>
 * 转义标记中的 {@code X} 大小写均可（{@code \x2\...\x0\}）。
 * 其他反斜杠按字面保留；格式不完整的转义序列原样保留，不抛异常。
 * <p>
 * 示例：{@code \X2\4E2D6587\X0\} 解码为 "中文"。
 */
public final class StepStringDecoder {

    private StepStringDecoder() {
    }

    /**
     * 去掉两侧单引号后再解码；没有包单引号时等同于 {@link #decode}。
     */
    public static String unquote(String literal) {
        if (literal == null) {
            return null;
        }
        String text = literal.trim();
        if (text.length() >= 2 && text.charAt(0) == '\'' && text.charAt(text.length() - 1) == '\'') {
            text = text.substring(1, text.length() - 1);
        }
        return decode(text);
    }

    public static String decode(String value) {
        if (value == null || value.isEmpty() || (value.indexOf('\\') < 0 && value.indexOf('\'') < 0)) {
            return value;
        }

        StringBuilder out = new StringBuilder(value.length());
        int len = value.length();
        for (int i = 0; i < len; i++) {
            char c = value.charAt(i);
            if (c == '\'') {
                out.append('\'');
                if (i + 1 < len && value.charAt(i + 1) == '\'') {
                    i++;
                }
                continue;
            }
            if (c != '\\' || i + 2 >= len || !isEscapeMarker(value.charAt(i + 1))) {
                out.append(c);
                continue;
            }

            char mode = value.charAt(i + 2);
            if ((mode == '2' || mode == '4') && i + 3 < len && value.charAt(i + 3) == '\\') {
                int seqStart = i + 4;
                int endMarker = indexOfEndMarker(value, seqStart);
                if (endMarker > 0) {
                    String decoded = decodeHexSequence(value.substring(seqStart, endMarker), mode);
                    if (decoded != null) {
                        out.append(decoded);
                        // 循环末尾 i++，落在 "\X0\" 之后
                        i = endMarker + 3;
                        continue;
                    }
                }
            }

            // \X\hh
            if (mode == '\\' && i + 4 < len) {
                int b = hexByte(value.charAt(i + 3), value.charAt(i + 4));
                if (b >= 0) {
                    out.append((char) b);
                    i += 4;
                    continue;
                }
            }

            out.append(c);
        }
        return out.toString();
    }

    private static boolean isEscapeMarker(char c) {
        return c == 'X' || c == 'x';
    }

    private static int indexOfEndMarker(String text, int fromIndex) {
        for (int i = fromIndex; i + 3 < text.length(); i++) {
            if (text.charAt(i) == '\\' && isEscapeMarker(text.charAt(i + 1))
                    && text.charAt(i + 2) == '0' && text.charAt(i + 3) == '\\') {
                return i;
            }
        }
        return -1;
    }

    private static String decodeHexSequence(String hex, char mode) {
        int group = (mode == '4') ? 8 : 4;
        if (hex.isEmpty() || hex.length() % group != 0) {
            return null;
        }
        StringBuilder out = new StringBuilder(hex.length() / group);
        for (int i = 0; i < hex.length(); i += group) {
            int value = 0;
            for (int j = i; j < i + group; j++) {
                int digit = hexValue(hex.charAt(j));
                if (digit < 0) {
                    return null;
                }
                value = (value << 4) | digit;
            }
            if (mode == '4') {
                if (!Character.isValidCodePoint(value)) {
                    return null;
                }
                out.appendCodePoint(value);
            } else {
                out.append((char) value);
            }
        }
        return out.toString();
    }

    private static int hexByte(char hi, char lo) {
        int a = hexValue(hi);
        int b = hexValue(lo);
        if (a < 0 || b < 0) {
            return -1;
        }
        return (a << 4) | b;
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'F') {
            return 10 + (c - 'A');
        }
        if (c >= 'a' && c <= 'f') {
            return 10 + (c - 'a');
        }
        return -1;
    }
}
