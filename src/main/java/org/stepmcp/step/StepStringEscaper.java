package org.stepmcp.step;

import java.util.HexFormat;

/**
 * STEP 字符串（ISO-10303-21 simple string）转义编码器。
 * <p>
 * 按码点逐个编码：
 * <ul>
 *   <li>{@code '} 写成 {@code ''}；{@code \} 原样输出</li>
 *   <li>{@code 0x20-0x7E} 可打印 ASCII 原样输出</li>
 *   <li>{@code 0x00-0x1F}、{@code 0x7F-0xFF}：{@code \X\hh}</li>
 *   <li>{@code 0x0100-0xFFFF}：{@code \X2\hhhh\X0\}</li>
 *   <li>{@code 0x10000-0x10FFFF}：{@code \X4\hhhhhhhh\X0\}</li>
 * </ul>
 * 十六进制一律大写、定宽补零。
 * <p>
 * {@link #encode} 只负责转义内容，不加两侧的单引号；需要完整字面量时用 {@link #quote}。
 * 逆过程见 {@link StepStringDecoder}。
 * <p>
 * 注意：反斜杠原样输出，因此原文中本身形如转义序列的片段（例如 {@code \X\41}）
 * 在解码时会被当作转义处理（得到 {@code A}）。编码再解码只对不含 {@code \X} 片段的文本是无损的。
 */
public final class StepStringEscaper {

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private StepStringEscaper() {
    }

    public static String encode(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length() + 8);
        // Java 字符串是 UTF-16：按码点遍历，代理对合成一个补充平面字符；落单的代理项按 0xD800-0xDFFF 处理
        text.codePoints().forEach(cp -> encodeCodePoint(out, cp));
        return out.toString();
    }

    public static String quote(String text) {
        return "'" + encode(text) + "'";
    }

    /**
     * 编码单个码点并追加到 {@code out}。
     *
     * @throws UnrepresentableCharacterException 码点不在 {@code 0x0-0x10FFFF} 范围内
     */
    public static void encodeCodePoint(StringBuilder out, int codePoint) {
        if (codePoint == '\'') {
            out.append("''");
        } else if (codePoint == '\\') {
            out.append('\\');
        } else if (codePoint >= 0x20 && codePoint <= 0x7E) {
            out.append((char) codePoint);
        } else if (codePoint >= 0x00 && codePoint <= 0xFF) {
            out.append("\\X\\").append(HEX.toHexDigits((byte) codePoint));
        } else if (codePoint >= 0x0100 && codePoint <= 0xFFFF) {
            out.append("\\X2\\").append(HEX.toHexDigits((char) codePoint)).append("\\X0\\");
        } else if (codePoint >= 0x10000 && codePoint <= 0x10FFFF) {
            out.append("\\X4\\").append(HEX.toHexDigits(codePoint)).append("\\X0\\");
        } else {
            throw new UnrepresentableCharacterException(codePoint);
        }
    }
}
