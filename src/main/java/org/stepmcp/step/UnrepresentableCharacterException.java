package org.stepmcp.step;

import java.util.Locale;

/**
 * 码点超出 STEP 字符串转义能表示的范围（{@code 0x0-0x10FFFF}）。
 */
public class UnrepresentableCharacterException extends IllegalArgumentException {

    private final int codePoint;

    public UnrepresentableCharacterException(int codePoint) {
        super("无法编码为 STEP 字符串的码点：0x" + Integer.toHexString(codePoint).toUpperCase(Locale.ROOT));
        this.codePoint = codePoint;
    }

    public int codePoint() {
        return codePoint;
    }
}
