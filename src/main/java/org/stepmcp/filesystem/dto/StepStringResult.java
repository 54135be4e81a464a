package org.stepmcp.filesystem.dto;

/**
 * {@code step_encode_string}/{@code step_decode_string} 的返回结果。
 *
 * @param text    原始 Unicode 文本
 * @param encoded 转义后的内容（不含两侧单引号）
 * @param literal 完整的 STEP 字符串字面量（含两侧单引号）
 */
public record StepStringResult(String text, String encoded, String literal) {
}
