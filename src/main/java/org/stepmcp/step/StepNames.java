package org.stepmcp.step;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 类型名/枚举名规范化：统一为 STEP 习惯的大写下划线形式。
 * <p>
 * 示例：{@code cartesian_point -> CARTESIAN_POINT}，{@code CartesianPoint -> CARTESIAN_POINT}，
 * {@code lengthMeasure -> LENGTH_MEASURE}。
 */
public final class StepNames {

    private static final Pattern VALID = Pattern.compile("[A-Z][A-Z0-9_]*");

    private StepNames() {
    }

    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("名称不能为空");
        }
        String trimmed = name.trim();
        StringBuilder out = new StringBuilder(trimmed.length() + 4);
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            // 小写字母或数字后紧跟大写字母时插入下划线（驼峰边界）
            if (i > 0 && Character.isUpperCase(c)) {
                char prev = trimmed.charAt(i - 1);
                if (Character.isLowerCase(prev) || Character.isDigit(prev)) {
                    out.append('_');
                }
            }
            out.append(c);
        }
        String normalized = out.toString().toUpperCase(Locale.ROOT);
        if (!VALID.matcher(normalized).matches()) {
            throw new IllegalArgumentException("非法的 STEP 名称（仅允许字母、数字、下划线，且以字母开头）：" + name);
        }
        return normalized;
    }
}
