package org.stepmcp.step;

import java.math.BigDecimal;
import java.util.List;

/**
 * 属性值到 STEP 文本的渲染器。
 * <p>
 * 规则：
 * <ul>
 *   <li>{@code $} / {@code *}：缺省 / 派生</li>
 *   <li>整数：十进制；实数：最短往返十进制，常规量级用普通计数法，不含小数点时补一个 {@code .}（{@code 2.0 -> 2.}）</li>
 *   <li>字符串：{@code 'escaped'}；二进制：{@code "hex"}（不校验内容）</li>
 *   <li>枚举/布尔：{@code .NAME.} / {@code .T.} / {@code .F.}</li>
 *   <li>SELECT 包装：{@code TYPE(value)}；列表：{@code (a,b)}，空列表 {@code ()}</li>
 *   <li>引用：{@code #id}，id 由 {@link StepReferenceResolver} 给出</li>
 * </ul>
 * 数值输出与 Locale 无关。
 */
public final class StepAttributeFormatter {

    private static final int MIN_PLAIN_EXPONENT = -6;
    private static final int MAX_PLAIN_EXPONENT = 15;

    private StepAttributeFormatter() {
    }

    public static String format(StepAttribute attribute, StepReferenceResolver resolver) {
        StringBuilder out = new StringBuilder();
        appendTo(out, attribute, resolver);
        return out.toString();
    }

    /**
     * 渲染逗号分隔的属性列表（不含两侧括号），即实体体 {@code TYPE(...)} 的括号内部分。
     */
    public static String formatAll(List<StepAttribute> attributes, StepReferenceResolver resolver) {
        StringBuilder out = new StringBuilder();
        appendJoined(out, attributes, resolver);
        return out.toString();
    }

    static void appendTo(StringBuilder out, StepAttribute attribute, StepReferenceResolver resolver) {
        if (attribute instanceof StepAttribute.Null) {
            out.append('$');
        } else if (attribute instanceof StepAttribute.Derived) {
            out.append('*');
        } else if (attribute instanceof StepAttribute.IntegerValue i) {
            out.append(i.value());
        } else if (attribute instanceof StepAttribute.RealValue r) {
            out.append(formatReal(r.value()));
        } else if (attribute instanceof StepAttribute.TextValue t) {
            out.append('\'').append(StepStringEscaper.encode(t.value())).append('\'');
        } else if (attribute instanceof StepAttribute.BinaryValue b) {
            out.append('"').append(b.hexDigits()).append('"');
        } else if (attribute instanceof StepAttribute.EnumValue e) {
            out.append('.').append(e.name()).append('.');
        } else if (attribute instanceof StepAttribute.BooleanValue b) {
            out.append('.').append(b.enumName()).append('.');
        } else if (attribute instanceof StepAttribute.TypedValue typed) {
            out.append(typed.typeName()).append('(');
            appendTo(out, typed.value(), resolver);
            out.append(')');
        } else if (attribute instanceof StepAttribute.ListValue list) {
            out.append('(');
            appendJoined(out, list.items(), resolver);
            out.append(')');
        } else if (attribute instanceof StepAttribute.Reference ref) {
            out.append('#').append(resolver.resolve(ref.entity()));
        } else {
            throw new IllegalArgumentException("不支持的属性类型：" + attribute);
        }
    }

    private static void appendJoined(StringBuilder out, List<StepAttribute> attributes, StepReferenceResolver resolver) {
        for (int i = 0; i < attributes.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            appendTo(out, attributes.get(i), resolver);
        }
    }

    /**
     * 实数渲染：取 {@link Double#toString} 的最短往返数字，去掉多余的尾随 0。
     * <p>
     * 十进制指数在 {@code [-6, 15]} 内用普通计数法，超出范围用 {@code E} 指数形式，尾数同样保证带小数点。
     * 示例：{@code 2.0 -> "2."}，{@code 2.5 -> "2.5"}，{@code 1.0E-4 -> "0.0001"}，{@code -0.0 -> "-0."}，
     * {@code 1.0E300 -> "1.E300"}，{@code 4.9E-324 -> "4.9E-324"}。
     */
    public static String formatReal(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("REAL 属性必须是有限数值：" + value);
        }
        if (value == 0.0d) {
            // BigDecimal 不保留 -0.0 的符号
            return (Double.doubleToRawLongBits(value) < 0) ? "-0." : "0.";
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent < MIN_PLAIN_EXPONENT || exponent > MAX_PLAIN_EXPONENT) {
            String digits = decimal.unscaledValue().abs().toString();
            StringBuilder out = new StringBuilder(digits.length() + 8);
            if (decimal.signum() < 0) {
                out.append('-');
            }
            out.append(digits.charAt(0)).append('.').append(digits, 1, digits.length());
            return out.append('E').append(exponent).toString();
        }
        String plain = decimal.toPlainString();
        return plain.indexOf('.') < 0 ? plain + "." : plain;
    }
}
