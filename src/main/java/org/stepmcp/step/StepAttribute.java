package org.stepmcp.step;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * STEP 实体的一个属性值（ISO-10303-21 参数）。
 * <p>
 * 每种取值形式对应一个 record：
 * <ul>
 *   <li>{@link Null}：{@code $}，显式缺省</li>
 *   <li>{@link Derived}：{@code *}，由派生规则给出、不落盘的值</li>
 *   <li>{@link IntegerValue}/{@link RealValue}：数值字面量</li>
 *   <li>{@link TextValue}：字符串（按 {@link StepStringEscaper} 转义）</li>
 *   <li>{@link BinaryValue}：调用方已编码好的十六进制位串，仅包上双引号</li>
 *   <li>{@link EnumValue}/{@link BooleanValue}：{@code .NAME.} / {@code .T.} / {@code .F.}</li>
 *   <li>{@link TypedValue}：SELECT 类型包装 {@code TYPE(value)}</li>
 *   <li>{@link ListValue}：{@code (a,b,...)}，可嵌套</li>
 *   <li>{@link Reference}：按值持有被引用实体，编译时才换成 {@code #id}</li>
 * </ul>
 * 类型名/枚举名应当已经规范化为大写（见 {@link StepNames}）。
 */
public sealed interface StepAttribute {

    static StepAttribute absent() {
        return Null.INSTANCE;
    }

    static StepAttribute derived() {
        return Derived.INSTANCE;
    }

    static StepAttribute integer(long value) {
        return new IntegerValue(value);
    }

    static StepAttribute real(double value) {
        return new RealValue(value);
    }

    static StepAttribute text(String value) {
        return new TextValue(value);
    }

    static StepAttribute binary(String hexDigits) {
        return new BinaryValue(hexDigits);
    }

    static StepAttribute enumeration(String name) {
        return new EnumValue(name);
    }

    static StepAttribute bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static StepAttribute typed(String typeName, StepAttribute value) {
        return new TypedValue(typeName, value);
    }

    static StepAttribute list(List<StepAttribute> items) {
        return new ListValue(items);
    }

    static StepAttribute list(StepAttribute... items) {
        return new ListValue(Arrays.asList(items));
    }

    static StepAttribute reference(StepEntity entity) {
        return new Reference(entity);
    }

    /**
     * 文本列表的便捷写法（HEADER 中的 description/author/organization/schema 均为字符串列表）。
     */
    static StepAttribute textList(List<String> values) {
        return new ListValue(values.stream().map(StepAttribute::text).toList());
    }

    record Null() implements StepAttribute {
        static final Null INSTANCE = new Null();
    }

    record Derived() implements StepAttribute {
        static final Derived INSTANCE = new Derived();
    }

    record IntegerValue(long value) implements StepAttribute {
    }

    record RealValue(double value) implements StepAttribute {
        public RealValue {
            // STEP 的 REAL 没有 NaN/Infinity 的写法
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("REAL 属性必须是有限数值：" + value);
            }
        }
    }

    record TextValue(String value) implements StepAttribute {
        public TextValue {
            Objects.requireNonNull(value, "TEXT 属性值不能为 null（缺省请使用 $）");
        }
    }

    record BinaryValue(String hexDigits) implements StepAttribute {
        public BinaryValue {
            Objects.requireNonNull(hexDigits, "BINARY 属性值不能为 null");
        }
    }

    record EnumValue(String name) implements StepAttribute {
        public EnumValue {
            Objects.requireNonNull(name, "枚举名不能为 null");
        }
    }

    record BooleanValue(boolean value) implements StepAttribute {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        public String enumName() {
            return value ? "T" : "F";
        }
    }

    record TypedValue(String typeName, StepAttribute value) implements StepAttribute {
        public TypedValue {
            Objects.requireNonNull(typeName, "SELECT 类型名不能为 null");
            Objects.requireNonNull(value, "SELECT 包装的值不能为 null");
        }
    }

    record ListValue(List<StepAttribute> items) implements StepAttribute {
        public ListValue {
            items = List.copyOf(items);
        }
    }

    /**
     * 引用属性：按值持有实体（而非编号）。
     */
    record Reference(StepEntity entity) implements StepAttribute {
        public Reference {
            Objects.requireNonNull(entity, "被引用实体不能为 null");
        }
    }
}
