package org.stepmcp.step;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 待编译的 STEP 实体：类型名 + 有序属性列表。
 * <p>
 * 实体本身没有编号，编号由 {@link StepEntityCompiler} 在编译时分配；渲染结果相同的两个实体会合并为同一条记录。
 * <p>
 * 属性列表在编译前可以继续追加（{@link #add}），因此调用方可以先建好实体再互相引用；
 * 这也意味着可能构造出引用环，编译器会拒绝（{@link CircularReferenceException}）。
 * equals/hashCode 保持实例语义。
 */
public final class StepEntity {

    private final String typeName;
    private final List<StepAttribute> attributes;

    public StepEntity(String typeName, List<StepAttribute> attributes) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("实体类型名不能为空");
        }
        this.typeName = typeName;
        this.attributes = new ArrayList<>(attributes.size());
        for (StepAttribute attribute : attributes) {
            this.attributes.add(Objects.requireNonNull(attribute, "实体属性不能为 null（缺省请使用 $）"));
        }
    }

    public static StepEntity of(String typeName, StepAttribute... attributes) {
        return new StepEntity(typeName, Arrays.asList(attributes));
    }

    public String typeName() {
        return typeName;
    }

    public List<StepAttribute> attributes() {
        return Collections.unmodifiableList(attributes);
    }

    public StepEntity add(StepAttribute attribute) {
        attributes.add(Objects.requireNonNull(attribute, "实体属性不能为 null（缺省请使用 $）"));
        return this;
    }

    @Override
    public String toString() {
        return typeName + "(" + attributes.size() + " attributes)";
    }
}
