package org.stepmcp.step;

import java.util.List;

/**
 * 实体引用成环：编译器无法为环上的实体分配编号（引用文本 {@code #id} 依赖被引用实体先编译完成）。
 * <p>
 * {@link #chain()} 为从第一次进入该实体到再次遇到它的类型名链路，首尾相同，例如 {@code [A, B, A]}。
 */
public class CircularReferenceException extends IllegalArgumentException {

    private final List<String> chain;

    public CircularReferenceException(List<String> chain) {
        super("实体引用存在环，无法编译：" + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
