package org.stepmcp.step;

/**
 * 把引用属性中的实体解析成 DATA 段编号（{@code #id} 中的 id）。
 * <p>
 * 由 {@link StepEntityCompiler} 在编译过程中提供；调用时被引用实体必须已经分配编号。
 */
@FunctionalInterface
public interface StepReferenceResolver {

    int resolve(StepEntity entity);
}
