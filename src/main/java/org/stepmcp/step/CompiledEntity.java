package org.stepmcp.step;

/**
 * 编译后的实体记录。
 *
 * @param id                 DATA 段编号（从 1 开始、按首次发现顺序连续分配）
 * @param typeName           实体类型名（大写）
 * @param renderedAttributes 括号内已渲染好的属性文本，例如 {@code '',(1.,2.,3.)}
 */
public record CompiledEntity(int id, String typeName, String renderedAttributes) {

    /**
     * 实体体：{@code TYPE(attrs)}，也是去重用的键。
     */
    public String body() {
        return body(typeName, renderedAttributes);
    }

    public String toDataLine() {
        return "#" + id + "=" + body() + ";";
    }

    public String toHeaderLine() {
        return body() + ";";
    }

    static String body(String typeName, String renderedAttributes) {
        return typeName + "(" + renderedAttributes + ")";
    }
}
