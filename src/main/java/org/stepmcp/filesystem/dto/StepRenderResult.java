package org.stepmcp.filesystem.dto;

import java.util.List;

/**
 * {@code step_render} 的返回结果。
 *
 * @param rootEntities   输入的根实体数量
 * @param dataEntities   DATA 段实体数量（去重后）
 * @param rootIds        各根实体对应的 DATA 编号（与输入顺序一致）
 * @param chars          完整文档字符数
 * @param bytes          完整文档 UTF-8 字节数
 * @param sha256         完整文档 UTF-8 字节的 sha256
 * @param truncated      {@code text} 是否因 app.step.render-max-chars 被截断
 * @param text           STEP 文档文本（可能被截断）
 * @param warnings       非致命告警
 */
public record StepRenderResult(
        int rootEntities,
        int dataEntities,
        List<Integer> rootIds,
        int chars,
        long bytes,
        String sha256,
        boolean truncated,
        String text,
        List<String> warnings
) {
}
