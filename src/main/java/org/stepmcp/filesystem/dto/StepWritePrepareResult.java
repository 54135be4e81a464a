package org.stepmcp.filesystem.dto;

import java.time.Instant;
import java.util.List;

/**
 * {@code step_prepare_write_file} 的返回结果（仅渲染并暂存，不会真的写入）。
 *
 * @param token          用于后续确认写入的 token
 * @param rootId         根目录标识
 * @param path           相对 root 的路径（统一使用 / 分隔）
 * @param exists         目标文件是否已存在
 * @param overwrite      是否允许覆盖
 * @param dataEntities   DATA 段实体数量（去重后）
 * @param bytes          待写入字节数
 * @param expectedSha256 可选：已存在文件的 sha256（确认时用于“是否被外部修改”校验）
 * @param newSha256      待写入文档的 sha256
 * @param expiresAt      token 过期时间
 * @param warnings       风险提示/告警（例如将覆盖已有文件）
 */
public record StepWritePrepareResult(
        String token,
        String rootId,
        String path,
        boolean exists,
        boolean overwrite,
        int dataEntities,
        long bytes,
        String expectedSha256,
        String newSha256,
        Instant expiresAt,
        List<String> warnings
) {
}
