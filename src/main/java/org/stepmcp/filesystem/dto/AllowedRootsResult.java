package org.stepmcp.filesystem.dto;

import java.util.List;

/**
 * {@code step_list_roots} 的返回结果。
 *
 * @param roots    根目录白名单
 * @param writable 是否允许写入（app.step.allow-write）
 */
public record AllowedRootsResult(List<AllowedRoot> roots, boolean writable) {
}
