package org.stepmcp.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * STEP 写出 MCP Server 的业务配置（{@code app.step.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许写出 STEP 文件的根目录白名单。</li>
 *   <li>通过 bytes/chars/实体数等上限控制内存占用与响应体积。</li>
 *   <li>写入必须走 prepare -> confirm 两段式确认，{@link #allowWrite} 为总开关。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.step")
public class StepServerProperties {

    /**
     * 允许写出的根目录白名单。
     * <p>
     * 每个 root 会自动分配一个 {@code rootId}（root0、root1...）；工具调用时可传入 rootId + 相对路径，或直接传入绝对路径。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许写入文件（关闭后 {@code step_prepare_write_file}/{@code step_confirm_write_file} 直接报错）。
     */
    private boolean allowWrite = true;

    /**
     * 是否允许写入符号链接路径。
     * <p>
     * 安全建议：默认 false；若开启请确保 {@link #roots} 已经非常严格。
     */
    private boolean allowSymlink = false;

    /**
     * prepare 阶段对“已存在目标文件”计算 sha256 的最大文件大小；超过则跳过“是否被外部修改”的校验。
     */
    @NotNull
    private DataSize hashMaxBytes = DataSize.ofMegabytes(32);

    /**
     * 单个待确认写入（渲染好的 STEP 文档）的最大字节数。
     * <p>
     * 说明：prepare 阶段文档暂存在内存中，必须设置上限。
     */
    @NotNull
    private DataSize pendingWriteMaxBytes = DataSize.ofMegabytes(16);

    /**
     * 待写入 token 的有效期（超过则失效，需要重新 prepare）。
     */
    @NotNull
    private Duration pendingWriteTtl = Duration.ofMinutes(10);

    /**
     * {@code step_render} 在响应中内联返回的最大字符数（超过则截断并给出告警）。
     */
    @Min(1_000)
    @Max(100_000_000)
    private int renderMaxChars = 200_000;

    /**
     * 单次 JSON 模型中允许的实体对象数量上限（含内联实体）。
     */
    @Min(1)
    @Max(100_000_000)
    private int maxInputEntities = 1_000_000;

    /**
     * HEADER 中 FILE_NAME 的 originating_system 缺省值。
     */
    @NotBlank
    private String defaultOriginatingSystem = "step-mcp-server";

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowWrite() {
        return allowWrite;
    }

    public void setAllowWrite(boolean allowWrite) {
        this.allowWrite = allowWrite;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public DataSize getHashMaxBytes() {
        return hashMaxBytes;
    }

    public void setHashMaxBytes(DataSize hashMaxBytes) {
        this.hashMaxBytes = hashMaxBytes;
    }

    public DataSize getPendingWriteMaxBytes() {
        return pendingWriteMaxBytes;
    }

    public void setPendingWriteMaxBytes(DataSize pendingWriteMaxBytes) {
        this.pendingWriteMaxBytes = pendingWriteMaxBytes;
    }

    public Duration getPendingWriteTtl() {
        return pendingWriteTtl;
    }

    public void setPendingWriteTtl(Duration pendingWriteTtl) {
        this.pendingWriteTtl = pendingWriteTtl;
    }

    public int getRenderMaxChars() {
        return renderMaxChars;
    }

    public void setRenderMaxChars(int renderMaxChars) {
        this.renderMaxChars = renderMaxChars;
    }

    public int getMaxInputEntities() {
        return maxInputEntities;
    }

    public void setMaxInputEntities(int maxInputEntities) {
        this.maxInputEntities = maxInputEntities;
    }

    public String getDefaultOriginatingSystem() {
        return defaultOriginatingSystem;
    }

    public void setDefaultOriginatingSystem(String defaultOriginatingSystem) {
        this.defaultOriginatingSystem = defaultOriginatingSystem;
    }
}
