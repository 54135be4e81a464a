package org.stepmcp.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.stepmcp.filesystem.PendingStepWriteStore;
import org.stepmcp.filesystem.SecurePathResolver;
import org.stepmcp.filesystem.StepFileWriter;
import org.stepmcp.filesystem.StepServerProperties;
import org.stepmcp.filesystem.dto.AllowedRootsResult;
import org.stepmcp.filesystem.dto.StepRenderResult;
import org.stepmcp.filesystem.dto.StepStringResult;
import org.stepmcp.filesystem.dto.StepWriteConfirmResult;
import org.stepmcp.filesystem.dto.StepWritePrepareResult;
import org.stepmcp.step.StepEntity;
import org.stepmcp.step.StepFileAssembler;
import org.stepmcp.step.StepHeader;
import org.stepmcp.step.StepStringDecoder;
import org.stepmcp.step.StepStringEscaper;
import org.stepmcp.step.json.StepJsonModelReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * STEP 写出 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出可写出的根目录（{@code step_list_roots}）。</li>
 *   <li>STEP 字符串转义/解码（{@code step_encode_string}/{@code step_decode_string}）。</li>
 *   <li>把 JSON 实体模型渲染为 ISO-10303-21 文本（{@code step_render}）。</li>
 *   <li>写出 STEP 文件（{@code step_prepare_write_file} -> {@code step_confirm_write_file} 两段式确认）。</li>
 * </ul>
 * <p>
 * 实体模型与 HEADER 的 JSON 写法见 {@link StepJsonModelReader}。
 * 渲染失败（格式错误、引用成环等）时整体报错，不会返回或写出半个文件。
 */
@Component
public class StepMcpTools {

    private static final Logger log = LoggerFactory.getLogger(StepMcpTools.class);

    private final StepServerProperties properties;
    private final SecurePathResolver pathResolver;
    private final PendingStepWriteStore pendingWriteStore;

    public StepMcpTools(StepServerProperties properties, SecurePathResolver pathResolver, PendingStepWriteStore pendingWriteStore) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.pendingWriteStore = pendingWriteStore;
    }

    @Tool(
            name = "step_list_roots",
            description = "列出允许写出 STEP 文件的根目录（rootId + path）以及是否允许写入。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots(), properties.isAllowWrite());
    }

    @Tool(
            name = "step_encode_string",
            description = "把任意 Unicode 文本转义为 STEP 字符串（'' / \\\\X\\\\hh / \\\\X2\\\\...\\\\X0\\\\ / \\\\X4\\\\...\\\\X0\\\\）。"
    )
    public StepStringResult encodeString(
            @ToolParam(description = "要转义的文本") String text
    ) {
        if (text == null) {
            throw new IllegalArgumentException("参数错误：text 不能为空");
        }
        String encoded = StepStringEscaper.encode(text);
        return new StepStringResult(text, encoded, "'" + encoded + "'");
    }

    @Tool(
            name = "step_decode_string",
            description = "解码 STEP 字符串（可带两侧单引号），例如 '\\\\X2\\\\4E2D6587\\\\X0\\\\' -> 中文。"
    )
    public StepStringResult decodeString(
            @ToolParam(description = "STEP 字符串字面量或其内容") String literal
    ) {
        if (literal == null) {
            throw new IllegalArgumentException("参数错误：literal 不能为空");
        }
        String text = StepStringDecoder.unquote(literal);
        String encoded = StepStringEscaper.encode(text);
        return new StepStringResult(text, encoded, "'" + encoded + "'");
    }

    @Tool(
            name = "step_render",
            description = "把 JSON 实体模型渲染为完整的 STEP(ISO-10303-21) 文本：嵌套实体自动拍平编号，渲染结果相同的实体合并为一条；引用成环会报错。"
    )
    /**
     * 渲染 STEP 文档并内联返回。
     * <p>
     * 文本超过 {@code app.step.render-max-chars} 时截断返回（sha256/bytes 仍基于完整文档）；
     * 需要完整落盘请使用 {@code step_prepare_write_file}。
     */
    public StepRenderResult render(
            @ToolParam(description = "实体模型 JSON：实体对象数组或 {\"entities\":[...]}；实体形如 {\"type\":\"CARTESIAN_POINT\",\"attributes\":[\"\",[1.0,2.0,3.0]],\"id\":\"可选标签\"}") String entities,
            @ToolParam(required = false, description = "HEADER JSON（可选）：fileDescriptions/implementationLevel/fileName/timeStamp/authors/organizations/preprocessorVersion/originatingSystem/authorization/schemas") String header
    ) {
        StepFileAssembler.StepDocument document = renderDocument(entities, header);
        String text = document.text();
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);

        List<String> warnings = new ArrayList<>();
        boolean truncated = text.length() > properties.getRenderMaxChars();
        String returned = truncated ? text.substring(0, properties.getRenderMaxChars()) : text;
        if (truncated) {
            warnings.add("文档共 " + text.length() + " 字符，已按 app.step.render-max-chars 截断返回；完整内容请用 step_prepare_write_file 写出到文件。");
        }

        return new StepRenderResult(
                document.data().rootIds().size(),
                document.data().size(),
                document.data().rootIds(),
                text.length(),
                bytes.length,
                StepFileWriter.sha256Hex(bytes),
                truncated,
                returned,
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "step_prepare_write_file",
            description = "渲染 STEP 文档并准备写出到 .stp/.step 文件（不直接写入）：返回 token + 风险提示；需再调用 step_confirm_write_file 才会真正写入。"
    )
    /**
     * 准备写出（第一阶段）：渲染 + 路径校验 + 暂存，不落盘。
     * <p>
     * 目标文件已存在且不超过 {@code app.step.hash-max-bytes} 时记录旧文件 sha256，confirm 阶段据此判断文件是否被外部改动。
     */
    public StepWritePrepareResult prepareWriteFile(
            @ToolParam(required = false, description = "rootId（可从 step_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "目标文件路径（.stp/.step，相对 rootId 或绝对路径）") String path,
            @ToolParam(description = "实体模型 JSON（同 step_render）") String entities,
            @ToolParam(required = false, description = "HEADER JSON（可选，同 step_render）") String header,
            @ToolParam(required = false, description = "是否覆盖已存在文件（默认 false）") Boolean overwrite,
            @ToolParam(required = false, description = "是否自动创建父目录（默认 false）") Boolean createParents
    ) {
        if (!properties.isAllowWrite()) {
            throw new IllegalStateException("已禁止写入：配置 app.step.allow-write=false");
        }

        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveStepTarget(rootId, path);
        Path target = resolved.absolutePath();
        boolean overwriteResolved = Boolean.TRUE.equals(overwrite);
        boolean createParentsResolved = Boolean.TRUE.equals(createParents);

        Path parent = target.getParent();
        boolean parentExists = Files.exists(parent, LinkOption.NOFOLLOW_LINKS);
        if (parentExists && !Files.isDirectory(parent, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("父路径不是目录：" + parent);
        }
        if (!parentExists && !createParentsResolved) {
            throw new IllegalArgumentException("父目录不存在；请设置 createParents=true 自动创建：" + parent);
        }

        List<String> warnings = new ArrayList<>();
        boolean exists = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
        if (exists) {
            if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
                throw new IllegalArgumentException("目标路径是目录，无法写入文件：" + resolved.displayPath());
            }
            if (!overwriteResolved) {
                throw new IllegalArgumentException("目标文件已存在；请设置 overwrite=true 以覆盖：" + resolved.displayPath());
            }
            warnings.add("目标文件已存在，确认后将覆盖。");
        } else {
            warnings.add("目标文件不存在，确认后将创建。");
        }

        // 路径校验通过后再渲染：渲染失败（格式错误/引用成环）不会留下任何 token
        StepFileAssembler.StepDocument document = renderDocument(entities, header);
        byte[] bytes = document.text().getBytes(StandardCharsets.UTF_8);

        String expectedSha256 = null;
        if (exists) {
            try {
                if (Files.size(target) <= properties.getHashMaxBytes().toBytes()) {
                    expectedSha256 = StepFileWriter.sha256Hex(target);
                } else {
                    warnings.add("现有文件过大，跳过 sha256 校验。");
                }
            } catch (IOException e) {
                warnings.add("计算现有文件 sha256 失败，跳过校验：" + e.getMessage());
            }
        }

        PendingStepWriteStore.PendingStepWrite pending = pendingWriteStore.create(
                resolved.rootId(),
                resolved.displayPath(),
                target,
                bytes,
                document.data().size(),
                overwriteResolved,
                createParentsResolved,
                exists,
                expectedSha256,
                StepFileWriter.sha256Hex(bytes)
        );
        log.debug("已暂存 STEP 写入：token={}, path={}, entities={}, bytes={}",
                pending.token(), pending.displayPath(), pending.dataEntities(), bytes.length);

        return new StepWritePrepareResult(
                pending.token(),
                pending.rootId(),
                pending.displayPath(),
                exists,
                overwriteResolved,
                pending.dataEntities(),
                bytes.length,
                expectedSha256,
                pending.newSha256(),
                pending.expiresAt(),
                warnings
        );
    }

    @Tool(
            name = "step_confirm_write_file",
            description = "确认或取消写出 STEP 文件：confirm=true 才会写入；confirm=false 则取消并丢弃 token。"
    )
    /**
     * 确认写出（第二阶段）。
     * <p>
     * confirm=true 时重新校验路径、目标文件存在性与 sha256，然后原子写入；token 只能使用一次。
     */
    public StepWriteConfirmResult confirmWriteFile(
            @ToolParam(description = "step_prepare_write_file 返回的 token") String token,
            @ToolParam(required = false, description = "是否确认写入（true 写入 / false 取消；默认 false）") Boolean confirm
    ) {
        PendingStepWriteStore.PendingStepWrite peek = pendingWriteStore.get(token);
        if (peek == null) {
            throw new IllegalArgumentException("token 无效或已过期");
        }
        if (!Boolean.TRUE.equals(confirm)) {
            pendingWriteStore.remove(token);
            log.warn("已取消 STEP 写入：token={}, path={}", peek.token(), peek.displayPath());
            return new StepWriteConfirmResult(
                    peek.token(),
                    peek.rootId(),
                    peek.displayPath(),
                    false,
                    false,
                    0,
                    null,
                    null,
                    List.of("已取消写入（confirm=false）")
            );
        }
        if (!properties.isAllowWrite()) {
            throw new IllegalStateException("已禁止写入：配置 app.step.allow-write=false");
        }

        // 取出并删除 token，避免重复确认
        PendingStepWriteStore.PendingStepWrite pending = pendingWriteStore.remove(token);
        if (pending == null) {
            throw new IllegalArgumentException("token 无效或已过期");
        }

        SecurePathResolver.ResolvedPath resolvedNow = pathResolver.resolveStepTarget(pending.rootId(), pending.targetFile().toString());
        Path target = resolvedNow.absolutePath();
        if (!properties.isAllowSymlink() && Files.isSymbolicLink(target)) {
            throw new IllegalArgumentException("不允许写入到符号链接目标路径：" + pending.displayPath());
        }

        if (pending.expectExists()) {
            if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                throw new IllegalStateException("确认失败：目标文件在 prepare 后发生变化（原本应存在）");
            }
            if (pending.expectedSha256() != null) {
                String currentSha;
                try {
                    currentSha = StepFileWriter.sha256Hex(target);
                } catch (IOException e) {
                    throw new IllegalStateException("确认失败：无法校验现有文件 sha256：" + pending.displayPath(), e);
                }
                if (!pending.expectedSha256().equalsIgnoreCase(currentSha)) {
                    throw new IllegalStateException("确认失败：目标文件内容已被修改（sha256 不一致）");
                }
            }
        } else if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalStateException("确认失败：目标文件在 prepare 后发生变化（现在已存在）");
        }

        try {
            if (pending.createParents()) {
                Files.createDirectories(target.getParent());
            } else if (!Files.isDirectory(target.getParent(), LinkOption.NOFOLLOW_LINKS)) {
                throw new IllegalStateException("父目录不存在：" + target.getParent());
            }
            StepFileWriter.writeAtomically(target, pending.bytes(), pending.overwrite());
        } catch (IOException e) {
            throw new IllegalStateException("写入 STEP 文件失败：" + pending.displayPath(), e);
        }
        log.info("已写出 STEP 文件：{}（{} 字节，{} 个实体）", pending.displayPath(), pending.bytes().length, pending.dataEntities());

        return new StepWriteConfirmResult(
                pending.token(),
                pending.rootId(),
                pending.displayPath(),
                true,
                true,
                pending.bytes().length,
                pending.newSha256(),
                Instant.now(),
                null
        );
    }

    private StepFileAssembler.StepDocument renderDocument(String entitiesJson, String headerJson) {
        List<StepEntity> entities = StepJsonModelReader.readEntities(entitiesJson, properties.getMaxInputEntities());
        StepHeader header = StepJsonModelReader.readHeader(headerJson, properties.getDefaultOriginatingSystem());
        return StepFileAssembler.render(header, entities);
    }
}
