package org.stepmcp.filesystem;

import org.stepmcp.filesystem.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 安全路径解析器：把 STEP 输出路径解析成“受控的绝对路径”，并确保它不会逃逸出允许写出的根目录白名单。
 * <p>
 * 规则：
 * <ul>
 *   <li>仅允许写入 {@code app.step.roots} 配置的目录（白名单）。</li>
 *   <li>阻止路径穿越（例如 {@code ../}）导致写到根目录之外。</li>
 *   <li>默认禁止符号链接（symlink）/junction 造成的“路径逃逸”。</li>
 *   <li>目标文件扩展名必须是 {@code .stp} 或 {@code .step}。</li>
 * </ul>
 * 写入目标可能尚不存在，因此只对已存在的父目录链路做 realPath 校验。
 */
public class SecurePathResolver {

    private final StepServerProperties properties;
    private final List<Root> roots;

    public SecurePathResolver(StepServerProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties);
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    /**
     * 解析 STEP 写出目标（目标文件可以不存在）。
     */
    public ResolvedPath resolveStepTarget(String rootId, String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }
        ResolvedPath resolved = resolve(rootId, inputPath);
        Path fileName = resolved.absolutePath().getFileName();
        String lower = (fileName == null) ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (!lower.endsWith(".stp") && !lower.endsWith(".step")) {
            throw new IllegalArgumentException("目标不是 STEP 文件（仅支持 .stp/.step）：" + resolved.displayPath());
        }
        return resolved;
    }

    ResolvedPath resolve(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许写出的根目录（app.step.roots）");
        }

        Path rawPath = Path.of(inputPath);
        Root selectedRoot;
        Path absolute;

        // 绝对路径：选择路径层级最长的匹配 root；相对路径：从 rootId 指定的 root 解析，rootId 为空默认 root0
        if (rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath()) || absolute.equals(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许写出的根目录范围内：" + inputPath);
        }

        validateWithinRoot(selectedRoot, absolute);

        return new ResolvedPath(selectedRoot.id(), selectedRoot.rootPath(), absolute, displayPath(selectedRoot, absolute));
    }

    private void validateWithinRoot(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        // root -> 目标路径逐级做 realPath 校验，防止中间某一级是 junction/symlink
        Path current = root.rootPath();
        Path relative = root.rootPath().relativize(absolute);
        for (Path segment : relative) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (!properties.isAllowSymlink() && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许写入符号链接路径：" + current);
            }
            try {
                Path realCurrent = current.toRealPath();
                if (!realCurrent.startsWith(rootReal)) {
                    throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许写出的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(StepServerProperties properties) {
        List<String> configured = properties.getRoots();
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.step.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        // 统一使用 '/' 分隔，避免 Windows 下返回反斜杠
        return root.rootPath().relativize(absolute).toString().replace('\\', '/');
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
