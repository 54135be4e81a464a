package org.stepmcp.filesystem;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * STEP 文档落盘与内容指纹（sha256）。
 * <ul>
 *   <li>sha256 用于两段式写入：prepare 时记录旧文件指纹，confirm 时校验文件是否已被外部修改。</li>
 *   <li>写入采用“同目录临时文件 -> move 替换”，避免中途失败留下半个 STEP 文件。</li>
 * </ul>
 */
public final class StepFileWriter {

    private static final HexFormat HEX = HexFormat.of();

    private StepFileWriter() {
    }

    public static String sha256Hex(byte[] bytes) {
        return HEX.formatHex(sha256Digest().digest(bytes));
    }

    public static String sha256Hex(Path file) throws IOException {
        MessageDigest digest = sha256Digest();
        // 流式读取，避免把大文件一次性读入内存
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) >= 0) {
                digest.update(buffer, 0, read);
            }
        }
        return HEX.formatHex(digest.digest());
    }

    public static void writeAtomically(Path target, byte[] bytes, boolean overwrite) throws IOException {
        Path parent = target.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("目标路径无效：" + target);
        }
        // 临时文件放在同一目录，保证与目标在同一文件系统内；ATOMIC_MOVE 不支持时降级为普通 move
        Path tmp = Files.createTempFile(parent, "step-write-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                if (overwrite) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } else {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
                }
            } catch (AtomicMoveNotSupportedException e) {
                if (overwrite) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.move(tmp, target);
                }
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static MessageDigest sha256Digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 SHA-256 摘要算法（MessageDigest）", e);
        }
    }
}
