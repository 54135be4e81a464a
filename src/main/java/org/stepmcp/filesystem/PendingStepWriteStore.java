package org.stepmcp.filesystem;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 待确认的 STEP 文件写入（内存版）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@code step_prepare_write_file}：渲染 STEP 文档，生成 token，并把文档字节暂存在内存。</li>
 *   <li>{@code step_confirm_write_file}：{@code confirm=true} 后用 token 取出文档并真正写入。</li>
 * </ol>
 * 每个 token 有 TTL，超时失效；单条文档大小受上限保护。仅适用于单进程场景。
 */
public class PendingStepWriteStore {

    private final Duration ttl;
    private final long maxBytesPerItem;
    private final Clock clock;
    private final ConcurrentHashMap<String, PendingStepWrite> store = new ConcurrentHashMap<>();

    public PendingStepWriteStore(Duration ttl, long maxBytesPerItem) {
        this(ttl, maxBytesPerItem, Clock.systemUTC());
    }

    PendingStepWriteStore(Duration ttl, long maxBytesPerItem, Clock clock) {
        this.ttl = ttl;
        this.maxBytesPerItem = maxBytesPerItem;
        this.clock = clock;
    }

    public PendingStepWrite create(
            String rootId,
            String displayPath,
            Path targetFile,
            byte[] bytes,
            int dataEntities,
            boolean overwrite,
            boolean createParents,
            boolean expectExists,
            String expectedSha256,
            String newSha256
    ) {
        cleanupExpired();
        if (bytes.length > maxBytesPerItem) {
            throw new IllegalArgumentException("STEP 文档过大：" + bytes.length + " 字节（上限 " + maxBytesPerItem + "）");
        }
        Instant now = clock.instant();
        PendingStepWrite pending = new PendingStepWrite(
                UUID.randomUUID().toString(),
                rootId,
                displayPath,
                targetFile,
                bytes,
                dataEntities,
                overwrite,
                createParents,
                expectExists,
                expectedSha256,
                newSha256,
                now,
                now.plus(ttl)
        );
        store.put(pending.token(), pending);
        return pending;
    }

    public PendingStepWrite get(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingStepWrite pending = store.get(token);
        if (pending == null) {
            return null;
        }
        if (isExpired(pending)) {
            store.remove(token);
            return null;
        }
        return pending;
    }

    public PendingStepWrite remove(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingStepWrite pending = store.remove(token);
        if (pending == null) {
            return null;
        }
        return isExpired(pending) ? null : pending;
    }

    public int size() {
        return store.size();
    }

    private boolean isExpired(PendingStepWrite pending) {
        return clock.instant().isAfter(pending.expiresAt());
    }

    private void cleanupExpired() {
        for (Map.Entry<String, PendingStepWrite> entry : store.entrySet()) {
            if (isExpired(entry.getValue())) {
                store.remove(entry.getKey());
            }
        }
    }

    public record PendingStepWrite(
            String token,
            String rootId,
            String displayPath,
            Path targetFile,
            byte[] bytes,
            int dataEntities,
            boolean overwrite,
            boolean createParents,
            boolean expectExists,
            String expectedSha256,
            String newSha256,
            Instant createdAt,
            Instant expiresAt
    ) {
    }
}
