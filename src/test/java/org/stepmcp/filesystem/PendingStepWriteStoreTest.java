package org.stepmcp.filesystem;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingStepWriteStoreTest {

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private static PendingStepWriteStore.PendingStepWrite stage(PendingStepWriteStore store, byte[] bytes) {
        return store.create("root0", "a.stp", Path.of("a.stp"), bytes, 1, false, false, false, null, "sha");
    }

    @Test
    void create_thenRemove_isSingleUse() {
        PendingStepWriteStore store = new PendingStepWriteStore(Duration.ofMinutes(10), 1024);

        PendingStepWriteStore.PendingStepWrite pending = stage(store, new byte[] {1, 2, 3});

        assertThat(store.get(pending.token())).isSameAs(pending);
        assertThat(store.remove(pending.token())).isSameAs(pending);
        assertThat(store.remove(pending.token())).isNull();
        assertThat(store.get(pending.token())).isNull();
    }

    @Test
    void get_returnsNullAfterTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-21T00:00:00Z"));
        PendingStepWriteStore store = new PendingStepWriteStore(Duration.ofMinutes(10), 1024, clock);
        PendingStepWriteStore.PendingStepWrite pending = stage(store, new byte[] {1});

        assertThat(pending.expiresAt()).isEqualTo(Instant.parse("2026-01-21T00:10:00Z"));
        clock.advance(Duration.ofMinutes(10));
        assertThat(store.get(pending.token())).isNotNull();
        clock.advance(Duration.ofSeconds(1));
        assertThat(store.get(pending.token())).isNull();
        assertThat(store.size()).isZero();
    }

    @Test
    void create_purgesExpiredEntries() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-21T00:00:00Z"));
        PendingStepWriteStore store = new PendingStepWriteStore(Duration.ofMinutes(1), 1024, clock);
        stage(store, new byte[] {1});
        clock.advance(Duration.ofMinutes(2));

        stage(store, new byte[] {2});

        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void create_rejectsOversizedDocument() {
        PendingStepWriteStore store = new PendingStepWriteStore(Duration.ofMinutes(10), 2);

        assertThatThrownBy(() -> stage(store, new byte[] {1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("STEP 文档过大");
        assertThat(store.get(null)).isNull();
    }
}
