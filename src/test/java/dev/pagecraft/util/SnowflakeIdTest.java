package dev.pagecraft.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SnowflakeId")
class SnowflakeIdTest {

    private SnowflakeId generator;

    @BeforeEach
    void setUp() {
        generator = new SnowflakeId(7);
    }

    @Nested
    @DisplayName("Constructor")
    class Constructor {

        @Test
        @DisplayName("should accept the node id range bounds")
        void shouldAcceptBounds() {
            assertThat(new SnowflakeId(0).getNodeId()).isZero();
            assertThat(new SnowflakeId(SnowflakeId.MAX_NODE_ID).getNodeId()).isEqualTo(1023);
        }

        @Test
        @DisplayName("should reject node ids outside 0..1023")
        void shouldRejectOutOfRange() {
            assertThatThrownBy(() -> new SnowflakeId(-1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("between 0 and 1023");
            assertThatThrownBy(() -> new SnowflakeId(1024))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("nextId")
    class NextId {

        @Test
        @DisplayName("should issue strictly increasing positive ids")
        void shouldIncrease() {
            long previous = generator.nextId();
            for (int i = 0; i < 10_000; i++) {
                long next = generator.nextId();
                assertThat(next).isPositive().isGreaterThan(previous);
                previous = next;
            }
        }

        @Test
        @DisplayName("should embed node id and current time")
        void shouldEmbedNodeAndTime() {
            long id = generator.nextId();

            assertThat(SnowflakeId.extractNodeId(id)).isEqualTo(7);
            assertThat(SnowflakeId.extractInstant(id))
                    .isBetween(Instant.now().minus(Duration.ofSeconds(5)), Instant.now().plus(Duration.ofSeconds(5)));
            assertThat(SnowflakeId.extractSequence(id)).isBetween(0, 4095);
        }

        @Test
        @DisplayName("should never stamp ids ahead of the clock during a burst")
        void shouldNotRunAheadOfClock() {
            long[] ids = new long[200_000];
            for (int i = 0; i < ids.length; i++) {
                ids[i] = generator.nextId();
            }
            long now = System.currentTimeMillis();

            assertThat(SnowflakeId.extractInstant(ids[ids.length - 1]).toEpochMilli()).isLessThanOrEqualTo(now);
            for (int i = 1; i < ids.length; i++) {
                assertThat(ids[i]).isGreaterThan(ids[i - 1]);
            }
        }

        @Test
        @DisplayName("should not repeat ids across threads")
        void shouldBeUniqueAcrossThreads() throws InterruptedException {
            int threads = 8;
            int perThread = 5_000;
            Set<Long> ids = ConcurrentHashMap.newKeySet();
            CountDownLatch done = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                for (int t = 0; t < threads; t++) {
                    executor.submit(() -> {
                        for (int i = 0; i < perThread; i++) {
                            ids.add(generator.nextId());
                        }
                        done.countDown();
                    });
                }
                assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
            } finally {
                executor.shutdownNow();
            }

            assertThat(ids).hasSize(threads * perThread);
        }
    }
}
