package io.github.samzhu.router.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.router.MutableClock;

class InMemorySharedCacheTest {

    private MutableClock clock;
    private InMemorySharedCache cache;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
        cache = new InMemorySharedCache(clock);
        pool = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void getReturnsEmptyAfterTtl() {
        cache.set("api_key:sk-demo", "{}", Duration.ofSeconds(60));
        assertThat(cache.get("api_key:sk-demo")).contains("{}");

        clock.advance(Duration.ofSeconds(60));

        assertThat(cache.get("api_key:sk-demo")).isEmpty();
    }

    @Test
    void deleteRemovesEntry() {
        cache.set("k", "v", Duration.ofMinutes(1));
        cache.delete("k");
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void decrementInitializesFromInitialValue() {
        CounterResult first = cache.decrementWithFloor("quota:sub:2025-06-01", 10, 3, Duration.ofHours(1));

        assertThat(first.applied()).isTrue();
        assertThat(first.remaining()).isEqualTo(7);
        assertThat(cache.get("quota:sub:2025-06-01")).contains("7");
    }

    @Test
    void decrementNeverGoesBelowZero() {
        cache.decrementWithFloor("q", 2, 2, Duration.ofHours(1));

        CounterResult rejected = cache.decrementWithFloor("q", 2, 1, Duration.ofHours(1));

        assertThat(rejected.applied()).isFalse();
        assertThat(rejected.remaining()).isZero();
    }

    @Test
    void expiredCounterIsReinitialized() {
        cache.decrementWithFloor("q", 1, 1, Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(2));

        CounterResult next = cache.decrementWithFloor("q", 1, 1, Duration.ofMinutes(1));

        assertThat(next.applied()).isTrue();
        assertThat(next.remaining()).isZero();
    }

    @Test
    void concurrentDecrementsAdmitExactlyTheRemainingQuota() throws Exception {
        int remaining = 25;
        int callers = 200;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                if (cache.decrementWithFloor("quota:race", remaining, 1, Duration.ofHours(1)).applied()) {
                    admitted.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertThat(admitted.get()).isEqualTo(remaining);
        assertThat(cache.get("quota:race")).contains("0");
    }

    @Test
    void incrementIfPresentIgnoresMissingKey() {
        assertThat(cache.incrementIfPresent("missing", 1)).isEmpty();
        assertThat(cache.get("missing")).isEmpty();
    }

    @Test
    void incrementIfPresentRestoresUnits() {
        cache.decrementWithFloor("q", 5, 2, Duration.ofHours(1));

        assertThat(cache.incrementIfPresent("q", 2)).contains(5L);
    }

    @Test
    void windowAdmitsAtMostLimitUnderConcurrentLoad() throws Exception {
        int limit = 5;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger acquired = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < 100; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                if (cache.acquireWindowSlot("ratelimit:sub", limit, Duration.ofSeconds(1)).acquired()) {
                    acquired.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertThat(acquired.get()).isEqualTo(limit);
    }

    @Test
    void windowSlidesInsteadOfResettingOnEachRequest() {
        Duration window = Duration.ofSeconds(1);
        assertThat(cache.acquireWindowSlot("r", 2, window).acquired()).isTrue();
        clock.advance(Duration.ofMillis(600));
        assertThat(cache.acquireWindowSlot("r", 2, window).acquired()).isTrue();

        WindowSlot rejected = cache.acquireWindowSlot("r", 2, window);
        assertThat(rejected.acquired()).isFalse();
        assertThat(rejected.retryAfterMs()).isEqualTo(400);

        clock.advance(Duration.ofMillis(400));
        assertThat(cache.acquireWindowSlot("r", 2, window).acquired()).isTrue();
        assertThat(cache.acquireWindowSlot("r", 2, window).acquired()).isFalse();
    }

    @Test
    void incrementByFloatAccumulates() {
        assertThat(cache.incrementByFloat("spend", 0.5, Duration.ofDays(1))).isEqualTo(0.5);
        assertThat(cache.incrementByFloat("spend", 0.25, Duration.ofDays(1))).isEqualTo(0.75);
    }

    @Test
    void evictExpiredKeepsMemoryBoundedAcrossDays() {
        for (int day = 0; day < 30; day++) {
            String date = "2025-06-" + String.format("%02d", day + 1);
            for (int i = 0; i < 100; i++) {
                cache.decrementWithFloor("quota:sub-" + i + ":" + date, 10, 1, Duration.ofHours(1));
                cache.set("session:sub-" + i + ":s-" + day + ":prompt", "hello", Duration.ofHours(1));
            }
            clock.advance(Duration.ofDays(1));
            cache.evictExpired();
        }

        assertThat(cache.size()).isZero();
    }

    @Test
    void evictExpiredKeepsLiveEntries() {
        cache.set("short", "a", Duration.ofSeconds(10));
        cache.set("long", "b", Duration.ofMinutes(10));
        cache.decrementWithFloor("quota:sub:2025-06-01", 5, 1, Duration.ofHours(14));

        clock.advance(Duration.ofSeconds(10));

        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(cache.get("long")).contains("b");
        assertThat(cache.decrementWithFloor("quota:sub:2025-06-01", 5, 1, Duration.ofHours(14)).remaining())
            .isEqualTo(3);
    }

    @Test
    void evictExpiredDropsIdleRateWindows() {
        Duration window = Duration.ofSeconds(1);
        cache.acquireWindowSlot("ratelimit:idle", 2, window);
        clock.advance(Duration.ofMillis(500));
        cache.acquireWindowSlot("ratelimit:busy", 2, window);
        clock.advance(Duration.ofMillis(600));

        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);

        cache.acquireWindowSlot("ratelimit:busy", 2, window);
        assertThat(cache.acquireWindowSlot("ratelimit:busy", 2, window).acquired()).isFalse();
    }
}
