package io.github.samzhu.router.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * 以真實 Redis 執行 Lua script，確認原子語意；無 Docker 環境時略過
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisSharedCacheContainerTest {

    @Container
    private static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7.2-alpine"))
        .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private RedisSharedCache cache;
    private String prefix;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
            new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        cache = new RedisSharedCache(redisTemplate);
        prefix = UUID.randomUUID() + ":";
    }

    @Test
    void decrementInitializesCounterWithTtl() {
        String key = prefix + "quota:sub:2025-06-01";

        CounterResult first = cache.decrementWithFloor(key, 10, 3, Duration.ofHours(1));
        CounterResult second = cache.decrementWithFloor(key, 10, 3, Duration.ofHours(1));

        assertThat(first.applied()).isTrue();
        assertThat(first.remaining()).isEqualTo(7);
        assertThat(second.remaining()).isEqualTo(4);
        assertThat(redisTemplate.getExpire(key, TimeUnit.SECONDS)).isBetween(3500L, 3600L);
    }

    @Test
    void decrementNeverGoesBelowZero() {
        String key = prefix + "quota";

        assertThat(cache.decrementWithFloor(key, 2, 3, Duration.ofHours(1)).applied()).isFalse();

        assertThat(redisTemplate.opsForValue().get(key)).isEqualTo("2");
    }

    @Test
    void concurrentDecrementsAdmitExactlyRemaining() throws Exception {
        String key = prefix + "quota";
        int callers = 60;
        ExecutorService pool = Executors.newFixedThreadPool(12);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger applied = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    if (cache.decrementWithFloor(key, 15, 1, Duration.ofHours(1)).applied()) {
                        applied.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(20, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(applied.get()).isEqualTo(15);
        assertThat(redisTemplate.opsForValue().get(key)).isEqualTo("0");
    }

    @Test
    void releaseOnlyTouchesLiveCounters() {
        String key = prefix + "quota";

        assertThat(cache.incrementIfPresent(key, 1)).isEmpty();
        assertThat(redisTemplate.hasKey(key)).isFalse();

        cache.decrementWithFloor(key, 5, 2, Duration.ofHours(1));
        assertThat(cache.incrementIfPresent(key, 2)).contains(5L);
    }

    @Test
    void windowAdmitsLimitThenReturnsRetryHint() {
        String key = prefix + "ratelimit:sub";
        Duration window = Duration.ofSeconds(1);

        for (int i = 0; i < 3; i++) {
            assertThat(cache.acquireWindowSlot(key, 3, window).acquired()).isTrue();
        }
        WindowSlot rejected = cache.acquireWindowSlot(key, 3, window);

        assertThat(rejected.acquired()).isFalse();
        assertThat(rejected.retryAfterMs()).isBetween(1L, 1000L);
        assertThat(redisTemplate.opsForZSet().size(key)).isEqualTo(3);
    }

    @Test
    void floatIncrementSetsTtlOnceAndAccumulates() {
        String key = prefix + "spend:sub:2025-06";

        assertThat(cache.incrementByFloat(key, 0.5, Duration.ofDays(1))).isEqualTo(0.5);
        assertThat(cache.incrementByFloat(key, 0.25, Duration.ofSeconds(5))).isEqualTo(0.75);

        assertThat(redisTemplate.getExpire(key, TimeUnit.SECONDS)).isGreaterThan(86000L);
    }
}
