package io.github.samzhu.router.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.router.Fixtures;
import io.github.samzhu.router.MutableClock;
import io.github.samzhu.router.cache.InMemorySharedCache;
import io.github.samzhu.router.config.RouterProperties;
import io.github.samzhu.router.model.AdmissionDecision;
import io.github.samzhu.router.model.SubscriptionContext;
import io.github.samzhu.router.store.SubscriptionStore;

class AdmissionControllerTest {

    private MutableClock clock;
    private InMemorySharedCache cache;
    private SubscriptionStore store;
    private AdmissionController controller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T23:59:00Z"));
        cache = new InMemorySharedCache(clock);
        store = mock(SubscriptionStore.class);
        controller = new AdmissionController(cache, store, clock, RouterProperties.defaults(), Runnable::run);
    }

    @Test
    void unlimitedSubscriptionWithoutRateLimitIsAlwaysAdmitted() {
        SubscriptionContext context = Fixtures.subscription("sub-unlimited", -1, 0, "DeepSeek");

        for (int i = 0; i < 50; i++) {
            AdmissionDecision decision = controller.admit(context, 5);
            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.quotaRemaining()).isEqualTo(-1);
        }
        verify(store, never()).updateQuotaRemaining(anyString(), anyLong());
    }

    @Test
    void quotaIsConsumedAndPersisted() {
        SubscriptionContext context = Fixtures.subscription("sub-1", 10, 0, "DeepSeek");

        AdmissionDecision decision = controller.admit(context, 3);

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.quotaRemaining()).isEqualTo(7);
        assertThat(cache.get("quota:sub-1:2025-06-01")).contains("7");
        verify(store).updateQuotaRemaining("sub-1", 7);
    }

    @Test
    void insufficientQuotaIsRejectedWithoutChangingCounter() {
        SubscriptionContext context = Fixtures.subscription("sub-1", 2, 0, "DeepSeek");
        controller.admit(context, 2);

        AdmissionDecision decision = controller.admit(context, 1);

        assertThat(decision.outcome()).isEqualTo(AdmissionDecision.Outcome.QUOTA_EXCEEDED);
        assertThat(decision.quotaRemaining()).isZero();
        assertThat(cache.get("quota:sub-1:2025-06-01")).contains("0");
    }

    @Test
    void quotaCounterRollsOverAtMidnight() {
        SubscriptionContext context = Fixtures.subscription("sub-1", 1, 0, "DeepSeek");
        assertThat(controller.admit(context, 1).isAllowed()).isTrue();
        assertThat(controller.admit(context, 1).isAllowed()).isFalse();

        clock.advance(Duration.ofMinutes(2));

        assertThat(controller.quotaKey("sub-1")).isEqualTo("quota:sub-1:2025-06-02");
        assertThat(controller.admit(context, 1).isAllowed()).isTrue();
    }

    @Test
    void concurrentRequestsNeverOverspendQuota() throws Exception {
        SubscriptionContext context = Fixtures.subscription("sub-race", 40, 0, "DeepSeek");
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 300; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    if (controller.admit(context, 1).isAllowed()) {
                        admitted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(admitted.get()).isEqualTo(40);
    }

    @Test
    void rateLimitRejectionReleasesConsumedQuota() {
        SubscriptionContext context = Fixtures.subscription("sub-1", 10, 2, "DeepSeek");
        controller.admit(context, 1);
        controller.admit(context, 1);

        AdmissionDecision decision = controller.admit(context, 1);

        assertThat(decision.outcome()).isEqualTo(AdmissionDecision.Outcome.RATE_LIMITED);
        assertThat(decision.retryAfterMs()).isPositive();
        assertThat(cache.get("quota:sub-1:2025-06-01")).contains("8");
    }

    @Test
    void rateLimitWindowReopensAfterOneSecond() {
        SubscriptionContext context = Fixtures.subscription("sub-1", -1, 1, "DeepSeek");
        assertThat(controller.admit(context, 1).isAllowed()).isTrue();
        assertThat(controller.admit(context, 1).isAllowed()).isFalse();

        clock.advance(Duration.ofSeconds(1));

        assertThat(controller.admit(context, 1).isAllowed()).isTrue();
    }

    @Test
    void releaseRestoresUnits() {
        SubscriptionContext context = Fixtures.subscription("sub-1", 10, 0, "DeepSeek");
        controller.admit(context, 4);

        controller.release(context, 4);

        assertThat(cache.get("quota:sub-1:2025-06-01")).contains("10");
        verify(store).updateQuotaRemaining("sub-1", 10);
    }
}
