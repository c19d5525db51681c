package io.github.samzhu.router.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.router.cache.CounterResult;
import io.github.samzhu.router.cache.SharedCache;
import io.github.samzhu.router.cache.WindowSlot;
import io.github.samzhu.router.config.RouterProperties;
import io.github.samzhu.router.model.AdmissionDecision;
import io.github.samzhu.router.model.SubscriptionContext;
import io.github.samzhu.router.store.SubscriptionStore;

/**
 * 准入控制：每日配額與每秒速率限制
 *
 * <p>兩道關卡依序檢查，任一失敗即中止請求：
 * <ol>
 *   <li><b>配額</b>：{@code quota:{subscription}:{yyyy-MM-dd}} 計數器，當日首次使用時以每日上限初始化，
 *       於當日結束時過期；餘額足夠才扣減（單一原子操作）</li>
 *   <li><b>速率</b>：{@code ratelimit:{subscription}} 一秒滑動視窗，視窗內請求數未達上限才登記</li>
 * </ol>
 *
 * <p>配額通過但速率被拒時，已扣減的配額會立即歸還，被拒絕的請求不計費。
 * 扣減後的剩餘量以非同步方式回寫持久層（best-effort，不影響回應）。
 */
@Service
public class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private static final String QUOTA_PREFIX = "quota:";
    private static final String RATE_PREFIX = "ratelimit:";
    private static final Duration RATE_WINDOW = Duration.ofSeconds(1);

    private final SharedCache cache;
    private final SubscriptionStore subscriptionStore;
    private final Clock clock;
    private final ZoneId zone;
    private final Executor asyncExecutor;

    public AdmissionController(
            SharedCache cache,
            SubscriptionStore subscriptionStore,
            Clock clock,
            RouterProperties properties,
            @Qualifier("routerAsyncExecutor") Executor asyncExecutor) {
        this.cache = cache;
        this.subscriptionStore = subscriptionStore;
        this.clock = clock;
        this.zone = properties.zoneId();
        this.asyncExecutor = asyncExecutor;
    }

    /**
     * 檢查並扣減配額與速率
     *
     * @param context   訂閱情境
     * @param costUnits 本次請求的成本單位
     * @return 准入結果
     */
    public AdmissionDecision admit(SubscriptionContext context, int costUnits) {
        String subscriptionId = context.subscriptionId();
        long remaining = SubscriptionContext.UNLIMITED;

        if (!context.isUnlimited()) {
            CounterResult quota = cache.decrementWithFloor(
                quotaKey(subscriptionId), context.dailyQuotaLimit(), costUnits, untilEndOfDay());
            if (!quota.applied()) {
                log.warn("Quota exceeded: subscriptionId={}, remaining={}, requested={}",
                    subscriptionId, quota.remaining(), costUnits);
                return AdmissionDecision.quotaExceeded(quota.remaining());
            }
            remaining = quota.remaining();
        }

        if (context.hasRateLimit()) {
            WindowSlot slot = cache.acquireWindowSlot(
                RATE_PREFIX + subscriptionId, context.rateLimitQps(), RATE_WINDOW);
            if (!slot.acquired()) {
                log.warn("Rate limit exceeded: subscriptionId={}, limitQps={}, retryAfterMs={}",
                    subscriptionId, context.rateLimitQps(), slot.retryAfterMs());
                release(context, costUnits);
                return AdmissionDecision.rateLimited(slot.retryAfterMs());
            }
        }

        if (!context.isUnlimited()) {
            writeBack(subscriptionId, remaining);
        }
        return AdmissionDecision.allowed(remaining);
    }

    /**
     * 歸還已扣減的配額（請求未實際送往後端時使用）
     */
    public void release(SubscriptionContext context, int costUnits) {
        if (context.isUnlimited()) {
            return;
        }
        cache.incrementIfPresent(quotaKey(context.subscriptionId()), costUnits)
            .ifPresent(remaining -> {
                log.debug("Quota released: subscriptionId={}, units={}, remaining={}",
                    context.subscriptionId(), costUnits, remaining);
                writeBack(context.subscriptionId(), remaining);
            });
    }

    String quotaKey(String subscriptionId) {
        return QUOTA_PREFIX + subscriptionId + ":" + LocalDate.now(clock.withZone(zone));
    }

    private Duration untilEndOfDay() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        ZonedDateTime midnight = now.toLocalDate().plusDays(1).atStartOfDay(zone);
        Duration ttl = Duration.between(now, midnight);
        return ttl.isZero() || ttl.isNegative() ? Duration.ofSeconds(1) : ttl;
    }

    private void writeBack(String subscriptionId, long remaining) {
        try {
            asyncExecutor.execute(() -> {
                try {
                    subscriptionStore.updateQuotaRemaining(subscriptionId, remaining);
                } catch (RuntimeException e) {
                    log.warn("Failed to persist quota remaining: subscriptionId={}, error={}",
                        subscriptionId, e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Quota write-back not scheduled: subscriptionId={}, error={}", subscriptionId, e.getMessage());
        }
    }
}
