package io.github.samzhu.router.service;

import java.time.Clock;
import java.time.Duration;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.router.cache.SharedCache;
import io.github.samzhu.router.config.RouterProperties;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.BudgetAlert;
import io.github.samzhu.router.model.SubscriptionContext;

/**
 * 每月花費追蹤
 *
 * <p>每次成功呼叫後累加 {@code costUnits × costPerUnit} 到 {@code spend:{subscription}:{yyyy-MM}}，
 * 累計值跨越方案月預算的 80% 或 100% 時通知 {@link BudgetListener}。
 * 只在方案設定了月預算時追蹤；累加在背景執行緒進行，失敗只記錄日誌。
 */
@Service
public class SpendTracker {

    private static final Logger log = LoggerFactory.getLogger(SpendTracker.class);

    private static final List<Double> THRESHOLDS = List.of(0.8, 1.0);

    private final SharedCache cache;
    private final BudgetListener budgetListener;
    private final Clock clock;
    private final ZoneId zone;
    private final Executor asyncExecutor;

    public SpendTracker(
            SharedCache cache,
            BudgetListener budgetListener,
            Clock clock,
            RouterProperties properties,
            @Qualifier("routerAsyncExecutor") Executor asyncExecutor) {
        this.cache = cache;
        this.budgetListener = budgetListener;
        this.clock = clock;
        this.zone = properties.zoneId();
        this.asyncExecutor = asyncExecutor;
    }

    public void record(SubscriptionContext context, BackendProfile backend, int costUnits) {
        double budget = context.routing().monthlyBudgetLimit();
        double spend = costUnits * backend.costPerUnit();
        if (budget <= 0 || spend <= 0) {
            return;
        }
        try {
            asyncExecutor.execute(() -> accumulate(context, spend, budget));
        } catch (RuntimeException e) {
            log.warn("Spend tracking not scheduled: subscriptionId={}, error={}",
                context.subscriptionId(), e.getMessage());
        }
    }

    private void accumulate(SubscriptionContext context, double spend, double budget) {
        try {
            ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
            YearMonth month = YearMonth.from(now);
            String key = "spend:" + context.subscriptionId() + ":" + month;
            // 下個月第一天再多保留一天
            Duration ttl = Duration.between(now, month.plusMonths(1).atDay(1).atStartOfDay(zone)).plusDays(1);

            double total = cache.incrementByFloat(key, spend, ttl);
            double previous = total - spend;
            for (double threshold : THRESHOLDS) {
                double line = budget * threshold;
                if (previous < line && total >= line) {
                    budgetListener.onThresholdCrossed(new BudgetAlert(
                        context.subscriptionId(), context.customerId(), month.toString(), total, budget, threshold));
                }
            }
        } catch (RuntimeException e) {
            log.warn("Failed to track spend: subscriptionId={}, error={}", context.subscriptionId(), e.getMessage());
        }
    }
}
