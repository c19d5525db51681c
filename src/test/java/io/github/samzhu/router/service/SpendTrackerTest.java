package io.github.samzhu.router.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.router.Fixtures;
import io.github.samzhu.router.MutableClock;
import io.github.samzhu.router.cache.InMemorySharedCache;
import io.github.samzhu.router.config.RouterProperties;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.BudgetAlert;
import io.github.samzhu.router.model.HealthState;
import io.github.samzhu.router.model.PlanRouting;
import io.github.samzhu.router.model.RoutingMode;
import io.github.samzhu.router.model.SubscriptionContext;

class SpendTrackerTest {

    private final List<BudgetAlert> alerts = new ArrayList<>();
    private InMemorySharedCache cache;
    private SpendTracker tracker;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2025-06-15T08:00:00Z"));
        cache = new InMemorySharedCache(clock);
        tracker = new SpendTracker(cache, alerts::add, clock, RouterProperties.defaults(), Runnable::run);
    }

    @Test
    void accumulatesMonthlySpend() {
        SubscriptionContext context = withBudget(10.0);
        BackendProfile claude = Fixtures.backend("Claude", HealthState.UP, 90, 0.5);

        tracker.record(context, claude, 2);
        tracker.record(context, claude, 4);

        assertThat(cache.get("spend:sub-1:2025-06")).hasValueSatisfying(
            value -> assertThat(Double.parseDouble(value)).isEqualTo(3.0));
        assertThat(alerts).isEmpty();
    }

    @Test
    void alertsOnceWhenEachThresholdIsCrossed() {
        SubscriptionContext context = withBudget(10.0);
        BackendProfile claude = Fixtures.backend("Claude", HealthState.UP, 90, 1.0);

        tracker.record(context, claude, 7);
        tracker.record(context, claude, 2);
        tracker.record(context, claude, 1);
        tracker.record(context, claude, 1);

        assertThat(alerts).extracting(BudgetAlert::threshold).containsExactly(0.8, 1.0);
        assertThat(alerts.get(0).month()).isEqualTo("2025-06");
        assertThat(alerts.get(1).spend()).isEqualTo(10.0);
    }

    @Test
    void singleJumpCanCrossBothThresholds() {
        tracker.record(withBudget(1.0), Fixtures.backend("GPT-4", HealthState.UP, 90, 0.6), 2);

        assertThat(alerts).extracting(BudgetAlert::threshold).containsExactly(0.8, 1.0);
    }

    @Test
    void skipsPlansWithoutBudgetAndFreeBackends() {
        tracker.record(withBudget(0), Fixtures.backend("Claude", HealthState.UP, 90, 1.0), 5);
        tracker.record(withBudget(10.0), Fixtures.backend("DeepSeek"), 5);

        assertThat(cache.get("spend:sub-1:2025-06")).isEmpty();
    }

    private static SubscriptionContext withBudget(double budget) {
        return Fixtures.subscription("sub-1", -1, 0,
            new PlanRouting(RoutingMode.AUTO, true, true, 0, 0, budget), "Claude");
    }
}
