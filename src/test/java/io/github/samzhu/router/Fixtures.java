package io.github.samzhu.router;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.HealthState;
import io.github.samzhu.router.model.PlanRouting;
import io.github.samzhu.router.model.SubscriptionContext;
import io.github.samzhu.router.model.SubscriptionStatus;

/**
 * 測試用資料建構
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static BackendProfile backend(String name) {
        return backend(name, HealthState.UP, 50, 0.0);
    }

    public static BackendProfile backend(String name, HealthState health, int capacityScore, double costPerUnit) {
        return new BackendProfile(name, "http://localhost:9100/" + name.toLowerCase(), health,
            capacityScore, costPerUnit, 100, 100, true, 30, 0, 0);
    }

    public static BackendProfile backend(String name, String endpointUrl) {
        return new BackendProfile(name, endpointUrl, HealthState.UP, 50, 0.0, 100, 100, true, 2, 0, 0);
    }

    public static SubscriptionContext subscription(String id, long dailyLimit, int rateLimitQps, String... backends) {
        return subscription(id, dailyLimit, rateLimitQps, PlanRouting.disabled(), backends);
    }

    public static SubscriptionContext subscription(
            String id, long dailyLimit, int rateLimitQps, PlanRouting routing, String... backends) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String backend : backends) {
            weights.put(backend, 10.0);
        }
        return new SubscriptionContext(id, "cust-" + id, "pro", 50, dailyLimit, dailyLimit,
            List.of(backends), rateLimitQps, SubscriptionStatus.ACTIVE, weights, routing, "hash", "sk-test-");
    }
}
