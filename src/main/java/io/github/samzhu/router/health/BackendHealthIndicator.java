package io.github.samzhu.router.health;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.HealthState;
import io.github.samzhu.router.store.BackendProfileStore;

/**
 * 上游後端健康指標
 *
 * <p>Spring Boot Actuator 健康檢查元件，彙總各後端的健康狀態。
 *
 * <p>健康狀態：
 * <ul>
 *   <li>UP - 至少一個啟用中的後端可以路由（Up 或 Degraded）</li>
 *   <li>DOWN - 沒有任何可路由的後端</li>
 * </ul>
 *
 * <p>存取方式：{@code GET /actuator/health}
 *
 * <p>回應範例（健康）：
 * <pre>{@code
 * {
 *   "components": {
 *     "backends": {
 *       "status": "UP",
 *       "details": { "total": 5, "up": 4, "degraded": 1, "down": 0, "inactive": 0 }
 *     }
 *   }
 * }
 * }</pre>
 */
@Component("backends")
public class BackendHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(BackendHealthIndicator.class);

    private final BackendProfileStore backendProfileStore;

    public BackendHealthIndicator(BackendProfileStore backendProfileStore) {
        this.backendProfileStore = backendProfileStore;
    }

    @Override
    public Health health() {
        List<BackendProfile> backends = backendProfileStore.findAll();
        long inactive = backends.stream().filter(b -> !b.active()).count();
        long up = count(backends, HealthState.UP);
        long degraded = count(backends, HealthState.DEGRADED);
        long down = count(backends, HealthState.DOWN);

        Health.Builder builder = (up + degraded) > 0 ? Health.up() : Health.down();
        if (up + degraded == 0) {
            log.warn("Backend health check failed: no routable backend, total={}", backends.size());
            builder.withDetail("message", "No routable backend");
        }
        return builder
            .withDetail("total", backends.size())
            .withDetail("up", up)
            .withDetail("degraded", degraded)
            .withDetail("down", down)
            .withDetail("inactive", inactive)
            .build();
    }

    private static long count(List<BackendProfile> backends, HealthState state) {
        return backends.stream()
            .filter(BackendProfile::active)
            .filter(b -> b.health() == state)
            .count();
    }
}
