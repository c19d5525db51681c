package io.github.samzhu.router.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.router.model.HealthState;
import io.github.samzhu.router.model.PlanRouting;
import io.github.samzhu.router.model.PlanWeighting;
import io.github.samzhu.router.model.RoutingMode;
import io.github.samzhu.router.model.SubscriptionStatus;

/**
 * 內建目錄配置屬性（{@code gateway.catalog}）
 *
 * <p>提供 {@link io.github.samzhu.router.store.InMemoryCatalog} 的初始資料：後端、方案、訂閱與 API Key。
 * API Key 只以 SHA-256 雜湊設定，設定檔中不出現原始 Key。
 *
 * <p>配置範例：
 * <pre>
 * gateway:
 *   catalog:
 *     backends:
 *       - name: DeepSeek
 *         endpoint-url: https://deepseek.internal/v1/chat
 *         capacity-score: 80
 *         cost-per-unit: 0.001
 *     plans:
 *       - id: starter
 *         priority: 20
 *         requests-per-day: 1000
 *         rate-limit-qps: 5
 *         models:
 *           - backend: DeepSeek
 *             cost-weight: 15
 *     subscriptions:
 *       - id: sub-001
 *         customer-id: cust-001
 *         plan-id: starter
 *     api-keys:
 *       - key-hash: a48e8bbc...
 *         key-prefix: sk-demo-
 *         subscription-id: sub-001
 * </pre>
 */
@ConfigurationProperties(prefix = "gateway.catalog")
public record CatalogProperties(
    List<Backend> backends,
    List<Plan> plans,
    List<Subscription> subscriptions,
    List<ApiKey> apiKeys
) {
    public CatalogProperties {
        backends = backends == null ? List.of() : backends;
        plans = plans == null ? List.of() : plans;
        subscriptions = subscriptions == null ? List.of() : subscriptions;
        apiKeys = apiKeys == null ? List.of() : apiKeys;
    }

    /**
     * 後端設定；平均延遲與成功率為啟動時的初始統計值
     */
    public record Backend(
        String name,
        String endpointUrl,
        HealthState health,
        Integer capacityScore,
        Double costPerUnit,
        Double avgLatencyMs,
        Double successRate,
        Boolean active,
        Integer timeoutSeconds
    ) {
        public Backend {
            health = health != null ? health : HealthState.UP;
            capacityScore = capacityScore != null ? capacityScore : 50;
            costPerUnit = costPerUnit != null ? costPerUnit : 0.0;
            avgLatencyMs = avgLatencyMs != null ? avgLatencyMs : 100.0;
            successRate = successRate != null ? successRate : 100.0;
            active = active != null ? active : true;
        }
    }

    /**
     * 方案設定
     *
     * @param requestsPerDay 每日配額，-1 表示無限制
     */
    public record Plan(
        String id,
        Integer priority,
        Long requestsPerDay,
        Integer rateLimitQps,
        List<ModelAccess> models,
        Routing routing
    ) {
        public Plan {
            priority = priority != null ? priority : 0;
            requestsPerDay = requestsPerDay != null ? requestsPerDay : -1L;
            rateLimitQps = rateLimitQps != null ? rateLimitQps : 0;
            models = models == null ? List.of() : models;
        }
    }

    public record ModelAccess(
        String backend,
        Boolean allowed,
        Double costWeight
    ) {
        public PlanWeighting toWeighting() {
            return new PlanWeighting(
                backend,
                allowed == null || allowed,
                costWeight != null ? costWeight : PlanWeighting.DEFAULT_COST_WEIGHT);
        }
    }

    public record Routing(
        String defaultMode,
        Boolean complexityDetection,
        Boolean sessionAffinity,
        Long sessionTtlSeconds,
        Double correlationThreshold,
        Double monthlyBudgetLimit
    ) {
        public PlanRouting toPlanRouting() {
            return new PlanRouting(
                RoutingMode.parse(defaultMode).orElse(null),
                Boolean.TRUE.equals(complexityDetection),
                Boolean.TRUE.equals(sessionAffinity),
                sessionTtlSeconds != null ? sessionTtlSeconds : 0,
                correlationThreshold != null ? correlationThreshold : 0,
                monthlyBudgetLimit != null ? monthlyBudgetLimit : 0);
        }
    }

    public record Subscription(
        String id,
        String customerId,
        String planId,
        SubscriptionStatus status
    ) {
        public Subscription {
            status = status != null ? status : SubscriptionStatus.ACTIVE;
        }
    }

    public record ApiKey(
        String keyHash,
        String keyPrefix,
        String subscriptionId,
        Boolean active
    ) {
        public ApiKey {
            active = active != null ? active : true;
        }
    }
}
