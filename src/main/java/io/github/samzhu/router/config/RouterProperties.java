package io.github.samzhu.router.config;

import java.time.Duration;
import java.time.ZoneId;

import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 路由引擎配置屬性
 *
 * <p>從 application.yaml 中的 {@code gateway.routing} 前綴載入配置：
 * <ul>
 *   <li>{@code weights} - 評分權重（見 {@link ScoringWeights}）</li>
 *   <li>{@code credentialCacheTtl} - 訂閱情境快取存活時間（預設: 60s）</li>
 *   <li>{@code keyCachePrefixLength} - 快取 key 取用的 API Key 前綴長度（預設: 16）</li>
 *   <li>{@code quotaZone} - 每日配額的日期切換時區（預設: UTC）</li>
 *   <li>{@code defaultTimeout} - 後端未設定逾時時使用的預設值（預設: 30s）</li>
 * </ul>
 *
 * <p>配置範例：
 * <pre>
 * gateway:
 *   routing:
 *     credential-cache-ttl: 60s
 *     quota-zone: Asia/Taipei
 *     weights:
 *       cost: 1.5
 *       degraded-penalty: -10
 * </pre>
 *
 * @param weights              評分權重
 * @param credentialCacheTtl   訂閱情境快取存活時間
 * @param keyCachePrefixLength 快取 key 前綴長度
 * @param quotaZone            配額時區
 * @param defaultTimeout       預設後端逾時
 */
@ConfigurationProperties(prefix = "gateway.routing")
public record RouterProperties(
    ScoringWeights weights,
    Duration credentialCacheTtl,
    Integer keyCachePrefixLength,
    String quotaZone,
    Duration defaultTimeout
) {
    public RouterProperties {
        if (weights == null) {
            weights = ScoringWeights.defaults();
        }
        if (credentialCacheTtl == null || credentialCacheTtl.isNegative() || credentialCacheTtl.isZero()) {
            credentialCacheTtl = Duration.ofSeconds(60);
        }
        if (keyCachePrefixLength == null || keyCachePrefixLength <= 0) {
            keyCachePrefixLength = 16;
        }
        if (StringUtils.isBlank(quotaZone)) {
            quotaZone = "UTC";
        }
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            defaultTimeout = Duration.ofSeconds(30);
        }
    }

    public static RouterProperties defaults() {
        return new RouterProperties(null, null, null, null, null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(quotaZone);
    }

    /**
     * 評分權重
     *
     * <pre>
     * score = latency × 1/(avgLatencyMs + 1)
     *       + capacity × (capacityScore / 100)
     *       - cost × costPerUnit
     *       + priority × subscriptionPriority
     *       + success × (successRate / 100)
     *       + planCostWeight × (planCostWeight / 10)
     *       + degradedPenalty（僅 Degraded）
     * </pre>
     */
    public record ScoringWeights(
        Double latency,
        Double capacity,
        Double cost,
        Double priority,
        Double success,
        Double planCostWeight,
        Double degradedPenalty
    ) {
        public ScoringWeights {
            latency = latency != null ? latency : 1.0;
            capacity = capacity != null ? capacity : 0.5;
            cost = cost != null ? cost : 1.5;
            priority = priority != null ? priority : 2.0;
            success = success != null ? success : 0.3;
            planCostWeight = planCostWeight != null ? planCostWeight : 3.0;
            degradedPenalty = degradedPenalty != null ? degradedPenalty : -10.0;
            if (latency < 0 || capacity < 0 || cost < 0 || priority < 0 || success < 0 || planCostWeight < 0) {
                throw new IllegalArgumentException("Scoring weights must be non-negative");
            }
            if (degradedPenalty > 0) {
                throw new IllegalArgumentException("Degraded penalty must not be positive");
            }
        }

        public static ScoringWeights defaults() {
            return new ScoringWeights(null, null, null, null, null, null, null);
        }
    }
}
