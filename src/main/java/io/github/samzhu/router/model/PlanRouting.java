package io.github.samzhu.router.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 方案的智慧路由設定
 *
 * @param defaultMode                 請求未指定模式時使用的模式，null 表示不套用模式權重
 * @param complexityDetectionEnabled  是否啟用任務複雜度偵測（停用時一律視為 simple）
 * @param sessionAffinityEnabled      是否啟用 Session 延續（同一對話固定同一後端）
 * @param sessionTtlSeconds           Session 快取存活秒數
 * @param correlationThreshold        判定為同一對話的相似度門檻（0.0 - 1.0）
 * @param monthlyBudgetLimit          每月花費上限，0 表示不追蹤
 */
public record PlanRouting(
    @JsonProperty("default_mode")
    RoutingMode defaultMode,

    @JsonProperty("complexity_detection_enabled")
    boolean complexityDetectionEnabled,

    @JsonProperty("session_affinity_enabled")
    boolean sessionAffinityEnabled,

    @JsonProperty("session_ttl_seconds")
    long sessionTtlSeconds,

    @JsonProperty("correlation_threshold")
    double correlationThreshold,

    @JsonProperty("monthly_budget_limit")
    double monthlyBudgetLimit
) {
    public static final long DEFAULT_SESSION_TTL_SECONDS = 3600;
    public static final double DEFAULT_CORRELATION_THRESHOLD = 0.7;

    public PlanRouting {
        if (sessionTtlSeconds <= 0) {
            sessionTtlSeconds = DEFAULT_SESSION_TTL_SECONDS;
        }
        if (correlationThreshold <= 0) {
            correlationThreshold = DEFAULT_CORRELATION_THRESHOLD;
        }
        if (correlationThreshold > 1.0) {
            throw new IllegalArgumentException("Correlation threshold must be between 0 and 1");
        }
        if (monthlyBudgetLimit < 0) {
            throw new IllegalArgumentException("Monthly budget limit cannot be negative");
        }
    }

    /**
     * 未啟用任何智慧功能的預設設定
     */
    public static PlanRouting disabled() {
        return new PlanRouting(null, false, false, DEFAULT_SESSION_TTL_SECONDS, DEFAULT_CORRELATION_THRESHOLD, 0);
    }
}
