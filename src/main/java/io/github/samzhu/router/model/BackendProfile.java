package io.github.samzhu.router.model;

import org.apache.commons.lang3.StringUtils;

/**
 * 上游模型後端設定檔
 *
 * <p>記錄單一上游 LLM 端點的健康狀態、容量、成本與滾動統計。
 * 由健康檢查與呼叫後統計更新，路由熱路徑上僅讀取。
 *
 * <p>統計公式：
 * <pre>
 * successRate  = (totalRequests - failedRequests) / totalRequests × 100
 * avgLatencyMs = (avgLatencyMs × (totalRequests - 1) + latencyMs) / totalRequests
 * </pre>
 *
 * @param name           後端名稱（如 DeepSeek、Claude）
 * @param endpointUrl    呼叫端點
 * @param health         健康狀態
 * @param capacityScore  容量分數（0 - 100）
 * @param costPerUnit    每單位成本
 * @param avgLatencyMs   滾動平均延遲（毫秒）
 * @param successRate    滾動成功率（0 - 100）
 * @param active         是否啟用
 * @param timeoutSeconds 呼叫逾時秒數
 * @param totalRequests  累計請求數
 * @param failedRequests 累計失敗數
 */
public record BackendProfile(
    String name,
    String endpointUrl,
    HealthState health,
    int capacityScore,
    double costPerUnit,
    double avgLatencyMs,
    double successRate,
    boolean active,
    int timeoutSeconds,
    long totalRequests,
    long failedRequests
) {
    public BackendProfile {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Backend name cannot be blank");
        }
        if (StringUtils.isBlank(endpointUrl)
                || !(endpointUrl.startsWith("http://") || endpointUrl.startsWith("https://"))) {
            throw new IllegalArgumentException("Endpoint URL must start with http:// or https://: " + name);
        }
        if (capacityScore < 0 || capacityScore > 100) {
            throw new IllegalArgumentException("Capacity score must be between 0 and 100: " + name);
        }
        if (costPerUnit < 0) {
            throw new IllegalArgumentException("Cost per unit cannot be negative: " + name);
        }
        if (avgLatencyMs < 0) {
            throw new IllegalArgumentException("Average latency cannot be negative: " + name);
        }
        if (successRate < 0 || successRate > 100) {
            throw new IllegalArgumentException("Success rate must be between 0 and 100: " + name);
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeout must be positive: " + name);
        }
        if (health == null) {
            health = HealthState.UP;
        }
    }

    /**
     * 是否可作為路由候選（啟用且非 Down）
     */
    public boolean isAvailable() {
        return active && health != HealthState.DOWN;
    }

    public BackendProfile withSuccess(long latencyMs) {
        long total = totalRequests + 1;
        double newAvg = ((avgLatencyMs * (total - 1)) + latencyMs) / total;
        return new BackendProfile(name, endpointUrl, health, capacityScore, costPerUnit,
            newAvg, rate(total, failedRequests), active, timeoutSeconds, total, failedRequests);
    }

    public BackendProfile withFailure() {
        long total = totalRequests + 1;
        long failed = failedRequests + 1;
        return new BackendProfile(name, endpointUrl, health, capacityScore, costPerUnit,
            avgLatencyMs, rate(total, failed), active, timeoutSeconds, total, failed);
    }

    public BackendProfile withHealth(HealthState newHealth, Long probeLatencyMs) {
        double latency = probeLatencyMs != null ? probeLatencyMs : avgLatencyMs;
        return new BackendProfile(name, endpointUrl, newHealth, capacityScore, costPerUnit,
            latency, successRate, active, timeoutSeconds, totalRequests, failedRequests);
    }

    private static double rate(long total, long failed) {
        return ((double) (total - failed) / total) * 100.0;
    }
}
