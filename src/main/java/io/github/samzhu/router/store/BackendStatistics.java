package io.github.samzhu.router.store;

import io.github.samzhu.router.model.HealthState;

/**
 * 後端統計寫入介面
 *
 * <p>統計為讀-改-寫且允許近似值（並發更新可能遺失部分樣本），與必須精確的配額/速率不同。
 * 獨立成介面是為了能替換成更嚴格一致性的實作，而不需修改路由流程。
 */
public interface BackendStatistics {

    void recordSuccess(String backendName, long latencyMs);

    void recordFailure(String backendName);

    /**
     * 記錄健康檢查結果
     *
     * @param probeLatencyMs 探測延遲，探測失敗時為 null
     */
    void recordHealth(String backendName, HealthState health, Long probeLatencyMs);
}
