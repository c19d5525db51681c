package io.github.samzhu.router.service;

import io.github.samzhu.router.model.UsageRecord;

/**
 * 用量紀錄接收端
 *
 * <p>實作必須非同步處理，發送失敗不得影響呼叫端回應。
 */
public interface UsageSink {

    void publish(UsageRecord record);
}
