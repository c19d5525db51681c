package io.github.samzhu.router.store;

import java.util.Optional;

/**
 * 訂閱持久層（外部協作者）
 *
 * <p>Router 只在快取未命中時讀取；唯一的寫入是每日剩餘配額的非同步回寫。
 */
public interface SubscriptionStore {

    Optional<ApiKeyRecord> findApiKeyByHash(String keyHash);

    Optional<SubscriptionRecord> findSubscription(String subscriptionId);

    Optional<PlanRecord> findPlan(String planId);

    /**
     * 回寫今日剩餘配額（best-effort）
     */
    void updateQuotaRemaining(String subscriptionId, long remaining);
}
