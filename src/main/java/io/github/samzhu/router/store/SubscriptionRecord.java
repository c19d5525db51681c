package io.github.samzhu.router.store;

import io.github.samzhu.router.model.SubscriptionStatus;

/**
 * 訂閱持久紀錄
 */
public record SubscriptionRecord(
    String subscriptionId,
    String customerId,
    String planId,
    SubscriptionStatus status,
    int priorityScore,
    long dailyQuotaLimit,
    long dailyQuotaRemaining
) {
    public SubscriptionRecord withQuotaRemaining(long remaining) {
        return new SubscriptionRecord(subscriptionId, customerId, planId, status,
            priorityScore, dailyQuotaLimit, remaining);
    }
}
