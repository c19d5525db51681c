package io.github.samzhu.router.model;

/**
 * 訂閱生命週期狀態
 */
public enum SubscriptionStatus {
    ACTIVE,
    TRIAL,
    EXPIRED,
    CANCELLED,
    PAST_DUE;

    /**
     * 只有 Active 與 Trial 允許請求進入
     */
    public boolean isAdmitting() {
        return this == ACTIVE || this == TRIAL;
    }
}
