package io.github.samzhu.router.model;

/**
 * 准入檢查結果
 *
 * <p>以明確的結果值取代例外流程，呼叫端必須處理每一種結果：
 * <ul>
 *   <li>{@code ALLOWED} - 通過；{@code quotaRemaining} 為扣除後剩餘量（無限方案為 -1）</li>
 *   <li>{@code QUOTA_EXCEEDED} - 每日配額不足；{@code quotaRemaining} 為目前剩餘量</li>
 *   <li>{@code RATE_LIMITED} - 超過每秒上限；{@code retryAfterMs} 為建議等待時間</li>
 * </ul>
 *
 * @see io.github.samzhu.router.service.AdmissionController
 */
public record AdmissionDecision(
    Outcome outcome,
    long quotaRemaining,
    long retryAfterMs
) {
    public enum Outcome {
        ALLOWED,
        QUOTA_EXCEEDED,
        RATE_LIMITED
    }

    public static AdmissionDecision allowed(long quotaRemaining) {
        return new AdmissionDecision(Outcome.ALLOWED, quotaRemaining, 0);
    }

    public static AdmissionDecision quotaExceeded(long quotaRemaining) {
        return new AdmissionDecision(Outcome.QUOTA_EXCEEDED, quotaRemaining, 0);
    }

    public static AdmissionDecision rateLimited(long retryAfterMs) {
        return new AdmissionDecision(Outcome.RATE_LIMITED, -1, retryAfterMs);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }
}
