package io.github.samzhu.router.model;

/**
 * 花費門檻通知
 *
 * @param subscriptionId 訂閱識別碼
 * @param customerId     帳號識別碼
 * @param month          計費月份（yyyy-MM）
 * @param spend          本月累計花費
 * @param budgetLimit    方案每月預算上限
 * @param threshold      被跨越的門檻比例（如 0.8、1.0）
 */
public record BudgetAlert(
    String subscriptionId,
    String customerId,
    String month,
    double spend,
    double budgetLimit,
    double threshold
) {}
