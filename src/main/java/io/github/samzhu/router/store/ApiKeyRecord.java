package io.github.samzhu.router.store;

/**
 * API Key 持久紀錄（只保存雜湊值，不保存原始 Key）
 *
 * @param keyHash        原始 Key 的 SHA-256 十六進位雜湊
 * @param keyPrefix      原始 Key 前 8 碼（用於遮罩顯示）
 * @param subscriptionId 所屬訂閱
 * @param customerId     所屬帳號
 * @param active         是否有效（false 表示已撤銷）
 */
public record ApiKeyRecord(
    String keyHash,
    String keyPrefix,
    String subscriptionId,
    String customerId,
    boolean active
) {}
