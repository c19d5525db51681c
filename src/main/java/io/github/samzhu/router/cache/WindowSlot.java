package io.github.samzhu.router.cache;

/**
 * 滑動視窗取得結果
 *
 * @param acquired     是否取得名額
 * @param retryAfterMs 未取得時，最早可能釋出名額的等待毫秒數
 */
public record WindowSlot(
    boolean acquired,
    long retryAfterMs
) {}
