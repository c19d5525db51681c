package io.github.samzhu.router.cache;

/**
 * 原子扣減結果
 *
 * @param applied   是否已扣減（餘額足夠）
 * @param remaining 扣減後餘額；未扣減時為目前餘額
 */
public record CounterResult(
    boolean applied,
    long remaining
) {}
