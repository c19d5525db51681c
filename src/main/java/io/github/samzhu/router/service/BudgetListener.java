package io.github.samzhu.router.service;

import io.github.samzhu.router.model.BudgetAlert;

/**
 * 花費門檻通知的接收端（帳務/通知系統）
 */
public interface BudgetListener {

    void onThresholdCrossed(BudgetAlert alert);
}
