package io.github.samzhu.router.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.router.model.BudgetAlert;

/**
 * 預設的花費門檻通知：寫入日誌
 */
@Component
public class LoggingBudgetListener implements BudgetListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingBudgetListener.class);

    @Override
    public void onThresholdCrossed(BudgetAlert alert) {
        log.warn("Monthly budget threshold crossed: subscriptionId={}, customerId={}, month={}, spend={}, limit={}, threshold={}%",
            alert.subscriptionId(), alert.customerId(), alert.month(),
            String.format("%.4f", alert.spend()), alert.budgetLimit(), Math.round(alert.threshold() * 100));
    }
}
