package io.github.samzhu.router.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.github.samzhu.router.model.PlanRouting;
import io.github.samzhu.router.model.PlanWeighting;

/**
 * 方案持久紀錄
 *
 * @param planId          方案識別碼
 * @param rateLimitQps    每秒請求上限，0 表示不限制
 * @param modelAccess     各後端的存取與成本權重（順序即評分平手時的優先順序）
 * @param routing         智慧路由設定
 */
public record PlanRecord(
    String planId,
    int rateLimitQps,
    List<PlanWeighting> modelAccess,
    PlanRouting routing
) {
    public PlanRecord {
        modelAccess = modelAccess == null ? List.of() : List.copyOf(modelAccess);
        if (routing == null) {
            routing = PlanRouting.disabled();
        }
    }

    public List<String> allowedBackends() {
        return modelAccess.stream()
            .filter(PlanWeighting::allowed)
            .map(PlanWeighting::backendName)
            .toList();
    }

    public Map<String, Double> costWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (PlanWeighting access : modelAccess) {
            if (access.allowed()) {
                weights.put(access.backendName(), access.costWeight());
            }
        }
        return weights;
    }
}
