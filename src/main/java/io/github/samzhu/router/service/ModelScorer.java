package io.github.samzhu.router.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import io.github.samzhu.router.config.RouterProperties;
import io.github.samzhu.router.config.RouterProperties.ScoringWeights;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.HealthState;
import io.github.samzhu.router.model.PlanWeighting;
import io.github.samzhu.router.model.ScoredBackend;

/**
 * 後端評分
 *
 * <p>停用或 Down 的後端分數固定為 0 且不列入候選；其餘以加權線性組合計分：
 * <pre>
 * score = w_latency × 1/(avgLatencyMs + 1)
 *       + w_capacity × (capacityScore / 100)
 *       - w_cost × costPerUnit
 *       + w_priority × subscriptionPriority
 *       + w_success × (successRate / 100)
 *       + w_planCostWeight × (planCostWeight / 10)
 *       + degradedPenalty（僅 Degraded）
 * </pre>
 *
 * <p>排序為穩定排序：同分時保留候選清單原本的順序（即方案設定順序）。
 *
 * @see RouterProperties.ScoringWeights
 */
@Component
public class ModelScorer {

    private final ScoringWeights weights;

    public ModelScorer(RouterProperties properties) {
        this.weights = properties.weights();
    }

    public double score(BackendProfile backend, int subscriptionPriority, double planCostWeight) {
        if (!backend.isAvailable()) {
            return 0.0;
        }
        double score = weights.latency() * (1.0 / (backend.avgLatencyMs() + 1))
            + weights.capacity() * (backend.capacityScore() / 100.0)
            - weights.cost() * backend.costPerUnit()
            + weights.priority() * subscriptionPriority
            + weights.success() * (backend.successRate() / 100.0)
            + weights.planCostWeight() * (planCostWeight / 10.0);
        if (backend.health() == HealthState.DEGRADED) {
            score += weights.degradedPenalty();
        }
        return score;
    }

    /**
     * 為候選後端評分並由高至低排序
     *
     * @param candidates           候選後端（順序即平手時的優先順序）
     * @param subscriptionPriority 訂閱優先權
     * @param costWeights          各後端的有效成本權重，未列出者使用預設值 10
     * @return 可用後端的評分結果，不可用者已排除
     */
    public List<ScoredBackend> rank(List<BackendProfile> candidates, int subscriptionPriority,
                                    Map<String, Double> costWeights) {
        List<ScoredBackend> scored = new ArrayList<>();
        for (BackendProfile backend : candidates) {
            if (!backend.isAvailable()) {
                continue;
            }
            double weight = costWeights.getOrDefault(backend.name(), PlanWeighting.DEFAULT_COST_WEIGHT);
            scored.add(new ScoredBackend(backend, score(backend, subscriptionPriority, weight)));
        }
        scored.sort(Comparator.comparingDouble(ScoredBackend::score).reversed());
        return scored;
    }
}
