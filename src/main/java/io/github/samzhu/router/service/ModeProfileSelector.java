package io.github.samzhu.router.service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import io.github.samzhu.router.model.PlanRouting;
import io.github.samzhu.router.model.RoutingMode;
import io.github.samzhu.router.model.SubscriptionContext;
import io.github.samzhu.router.model.TaskComplexity;

/**
 * 路由模式權重表
 *
 * <p>每個模式依任務複雜度定義各後端的相對權重（總和約 100，不需正規化）。
 * 權重在單次選擇中取代方案對同名後端的成本權重，不會寫回方案。
 *
 * <table>
 *   <caption>模式權重（DeepSeek / Grok / Gemini / Claude / GPT-4）</caption>
 *   <tr><th>模式</th><th>複雜度</th><th>權重</th></tr>
 *   <tr><td>auto</td><td>simple</td><td>80 / 10 / 5 / 3 / 2</td></tr>
 *   <tr><td>auto</td><td>reasoning</td><td>40 / 40 / 10 / 7 / 3</td></tr>
 *   <tr><td>auto</td><td>complex</td><td>2 / 8 / 15 / 50 / 25</td></tr>
 *   <tr><td>auto</td><td>multimodal</td><td>2 / 3 / 70 / 15 / 10</td></tr>
 *   <tr><td>performance</td><td>全部</td><td>0 / 2 / 8 / 60 / 30</td></tr>
 *   <tr><td>efficient</td><td>reasoning</td><td>60 / 35 / 3 / 2 / 0</td></tr>
 *   <tr><td>efficient</td><td>其他</td><td>90 / 8 / 2 / 0 / 0</td></tr>
 *   <tr><td>lite</td><td>全部</td><td>30 / 70 / 0 / 0 / 0</td></tr>
 * </table>
 *
 * <p>後端名稱比對不分大小寫。
 */
@Component
public class ModeProfileSelector {

    private static final Map<TaskComplexity, Map<String, Double>> AUTO = new EnumMap<>(TaskComplexity.class);
    private static final Map<String, Double> PERFORMANCE = weights(0, 2, 8, 60, 30);
    private static final Map<String, Double> EFFICIENT_REASONING = weights(60, 35, 3, 2, 0);
    private static final Map<String, Double> EFFICIENT_DEFAULT = weights(90, 8, 2, 0, 0);
    private static final Map<String, Double> LITE = weights(30, 70, 0, 0, 0);

    static {
        AUTO.put(TaskComplexity.SIMPLE, weights(80, 10, 5, 3, 2));
        AUTO.put(TaskComplexity.REASONING, weights(40, 40, 10, 7, 3));
        AUTO.put(TaskComplexity.COMPLEX, weights(2, 8, 15, 50, 25));
        AUTO.put(TaskComplexity.MULTIMODAL, weights(2, 3, 70, 15, 10));
    }

    /**
     * 決定本次請求的有效模式
     *
     * <p>請求指定的模式優先，其次為方案預設模式；無法辨識的模式名稱視為 auto。
     *
     * @return 有效模式，請求與方案皆未指定時為 null（不套用模式權重）
     */
    public RoutingMode effectiveMode(String requestedMode, PlanRouting routing) {
        if (StringUtils.isNotBlank(requestedMode)) {
            return RoutingMode.parse(requestedMode).orElse(RoutingMode.AUTO);
        }
        return routing.defaultMode();
    }

    public Map<String, Double> modeWeights(RoutingMode mode, TaskComplexity complexity) {
        TaskComplexity effective = complexity != null ? complexity : TaskComplexity.SIMPLE;
        if (mode == RoutingMode.PERFORMANCE) {
            return PERFORMANCE;
        }
        if (mode == RoutingMode.EFFICIENT) {
            return effective == TaskComplexity.REASONING ? EFFICIENT_REASONING : EFFICIENT_DEFAULT;
        }
        if (mode == RoutingMode.LITE) {
            return LITE;
        }
        return AUTO.get(effective);
    }

    /**
     * 以模式權重覆寫方案成本權重
     *
     * @return 訂閱可用後端的有效成本權重（以後端名稱為 key）
     */
    public Map<String, Double> merge(SubscriptionContext context, Map<String, Double> modeWeights) {
        Map<String, Double> byLowerName = new LinkedHashMap<>();
        modeWeights.forEach((name, weight) -> byLowerName.put(name.toLowerCase(Locale.ROOT), weight));

        Map<String, Double> merged = new LinkedHashMap<>();
        for (String backend : context.allowedBackends()) {
            Double override = byLowerName.get(backend.toLowerCase(Locale.ROOT));
            merged.put(backend, override != null ? override : context.costWeight(backend));
        }
        return merged;
    }

    private static Map<String, Double> weights(double deepSeek, double grok, double gemini, double claude, double gpt4) {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("DeepSeek", deepSeek);
        weights.put("Grok", grok);
        weights.put("Gemini", gemini);
        weights.put("Claude", claude);
        weights.put("GPT-4", gpt4);
        return Collections.unmodifiableMap(weights);
    }
}
