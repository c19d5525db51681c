package io.github.samzhu.router.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.samzhu.router.model.PlanRouting;
import io.github.samzhu.router.model.RoutingMode;
import io.github.samzhu.router.model.SubscriptionContext;
import io.github.samzhu.router.model.SubscriptionStatus;
import io.github.samzhu.router.model.TaskComplexity;

class ModeProfileSelectorTest {

    private final ModeProfileSelector selector = new ModeProfileSelector();

    @Test
    void requestedModeWinsOverPlanDefault() {
        PlanRouting routing = new PlanRouting(RoutingMode.PERFORMANCE, true, false, 0, 0, 0);

        assertThat(selector.effectiveMode("lite", routing)).isEqualTo(RoutingMode.LITE);
        assertThat(selector.effectiveMode(null, routing)).isEqualTo(RoutingMode.PERFORMANCE);
        assertThat(selector.effectiveMode("", PlanRouting.disabled())).isNull();
    }

    @Test
    void unknownModeFallsBackToAuto() {
        assertThat(selector.effectiveMode("turbo", PlanRouting.disabled())).isEqualTo(RoutingMode.AUTO);
    }

    @Test
    void autoWeightsFollowComplexity() {
        assertThat(selector.modeWeights(RoutingMode.AUTO, TaskComplexity.SIMPLE))
            .containsEntry("DeepSeek", 80.0).containsEntry("GPT-4", 2.0);
        assertThat(selector.modeWeights(RoutingMode.AUTO, TaskComplexity.COMPLEX))
            .containsEntry("Claude", 50.0);
        assertThat(selector.modeWeights(RoutingMode.AUTO, TaskComplexity.MULTIMODAL))
            .containsEntry("Gemini", 70.0);
    }

    @Test
    void efficientDistinguishesReasoning() {
        assertThat(selector.modeWeights(RoutingMode.EFFICIENT, TaskComplexity.REASONING))
            .containsEntry("DeepSeek", 60.0).containsEntry("Grok", 35.0);
        assertThat(selector.modeWeights(RoutingMode.EFFICIENT, TaskComplexity.COMPLEX))
            .containsEntry("DeepSeek", 90.0);
    }

    @Test
    void performanceAndLiteIgnoreComplexity() {
        assertThat(selector.modeWeights(RoutingMode.PERFORMANCE, TaskComplexity.SIMPLE))
            .isEqualTo(selector.modeWeights(RoutingMode.PERFORMANCE, TaskComplexity.MULTIMODAL));
        assertThat(selector.modeWeights(RoutingMode.LITE, TaskComplexity.COMPLEX))
            .containsEntry("Grok", 70.0).containsEntry("Claude", 0.0);
    }

    @Test
    void mergeOverridesMatchingBackendsOnly() {
        Map<String, Double> planWeights = new LinkedHashMap<>();
        planWeights.put("deepseek", 15.0);
        planWeights.put("Mistral", 12.0);
        SubscriptionContext context = new SubscriptionContext("sub-1", "cust-1", "pro", 50, -1, -1,
            List.of("deepseek", "Mistral"), 0, SubscriptionStatus.ACTIVE, planWeights, null, "hash", "sk-test-");

        Map<String, Double> merged = selector.merge(context,
            selector.modeWeights(RoutingMode.LITE, TaskComplexity.SIMPLE));

        assertThat(merged).containsExactly(Map.entry("deepseek", 30.0), Map.entry("Mistral", 12.0));
    }
}
