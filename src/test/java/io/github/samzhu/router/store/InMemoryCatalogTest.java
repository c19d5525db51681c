package io.github.samzhu.router.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.router.config.CatalogProperties;
import io.github.samzhu.router.config.RouterProperties;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.HealthState;
import io.github.samzhu.router.model.RoutingMode;
import io.github.samzhu.router.model.SubscriptionStatus;

class InMemoryCatalogTest {

    private InMemoryCatalog catalog;

    @BeforeEach
    void setUp() {
        CatalogProperties properties = new CatalogProperties(
            List.of(
                new CatalogProperties.Backend("DeepSeek", "http://localhost:9101", null, 80, 0.001, null, null, null, null),
                new CatalogProperties.Backend("Claude", "http://localhost:9104", HealthState.DEGRADED, 90, 0.015, 400.0, null, null, 60)),
            List.of(new CatalogProperties.Plan("pro", 60, 5000L, 10,
                List.of(
                    new CatalogProperties.ModelAccess("DeepSeek", null, 15.0),
                    new CatalogProperties.ModelAccess("Claude", false, null)),
                new CatalogProperties.Routing("auto", true, true, null, null, 14.29))),
            List.of(new CatalogProperties.Subscription("sub-1", "cust-1", "pro", null)),
            List.of(new CatalogProperties.ApiKey("abc123", "sk-demo-", "sub-1", null)));
        catalog = new InMemoryCatalog(properties, RouterProperties.defaults());
    }

    @Test
    void loadsBackendsInConfiguredOrderWithDefaults() {
        List<BackendProfile> backends = catalog.findAll();

        assertThat(backends).extracting(BackendProfile::name).containsExactly("DeepSeek", "Claude");
        BackendProfile deepSeek = backends.get(0);
        assertThat(deepSeek.health()).isEqualTo(HealthState.UP);
        assertThat(deepSeek.avgLatencyMs()).isEqualTo(100.0);
        assertThat(deepSeek.successRate()).isEqualTo(100.0);
        assertThat(deepSeek.timeoutSeconds()).isEqualTo(30);
        assertThat(backends.get(1).timeoutSeconds()).isEqualTo(60);
    }

    @Test
    void subscriptionInheritsPlanPriorityAndQuota() {
        SubscriptionRecord subscription = catalog.findSubscription("sub-1").orElseThrow();

        assertThat(subscription.status()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(subscription.priorityScore()).isEqualTo(60);
        assertThat(subscription.dailyQuotaLimit()).isEqualTo(5000);
        assertThat(subscription.dailyQuotaRemaining()).isEqualTo(5000);
    }

    @Test
    void planExcludesDisallowedBackends() {
        PlanRecord plan = catalog.findPlan("pro").orElseThrow();

        assertThat(plan.allowedBackends()).containsExactly("DeepSeek");
        assertThat(plan.costWeights()).containsOnlyKeys("DeepSeek").containsEntry("DeepSeek", 15.0);
        assertThat(plan.routing().defaultMode()).isEqualTo(RoutingMode.AUTO);
        assertThat(plan.routing().correlationThreshold()).isEqualTo(0.7);
    }

    @Test
    void apiKeyCarriesOwnerCustomer() {
        ApiKeyRecord key = catalog.findApiKeyByHash("abc123").orElseThrow();

        assertThat(key.active()).isTrue();
        assertThat(key.customerId()).isEqualTo("cust-1");
    }

    @Test
    void statisticsFollowRollingFormulas() {
        catalog.recordSuccess("DeepSeek", 300);
        catalog.recordFailure("DeepSeek");

        BackendProfile deepSeek = catalog.findByName("DeepSeek").orElseThrow();
        assertThat(deepSeek.totalRequests()).isEqualTo(2);
        assertThat(deepSeek.failedRequests()).isEqualTo(1);
        assertThat(deepSeek.successRate()).isEqualTo(50.0);
        assertThat(deepSeek.avgLatencyMs()).isEqualTo(300.0);
    }

    @Test
    void healthProbeUpdatesStateAndLatency() {
        catalog.recordHealth("Claude", HealthState.UP, 120L);
        catalog.recordHealth("Unknown", HealthState.DOWN, null);

        BackendProfile claude = catalog.findByName("Claude").orElseThrow();
        assertThat(claude.health()).isEqualTo(HealthState.UP);
        assertThat(claude.avgLatencyMs()).isEqualTo(120.0);
        assertThat(catalog.findByName("Unknown")).isEmpty();
    }

    @Test
    void dailyResetRestoresRemainingQuota() {
        catalog.updateQuotaRemaining("sub-1", 12);
        assertThat(catalog.findSubscription("sub-1").orElseThrow().dailyQuotaRemaining()).isEqualTo(12);

        catalog.resetDailyQuotas();

        assertThat(catalog.findSubscription("sub-1").orElseThrow().dailyQuotaRemaining()).isEqualTo(5000);
    }

    @Test
    void rejectsSubscriptionWithUnknownPlan() {
        CatalogProperties properties = new CatalogProperties(null, null,
            List.of(new CatalogProperties.Subscription("sub-x", "cust-x", "missing", null)), null);

        assertThatThrownBy(() -> new InMemoryCatalog(properties, RouterProperties.defaults()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("missing");
    }
}
