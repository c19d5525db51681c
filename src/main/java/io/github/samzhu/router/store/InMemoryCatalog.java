package io.github.samzhu.router.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.github.samzhu.router.config.CatalogProperties;
import io.github.samzhu.router.config.RouterProperties;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.HealthState;

/**
 * 以設定檔初始化的記憶體目錄
 *
 * <p>同時扮演訂閱持久層、後端設定檔持久層與後端統計寫入端。
 * 後端清單保留設定順序；統計更新透過 {@link ConcurrentHashMap#computeIfPresent} 逐筆套用。
 *
 * <p>每日午夜（{@code gateway.routing.quota-zone}）將所有仍可使用的訂閱剩餘配額重設為上限。
 */
@Component
public class InMemoryCatalog implements SubscriptionStore, BackendProfileStore, BackendStatistics {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalog.class);

    private final Map<String, ApiKeyRecord> apiKeysByHash = new ConcurrentHashMap<>();
    private final Map<String, SubscriptionRecord> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, PlanRecord> plans = new ConcurrentHashMap<>();
    private final Map<String, BackendProfile> backends = new ConcurrentHashMap<>();
    private final List<String> backendOrder = new CopyOnWriteArrayList<>();

    public InMemoryCatalog(CatalogProperties catalog, RouterProperties routerProperties) {
        int defaultTimeout = (int) routerProperties.defaultTimeout().toSeconds();

        for (CatalogProperties.Backend backend : catalog.backends()) {
            saveBackend(new BackendProfile(
                backend.name(),
                backend.endpointUrl(),
                backend.health(),
                backend.capacityScore(),
                backend.costPerUnit(),
                backend.avgLatencyMs(),
                backend.successRate(),
                backend.active(),
                backend.timeoutSeconds() != null ? backend.timeoutSeconds() : defaultTimeout,
                0,
                0));
        }

        Map<String, CatalogProperties.Plan> planConfigs = new ConcurrentHashMap<>();
        for (CatalogProperties.Plan plan : catalog.plans()) {
            planConfigs.put(plan.id(), plan);
            savePlan(new PlanRecord(
                plan.id(),
                plan.rateLimitQps(),
                plan.models().stream().map(CatalogProperties.ModelAccess::toWeighting).toList(),
                plan.routing() != null ? plan.routing().toPlanRouting() : null));
        }

        for (CatalogProperties.Subscription subscription : catalog.subscriptions()) {
            CatalogProperties.Plan plan = planConfigs.get(subscription.planId());
            if (plan == null) {
                throw new IllegalStateException("Subscription " + subscription.id()
                    + " references unknown plan " + subscription.planId());
            }
            saveSubscription(new SubscriptionRecord(
                subscription.id(),
                subscription.customerId(),
                subscription.planId(),
                subscription.status(),
                plan.priority(),
                plan.requestsPerDay(),
                plan.requestsPerDay()));
        }

        for (CatalogProperties.ApiKey apiKey : catalog.apiKeys()) {
            SubscriptionRecord owner = subscriptions.get(apiKey.subscriptionId());
            if (owner == null) {
                throw new IllegalStateException("API key " + apiKey.keyPrefix()
                    + "**** references unknown subscription " + apiKey.subscriptionId());
            }
            saveApiKey(new ApiKeyRecord(
                apiKey.keyHash(),
                apiKey.keyPrefix(),
                owner.subscriptionId(),
                owner.customerId(),
                apiKey.active()));
        }

        log.info("Catalog loaded: backends={}, plans={}, subscriptions={}, apiKeys={}",
            backends.size(), plans.size(), subscriptions.size(), apiKeysByHash.size());
    }

    // === 訂閱 ===

    @Override
    public Optional<ApiKeyRecord> findApiKeyByHash(String keyHash) {
        return Optional.ofNullable(apiKeysByHash.get(keyHash));
    }

    @Override
    public Optional<SubscriptionRecord> findSubscription(String subscriptionId) {
        return Optional.ofNullable(subscriptions.get(subscriptionId));
    }

    @Override
    public Optional<PlanRecord> findPlan(String planId) {
        return Optional.ofNullable(plans.get(planId));
    }

    @Override
    public void updateQuotaRemaining(String subscriptionId, long remaining) {
        subscriptions.computeIfPresent(subscriptionId, (id, record) -> record.withQuotaRemaining(remaining));
    }

    public void saveApiKey(ApiKeyRecord record) {
        apiKeysByHash.put(record.keyHash(), record);
    }

    public void saveSubscription(SubscriptionRecord record) {
        subscriptions.put(record.subscriptionId(), record);
    }

    public void savePlan(PlanRecord record) {
        plans.put(record.planId(), record);
    }

    /**
     * 每日配額重設
     */
    @Scheduled(cron = "0 0 0 * * *", zone = "${gateway.routing.quota-zone:UTC}")
    public void resetDailyQuotas() {
        List<String> reset = new ArrayList<>();
        subscriptions.replaceAll((id, record) -> {
            if (record.status().isAdmitting() && record.dailyQuotaLimit() >= 0) {
                reset.add(id);
                return record.withQuotaRemaining(record.dailyQuotaLimit());
            }
            return record;
        });
        log.info("Daily quota rollover completed: subscriptions={}", reset.size());
    }

    // === 後端 ===

    @Override
    public List<BackendProfile> findAll() {
        return backendOrder.stream()
            .map(backends::get)
            .filter(Objects::nonNull)
            .toList();
    }

    @Override
    public Optional<BackendProfile> findByName(String name) {
        return Optional.ofNullable(backends.get(name));
    }

    public void saveBackend(BackendProfile profile) {
        if (backends.put(profile.name(), profile) == null) {
            backendOrder.add(profile.name());
        }
    }

    @Override
    public void recordSuccess(String backendName, long latencyMs) {
        backends.computeIfPresent(backendName, (name, profile) -> profile.withSuccess(latencyMs));
    }

    @Override
    public void recordFailure(String backendName) {
        backends.computeIfPresent(backendName, (name, profile) -> profile.withFailure());
    }

    @Override
    public void recordHealth(String backendName, HealthState health, Long probeLatencyMs) {
        BackendProfile updated = backends.computeIfPresent(backendName,
            (name, profile) -> profile.withHealth(health, probeLatencyMs));
        if (updated != null) {
            log.debug("Backend health updated: backend={}, health={}, latencyMs={}",
                backendName, health, probeLatencyMs);
        }
    }
}
