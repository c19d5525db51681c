package io.github.samzhu.router.service;

import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.router.cache.SharedCache;
import io.github.samzhu.router.config.RouterProperties;
import io.github.samzhu.router.model.SubscriptionContext;
import io.github.samzhu.router.store.ApiKeyRecord;
import io.github.samzhu.router.store.PlanRecord;
import io.github.samzhu.router.store.SubscriptionRecord;
import io.github.samzhu.router.store.SubscriptionStore;
import io.github.samzhu.router.util.ApiKeyHasher;

/**
 * API Key 解析服務
 *
 * <p>將呼叫端出示的 API Key 轉換為 {@link SubscriptionContext}：
 * <ol>
 *   <li>以 {@code api_key:} + Key 前 16 碼查詢共享快取</li>
 *   <li>快取命中且雜湊相符 → 直接回傳（O(1)）</li>
 *   <li>未命中 → 以 SHA-256 雜湊查詢持久層，驗證 Key 有效、訂閱為 Active 或 Trial、方案存在</li>
 *   <li>組合訂閱情境並寫回快取（預設 60 秒）</li>
 * </ol>
 *
 * <p>快取內保存 Key 雜湊：兩把前綴相同的 Key 不會誤用彼此的快取內容。
 * 找不到、已撤銷或訂閱不可用時回傳 empty，由呼叫端對應為 unauthorized。
 *
 * @see io.github.samzhu.router.store.SubscriptionStore
 */
@Service
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    static final String CACHE_PREFIX = "api_key:";

    private final SharedCache cache;
    private final SubscriptionStore subscriptionStore;
    private final ObjectMapper objectMapper;
    private final RouterProperties properties;

    public CredentialResolver(
            SharedCache cache,
            SubscriptionStore subscriptionStore,
            ObjectMapper objectMapper,
            RouterProperties properties) {
        this.cache = cache;
        this.subscriptionStore = subscriptionStore;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * 解析 API Key
     *
     * @param apiKey 呼叫端出示的原始 Key
     * @return 訂閱情境，無效時為 empty
     */
    public Optional<SubscriptionContext> resolve(String apiKey) {
        if (StringUtils.isBlank(apiKey)) {
            return Optional.empty();
        }
        String keyHash = ApiKeyHasher.sha256Hex(apiKey);
        String cacheKey = cacheKey(apiKey);

        Optional<SubscriptionContext> cached = readCache(cacheKey, keyHash);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<SubscriptionContext> loaded = load(apiKey, keyHash);
        loaded.ifPresent(context -> writeCache(cacheKey, context));
        return loaded;
    }

    /**
     * 移除快取的訂閱情境（方案或訂閱異動後使用）
     */
    public void invalidate(String apiKey) {
        if (StringUtils.isNotBlank(apiKey)) {
            cache.delete(cacheKey(apiKey));
            log.debug("Credential cache invalidated: key={}", ApiKeyHasher.mask(apiKey));
        }
    }

    String cacheKey(String apiKey) {
        return CACHE_PREFIX + StringUtils.left(apiKey, properties.keyCachePrefixLength());
    }

    private Optional<SubscriptionContext> readCache(String cacheKey, String keyHash) {
        Optional<String> json = cache.get(cacheKey);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            SubscriptionContext context = objectMapper.readValue(json.get(), SubscriptionContext.class);
            if (!keyHash.equals(context.keyHash())) {
                log.debug("Credential cache entry belongs to another key: cacheKey={}", cacheKey);
                return Optional.empty();
            }
            return Optional.of(context);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Discarding unreadable credential cache entry: cacheKey={}, error={}", cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String cacheKey, SubscriptionContext context) {
        try {
            cache.set(cacheKey, objectMapper.writeValueAsString(context), properties.credentialCacheTtl());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize subscription context: subscriptionId={}, error={}",
                context.subscriptionId(), e.getMessage());
        }
    }

    private Optional<SubscriptionContext> load(String apiKey, String keyHash) {
        Optional<ApiKeyRecord> keyRecord = subscriptionStore.findApiKeyByHash(keyHash);
        if (keyRecord.isEmpty() || !keyRecord.get().active()) {
            log.debug("Unknown or revoked API key: key={}", ApiKeyHasher.mask(apiKey));
            return Optional.empty();
        }

        Optional<SubscriptionRecord> subscription = subscriptionStore.findSubscription(keyRecord.get().subscriptionId());
        if (subscription.isEmpty() || !subscription.get().status().isAdmitting()) {
            log.debug("Subscription not admitting: subscriptionId={}, status={}",
                keyRecord.get().subscriptionId(),
                subscription.map(s -> s.status().name()).orElse("MISSING"));
            return Optional.empty();
        }

        SubscriptionRecord sub = subscription.get();
        Optional<PlanRecord> plan = subscriptionStore.findPlan(sub.planId());
        if (plan.isEmpty()) {
            log.warn("Subscription references missing plan: subscriptionId={}, planId={}",
                sub.subscriptionId(), sub.planId());
            return Optional.empty();
        }

        SubscriptionContext context = new SubscriptionContext(
            sub.subscriptionId(),
            sub.customerId(),
            sub.planId(),
            sub.priorityScore(),
            sub.dailyQuotaLimit(),
            sub.dailyQuotaRemaining(),
            plan.get().allowedBackends(),
            plan.get().rateLimitQps(),
            sub.status(),
            plan.get().costWeights(),
            plan.get().routing(),
            keyHash,
            ApiKeyHasher.visiblePrefix(apiKey));

        log.debug("Subscription context loaded: subscriptionId={}, planId={}, allowedBackends={}",
            context.subscriptionId(), context.planId(), context.allowedBackends());
        return Optional.of(context);
    }
}
