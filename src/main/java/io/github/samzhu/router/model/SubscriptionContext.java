package io.github.samzhu.router.model;

import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 訂閱情境（由 API Key 解析後快取的權限視圖）
 *
 * <p>包含路由所需的全部資訊，命中快取時不需再查詢持久層：
 * <ul>
 *   <li>帳號、方案、訂閱識別碼與優先權（0 - 100）</li>
 *   <li>每日配額上限（{@code -1} 表示無限制）與剩餘量</li>
 *   <li>可用後端清單（保留方案設定順序，作為評分平手時的排序依據）</li>
 *   <li>每秒請求上限（0 表示不限制）</li>
 *   <li>方案對各後端的成本權重與智慧路由設定</li>
 * </ul>
 *
 * <p>不變量：有限配額時剩餘量不得超過上限；無限方案剩餘量固定為 {@code -1}。
 *
 * @see io.github.samzhu.router.service.CredentialResolver
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubscriptionContext(
    @JsonProperty("subscription_id")
    String subscriptionId,

    @JsonProperty("customer_id")
    String customerId,

    @JsonProperty("plan_id")
    String planId,

    @JsonProperty("priority_score")
    int priorityScore,

    @JsonProperty("daily_quota_limit")
    long dailyQuotaLimit,

    @JsonProperty("daily_quota_remaining")
    long dailyQuotaRemaining,

    @JsonProperty("allowed_backends")
    List<String> allowedBackends,

    @JsonProperty("rate_limit_qps")
    int rateLimitQps,

    SubscriptionStatus status,

    @JsonProperty("cost_weights")
    Map<String, Double> costWeights,

    PlanRouting routing,

    @JsonProperty("key_hash")
    String keyHash,

    @JsonProperty("key_prefix")
    String keyPrefix
) {
    public static final long UNLIMITED = -1;

    public SubscriptionContext {
        if (StringUtils.isBlank(subscriptionId)) {
            throw new IllegalArgumentException("Subscription id cannot be blank");
        }
        if (priorityScore < 0 || priorityScore > 100) {
            throw new IllegalArgumentException("Priority score must be between 0 and 100");
        }
        if (dailyQuotaLimit < UNLIMITED) {
            throw new IllegalArgumentException("Daily quota limit must be -1 (unlimited) or non-negative");
        }
        if (dailyQuotaLimit == UNLIMITED) {
            dailyQuotaRemaining = UNLIMITED;
        } else {
            // 剩餘量不得超過上限
            dailyQuotaRemaining = Math.max(0, Math.min(dailyQuotaRemaining, dailyQuotaLimit));
        }
        if (rateLimitQps < 0) {
            throw new IllegalArgumentException("Rate limit must be 0 (no limit) or positive");
        }
        if (status == null) {
            throw new IllegalArgumentException("Subscription status is required");
        }
        allowedBackends = allowedBackends == null ? List.of() : List.copyOf(allowedBackends);
        costWeights = costWeights == null ? Map.of() : Map.copyOf(costWeights);
        if (routing == null) {
            routing = PlanRouting.disabled();
        }
    }

    @JsonIgnore
    public boolean isUnlimited() {
        return dailyQuotaLimit == UNLIMITED;
    }

    public boolean hasRateLimit() {
        return rateLimitQps > 0;
    }

    /**
     * 取得方案對指定後端的成本權重，未設定時回傳預設值 10
     */
    public double costWeight(String backendName) {
        Double weight = costWeights.get(backendName);
        return weight != null ? weight : PlanWeighting.DEFAULT_COST_WEIGHT;
    }

    /**
     * 遮罩後的 API Key（僅顯示前 8 碼），用於用量紀錄
     */
    public String maskedKey() {
        return StringUtils.defaultString(keyPrefix) + "****";
    }
}
