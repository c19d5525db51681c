package io.github.samzhu.router.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 用量紀錄（CloudEvents data payload）
 *
 * <p>每次完成或失敗的路由呼叫產生一筆，交給用量日誌接收端後不再讀回。
 * <b>Router 只記錄原始數據，計費與月結由下游帳務系統處理。</b>
 *
 * <p>狀態值：
 * <ul>
 *   <li>{@code success} - 後端呼叫成功（含備援成功）</li>
 *   <li>{@code failed} - 所有候選後端皆失敗</li>
 *   <li>{@code rejected} - 被配額或速率限制拒絕，未呼叫後端，{@code cost_units} 為 0</li>
 * </ul>
 *
 * <p>欄位說明：
 * <ul>
 *   <li><b>歸屬</b>：{@code subscription_id}、{@code customer_id}、{@code api_key}（僅前 8 碼）</li>
 *   <li><b>用量</b>：{@code backend}、{@code cost_units}、{@code tokens_input}、{@code tokens_output}</li>
 *   <li><b>結果</b>：{@code status}、{@code latency_ms}、{@code error_message}、{@code fallback}</li>
 *   <li><b>路由</b>：{@code priority_score}、{@code task_complexity}、{@code mode}</li>
 *   <li><b>運維</b>：{@code request_id}、{@code trace_id}</li>
 * </ul>
 *
 * @see io.github.samzhu.router.service.UsageEventPublisher
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UsageRecord(
    // === 歸屬 ===
    @JsonProperty("request_id")
    String requestId,

    @JsonProperty("subscription_id")
    String subscriptionId,

    @JsonProperty("customer_id")
    String customerId,

    @JsonProperty("api_key")
    String apiKey,

    // === 用量 ===
    String backend,

    @JsonProperty("cost_units")
    int costUnits,

    @JsonProperty("tokens_input")
    Integer tokensInput,

    @JsonProperty("tokens_output")
    Integer tokensOutput,

    // === 結果 ===
    String status,

    @JsonProperty("latency_ms")
    Long latencyMs,

    @JsonProperty("error_message")
    String errorMessage,

    boolean fallback,

    // === 路由 ===
    @JsonProperty("priority_score")
    int priorityScore,

    @JsonProperty("task_complexity")
    String taskComplexity,

    String mode,

    // === 運維 ===
    @JsonProperty("trace_id")
    String traceId,

    @JsonProperty("event_time")
    Instant eventTime
) {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_REJECTED = "rejected";

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String requestId;
        private String subscriptionId;
        private String customerId;
        private String apiKey;
        private String backend;
        private int costUnits;
        private Integer tokensInput;
        private Integer tokensOutput;
        private String status = STATUS_SUCCESS;
        private Long latencyMs;
        private String errorMessage;
        private boolean fallback;
        private int priorityScore;
        private String taskComplexity;
        private String mode;
        private String traceId;
        private Instant eventTime;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder subscriptionId(String subscriptionId) {
            this.subscriptionId = subscriptionId;
            return this;
        }

        public Builder customerId(String customerId) {
            this.customerId = customerId;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder backend(String backend) {
            this.backend = backend;
            return this;
        }

        public Builder costUnits(int costUnits) {
            this.costUnits = costUnits;
            return this;
        }

        public Builder tokensInput(Integer tokensInput) {
            this.tokensInput = tokensInput;
            return this;
        }

        public Builder tokensOutput(Integer tokensOutput) {
            this.tokensOutput = tokensOutput;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder latencyMs(Long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder fallback(boolean fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder priorityScore(int priorityScore) {
            this.priorityScore = priorityScore;
            return this;
        }

        public Builder taskComplexity(String taskComplexity) {
            this.taskComplexity = taskComplexity;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder eventTime(Instant eventTime) {
            this.eventTime = eventTime;
            return this;
        }

        public UsageRecord build() {
            return new UsageRecord(
                requestId, subscriptionId, customerId, apiKey,
                backend, costUnits, tokensInput, tokensOutput,
                status, latencyMs, errorMessage, fallback,
                priorityScore, taskComplexity, mode,
                traceId, eventTime
            );
        }
    }
}
