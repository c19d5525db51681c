package io.github.samzhu.router.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 路由結果
 *
 * <p>成功時（200）包含後端回應與路由中繼資料；失敗時包含 {@code error}（機器可讀原因）與
 * {@code message}（簡短說明），不會包含堆疊資訊。
 *
 * <p>回應範例：
 * <pre>{@code
 * {
 *   "status": 200,
 *   "model": "DeepSeek",
 *   "response": { ... },
 *   "latency_ms": 812,
 *   "total_time_ms": 830,
 *   "cost_units": 1,
 *   "task_complexity": "simple",
 *   "smart_mode": "efficient",
 *   "mode_weights_applied": { "DeepSeek": 90.0, ... },
 *   "fallback": false
 * }
 * }</pre>
 *
 * @see RouteFailure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteResult(
    int status,

    String model,

    JsonNode response,

    @JsonProperty("latency_ms")
    Long latencyMs,

    @JsonProperty("total_time_ms")
    Long totalTimeMs,

    @JsonProperty("cost_units")
    Integer costUnits,

    @JsonProperty("task_complexity")
    TaskComplexity taskComplexity,

    @JsonProperty("smart_mode")
    RoutingMode smartMode,

    @JsonProperty("mode_weights_applied")
    Map<String, Double> modeWeightsApplied,

    Boolean fallback,

    @JsonProperty("session_affinity")
    Boolean sessionAffinity,

    @JsonProperty("request_id")
    String requestId,

    String error,

    String message,

    @JsonProperty("quota_remaining")
    Long quotaRemaining,

    @JsonProperty("retry_after_ms")
    Long retryAfterMs
) {
    public static RouteResult failure(RouteFailure failure, String message, String requestId) {
        return builder()
            .status(failure.status())
            .error(failure.reason())
            .message(message)
            .requestId(requestId)
            .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == 200;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int status = 200;
        private String model;
        private JsonNode response;
        private Long latencyMs;
        private Long totalTimeMs;
        private Integer costUnits;
        private TaskComplexity taskComplexity;
        private RoutingMode smartMode;
        private Map<String, Double> modeWeightsApplied;
        private Boolean fallback;
        private Boolean sessionAffinity;
        private String requestId;
        private String error;
        private String message;
        private Long quotaRemaining;
        private Long retryAfterMs;

        public Builder status(int status) {
            this.status = status;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder response(JsonNode response) {
            this.response = response;
            return this;
        }

        public Builder latencyMs(Long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder totalTimeMs(Long totalTimeMs) {
            this.totalTimeMs = totalTimeMs;
            return this;
        }

        public Builder costUnits(Integer costUnits) {
            this.costUnits = costUnits;
            return this;
        }

        public Builder taskComplexity(TaskComplexity taskComplexity) {
            this.taskComplexity = taskComplexity;
            return this;
        }

        public Builder smartMode(RoutingMode smartMode) {
            this.smartMode = smartMode;
            return this;
        }

        public Builder modeWeightsApplied(Map<String, Double> modeWeightsApplied) {
            this.modeWeightsApplied = modeWeightsApplied;
            return this;
        }

        public Builder fallback(Boolean fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder sessionAffinity(Boolean sessionAffinity) {
            this.sessionAffinity = sessionAffinity;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder quotaRemaining(Long quotaRemaining) {
            this.quotaRemaining = quotaRemaining;
            return this;
        }

        public Builder retryAfterMs(Long retryAfterMs) {
            this.retryAfterMs = retryAfterMs;
            return this;
        }

        public RouteResult build() {
            return new RouteResult(
                status, model, response, latencyMs, totalTimeMs, costUnits,
                taskComplexity, smartMode, modeWeightsApplied, fallback, sessionAffinity,
                requestId, error, message, quotaRemaining, retryAfterMs
            );
        }
    }
}
