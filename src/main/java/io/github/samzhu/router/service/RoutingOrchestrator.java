package io.github.samzhu.router.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;

import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;

import io.github.samzhu.router.exception.BackendCallException;
import io.github.samzhu.router.handler.BackendClient;
import io.github.samzhu.router.model.AdmissionDecision;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.BackendResponse;
import io.github.samzhu.router.model.RouteFailure;
import io.github.samzhu.router.model.RouteRequest;
import io.github.samzhu.router.model.RouteResult;
import io.github.samzhu.router.model.RoutingMode;
import io.github.samzhu.router.model.ScoredBackend;
import io.github.samzhu.router.model.SubscriptionContext;
import io.github.samzhu.router.model.TaskComplexity;
import io.github.samzhu.router.model.UsageRecord;
import io.github.samzhu.router.store.BackendProfileStore;
import io.github.samzhu.router.store.BackendStatistics;
import io.github.samzhu.router.util.PromptExtractor;

/**
 * 路由主流程
 *
 * <p>每個請求依序經過：
 * <pre>
 * Resolving → Admitting → Classifying → Selecting → Calling → Succeeded
 *                                                      ↓ 失敗
 *                                                  Retrying → Calling（下一個候選）→ … → Failed
 * </pre>
 *
 * <ol>
 *   <li>解析 API Key，失敗 → 401 unauthorized</li>
 *   <li>驗證 payload（需有 messages 與 user 訊息），失敗 → 400 invalid_request</li>
 *   <li>准入檢查，失敗 → 429 quota_exceeded / rate_limited（記錄 rejected 用量，不呼叫後端）</li>
 *   <li>分類任務複雜度（方案啟用時），錯誤時視為 simple</li>
 *   <li>Session 延續：相似度超過門檻且快取後端仍可用 → 直接沿用，錯誤時略過</li>
 *   <li>否則套用模式權重、評分並選出最高分後端；沒有候選 → 503 no_available_models（歸還配額）</li>
 *   <li>呼叫後端；失敗時依方案順序逐一嘗試其他候選（每個後端最多一次），全部失敗 → 503 all_models_failed</li>
 * </ol>
 *
 * <p>只有最終結果會產生一筆用量紀錄，中途失敗的嘗試不另外記錄。
 * 跨請求狀態全部存放在共享快取，本類別不持有可變狀態。
 */
@Service
public class RoutingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RoutingOrchestrator.class);

    private final CredentialResolver credentialResolver;
    private final AdmissionController admissionController;
    private final TaskClassifier taskClassifier;
    private final ModeProfileSelector modeProfileSelector;
    private final SessionAffinityTracker sessionAffinityTracker;
    private final ModelScorer modelScorer;
    private final BackendProfileStore backendProfileStore;
    private final BackendStatistics backendStatistics;
    private final BackendClient backendClient;
    private final UsageSink usageSink;
    private final SpendTracker spendTracker;
    private final RoutingMetrics metrics;
    private final Tracer tracer;
    private final Clock clock;

    public RoutingOrchestrator(
            CredentialResolver credentialResolver,
            AdmissionController admissionController,
            TaskClassifier taskClassifier,
            ModeProfileSelector modeProfileSelector,
            SessionAffinityTracker sessionAffinityTracker,
            ModelScorer modelScorer,
            BackendProfileStore backendProfileStore,
            BackendStatistics backendStatistics,
            BackendClient backendClient,
            UsageSink usageSink,
            SpendTracker spendTracker,
            RoutingMetrics metrics,
            Tracer tracer,
            Clock clock) {
        this.credentialResolver = credentialResolver;
        this.admissionController = admissionController;
        this.taskClassifier = taskClassifier;
        this.modeProfileSelector = modeProfileSelector;
        this.sessionAffinityTracker = sessionAffinityTracker;
        this.modelScorer = modelScorer;
        this.backendProfileStore = backendProfileStore;
        this.backendStatistics = backendStatistics;
        this.backendClient = backendClient;
        this.usageSink = usageSink;
        this.spendTracker = spendTracker;
        this.metrics = metrics;
        this.tracer = tracer;
        this.clock = clock;
    }

    public RouteResult route(RouteRequest request) {
        long startNanos = System.nanoTime();
        String requestId = StringUtils.defaultIfBlank(request.requestId(), UUID.randomUUID().toString());
        JsonNode payload = request.payload();

        // === Resolving ===
        Optional<SubscriptionContext> resolved = credentialResolver.resolve(request.apiKey());
        if (resolved.isEmpty()) {
            log.warn("Unauthorized request: requestId={}", requestId);
            metrics.recordOutcome(RouteFailure.UNAUTHORIZED.reason(), null);
            return RouteResult.failure(RouteFailure.UNAUTHORIZED, "Invalid or expired API key", requestId);
        }
        SubscriptionContext context = resolved.get();

        String invalid = validatePayload(payload);
        if (invalid != null) {
            metrics.recordOutcome(RouteFailure.INVALID_REQUEST.reason(), null);
            return RouteResult.failure(RouteFailure.INVALID_REQUEST, invalid, requestId);
        }

        int costUnits = PromptExtractor.costUnits(payload);
        RoutingMode mode = modeProfileSelector.effectiveMode(request.mode(), context.routing());
        RequestTrace trace = new RequestTrace(requestId, context, costUnits, mode, currentTraceId());
        trace.tokensInput = PromptExtractor.tokensInput(payload);

        // === Admitting ===
        AdmissionDecision decision = admissionController.admit(context, costUnits);
        if (!decision.isAllowed()) {
            return reject(trace, decision);
        }

        // === Classifying ===
        String prompt = PromptExtractor.lastUserPrompt(payload);
        trace.complexity = classify(context, prompt, PromptExtractor.approxTokens(payload));

        // === Selecting ===
        List<BackendProfile> candidates = candidates(context);
        if (candidates.isEmpty()) {
            admissionController.release(context, costUnits);
            log.warn("No available backends: requestId={}, subscriptionId={}, allowedBackends={}",
                requestId, context.subscriptionId(), context.allowedBackends());
            metrics.recordOutcome(RouteFailure.NO_AVAILABLE_BACKENDS.reason(), null);
            return RouteResult.failure(RouteFailure.NO_AVAILABLE_BACKENDS,
                "All models are down or unavailable", requestId);
        }

        BackendProfile primary = pinnedCandidate(context, request.sessionId(), prompt, candidates).orElse(null);
        Map<String, Double> modeWeights = null;
        if (primary != null) {
            trace.sessionAffinity = true;
        } else {
            modeWeights = mode != null ? modeProfileSelector.modeWeights(mode, trace.complexity) : null;
            Map<String, Double> costWeights = modeProfileSelector.merge(context,
                modeWeights != null ? modeWeights : Map.of());
            List<ScoredBackend> ranked = modelScorer.rank(candidates, context.priorityScore(), costWeights);
            primary = ranked.get(0).backend();
            log.debug("Backend selected: requestId={}, backend={}, score={}, mode={}, complexity={}",
                requestId, primary.name(), ranked.get(0).score(), mode, trace.complexity.value());
        }

        // === Calling ===
        BackendCallException lastFailure;
        try {
            BackendResponse response = backendClient.call(primary, payload);
            return succeed(trace, request, primary, response, false, modeWeights, startNanos);
        } catch (BackendCallException e) {
            lastFailure = e;
            recordFailure(trace, primary, e);
        }

        // === Retrying ===
        for (BackendProfile fallback : candidates) {
            if (fallback.name().equals(primary.name())) {
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Fallback abandoned, request thread interrupted: requestId={}, lastBackend={}",
                    requestId, lastFailure.getBackend());
                break;
            }
            try {
                BackendResponse response = backendClient.call(fallback, payload);
                log.info("Fallback succeeded: requestId={}, primary={}, fallback={}",
                    requestId, primary.name(), fallback.name());
                return succeed(trace, request, fallback, response, true, modeWeights, startNanos);
            } catch (BackendCallException e) {
                lastFailure = e;
                recordFailure(trace, fallback, e);
            }
        }

        // === Failed ===
        log.error("All backends failed: requestId={}, subscriptionId={}, primary={}, lastError={}",
            requestId, context.subscriptionId(), primary.name(), lastFailure.getMessage());
        usageSink.publish(usage(trace)
            .backend(primary.name())
            .status(UsageRecord.STATUS_FAILED)
            .errorMessage(lastFailure.getMessage())
            .build());
        metrics.recordOutcome(RouteFailure.ALL_BACKENDS_FAILED.reason(), primary.name());
        return RouteResult.failure(RouteFailure.ALL_BACKENDS_FAILED, lastFailure.getMessage(), requestId);
    }

    private String validatePayload(JsonNode payload) {
        JsonNode messages = payload == null ? null : payload.get("messages");
        if (messages == null || !messages.isArray() || messages.isEmpty()) {
            return "No messages provided";
        }
        if (!PromptExtractor.hasUserMessage(payload)) {
            return "No user message found";
        }
        return null;
    }

    private RouteResult reject(RequestTrace trace, AdmissionDecision decision) {
        RouteFailure failure = decision.outcome() == AdmissionDecision.Outcome.QUOTA_EXCEEDED
            ? RouteFailure.QUOTA_EXCEEDED
            : RouteFailure.RATE_LIMITED;

        usageSink.publish(usage(trace)
            .costUnits(0)
            .status(UsageRecord.STATUS_REJECTED)
            .errorMessage(failure.reason())
            .build());
        metrics.recordOutcome(failure.reason(), null);

        RouteResult.Builder result = RouteResult.builder()
            .status(failure.status())
            .error(failure.reason())
            .requestId(trace.requestId);
        if (failure == RouteFailure.QUOTA_EXCEEDED) {
            result.message("Daily quota exhausted")
                .quotaRemaining(decision.quotaRemaining());
        } else {
            result.message("Rate limit of " + trace.context.rateLimitQps() + " requests per second exceeded")
                .retryAfterMs(decision.retryAfterMs());
        }
        return result.build();
    }

    private TaskComplexity classify(SubscriptionContext context, String prompt, int approxTokens) {
        if (!context.routing().complexityDetectionEnabled()) {
            return TaskComplexity.SIMPLE;
        }
        try {
            return taskClassifier.classify(prompt, approxTokens);
        } catch (RuntimeException e) {
            log.warn("Task classification failed, using simple: subscriptionId={}, error={}",
                context.subscriptionId(), e.getMessage());
            return TaskComplexity.SIMPLE;
        }
    }

    /**
     * 方案允許、啟用且非 Down 的後端，保留方案設定順序
     */
    private List<BackendProfile> candidates(SubscriptionContext context) {
        List<BackendProfile> candidates = new ArrayList<>();
        for (String name : context.allowedBackends()) {
            backendProfileStore.findByName(name)
                .filter(BackendProfile::isAvailable)
                .ifPresent(candidates::add);
        }
        return candidates;
    }

    private Optional<BackendProfile> pinnedCandidate(SubscriptionContext context, String sessionId, String prompt,
                                                     List<BackendProfile> candidates) {
        if (StringUtils.isBlank(sessionId) || !context.routing().sessionAffinityEnabled()) {
            return Optional.empty();
        }
        try {
            Optional<String> pinned = sessionAffinityTracker.pinnedBackend(
                context.subscriptionId(), sessionId, prompt, context.routing());
            if (pinned.isEmpty()) {
                return Optional.empty();
            }
            return candidates.stream()
                .filter(candidate -> candidate.name().equals(pinned.get()))
                .findFirst();
        } catch (RuntimeException e) {
            log.warn("Session affinity lookup failed, scoring instead: sessionId={}, error={}",
                sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private RouteResult succeed(RequestTrace trace, RouteRequest request, BackendProfile backend,
                                BackendResponse response, boolean fallback, Map<String, Double> modeWeights,
                                long startNanos) {
        SubscriptionContext context = trace.context;
        backendStatistics.recordSuccess(backend.name(), response.latencyMs());
        metrics.recordUpstream(backend.name(), true, response.latencyMs());

        if (StringUtils.isNotBlank(request.sessionId()) && context.routing().sessionAffinityEnabled()) {
            try {
                sessionAffinityTracker.remember(context.subscriptionId(), request.sessionId(), backend.name(),
                    context.routing());
            } catch (RuntimeException e) {
                log.warn("Failed to remember session backend: sessionId={}, error={}",
                    request.sessionId(), e.getMessage());
            }
        }

        spendTracker.record(context, backend, trace.costUnits);
        usageSink.publish(usage(trace)
            .backend(backend.name())
            .tokensOutput(response.tokensOutput())
            .latencyMs(response.latencyMs())
            .fallback(fallback)
            .build());
        metrics.recordOutcome(fallback ? "fallback" : "success", backend.name());

        long totalTimeMs = (System.nanoTime() - startNanos) / 1_000_000;
        log.info("Request routed: requestId={}, subscriptionId={}, backend={}, fallback={}, sessionAffinity={}, latencyMs={}, totalTimeMs={}",
            trace.requestId, context.subscriptionId(), backend.name(), fallback, trace.sessionAffinity,
            response.latencyMs(), totalTimeMs);

        return RouteResult.builder()
            .model(backend.name())
            .response(response.body())
            .latencyMs(response.latencyMs())
            .totalTimeMs(totalTimeMs)
            .costUnits(trace.costUnits)
            .taskComplexity(trace.complexity)
            .smartMode(trace.mode)
            .modeWeightsApplied(modeWeights)
            .fallback(fallback)
            .sessionAffinity(trace.sessionAffinity)
            .requestId(trace.requestId)
            .build();
    }

    private void recordFailure(RequestTrace trace, BackendProfile backend, BackendCallException e) {
        log.warn("Backend call failed: requestId={}, backend={}, timeout={}, status={}, error={}",
            trace.requestId, backend.name(), e.isTimeout(), e.getStatusCode(), e.getMessage());
        backendStatistics.recordFailure(backend.name());
        metrics.recordUpstream(backend.name(), false, 0);
    }

    private UsageRecord.Builder usage(RequestTrace trace) {
        SubscriptionContext context = trace.context;
        return UsageRecord.builder()
            .requestId(trace.requestId)
            .subscriptionId(context.subscriptionId())
            .customerId(context.customerId())
            .apiKey(context.maskedKey())
            .costUnits(trace.costUnits)
            .tokensInput(trace.tokensInput)
            .status(UsageRecord.STATUS_SUCCESS)
            .priorityScore(context.priorityScore())
            .taskComplexity(trace.complexity != null ? trace.complexity.value() : null)
            .mode(trace.mode != null ? trace.mode.value() : null)
            .traceId(trace.traceId)
            .eventTime(clock.instant());
    }

    private String currentTraceId() {
        Span span = tracer.currentSpan();
        if (span == null) {
            return null;
        }
        return StringUtils.defaultIfBlank(span.context().traceId(), null);
    }

    /**
     * 單一請求在流程中累積的資訊
     */
    private static final class RequestTrace {
        private final String requestId;
        private final SubscriptionContext context;
        private final int costUnits;
        private final RoutingMode mode;
        private final String traceId;
        private Integer tokensInput;
        private TaskComplexity complexity;
        private boolean sessionAffinity;

        private RequestTrace(String requestId, SubscriptionContext context, int costUnits, RoutingMode mode,
                             String traceId) {
            this.requestId = requestId;
            this.context = context;
            this.costUnits = costUnits;
            this.mode = mode;
            this.traceId = traceId;
        }
    }
}
