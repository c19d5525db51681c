package io.github.samzhu.router.service;

import java.time.Duration;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * 路由指標
 *
 * <ul>
 *   <li>{@code router.requests} - 請求結果計數（tags: outcome, backend）</li>
 *   <li>{@code router.upstream.latency} - 後端呼叫延遲（tags: backend, outcome）</li>
 * </ul>
 */
@Component
public class RoutingMetrics {

    static final String NO_BACKEND = "none";

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOutcome(String outcome, String backend) {
        Counter.builder("router.requests")
            .description("Routed requests by outcome")
            .tag("outcome", outcome)
            .tag("backend", backend != null ? backend : NO_BACKEND)
            .register(registry)
            .increment();
    }

    public void recordUpstream(String backend, boolean success, long latencyMs) {
        Timer.builder("router.upstream.latency")
            .description("Upstream backend call latency")
            .tag("backend", backend)
            .tag("outcome", success ? "success" : "failure")
            .register(registry)
            .record(Duration.ofMillis(latencyMs));
    }
}
