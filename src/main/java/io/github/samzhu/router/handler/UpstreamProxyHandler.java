package io.github.samzhu.router.handler;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.samzhu.router.exception.BackendCallException;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.BackendResponse;

/**
 * 上游後端代理處理器
 *
 * <p>將 payload 以 JSON POST 到後端端點，並解析回應：
 * <ul>
 *   <li>2xx → {@link BackendResponse}，含延遲與輸出 Token 數（{@code tokens_output}、
 *       {@code usage.completion_tokens} 或 {@code usage.output_tokens}）</li>
 *   <li>非 2xx、網路錯誤、逾時 → {@link BackendCallException}</li>
 * </ul>
 *
 * <p>逾時有兩層：HTTP client 的 read timeout，以及外層 Resilience4j {@link TimeLimiter}
 * （逾時即取消，該次嘗試視為失敗）。兩者都使用後端設定的 {@code timeoutSeconds}。
 *
 * <p>每個後端一個 {@link RestClient}，皆由 Spring 自動配置的 {@code RestClient.Builder} 複製而來，
 * 保留 Tracing instrumentation（Trace Context 傳播、子 Span 建立）。
 */
@Component
public class UpstreamProxyHandler implements BackendClient {

    private static final Logger log = LoggerFactory.getLogger(UpstreamProxyHandler.class);

    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;
    private final Executor upstreamExecutor;
    private final Map<String, Upstream> upstreams = new ConcurrentHashMap<>();

    public UpstreamProxyHandler(
            RestClient.Builder restClientBuilder,
            ObjectMapper objectMapper,
            @Qualifier("upstreamExecutor") Executor upstreamExecutor) {
        this.restClientBuilder = restClientBuilder;
        this.objectMapper = objectMapper;
        this.upstreamExecutor = upstreamExecutor;
    }

    @Override
    public BackendResponse call(BackendProfile backend, JsonNode payload) {
        Upstream upstream = upstreams.compute(backend.name(), (name, existing) ->
            existing != null && existing.matches(backend) ? existing : Upstream.create(restClientBuilder, backend));

        long start = System.nanoTime();
        Callable<ResponseSnapshot> timed = TimeLimiter.decorateFutureSupplier(upstream.timeLimiter(),
            () -> CompletableFuture.supplyAsync(() -> exchange(upstream.restClient(), backend, payload), upstreamExecutor));

        ResponseSnapshot snapshot;
        try {
            snapshot = timed.call();
        } catch (TimeoutException e) {
            log.warn("Backend call timed out: backend={}, timeoutSeconds={}", backend.name(), backend.timeoutSeconds());
            throw BackendCallException.timeout(backend.name(), backend.timeoutSeconds());
        } catch (BackendCallException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Backend call interrupted: backend={}", backend.name());
            throw BackendCallException.io(backend.name(), e);
        } catch (Exception e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            if (cause instanceof BackendCallException backendFailure) {
                throw backendFailure;
            }
            throw BackendCallException.io(backend.name(), cause);
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;

        if (!snapshot.status().is2xxSuccessful()) {
            log.warn("Backend returned error: backend={}, status={}, latencyMs={}, body={}",
                backend.name(), snapshot.status().value(), latencyMs, StringUtils.abbreviate(snapshot.body(), 200));
            throw BackendCallException.status(backend.name(), snapshot.status().value());
        }

        JsonNode body = parseBody(snapshot.body());
        log.debug("Backend call completed: backend={}, status={}, latencyMs={}",
            backend.name(), snapshot.status().value(), latencyMs);
        return new BackendResponse(snapshot.status().value(), body, latencyMs, tokensOutput(body));
    }

    private ResponseSnapshot exchange(RestClient restClient, BackendProfile backend, JsonNode payload) {
        try {
            return restClient.post()
                .uri(backend.endpointUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload)
                .exchange((request, response) -> new ResponseSnapshot(
                    response.getStatusCode(),
                    new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8)));
        } catch (RestClientException e) {
            throw BackendCallException.io(backend.name(), e);
        }
    }

    private JsonNode parseBody(String body) {
        if (StringUtils.isBlank(body)) {
            return TextNode.valueOf("");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    static Integer tokensOutput(JsonNode body) {
        JsonNode direct = body.get("tokens_output");
        if (direct != null && direct.canConvertToInt()) {
            return direct.asInt();
        }
        JsonNode usage = body.path("usage");
        for (String field : new String[] {"completion_tokens", "output_tokens"}) {
            JsonNode value = usage.get(field);
            if (value != null && value.canConvertToInt()) {
                return value.asInt();
            }
        }
        return null;
    }

    private record ResponseSnapshot(HttpStatusCode status, String body) {}

    /**
     * 單一後端的 HTTP client 與 TimeLimiter；端點或逾時變更時重建
     */
    private record Upstream(String endpointUrl, int timeoutSeconds, RestClient restClient, TimeLimiter timeLimiter) {

        boolean matches(BackendProfile backend) {
            return endpointUrl.equals(backend.endpointUrl()) && timeoutSeconds == backend.timeoutSeconds();
        }

        static Upstream create(RestClient.Builder builder, BackendProfile backend) {
            Duration timeout = Duration.ofSeconds(backend.timeoutSeconds());
            HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
            JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
            requestFactory.setReadTimeout(timeout);

            RestClient restClient = builder.clone()
                .requestFactory(requestFactory)
                .build();
            TimeLimiter timeLimiter = TimeLimiter.of(backend.name(), TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
            return new Upstream(backend.endpointUrl(), backend.timeoutSeconds(), restClient, timeLimiter);
        }
    }
}
