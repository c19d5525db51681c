package io.github.samzhu.router.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.router.exception.GlobalExceptionHandler;
import io.github.samzhu.router.filter.ApiKeyExtractionFilter;
import io.github.samzhu.router.model.RouteRequest;
import io.github.samzhu.router.model.RouteResult;
import io.github.samzhu.router.service.RoutingOrchestrator;

/**
 * 路由端點配置
 *
 * <p>{@code POST /v1/chat/completions} 處理流程：
 * <ol>
 *   <li>{@link ApiKeyExtractionFilter} 取出 API Key、模式、Session 與請求識別碼</li>
 *   <li>讀取 JSON payload</li>
 *   <li>交給 {@link RoutingOrchestrator} 執行解析、准入、選擇與呼叫</li>
 *   <li>HTTP 狀態碼即路由結果的 {@code status}；速率限制時附上 {@code Retry-After}（秒）</li>
 * </ol>
 *
 * <p>無法解析的 JSON 與未預期例外由 {@link GlobalExceptionHandler} 處理。
 */
@Configuration
public class RouterConfig {

    private static final Logger log = LoggerFactory.getLogger(RouterConfig.class);
    private static final String REQUEST_ID_HEADER = "x-request-id";

    private final RoutingOrchestrator routingOrchestrator;
    private final ApiKeyExtractionFilter apiKeyExtractionFilter;
    private final GlobalExceptionHandler globalExceptionHandler;

    public RouterConfig(
            RoutingOrchestrator routingOrchestrator,
            ApiKeyExtractionFilter apiKeyExtractionFilter,
            GlobalExceptionHandler globalExceptionHandler) {
        this.routingOrchestrator = routingOrchestrator;
        this.apiKeyExtractionFilter = apiKeyExtractionFilter;
        this.globalExceptionHandler = globalExceptionHandler;
    }

    @Bean
    public RouterFunction<ServerResponse> chatCompletionsRoute() {
        return RouterFunctions.route()
            .POST("/v1/chat/completions", this::handleChatCompletions)
            .before(apiKeyExtractionFilter)
            .onError(Throwable.class, globalExceptionHandler::handle)
            .build();
    }

    /**
     * 處理 /v1/chat/completions 請求
     */
    private ServerResponse handleChatCompletions(ServerRequest request) throws Exception {
        JsonNode payload = request.body(JsonNode.class);

        RouteRequest routeRequest = new RouteRequest(
            attribute(request, ApiKeyExtractionFilter.API_KEY_ATTRIBUTE),
            payload,
            attribute(request, ApiKeyExtractionFilter.MODE_ATTRIBUTE),
            attribute(request, ApiKeyExtractionFilter.SESSION_ID_ATTRIBUTE),
            attribute(request, ApiKeyExtractionFilter.REQUEST_ID_ATTRIBUTE));

        RouteResult result = routingOrchestrator.route(routeRequest);
        log.debug("Route finished: requestId={}, status={}, model={}, error={}",
            result.requestId(), result.status(), result.model(), result.error());

        ServerResponse.BodyBuilder response = ServerResponse.status(result.status())
            .contentType(MediaType.APPLICATION_JSON);
        if (result.requestId() != null) {
            response.header(REQUEST_ID_HEADER, result.requestId());
        }
        if (result.retryAfterMs() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(result.retryAfterMs())));
        }
        return response.body(result);
    }

    static long retryAfterSeconds(long retryAfterMs) {
        return Math.max(1, (retryAfterMs + 999) / 1000);
    }

    private static String attribute(ServerRequest request, String name) {
        return request.attribute(name).map(Object::toString).orElse(null);
    }
}
