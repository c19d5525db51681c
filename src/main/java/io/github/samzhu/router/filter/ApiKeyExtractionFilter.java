package io.github.samzhu.router.filter;

import java.util.UUID;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;

/**
 * 路由請求前置過濾器
 *
 * <p>從請求中取出路由所需的資訊並存入請求屬性：
 * <ul>
 *   <li>API Key：{@code Authorization: Bearer <key>} 或 {@code x-api-key}</li>
 *   <li>路由模式：{@code x-routing-mode} header 或 {@code mode} query 參數</li>
 *   <li>Session：{@code x-session-id} header 或 {@code session_id} query 參數</li>
 *   <li>請求識別碼：{@code x-request-id} header，未提供時產生 UUID</li>
 * </ul>
 *
 * <p>請求屬性：
 * <ul>
 *   <li>{@code router.apiKey} - 呼叫端 API Key</li>
 *   <li>{@code router.mode} - 指定的路由模式（可能不存在）</li>
 *   <li>{@code router.sessionId} - 對話識別碼（可能不存在）</li>
 *   <li>{@code router.requestId} - 請求唯一識別碼</li>
 * </ul>
 *
 * <p>此過濾器不做驗證，Key 是否有效由 {@link io.github.samzhu.router.service.CredentialResolver} 判斷。
 *
 * @see io.github.samzhu.router.config.RouterConfig
 */
@Component
public class ApiKeyExtractionFilter implements Function<ServerRequest, ServerRequest> {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyExtractionFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String API_KEY_HEADER = "x-api-key";
    private static final String MODE_HEADER = "x-routing-mode";
    private static final String SESSION_HEADER = "x-session-id";
    private static final String REQUEST_ID_HEADER = "x-request-id";

    public static final String API_KEY_ATTRIBUTE = "router.apiKey";
    public static final String MODE_ATTRIBUTE = "router.mode";
    public static final String SESSION_ID_ATTRIBUTE = "router.sessionId";
    public static final String REQUEST_ID_ATTRIBUTE = "router.requestId";

    @Override
    public ServerRequest apply(ServerRequest request) {
        String apiKey = extractApiKey(request);
        String mode = firstNonBlank(request.headers().firstHeader(MODE_HEADER), request.param("mode").orElse(null));
        String sessionId = firstNonBlank(request.headers().firstHeader(SESSION_HEADER),
            request.param("session_id").orElse(null));
        String requestId = StringUtils.defaultIfBlank(request.headers().firstHeader(REQUEST_ID_HEADER),
            UUID.randomUUID().toString());

        log.debug("Processing request: requestId={}, mode={}, sessionId={}, keyPresent={}",
            requestId, mode, sessionId, apiKey != null);

        ServerRequest.Builder builder = ServerRequest.from(request)
            .attribute(REQUEST_ID_ATTRIBUTE, requestId);
        if (apiKey != null) {
            builder.attribute(API_KEY_ATTRIBUTE, apiKey);
        }
        if (mode != null) {
            builder.attribute(MODE_ATTRIBUTE, mode);
        }
        if (sessionId != null) {
            builder.attribute(SESSION_ID_ATTRIBUTE, sessionId);
        }
        return builder.build();
    }

    private String extractApiKey(ServerRequest request) {
        String authorization = request.headers().firstHeader(HttpHeaders.AUTHORIZATION);
        if (StringUtils.startsWithIgnoreCase(authorization, BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (StringUtils.isNotEmpty(token)) {
                return token;
            }
        }
        return StringUtils.trimToNull(request.headers().firstHeader(API_KEY_HEADER));
    }

    private static String firstNonBlank(String first, String second) {
        if (StringUtils.isNotBlank(first)) {
            return first.trim();
        }
        return StringUtils.trimToNull(second);
    }
}
