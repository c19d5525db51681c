package io.github.samzhu.router.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 路由請求
 *
 * @param apiKey    呼叫端出示的 API Key
 * @param payload   請求內容（messages、model 等，原樣轉發給後端）
 * @param mode      指定的路由模式名稱，可為 null
 * @param sessionId 對話識別碼，可為 null
 * @param requestId 請求唯一識別碼
 */
public record RouteRequest(
    String apiKey,
    JsonNode payload,
    String mode,
    String sessionId,
    String requestId
) {}
