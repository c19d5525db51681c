package io.github.samzhu.router.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 後端成功回應
 *
 * @param statusCode   HTTP 狀態碼（2xx）
 * @param body         回應內容
 * @param latencyMs    呼叫延遲（毫秒）
 * @param tokensOutput 回應中的輸出 Token 數，未提供時為 null
 */
public record BackendResponse(
    int statusCode,
    JsonNode body,
    long latencyMs,
    Integer tokensOutput
) {}
