package io.github.samzhu.router.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 框架層級錯誤回應格式
 *
 * <p>用於路由流程之外的錯誤（無法解析的 JSON、未預期例外），
 * 路由流程本身的失敗以 {@link RouteResult} 回應。
 *
 * <p>錯誤結構：
 * <pre>{@code
 * {
 *   "type": "error",
 *   "error": {
 *     "type": "invalid_request_error|api_error",
 *     "message": "錯誤描述"
 *   }
 * }
 * }</pre>
 *
 * @see io.github.samzhu.router.exception.GlobalExceptionHandler
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayError(
    String type,
    Error error
) {
    public record Error(
        String type,
        String message
    ) {}

    public static GatewayError invalidRequestError(String message) {
        return new GatewayError("error", new Error("invalid_request_error", message));
    }

    public static GatewayError apiError(String message) {
        return new GatewayError("error", new Error("api_error", message));
    }
}
