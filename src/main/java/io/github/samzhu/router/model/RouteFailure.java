package io.github.samzhu.router.model;

/**
 * 路由終止原因
 *
 * <p>每種原因對應穩定的 HTTP 狀態碼與機器可讀的原因字串。
 */
public enum RouteFailure {
    UNAUTHORIZED(401, "unauthorized"),
    INVALID_REQUEST(400, "invalid_request"),
    QUOTA_EXCEEDED(429, "quota_exceeded"),
    RATE_LIMITED(429, "rate_limited"),
    NO_AVAILABLE_BACKENDS(503, "no_available_models"),
    ALL_BACKENDS_FAILED(503, "all_models_failed");

    private final int status;
    private final String reason;

    RouteFailure(int status, String reason) {
        this.status = status;
        this.reason = reason;
    }

    public int status() {
        return status;
    }

    public String reason() {
        return reason;
    }
}
