package io.github.samzhu.router.exception;

/**
 * 後端呼叫失敗（網路錯誤、逾時或非 2xx 回應）
 *
 * <p>由路由流程在本地處理（改用下一個候選後端），不會直接回傳給呼叫端。
 */
public class BackendCallException extends RuntimeException {

    private final String backend;
    private final Integer statusCode;
    private final boolean timeout;

    public BackendCallException(String backend, String message, Integer statusCode, boolean timeout, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.statusCode = statusCode;
        this.timeout = timeout;
    }

    public static BackendCallException status(String backend, int statusCode) {
        return new BackendCallException(backend, "Backend " + backend + " returned " + statusCode, statusCode, false, null);
    }

    public static BackendCallException timeout(String backend, int timeoutSeconds) {
        return new BackendCallException(backend,
            "Backend " + backend + " timed out after " + timeoutSeconds + "s", null, true, null);
    }

    public static BackendCallException io(String backend, Throwable cause) {
        return new BackendCallException(backend,
            "Backend " + backend + " unreachable: " + cause.getMessage(), null, false, cause);
    }

    public String getBackend() {
        return backend;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
