package io.github.samzhu.router.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.router.model.GatewayError;

/**
 * 全域異常處理器
 *
 * <p>掛在路由函式的 {@code onError}，將路由流程之外的例外轉換為 {@link GatewayError} 格式，
 * 不回傳堆疊資訊：
 * <ul>
 *   <li>{@code HttpMessageNotReadableException} - 400（請求內容不是合法 JSON）</li>
 *   <li>{@code IllegalArgumentException} - 400（請求參數不合法）</li>
 *   <li>{@code Exception} - 500（未預期錯誤，例如共享快取無法連線）</li>
 * </ul>
 *
 * @see GatewayError
 * @see io.github.samzhu.router.config.RouterConfig
 */
@Component
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    public ServerResponse handle(Throwable error, ServerRequest request) {
        if (error instanceof HttpMessageNotReadableException e) {
            return handleUnreadableBody(e);
        }
        if (error instanceof IllegalArgumentException e) {
            return handleIllegalArgument(e);
        }
        return handleGenericException(error, request);
    }

    /**
     * 處理無法解析的請求內容
     */
    private ServerResponse handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ServerResponse.status(HttpStatus.BAD_REQUEST)
            .contentType(MediaType.APPLICATION_JSON)
            .body(GatewayError.invalidRequestError("Request body must be a JSON object"));
    }

    /**
     * 處理不合法的請求參數
     */
    private ServerResponse handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return ServerResponse.status(HttpStatus.BAD_REQUEST)
            .contentType(MediaType.APPLICATION_JSON)
            .body(GatewayError.invalidRequestError("Invalid request"));
    }

    /**
     * 處理其他未預期異常
     */
    private ServerResponse handleGenericException(Throwable e, ServerRequest request) {
        log.error("Unexpected error: path={}, message={}", request.path(), e.getMessage(), e);
        return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .contentType(MediaType.APPLICATION_JSON)
            .body(GatewayError.apiError("Internal server error"));
    }
}
