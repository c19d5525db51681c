package io.github.samzhu.router.handler;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.router.exception.BackendCallException;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.BackendResponse;

/**
 * 上游後端呼叫介面
 */
public interface BackendClient {

    /**
     * 將 payload 原樣送往後端，受後端設定的逾時限制
     *
     * @throws BackendCallException 網路錯誤、逾時或非 2xx 回應
     */
    BackendResponse call(BackendProfile backend, JsonNode payload);
}
