package io.github.samzhu.router.service;

import java.net.http.HttpClient;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import io.github.samzhu.router.config.HealthCheckProperties;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.HealthState;
import io.github.samzhu.router.store.BackendProfileStore;
import io.github.samzhu.router.store.BackendStatistics;

/**
 * 後端健康檢查排程
 *
 * <p>定期（預設每 5 分鐘）對每個啟用中的後端發送 {@code GET {endpoint}/health}：
 * <ul>
 *   <li>200 → Up</li>
 *   <li>503 → Degraded</li>
 *   <li>其他狀態碼 → Down</li>
 *   <li>連線失敗 → 改探測端點本身，狀態碼 &lt; 500 為 Up，否則 Down；再失敗則為 Down</li>
 * </ul>
 *
 * <p>探測延遲會作為該後端的延遲樣本寫入統計。
 */
@Service
@ConditionalOnProperty(prefix = "gateway.health-check", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BackendHealthProbe {

    private static final Logger log = LoggerFactory.getLogger(BackendHealthProbe.class);

    private final BackendProfileStore backendProfileStore;
    private final BackendStatistics backendStatistics;
    private final HealthCheckProperties properties;
    private final RestClient restClient;

    public BackendHealthProbe(
            BackendProfileStore backendProfileStore,
            BackendStatistics backendStatistics,
            HealthCheckProperties properties,
            RestClient.Builder restClientBuilder) {
        this.backendProfileStore = backendProfileStore;
        this.backendStatistics = backendStatistics;
        this.properties = properties;

        HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(properties.timeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.timeout());
        this.restClient = restClientBuilder.clone()
            .requestFactory(requestFactory)
            .build();
    }

    @Scheduled(
        initialDelayString = "${gateway.health-check.initial-delay:PT30S}",
        fixedDelayString = "${gateway.health-check.interval:PT5M}")
    public void probeAll() {
        int up = 0;
        int degraded = 0;
        int down = 0;
        for (BackendProfile backend : backendProfileStore.findAll()) {
            if (!backend.active()) {
                continue;
            }
            HealthState state = probe(backend);
            if (state == HealthState.UP) {
                up++;
            } else if (state == HealthState.DEGRADED) {
                degraded++;
            } else {
                down++;
            }
        }
        log.info("Backend health check completed: up={}, degraded={}, down={}", up, degraded, down);
    }

    /**
     * 探測單一後端並寫入結果
     */
    public HealthState probe(BackendProfile backend) {
        long start = System.nanoTime();
        HealthState state;
        Long latencyMs;
        try {
            state = probeHealthEndpoint(backend);
            latencyMs = (System.nanoTime() - start) / 1_000_000;
        } catch (RuntimeException e) {
            log.debug("Health endpoint unreachable, probing base endpoint: backend={}, error={}",
                backend.name(), e.getMessage());
            try {
                int status = getStatus(backend.endpointUrl());
                state = status < 500 ? HealthState.UP : HealthState.DOWN;
                latencyMs = (System.nanoTime() - start) / 1_000_000;
            } catch (RuntimeException fallbackError) {
                state = HealthState.DOWN;
                latencyMs = null;
            }
        }

        if (state != backend.health()) {
            log.warn("Backend health changed: backend={}, from={}, to={}", backend.name(), backend.health(), state);
        }
        backendStatistics.recordHealth(backend.name(), state, latencyMs);
        return state;
    }

    private HealthState probeHealthEndpoint(BackendProfile backend) {
        int status = getStatus(StringUtils.removeEnd(backend.endpointUrl(), "/") + properties.path());
        if (status == 200) {
            return HealthState.UP;
        }
        if (status == 503) {
            return HealthState.DEGRADED;
        }
        return HealthState.DOWN;
    }

    private int getStatus(String url) {
        Integer status = restClient.get()
            .uri(url)
            .exchange((request, response) -> response.getStatusCode().value());
        return status != null ? status : 500;
    }
}
