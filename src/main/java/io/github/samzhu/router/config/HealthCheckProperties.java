package io.github.samzhu.router.config;

import java.time.Duration;

import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 後端健康檢查配置屬性（{@code gateway.health-check}）
 *
 * @param enabled  是否啟用排程檢查（預設: true）
 * @param interval 檢查間隔（預設: 5m）
 * @param timeout  單次探測逾時（預設: 5s）
 * @param path     健康檢查路徑（預設: /health）
 */
@ConfigurationProperties(prefix = "gateway.health-check")
public record HealthCheckProperties(
    Boolean enabled,
    Duration interval,
    Duration timeout,
    String path
) {
    public HealthCheckProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (interval == null) {
            interval = Duration.ofMinutes(5);
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(5);
        }
        if (StringUtils.isBlank(path)) {
            path = "/health";
        }
    }
}
