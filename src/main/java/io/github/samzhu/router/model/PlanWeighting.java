package io.github.samzhu.router.model;

import org.apache.commons.lang3.StringUtils;

/**
 * 方案對單一後端的存取與成本權重
 *
 * <p>成本權重會乘入路由評分（權重越高越容易被選中），未設定時預設為 {@value #DEFAULT_COST_WEIGHT}。
 * {@code allowed = false} 的後端不會出現在訂閱的可用後端清單中。
 *
 * @param backendName 後端名稱
 * @param allowed     方案是否允許使用此後端
 * @param costWeight  成本權重
 */
public record PlanWeighting(
    String backendName,
    boolean allowed,
    double costWeight
) {
    public static final double DEFAULT_COST_WEIGHT = 10.0;

    public PlanWeighting {
        if (StringUtils.isBlank(backendName)) {
            throw new IllegalArgumentException("Backend name cannot be blank");
        }
        if (costWeight < 0) {
            throw new IllegalArgumentException("Cost weight cannot be negative: " + backendName);
        }
    }
}
