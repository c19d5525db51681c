package io.github.samzhu.router.model;

/**
 * 後端模型健康狀態
 *
 * <ul>
 *   <li>{@code UP} - 正常</li>
 *   <li>{@code DEGRADED} - 降級：仍可路由，但評分會被大幅扣分</li>
 *   <li>{@code DOWN} - 停機：評分為 0，不列入候選</li>
 * </ul>
 */
public enum HealthState {
    UP,
    DEGRADED,
    DOWN
}
