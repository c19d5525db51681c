package io.github.samzhu.router.model;

import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 智慧路由模式
 *
 * <ul>
 *   <li>{@code AUTO} - 依任務複雜度動態分配</li>
 *   <li>{@code PERFORMANCE} - 品質優先</li>
 *   <li>{@code EFFICIENT} - 成本優先</li>
 *   <li>{@code LITE} - 僅使用免費或近乎免費的後端</li>
 * </ul>
 *
 * @see io.github.samzhu.router.service.ModeProfileSelector
 */
public enum RoutingMode {
    AUTO,
    PERFORMANCE,
    EFFICIENT,
    LITE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 解析模式名稱（不分大小寫），空白或未知名稱回傳 empty
     */
    public static Optional<RoutingMode> parse(String name) {
        if (StringUtils.isBlank(name)) {
            return Optional.empty();
        }
        for (RoutingMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static RoutingMode fromJson(String name) {
        return parse(name).orElse(null);
    }
}
