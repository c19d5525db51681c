package io.github.samzhu.router.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import io.github.samzhu.router.cache.InMemorySharedCache;
import io.github.samzhu.router.cache.RedisSharedCache;
import io.github.samzhu.router.cache.SharedCache;

/**
 * 共享快取配置
 *
 * <p>依 {@code gateway.cache.type} 選擇實作：
 * <ul>
 *   <li>{@code redis}（預設）- {@link RedisSharedCache}，多實例部署必須使用</li>
 *   <li>{@code in-memory} - {@link InMemorySharedCache}，僅適用單一實例（本地開發、測試）</li>
 * </ul>
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.cache", name = "type", havingValue = "redis", matchIfMissing = true)
    public SharedCache redisSharedCache(StringRedisTemplate redisTemplate) {
        log.info("Shared cache: redis");
        return new RedisSharedCache(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.cache", name = "type", havingValue = "in-memory")
    public SharedCache inMemorySharedCache(Clock clock) {
        log.warn("Shared cache: in-memory (single instance only, quota and rate limits are not shared)");
        return new InMemorySharedCache(clock);
    }
}
