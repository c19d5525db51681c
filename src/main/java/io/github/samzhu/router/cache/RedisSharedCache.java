package io.github.samzhu.router.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

/**
 * Redis 共享快取實作
 *
 * <p>配額扣減、配額歸還與速率視窗都以 Lua script 在 Redis 端原子執行，
 * 多個 Router 實例並發存取同一訂閱時不會出現「先讀後寫」競態：
 * <ul>
 *   <li>{@code scripts/quota_decrement.lua} - GET（不存在則以初始值 SET PX）→ 餘額足夠才 DECRBY</li>
 *   <li>{@code scripts/quota_release.lua} - key 仍存在時 INCRBY</li>
 *   <li>{@code scripts/rate_window.lua} - 以 Redis TIME 為時鐘的 sorted set 滑動視窗</li>
 *   <li>{@code scripts/float_increment.lua} - INCRBYFLOAT，首次建立時設定 TTL</li>
 * </ul>
 *
 * <p>一般 get/set 失敗時只記錄錯誤（視為快取未命中），原子計數操作失敗則向上拋出，
 * 避免在無法確認配額的情況下放行請求。
 */
public class RedisSharedCache implements SharedCache {

    private static final Logger log = LoggerFactory.getLogger(RedisSharedCache.class);

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> QUOTA_DECREMENT = script("scripts/quota_decrement.lua", List.class);
    private static final RedisScript<Long> QUOTA_RELEASE = script("scripts/quota_release.lua", Long.class);
    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> RATE_WINDOW = script("scripts/rate_window.lua", List.class);
    private static final RedisScript<String> FLOAT_INCREMENT = script("scripts/float_increment.lua", String.class);

    private final StringRedisTemplate redisTemplate;

    public RedisSharedCache(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            log.error("Redis get failed: key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            log.error("Redis set failed: key={}, error={}", key, e.getMessage());
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            log.error("Redis delete failed: key={}, error={}", key, e.getMessage());
        }
    }

    @Override
    public CounterResult decrementWithFloor(String key, long initialValue, long amount, Duration ttl) {
        List<?> result = redisTemplate.execute(QUOTA_DECREMENT, List.of(key),
            String.valueOf(initialValue), String.valueOf(amount), String.valueOf(ttl.toMillis()));
        return new CounterResult(toLong(result, 0) == 1, toLong(result, 1));
    }

    @Override
    public Optional<Long> incrementIfPresent(String key, long amount) {
        Long result = redisTemplate.execute(QUOTA_RELEASE, List.of(key), String.valueOf(amount));
        if (result == null || result < 0) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    @Override
    public WindowSlot acquireWindowSlot(String key, int limit, Duration window) {
        List<?> result = redisTemplate.execute(RATE_WINDOW, List.of(key),
            String.valueOf(limit), String.valueOf(window.toMillis()), UUID.randomUUID().toString());
        return new WindowSlot(toLong(result, 0) == 1, Math.max(0, toLong(result, 1)));
    }

    @Override
    public double incrementByFloat(String key, double delta, Duration ttl) {
        String result = redisTemplate.execute(FLOAT_INCREMENT, List.of(key),
            String.valueOf(delta), String.valueOf(ttl.toMillis()));
        return result != null ? Double.parseDouble(result) : delta;
    }

    private static long toLong(List<?> result, int index) {
        if (result == null || result.size() <= index) {
            throw new IllegalStateException("Unexpected Redis script result: " + result);
        }
        Object value = result.get(index);
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }

    private static <T> RedisScript<T> script(String path, Class<T> resultType) {
        DefaultRedisScript<T> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource(path)));
        script.setResultType(resultType);
        return script;
    }
}
