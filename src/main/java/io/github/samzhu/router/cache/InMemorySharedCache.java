package io.github.samzhu.router.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * 單一實例用的記憶體共享快取
 *
 * <p>適用於本地開發與單機部署（{@code gateway.cache.type=in-memory}）。
 * 所有複合操作都在 {@link ConcurrentMap#compute} 內完成，同一 key 的並發呼叫會被序列化，
 * 與 Redis Lua script 提供相同的原子語意。多實例部署必須使用 {@link RedisSharedCache}。
 *
 * <p>過期項目除了在讀取時移除，也由 {@link #evictExpired()} 定期清除
 * （{@code gateway.cache.sweep-interval}，預設 60000 ms），避免已不再讀取的日期配額與 session 累積。
 */
public class InMemorySharedCache implements SharedCache {

    private static final Logger log = LoggerFactory.getLogger(InMemorySharedCache.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SlidingWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySharedCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(now())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, now() + ttl.toMillis()));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public CounterResult decrementWithFloor(String key, long initialValue, long amount, Duration ttl) {
        AtomicReference<CounterResult> result = new AtomicReference<>();
        long now = now();
        entries.compute(key, (k, entry) -> {
            Entry current = entry == null || entry.isExpired(now)
                ? new Entry(String.valueOf(initialValue), now + ttl.toMillis())
                : entry;
            long value = Long.parseLong(current.value());
            if (value < amount) {
                result.set(new CounterResult(false, value));
                return current;
            }
            long remaining = value - amount;
            result.set(new CounterResult(true, remaining));
            return new Entry(String.valueOf(remaining), current.expiresAt());
        });
        return result.get();
    }

    @Override
    public Optional<Long> incrementIfPresent(String key, long amount) {
        AtomicReference<Long> result = new AtomicReference<>();
        long now = now();
        entries.computeIfPresent(key, (k, entry) -> {
            if (entry.isExpired(now)) {
                return null;
            }
            long value = Long.parseLong(entry.value()) + amount;
            result.set(value);
            return new Entry(String.valueOf(value), entry.expiresAt());
        });
        return Optional.ofNullable(result.get());
    }

    @Override
    public WindowSlot acquireWindowSlot(String key, int limit, Duration window) {
        AtomicReference<WindowSlot> result = new AtomicReference<>();
        long now = now();
        long windowMs = window.toMillis();
        windows.compute(key, (k, existing) -> {
            SlidingWindow current = existing != null
                ? existing.withWindow(windowMs)
                : new SlidingWindow(new ArrayDeque<>(), windowMs);
            current.prune(now);
            Deque<Long> timestamps = current.timestamps();
            if (timestamps.size() < limit) {
                timestamps.addLast(now);
                result.set(new WindowSlot(true, 0));
            } else {
                long wait = timestamps.isEmpty() ? windowMs : timestamps.peekFirst() + windowMs - now;
                result.set(new WindowSlot(false, Math.max(0, wait)));
            }
            return current;
        });
        return result.get();
    }

    @Override
    public double incrementByFloat(String key, double delta, Duration ttl) {
        AtomicReference<Double> result = new AtomicReference<>();
        long now = now();
        entries.compute(key, (k, entry) -> {
            Entry current = entry == null || entry.isExpired(now)
                ? new Entry("0", now + ttl.toMillis())
                : entry;
            double value = Double.parseDouble(current.value()) + delta;
            result.set(value);
            return new Entry(String.valueOf(value), current.expiresAt());
        });
        return result.get();
    }

    /**
     * 移除已過期的項目與已無時間戳的速率視窗
     *
     * @return 移除的項目數量
     */
    @Scheduled(fixedDelayString = "${gateway.cache.sweep-interval:60000}")
    public int evictExpired() {
        long now = now();
        AtomicInteger removed = new AtomicInteger();
        for (String key : entries.keySet()) {
            entries.computeIfPresent(key, (k, entry) -> {
                if (entry.isExpired(now)) {
                    removed.incrementAndGet();
                    return null;
                }
                return entry;
            });
        }
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, window) -> {
                window.prune(now);
                if (window.timestamps().isEmpty()) {
                    removed.incrementAndGet();
                    return null;
                }
                return window;
            });
        }
        if (removed.get() > 0) {
            log.debug("Evicted expired cache entries: removed={}, remainingEntries={}, remainingWindows={}",
                removed.get(), entries.size(), windows.size());
        }
        return removed.get();
    }

    int size() {
        return entries.size() + windows.size();
    }

    private long now() {
        return clock.millis();
    }

    private record SlidingWindow(Deque<Long> timestamps, long windowMs) {
        SlidingWindow withWindow(long newWindowMs) {
            return newWindowMs == windowMs ? this : new SlidingWindow(timestamps, newWindowMs);
        }

        void prune(long now) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= now - windowMs) {
                timestamps.pollFirst();
            }
        }
    }

    private record Entry(String value, long expiresAt) {
        boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
