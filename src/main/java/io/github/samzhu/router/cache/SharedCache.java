package io.github.samzhu.router.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * 跨實例共享快取
 *
 * <p>多個 Router 實例同時存取同一份快取，因此所有「檢查後扣減」操作都必須是單一原子操作，
 * 不能在應用程式端先讀後寫。
 *
 * <ul>
 *   <li>{@link #decrementWithFloor} - 配額計數器：不存在時以初始值建立，餘額足夠才扣減</li>
 *   <li>{@link #acquireWindowSlot} - 速率限制：滑動視窗內請求數未達上限才登記</li>
 * </ul>
 *
 * @see RedisSharedCache
 * @see InMemorySharedCache
 */
public interface SharedCache {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * 原子扣減計數器，結果不會低於 0
     *
     * @param key          計數器 key
     * @param initialValue key 不存在時的初始值
     * @param amount       扣減量
     * @param ttl          建立 key 時設定的存活時間
     * @return 扣減結果
     */
    CounterResult decrementWithFloor(String key, long initialValue, long amount, Duration ttl);

    /**
     * 歸還先前扣減的量；key 已過期時不做任何事
     *
     * @return 歸還後的餘額，key 不存在時為 empty
     */
    Optional<Long> incrementIfPresent(String key, long amount);

    /**
     * 在滑動視窗內原子取得一個名額
     *
     * @param key    視窗 key
     * @param limit  視窗內允許的請求數
     * @param window 視窗長度
     * @return 取得結果
     */
    WindowSlot acquireWindowSlot(String key, int limit, Duration window);

    /**
     * 累加浮點數值，key 不存在時從 0 開始並設定存活時間
     *
     * @return 累加後的值
     */
    double incrementByFloat(String key, double delta, Duration ttl);
}
