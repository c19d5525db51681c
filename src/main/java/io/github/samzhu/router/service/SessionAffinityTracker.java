package io.github.samzhu.router.service;

import java.time.Duration;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.router.cache.SharedCache;
import io.github.samzhu.router.model.PlanRouting;
import io.github.samzhu.router.util.PromptSimilarity;

/**
 * Session 延續追蹤
 *
 * <p>同一對話中，若本次 Prompt 與上一則的相似度超過方案門檻（預設 0.7），沿用上次選中的後端。
 *
 * <p>快取 key 以訂閱隔離：
 * <ul>
 *   <li>{@code session:{subscription}:{session}:last_prompt} - 上一則 Prompt（每次請求都會更新）</li>
 *   <li>{@code session:{subscription}:{session}:model} - 上次成功呼叫的後端名稱</li>
 * </ul>
 *
 * <p>僅作為選擇偏好，不具權威性：快取中的後端若已不可用，呼叫端會改走評分流程。
 */
@Component
public class SessionAffinityTracker {

    private static final Logger log = LoggerFactory.getLogger(SessionAffinityTracker.class);

    private final SharedCache cache;

    public SessionAffinityTracker(SharedCache cache) {
        this.cache = cache;
    }

    /**
     * 判斷是否為同一對話的延續，並記錄本次 Prompt
     *
     * @return 應沿用的後端名稱；首次請求或相似度未超過門檻時為 empty
     */
    public Optional<String> pinnedBackend(String subscriptionId, String sessionId, String prompt,
                                          PlanRouting routing) {
        String promptKey = key(subscriptionId, sessionId, "last_prompt");
        Optional<String> lastPrompt = cache.get(promptKey);
        cache.set(promptKey, StringUtils.defaultString(prompt), ttl(routing));

        if (lastPrompt.isEmpty()) {
            return Optional.empty();
        }
        double similarity = PromptSimilarity.jaccard(prompt, lastPrompt.get());
        if (similarity <= routing.correlationThreshold()) {
            log.debug("Session topic changed: sessionId={}, similarity={}", sessionId, similarity);
            return Optional.empty();
        }

        Optional<String> backend = cache.get(key(subscriptionId, sessionId, "model"));
        backend.ifPresent(name -> log.debug("Session continuity: sessionId={}, backend={}, similarity={}",
            sessionId, name, similarity));
        return backend;
    }

    /**
     * 記錄本次對話使用的後端
     */
    public void remember(String subscriptionId, String sessionId, String backendName, PlanRouting routing) {
        cache.set(key(subscriptionId, sessionId, "model"), backendName, ttl(routing));
    }

    private static String key(String subscriptionId, String sessionId, String suffix) {
        return "session:" + subscriptionId + ":" + sessionId + ":" + suffix;
    }

    private static Duration ttl(PlanRouting routing) {
        return Duration.ofSeconds(routing.sessionTtlSeconds());
    }
}
