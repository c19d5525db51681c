package io.github.samzhu.router;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import io.github.samzhu.router.config.RouterProperties;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.store.BackendProfileStore;

import jakarta.annotation.PostConstruct;

/**
 * 應用程式啟動處理器
 *
 * <p>啟動時檢查路由部署設定，啟動完成後輸出路由表。檢查項目：
 * <ul>
 *   <li>互斥的 Profile（dev/prod、local/cloud）同時啟用</li>
 *   <li>雲端或正式環境使用 in-memory 共享快取（配額與速率無法跨實例共享）</li>
 *   <li>目錄中沒有任何可用後端（所有請求都會回 503）</li>
 * </ul>
 */
@Component
public class ApplicationStartup {

    private static final Logger log = LoggerFactory.getLogger(ApplicationStartup.class);

    private static final List<List<String>> EXCLUSIVE_PROFILES = List.of(
        List.of("dev", "prod"),
        List.of("local", "cloud"));
    private static final Set<String> SHARED_DEPLOYMENT_PROFILES = Set.of("cloud", "prod");

    private final Environment env;
    private final Optional<BuildProperties> buildProperties;
    private final RouterProperties routerProperties;
    private final BackendProfileStore backendProfileStore;

    public ApplicationStartup(
            Environment env,
            Optional<BuildProperties> buildProperties,
            RouterProperties routerProperties,
            BackendProfileStore backendProfileStore) {
        this.env = env;
        this.buildProperties = buildProperties;
        this.routerProperties = routerProperties;
        this.backendProfileStore = backendProfileStore;
    }

    @PostConstruct
    public void validateDeployment() {
        configurationWarnings().forEach(warning -> log.error("Router configuration problem: {}", warning));
    }

    /**
     * 收集部署設定問題，不中斷啟動
     */
    List<String> configurationWarnings() {
        List<String> activeProfiles = Arrays.asList(env.getActiveProfiles());
        List<String> warnings = new ArrayList<>();

        for (List<String> pair : EXCLUSIVE_PROFILES) {
            if (activeProfiles.containsAll(pair)) {
                warnings.add("profiles '" + pair.get(0) + "' and '" + pair.get(1) + "' must not be active together");
            }
        }

        if ("in-memory".equals(cacheType())) {
            activeProfiles.stream()
                .filter(SHARED_DEPLOYMENT_PROFILES::contains)
                .findFirst()
                .ifPresent(profile -> warnings.add(
                    "in-memory shared cache under profile '" + profile + "' does not share quota or rate limits"));
        }

        if (backendProfileStore.findAll().stream().noneMatch(BackendProfile::isAvailable)) {
            warnings.add("no active backend is available, every request will be rejected with 503");
        }
        return warnings;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        String baseUrl = "http://localhost:" + env.getProperty("server.port", "8080")
            + StringUtils.removeEnd(env.getProperty("server.servlet.context-path", ""), "/");
        String[] activeProfiles = env.getActiveProfiles();
        String version = buildProperties.map(BuildProperties::getVersion).orElse("N/A");

        log.info("""

            ----------------------------------------------------------
            \tRouter '{}' {} 啟動完成（Profile：{}）
            \t  Chat：   POST {}/v1/chat/completions
            \t  Health： GET  {}/actuator/health
            ----------------------------------------------------------
            \t共享快取：{}　配額時區：{}　預設逾時：{}
            \t評分權重：{}
            ----------------------------------------------------------
            {}----------------------------------------------------------""",
            env.getProperty("spring.application.name"),
            version,
            Arrays.toString(activeProfiles.length > 0 ? activeProfiles : env.getDefaultProfiles()),
            baseUrl,
            baseUrl,
            cacheType(),
            routerProperties.quotaZone(),
            routerProperties.defaultTimeout(),
            routerProperties.weights(),
            routingTable()
        );
    }

    String routingTable() {
        StringBuilder table = new StringBuilder();
        for (BackendProfile backend : backendProfileStore.findAll()) {
            table.append(String.format("\t%-10s %-9s capacity=%-3d cost=%-8s %s%n",
                backend.name(),
                backend.active() ? backend.health() : "INACTIVE",
                backend.capacityScore(),
                backend.costPerUnit(),
                backend.endpointUrl()));
        }
        return table.length() > 0 ? table.toString() : "\t（目錄中沒有後端）\n";
    }

    private String cacheType() {
        return env.getProperty("gateway.cache.type", "redis");
    }
}
