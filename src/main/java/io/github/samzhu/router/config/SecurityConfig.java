package io.github.samzhu.router.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Spring Security 安全配置
 *
 * <p>Router 以 API Key 自行驗證呼叫端（見 {@link io.github.samzhu.router.service.CredentialResolver}），
 * Security filter chain 只負責端點白名單：
 * <ul>
 *   <li>無狀態 Session</li>
 *   <li>停用 CSRF（RESTful API 不需要）</li>
 *   <li>停用 form login 與 HTTP Basic</li>
 * </ul>
 *
 * <p>端點權限：
 * <ul>
 *   <li>{@code /v1/**} - 交給路由流程驗證 API Key</li>
 *   <li>{@code /actuator/**} - 公開存取（健康檢查、指標）</li>
 *   <li>其他端點 - 拒絕</li>
 * </ul>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        log.info("Configuring security: API key authentication handled by router");
        http
            // 停用 CSRF
            .csrf(csrf -> csrf.disable())
            // 無狀態 Session
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .formLogin(form -> form.disable())
            .httpBasic(basic -> basic.disable())
            // 端點權限配置
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/v1/**").permitAll()
                .requestMatchers("/actuator/**").permitAll()
                .anyRequest().denyAll()
            );

        return http.build();
    }
}
