package io.github.samzhu.router.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.core.task.support.ContextPropagatingTaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 可觀測性與執行緒池配置
 *
 * <p>配置 Tracing Context 傳播，確保追蹤資訊在非同步任務間的完整性：
 * <ul>
 *   <li>{@code upstreamExecutor} - 後端呼叫（外層由 TimeLimiter 限制逾時）</li>
 *   <li>{@code routerAsyncExecutor} - 用量紀錄發送、配額回寫、花費累計等背景工作</li>
 * </ul>
 *
 * <p>兩者都套用 {@link ContextPropagatingTaskDecorator}，背景工作的日誌仍帶有原請求的 traceId。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/actuator/tracing.html">Spring Boot Tracing</a>
 */
@Configuration
public class ObservabilityConfig {

    /**
     * Context 傳播 TaskDecorator
     */
    @Bean
    public TaskDecorator contextPropagatingTaskDecorator() {
        return new ContextPropagatingTaskDecorator();
    }

    @Bean
    public ThreadPoolTaskExecutor upstreamExecutor(TaskDecorator contextPropagatingTaskDecorator) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("upstream-");
        executor.setCorePoolSize(16);
        executor.setMaxPoolSize(200);
        executor.setQueueCapacity(0);
        executor.setTaskDecorator(contextPropagatingTaskDecorator);
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor routerAsyncExecutor(TaskDecorator contextPropagatingTaskDecorator) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("router-async-");
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(10_000);
        executor.setTaskDecorator(contextPropagatingTaskDecorator);
        executor.initialize();
        return executor;
    }
}
