package io.github.samzhu.router;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * LLM Router 應用程式入口
 *
 * <p>多租戶 LLM API 路由閘道，位於客戶端與多個上游模型供應商之間：
 * <ul>
 *   <li>API Key 解析與訂閱情境快取</li>
 *   <li>每日配額與每秒速率限制（跨實例原子扣減）</li>
 *   <li>依成本、延遲、容量、方案權重與訂閱優先權評分選擇後端</li>
 *   <li>任務複雜度分類、路由模式與 Session 延續</li>
 *   <li>後端失敗時依序改用其他候選</li>
 *   <li>用量紀錄（CloudEvents 格式發送到 RabbitMQ）</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class RouterApplication {

	public static void main(String[] args) {
		SpringApplication.run(RouterApplication.class, args);
	}

}
