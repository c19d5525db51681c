package io.github.samzhu.router.service;

import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cloud.function.cloudevent.CloudEventMessageBuilder;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.stereotype.Service;

import io.github.samzhu.router.model.UsageRecord;

/**
 * 用量事件發送服務
 *
 * <p>使用 CloudEvents v1.0 規範格式，透過 Spring Cloud Stream 發送用量紀錄到訊息佇列（RabbitMQ），
 * 由下游帳務系統彙總計費。發送在背景執行緒進行，不阻塞回應。
 *
 * <p>CloudEvents 屬性：
 * <ul>
 *   <li>{@code type}: io.github.samzhu.router.usage.v1</li>
 *   <li>{@code source}: /router/route</li>
 *   <li>{@code subject}: 訂閱識別碼</li>
 *   <li>{@code id}: 請求識別碼（無則產生 UUID）</li>
 * </ul>
 *
 * @see UsageRecord
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 */
@Service
public class UsageEventPublisher implements UsageSink {

    private static final Logger log = LoggerFactory.getLogger(UsageEventPublisher.class);

    static final String BINDING_NAME = "usageRecord-out-0";
    static final String EVENT_TYPE = "io.github.samzhu.router.usage.v1";
    static final URI EVENT_SOURCE = URI.create("/router/route");

    private final StreamBridge streamBridge;
    private final Executor asyncExecutor;

    public UsageEventPublisher(StreamBridge streamBridge, @Qualifier("routerAsyncExecutor") Executor asyncExecutor) {
        this.streamBridge = streamBridge;
        this.asyncExecutor = asyncExecutor;
        log.info("UsageEventPublisher initialized: bindingName={}", BINDING_NAME);
    }

    @Override
    public void publish(UsageRecord record) {
        try {
            asyncExecutor.execute(() -> send(record));
        } catch (RuntimeException e) {
            log.error("Usage record dropped: requestId={}, error={}", record.requestId(), e.getMessage(), e);
        }
    }

    /**
     * 以 Binary Mode 發送：CloudEvents 屬性放在 {@code ce-} headers，紀錄本身為 JSON body
     */
    void send(UsageRecord record) {
        try {
            String eventId = record.requestId() != null ? record.requestId() : UUID.randomUUID().toString();
            Instant time = record.eventTime() != null ? record.eventTime() : Instant.now();

            Message<UsageRecord> message = CloudEventMessageBuilder
                .withData(record)
                .setId(eventId)
                .setType(EVENT_TYPE)
                .setSource(EVENT_SOURCE)
                .setTime(OffsetDateTime.ofInstant(time, ZoneOffset.UTC))
                .setSubject(record.subscriptionId())
                .setDataContentType("application/json")
                .build();

            boolean sent = streamBridge.send(BINDING_NAME, message);

            if (sent) {
                log.debug("Usage record published: requestId={}, subscriptionId={}, backend={}, status={}, costUnits={}",
                    eventId, record.subscriptionId(), record.backend(), record.status(), record.costUnits());
            } else {
                log.warn("Failed to publish usage record: requestId={}", eventId);
            }
        } catch (Exception e) {
            // 發送失敗不影響路由結果
            String rootCause = e.getCause() != null ? e.getCause().getClass().getSimpleName() : "N/A";
            log.error("Error publishing usage record: type={}, message={}, rootCause={}, binding={}",
                e.getClass().getSimpleName(), e.getMessage(), rootCause, BINDING_NAME, e);
        }
    }
}
