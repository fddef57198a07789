package io.github.samzhu.points.adapter;

import java.net.URI;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageBuilder;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;

import io.github.samzhu.points.config.PointsProperties;
import io.github.samzhu.points.port.EventEmitter;

/**
 * 以 CloudEvents 格式透過 Spring Cloud Stream 發佈領域事件。
 *
 * <p>CloudEvent 屬性：
 * <ul>
 *   <li>{@code type} - {@code io.github.samzhu.points.<eventName>.v1}</li>
 *   <li>{@code source} - {@code points.events.source}</li>
 *   <li>{@code subject} - 事件內容中的 {@code user_id}</li>
 *   <li>{@code id} - 隨機 UUID</li>
 * </ul>
 *
 * <p>發佈失敗只記錄錯誤，不拋出。
 */
@Component
public class CloudEventEmitter implements EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(CloudEventEmitter.class);

    static final String TYPE_PREFIX = "io.github.samzhu.points.";
    static final String TYPE_SUFFIX = ".v1";

    private final StreamBridge streamBridge;
    private final PointsProperties.EventsConfig config;
    private final Clock clock;

    public CloudEventEmitter(StreamBridge streamBridge, PointsProperties properties, Clock clock) {
        this.streamBridge = streamBridge;
        this.config = properties.events();
        this.clock = clock;
    }

    @Override
    public void emit(String eventName, Map<String, Object> payload) {
        try {
            Object subject = payload.get("user_id");
            CloudEventMessageBuilder<Map<String, Object>> builder = CloudEventMessageBuilder.withData(payload)
                .setId(UUID.randomUUID().toString())
                .setSource(URI.create(config.source()))
                .setType(TYPE_PREFIX + eventName + TYPE_SUFFIX)
                .setTime(clock.instant().atOffset(ZoneOffset.UTC))
                .setDataContentType(MimeTypeUtils.APPLICATION_JSON_VALUE);
            if (subject != null) {
                builder.setSubject(subject.toString());
            }
            Message<Map<String, Object>> message = builder.build();

            boolean sent = streamBridge.send(config.binding(), message);
            if (sent) {
                log.debug("Event published: type={}, subject={}", eventName, subject);
            } else {
                log.error("Event not accepted by binding: binding={}, type={}, subject={}",
                    config.binding(), eventName, subject);
            }
        } catch (RuntimeException e) {
            log.error("Failed to publish event: type={}, payload={}, error={}",
                eventName, payload, e.getMessage(), e);
        }
    }
}
