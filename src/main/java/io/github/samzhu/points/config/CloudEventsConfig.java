package io.github.samzhu.points.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>上游服務（文件、問卷、排程）可能以 <b>Structured Mode</b>
 * ({@code application/cloudevents+json}) 發送點數給予命令。註冊
 * {@link CloudEventMessageConverter} 後，Spring Cloud Stream 會把
 * CloudEvent attributes 轉為 Message Headers，data 反序列化為
 * {@link io.github.samzhu.points.dto.AwardCommand}。
 *
 * <p>輸出方向由 {@link io.github.samzhu.points.adapter.CloudEventEmitter} 以
 * Binary Mode 發送，attributes 放在 {@code ce-} 前綴的 headers。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    /**
     * 需要 {@code cloudevents-json-jackson}，透過 ServiceLoader 提供 JSON 格式支援。
     *
     * @return CloudEventMessageConverter 實例
     */
    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
