package io.github.samzhu.tokenmeter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>AI 功能服務（chat / refine / assess）可改以 CloudEvents 發布用量，
 * 不需同步呼叫記錄 API。發布端使用 <b>Structured Mode</b>
 * ({@code application/cloudevents+json})，由此轉換器將：
 * <ul>
 *   <li>CloudEvent attributes (id, type, source, subject, time) → Message Headers</li>
 *   <li>CloudEvent data → Message Payload（反序列化為 {@code TokenUsageMessage}）</li>
 * </ul>
 *
 * <p>需要 {@code cloudevents-json-jackson} 依賴，透過 ServiceLoader 提供 JSON 格式支援。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
