package io.github.samzhu.keeper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>GPU 實例上的 agent 以 <b>Structured Mode</b> ({@code application/cloudevents+json}) 回報活動。
 * 註冊 {@link CloudEventMessageConverter} 後，Spring Cloud Stream 會將：
 * <ul>
 *   <li>CloudEvent attributes (id, type, source, subject, time) → Message Headers</li>
 *   <li>CloudEvent data → Message Payload (自動反序列化為 POJO)</li>
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
