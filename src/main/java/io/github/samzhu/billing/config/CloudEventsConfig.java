package io.github.samzhu.billing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>對話管線在每次模型回應結束後，以 <b>Structured Mode</b>
 * ({@code application/cloudevents+json}) 發送用量回報事件。
 *
 * <p>此轉換器讓 Spring Cloud Stream 將事件拆解為：
 * <ul>
 *   <li>CloudEvent attributes (id, type, source, subject, time) → Message Headers</li>
 *   <li>CloudEvent data → Message Payload ({@code UsageReportData})</li>
 * </ul>
 *
 * <p>CloudEvent {@code id} 在重送時保持不變，因此可作為計費的冪等鍵。
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
