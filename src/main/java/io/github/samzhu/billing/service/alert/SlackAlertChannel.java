package io.github.samzhu.billing.service.alert;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import io.github.samzhu.billing.config.BillingProperties;

/**
 * Slack Incoming Webhook 告警通道。
 *
 * <p>只有設定 {@code billing.alerts.slack-webhook-url} 時才會建立。
 *
 * @see <a href="https://api.slack.com/messaging/webhooks">Slack Incoming Webhooks</a>
 */
@Component
@ConditionalOnProperty(prefix = "billing.alerts", name = "slack-webhook-url")
public class SlackAlertChannel implements AlertChannel {

    private static final Logger log = LoggerFactory.getLogger(SlackAlertChannel.class);

    private final RestClient restClient;
    private final String webhookUrl;

    public SlackAlertChannel(BillingProperties properties, RestClient.Builder restClientBuilder) {
        this.webhookUrl = properties.alerts().slackWebhookUrl();
        this.restClient = restClientBuilder.build();
    }

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public boolean external() {
        return true;
    }

    @Override
    public void send(String title, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", "*" + title + "*\n" + message);
        payload.put("username", "Pricing Bot");
        payload.put("icon_emoji", ":chart_with_upwards_trend:");
        payload.put("mrkdwn", true);

        restClient.post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .body(payload)
            .retrieve()
            .toBodilessEntity();
        log.debug("Slack alert sent: title={}", title);
    }
}
