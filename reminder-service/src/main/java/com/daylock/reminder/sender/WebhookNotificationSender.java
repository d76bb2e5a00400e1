package com.daylock.reminder.sender;

import com.daylock.reminder.model.ReminderNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Posts reminder notifications to a push-gateway webhook as JSON.
 *
 * <p>When the webhook is disabled or no URL is configured the notification is logged
 * instead. Delivery is fire-and-forget; failures are logged and swallowed.
 */
@Component
public class WebhookNotificationSender implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSender.class);

    private final WebClient webClient;
    private final boolean webhookEnabled;
    private final String webhookUrl;

    public WebhookNotificationSender(WebClient.Builder builder,
                                     @Value("${notification.webhook.enabled:false}") boolean webhookEnabled,
                                     @Value("${notification.webhook.url:}") String webhookUrl) {
        this.webClient      = builder.build();
        this.webhookEnabled = webhookEnabled;
        this.webhookUrl     = webhookUrl == null ? "" : webhookUrl;
    }

    @Override
    public void send(ReminderNotification notification) {
        if (!webhookEnabled || webhookUrl.isBlank()) {
            log.info("Webhook disabled. Logging reminder instead. tag={} title=\"{}\" body=\"{}\"",
                     notification.tag(), notification.title(), notification.body());
            return;
        }

        webClient.post()
            .uri(webhookUrl)
            .bodyValue(notification)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Reminder notification sent. tag={} status={}", notification.tag(), r.getStatusCode()),
                err -> log.error("Reminder notification failed. tag={}", notification.tag(), err)
            );
    }
}
