package com.demo.network.service.notification;

import com.demo.network.config.NetworkProperties;
import com.demo.network.model.Notification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/** Posts notifications as JSON to the configured webhook. Without a URL it only logs. */
@Slf4j
@Component
public class WebhookNotificationSink implements NotificationSink {

    private final RestTemplate restTemplate;
    private final String webhookUrl;

    public WebhookNotificationSink(RestTemplate restTemplate, NetworkProperties properties) {
        this.restTemplate = restTemplate;
        this.webhookUrl = properties.getNotification().getWebhookUrl();
    }

    @Override
    public void send(Notification notification) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("Notification webhook not configured; {} '{}' for user {} not delivered",
                    notification.type(), notification.title(), notification.userId());
            return;
        }
        try {
            var req = RequestEntity
                    .post(URI.create(webhookUrl))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(notification);
            restTemplate.exchange(req, Void.class);
        } catch (Exception ex) {
            log.warn("Webhook delivery of {} to user {} failed: {}", notification.type(), notification.userId(), ex.toString());
        }
    }
}
