package com.example.charging.controllers.impl;

import com.example.charging.controllers.NotificationEmitter;
import com.example.charging.dto.QueueEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Slf4j
@Service
@ConditionalOnProperty(name = "notifications.webhook.enabled", havingValue = "true")
public class WebhookNotificationEmitter implements NotificationEmitter {

    private final WebClient client;

    public WebhookNotificationEmitter(WebClient.Builder builder,
                                      @Value("${notifications.webhook.base-url}") String baseUrl) {
        this.client = builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public void emit(QueueEvent event) {
        try {
            client.post()
                    .uri("/events")
                    .bodyValue(event)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(Duration.ofSeconds(10))
                    .subscribe(
                            ok -> log.debug("Delivered {} for user {} on resource {}", event.type(), event.userId(), event.resourceId()),
                            err -> log.warn("Delivery of {} for user {} failed: {}", event.type(), event.userId(), err.toString())
                    );
        } catch (Exception e) {
            log.warn("Push of {} to webhook failed: {}", event.type(), e.toString());
        }
    }
}
