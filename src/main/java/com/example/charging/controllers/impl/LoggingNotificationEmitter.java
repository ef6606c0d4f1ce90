package com.example.charging.controllers.impl;

import com.example.charging.controllers.NotificationEmitter;
import com.example.charging.dto.QueueEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@ConditionalOnProperty(name = "notifications.webhook.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingNotificationEmitter implements NotificationEmitter {

    @Override
    public void emit(QueueEvent event) {
        log.info("Notification {} -> user={} resource={} payload={}",
                event.type(), event.userId(), event.resourceId(), event.payload());
    }
}
