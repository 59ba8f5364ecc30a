package com.flagship.finance_automation.homeassistant;

import com.flagship.finance_automation.config.FinanceProperties;
import com.flagship.finance_automation.observability.FinanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends human notifications by running the configured Home Assistant script.
 * Delivery is asynchronous and best effort.
 */
@Component
@Slf4j
public class Notifier {

    private final HomeAssistantClient client;
    private final ThreadPoolTaskExecutor publishExecutor;
    private final FinanceMetrics metrics;
    private final String notifyScript;

    public Notifier(HomeAssistantClient client,
                    @Qualifier("publishExecutor") ThreadPoolTaskExecutor publishExecutor,
                    FinanceMetrics metrics,
                    FinanceProperties properties) {
        this.client = client;
        this.publishExecutor = publishExecutor;
        this.metrics = metrics;
        this.notifyScript = properties.getHomeAssistant().getNotifyScript();
    }

    public void notify(String title, String message) {
        Notification notification = new Notification(title, message);
        log.info("Notification: title='{}', message='{}'", title, message);
        try {
            publishExecutor.execute(() -> send(notification));
        } catch (TaskRejectedException e) {
            metrics.recordPublishFailure("notification");
            log.warn("Notification queue full, dropping '{}'", title);
        }
    }

    void send(Notification notification) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("title", notification.getTitle());
        variables.put("message", notification.getMessage());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("entity_id", notifyScript);
        data.put("variables", variables);
        try {
            client.callService("script", "turn_on", data);
        } catch (RuntimeException e) {
            metrics.recordPublishFailure("notification");
            log.warn("Failed to send notification '{}': {}", notification.getTitle(), e.getMessage());
        }
    }
}
