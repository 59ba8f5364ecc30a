package com.flagship.finance_automation.homeassistant;

import com.flagship.finance_automation.observability.FinanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fire-and-forget publisher of state entities.
 *
 * Publishing runs on its own executor so a slow or unreachable Home Assistant
 * never blocks a poll. Failures are logged and counted, never propagated.
 */
@Component
@Slf4j
public class StatePublisher {

    private final HomeAssistantClient client;
    private final ThreadPoolTaskExecutor publishExecutor;
    private final FinanceMetrics metrics;

    public StatePublisher(HomeAssistantClient client,
                          @Qualifier("publishExecutor") ThreadPoolTaskExecutor publishExecutor,
                          FinanceMetrics metrics) {
        this.client = client;
        this.publishExecutor = publishExecutor;
        this.metrics = metrics;
    }

    public void publishAsync(StateUpdate update) {
        try {
            publishExecutor.execute(() -> publish(update));
        } catch (TaskRejectedException e) {
            metrics.recordPublishFailure("state");
            log.warn("State publish queue full, dropping update for {}", update.getEntityId());
        }
    }

    void publish(StateUpdate update) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("entity_id", update.getEntityId());
        data.put("value", update.getValue());
        data.put("attributes", update.getAttributes());
        try {
            client.callService("var", "set", data);
        } catch (RuntimeException e) {
            metrics.recordPublishFailure("state");
            log.warn("Failed to publish state {}: {}", update.getEntityId(), e.getMessage());
        }
    }
}
