package com.flagship.finance_automation.autosave;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Kafka consumer for track-changed events.
 *
 * Offsets are acknowledged manually after processing. A message that cannot
 * be parsed is acknowledged and skipped; a processing failure is not
 * acknowledged, so the event is redelivered. Redelivery is safe because the
 * auto-save key is deterministic.
 */
@Component
@ConditionalOnProperty(name = "finance.auto-saver.kafka.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TrackEventConsumer {

    private final AutoSaveService autoSaveService;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    @KafkaListener(
        topics = "${finance.auto-saver.topic:media.track-changed}",
        groupId = "${spring.kafka.consumer.group-id:finance-automation}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        TrackChangedEvent event = parseEvent(record.value());
        if (event == null) {
            log.warn("Could not parse track event, acknowledging to skip: {}", record.value());
            ack.acknowledge();
            return;
        }

        try {
            autoSaveService.handle(event);
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Error processing track event {} at offset {}: {}",
                    event.getEventId(), record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private TrackChangedEvent parseEvent(String json) {
        try {
            TrackChangedEvent event = objectMapper.readValue(json, TrackChangedEvent.class);
            Set<ConstraintViolation<TrackChangedEvent>> violations = validator.validate(event);
            if (!violations.isEmpty()) {
                log.error("Invalid track event: {}", violations.iterator().next().getMessage());
                return null;
            }
            return event;
        } catch (Exception e) {
            log.error("Failed to parse track event: {}", e.getMessage());
            return null;
        }
    }
}
