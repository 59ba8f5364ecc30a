package com.flagship.finance_automation.autosave;

import com.flagship.finance_automation.transfer.dto.TransferRecordResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP webhook for trigger events, for sources that cannot publish to Kafka.
 */
@RestController
@RequestMapping("/api/triggers")
@RequiredArgsConstructor
@Slf4j
public class TriggerController {

    private final AutoSaveService autoSaveService;

    /**
     * @return the resulting ledger record, or 204 when the event saved nothing
     */
    @PostMapping("/track-changed")
    public ResponseEntity<TransferRecordResponse> trackChanged(@Valid @RequestBody TrackChangedEvent event) {
        log.info("Track changed: eventId={}, trackId={}", event.getEventId(), event.getTrackId());
        return autoSaveService.handle(event)
                .map(record -> ResponseEntity.ok(TransferRecordResponse.from(record)))
                .orElse(ResponseEntity.noContent().build());
    }
}
