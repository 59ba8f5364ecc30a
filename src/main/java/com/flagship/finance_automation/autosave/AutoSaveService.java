package com.flagship.finance_automation.autosave;

import com.flagship.finance_automation.transfer.MoneyMover;
import com.flagship.finance_automation.transfer.TransferIntent;
import com.flagship.finance_automation.transfer.TransferRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for trigger events from any delivery path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoSaveService {

    private final AutoSaver autoSaver;
    private final MoneyMover moneyMover;

    /**
     * @return the ledger record when the event produced a transfer
     */
    public Optional<TransferRecord> handle(TrackChangedEvent event) {
        MDC.put("eventId", String.valueOf(event.getEventId()));
        try {
            Optional<TransferIntent> intent = autoSaver.onTrigger(event);
            if (intent.isEmpty()) {
                return Optional.empty();
            }
            TransferRecord record = moneyMover.execute(intent.get());
            log.info("Auto-save for track {} finished: key={}, status={}",
                    event.getTrackId(), record.getIdempotencyKey(), record.getStatus());
            return Optional.of(record);
        } finally {
            MDC.remove("eventId");
        }
    }
}
