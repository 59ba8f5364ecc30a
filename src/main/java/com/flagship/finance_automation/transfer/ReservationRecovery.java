package com.flagship.finance_automation.transfer;

import com.flagship.finance_automation.config.FinanceConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Re-drives RESERVED records left behind by a crash or restart.
 *
 * A reservation counts as stuck once its {@code updated_at} is older than the
 * stale threshold; live executions touch it on every attempt. Each stuck
 * record is claimed with a compare-and-set so only one process resumes it,
 * and the resumed call reuses the same key as the provider's dedupe id.
 */
@Component
@ConditionalOnProperty(name = "finance.transfers.recovery-enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ReservationRecovery {

    private final TransferLedger ledger;
    private final MoneyMover moneyMover;
    private final Clock clock;
    private final Duration staleAfter;

    public ReservationRecovery(TransferLedger ledger, MoneyMover moneyMover, Clock clock,
                               FinanceConfiguration configuration) {
        this.ledger = ledger;
        this.moneyMover = moneyMover;
        this.clock = clock;
        this.staleAfter = configuration.getTransfers().getStaleReservationAfter();
    }

    @Scheduled(fixedDelayString = "${finance.transfers.recovery-interval:PT5M}",
            initialDelayString = "${finance.transfers.recovery-initial-delay:PT30S}")
    public void recoverStaleReservations() {
        try {
            int resumed = recover();
            if (resumed > 0) {
                log.info("Recovery pass resumed {} stale reservations", resumed);
            }
        } catch (Exception e) {
            log.error("Error during reservation recovery: {}", e.getMessage(), e);
        }
    }

    /**
     * @return the number of reservations this pass claimed and resumed
     */
    public int recover() {
        Instant cutoff = clock.instant().minus(staleAfter);
        List<TransferRecord> stale = ledger.findReservedOlderThan(cutoff);
        if (stale.isEmpty()) {
            return 0;
        }
        log.warn("Found {} stale reservations older than {}", stale.size(), cutoff);

        int resumed = 0;
        for (TransferRecord record : stale) {
            if (!ledger.claimStaleReservation(record.getIdempotencyKey(), record.getUpdatedAt())) {
                log.debug("Reservation {} claimed by another process", record.getIdempotencyKey());
                continue;
            }
            try {
                TransferRecord result = moneyMover.resume(record);
                log.info("Recovered reservation {}: status={}", record.getIdempotencyKey(), result.getStatus());
                resumed++;
            } catch (RuntimeException e) {
                log.error("Failed to resume reservation {}: {}", record.getIdempotencyKey(), e.getMessage(), e);
            }
        }
        return resumed;
    }
}
