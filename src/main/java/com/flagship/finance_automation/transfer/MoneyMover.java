package com.flagship.finance_automation.transfer;

import com.flagship.finance_automation.common.MinorUnits;
import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.homeassistant.Notifier;
import com.flagship.finance_automation.observability.FinanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * The single path through which money moves.
 *
 * Every execution follows reserve -> call -> commit | fail | abandon:
 * 1. The intent's key is reserved in the ledger. A duplicate key returns the
 *    existing record without calling the provider.
 * 2. The provider is called with the ledger key as its dedupe id, retried with
 *    bounded exponential backoff for transient and ambiguous failures.
 * 3. A definitive rejection fails the record immediately, even after earlier
 *    ambiguous attempts.
 * 4. Exhausted retries abandon the record when any attempt was ambiguous
 *    (a human must check the provider) and fail it when every attempt was
 *    provably not processed.
 *
 * Per-intent failures are returned as records, never thrown, so one bad
 * transfer cannot block others.
 */
@Service
@Slf4j
public class MoneyMover {

    private static final String MDC_KEY = "idempotencyKey";

    private final TransferLedger ledger;
    private final TransferApi transferApi;
    private final RetryTemplate retryTemplate;
    private final Notifier notifier;
    private final FinanceMetrics metrics;
    private final long maximumAmount;

    public MoneyMover(TransferLedger ledger,
                      TransferApi transferApi,
                      @Qualifier("transferRetryTemplate") RetryTemplate retryTemplate,
                      Notifier notifier,
                      FinanceMetrics metrics,
                      FinanceConfiguration configuration) {
        this.ledger = ledger;
        this.transferApi = transferApi;
        this.retryTemplate = retryTemplate;
        this.notifier = notifier;
        this.metrics = metrics;
        this.maximumAmount = configuration.getTransfers().getMaximumAmount();
    }

    /**
     * Executes an intent at most once.
     *
     * @return the final ledger record: COMMITTED, FAILED or ABANDONED, or the
     *         existing record when the key was already taken
     * @throws IllegalArgumentException if the amount exceeds the configured safety bound
     */
    public TransferRecord execute(TransferIntent intent) {
        if (intent.getAmountMinorUnits() > maximumAmount) {
            throw new IllegalArgumentException(String.format(
                    "Transfer %s of %d exceeds the maximum amount %d",
                    intent.getIdempotencyKey(), intent.getAmountMinorUnits(), maximumAmount));
        }

        long startTime = System.currentTimeMillis();
        MDC.put(MDC_KEY, intent.getIdempotencyKey());
        try {
            TransferRecord reserved;
            try {
                reserved = ledger.reserve(intent);
            } catch (DuplicateIntentException e) {
                metrics.incrementDuplicateIntents();
                log.info("Duplicate transfer intent, returning existing record: status={}",
                        e.getExisting().getStatus());
                return e.getExisting();
            }

            log.info("Transfer reserved: amount={}, source={}, destination={}, reason={}",
                    intent.getAmountMinorUnits(), intent.getSource(), intent.getDestination(), intent.getReason());
            return drive(reserved, false, startTime);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /**
     * Re-drives a RESERVED record left behind by a crash or restart.
     *
     * The outcome of the interrupted call is unknown, so exhausting retries
     * abandons the record rather than failing it.
     */
    public TransferRecord resume(TransferRecord record) {
        if (!record.isReserved()) {
            throw new IllegalStateException(
                    String.format("Cannot resume transfer %s in %s status. Only RESERVED transfers can be resumed.",
                            record.getIdempotencyKey(), record.getStatus()));
        }
        long startTime = System.currentTimeMillis();
        MDC.put(MDC_KEY, record.getIdempotencyKey());
        try {
            log.info("Resuming reserved transfer: attempts={}, lastError={}",
                    record.getAttempts(), record.getLastError());
            return drive(record, true, startTime);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private TransferRecord drive(TransferRecord record, boolean outcomeUnknown, long startTime) {
        String key = record.getIdempotencyKey();
        AttemptTracker tracker = new AttemptTracker(record.getAttempts(), outcomeUnknown);
        TransferRequest request = record.toRequest();
        String outcome;
        TransferRecord result;

        try {
            try {
                TransferReceipt receipt = retryTemplate.execute(context -> attempt(request, tracker));
                result = ledger.commit(key, receipt.getExternalTransferId());
                outcome = "committed";
                log.info("Transfer committed: externalId={}, attempts={}",
                        receipt.getExternalTransferId(), tracker.attempts);

            } catch (TransferRejectedException e) {
                result = ledger.fail(key, "Rejected: " + e.getMessage());
                outcome = "failed";
                log.warn("Transfer rejected by provider: attempts={}, reason={}", tracker.attempts, e.getMessage());

            } catch (TransientTransferException e) {
                if (tracker.ambiguous) {
                    result = ledger.abandon(key, "Outcome unknown after retries: " + e.getMessage());
                    outcome = "abandoned";
                    log.error("Transfer abandoned after {} attempts with ambiguous outcome: {}",
                            tracker.attempts, e.getMessage());
                    notifyAbandoned(result);
                } else {
                    result = ledger.fail(key, "Retries exhausted: " + e.getMessage());
                    outcome = "failed";
                    log.warn("Transfer failed, retries exhausted without reaching provider: attempts={}",
                            tracker.attempts);
                }
            }
        } catch (UnknownRecordException e) {
            // Another executor finished this key first.
            log.warn("Transfer record changed underneath this execution: {}", e.getMessage());
            outcome = "superseded";
            result = ledger.find(key).orElse(record);
        } catch (DataAccessException e) {
            log.error("Ledger update failed, reservation left for recovery: {}", e.getMessage(), e);
            outcome = "ledger_error";
            result = record;
        }

        metrics.recordTransferExecuted(outcome);
        metrics.recordTransferLatency(Duration.ofMillis(System.currentTimeMillis() - startTime));
        return result;
    }

    private TransferReceipt attempt(TransferRequest request, AttemptTracker tracker) {
        int attempt = ++tracker.attempts;
        metrics.incrementTransferAttempts();
        log.debug("Calling transfer API: attempt={}", attempt);
        try {
            return transferApi.transfer(request);
        } catch (TransferRejectedException e) {
            recordFailedAttempt(request, attempt, "Rejected: " + e.getMessage());
            throw e;
        } catch (AmbiguousTransferException e) {
            tracker.ambiguous = true;
            recordFailedAttempt(request, attempt, "Ambiguous: " + e.getMessage());
            throw e;
        } catch (TransientTransferException e) {
            recordFailedAttempt(request, attempt, "Not processed: " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            tracker.ambiguous = true;
            recordFailedAttempt(request, attempt, "Unexpected: " + e);
            throw new AmbiguousTransferException("Unexpected transfer API error: " + e.getMessage(), e);
        }
    }

    private void recordFailedAttempt(TransferRequest request, int attempt, String error) {
        log.warn("Transfer attempt {} failed: {}", attempt, error);
        ledger.recordAttempt(request.getClientIdempotencyKey(), attempt, error);
    }

    private void notifyAbandoned(TransferRecord record) {
        notifier.notify("Transfer needs checking",
                String.format("A transfer of £%s from %s to %s could not be confirmed after %d attempts. "
                                + "Check the provider, then resolve %s as COMMITTED or FAILED.",
                        MinorUnits.toMajorString(record.getAmountMinorUnits()),
                        record.getSource(), record.getDestination(), record.getAttempts(),
                        record.getIdempotencyKey()));
    }

    /**
     * Mutable per-execution state shared with the retry callback.
     */
    private static final class AttemptTracker {
        private int attempts;
        private boolean ambiguous;

        private AttemptTracker(int attempts, boolean ambiguous) {
            this.attempts = attempts;
            this.ambiguous = ambiguous;
        }
    }
}
