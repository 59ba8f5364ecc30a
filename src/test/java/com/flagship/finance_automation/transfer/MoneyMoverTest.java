package com.flagship.finance_automation.transfer;

import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.homeassistant.Notifier;
import com.flagship.finance_automation.observability.FinanceMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Drives MoneyMover against a mocked ledger and transfer API, with retries but no backoff.
 */
class MoneyMoverTest {

    private static final Instant NOW = Instant.parse("2026-03-10T21:00:00Z");
    private static final String KEY = "pot-reconcile:pot_cc:20260310:12345:10000";

    private TransferLedger ledger;
    private TransferApi transferApi;
    private Notifier notifier;
    private MoneyMover moneyMover;
    private TransferIntent intent;

    @BeforeEach
    void setUp() {
        ledger = mock(TransferLedger.class);
        transferApi = mock(TransferApi.class);
        notifier = mock(Notifier.class);

        RetryTemplate retryTemplate = RetryTemplate.builder()
                .maxAttempts(5)
                .noBackoff()
                .retryOn(TransientTransferException.class)
                .build();

        FinanceConfiguration configuration = FinanceConfiguration.builder()
                .transfers(FinanceConfiguration.TransferPolicy.builder()
                        .maxAttempts(5)
                        .initialBackoff(Duration.ofMillis(1))
                        .multiplier(2.0)
                        .maxBackoff(Duration.ofMillis(5))
                        .maximumAmount(1_000_000)
                        .staleReservationAfter(Duration.ofMinutes(10))
                        .build())
                .build();

        moneyMover = new MoneyMover(ledger, transferApi, retryTemplate, notifier,
                mock(FinanceMetrics.class), configuration);

        intent = TransferIntent.create(KEY, TransferEndpoint.account("acc_current"),
                TransferEndpoint.pot("pot_cc"), 2_345, "Top up credit-cards", NOW);

        when(ledger.reserve(intent)).thenReturn(record(TransferStatus.RESERVED, 0));
        when(ledger.commit(eq(KEY), anyString())).thenReturn(record(TransferStatus.COMMITTED, 1));
        when(ledger.fail(eq(KEY), anyString())).thenReturn(record(TransferStatus.FAILED, 4));
        when(ledger.abandon(eq(KEY), anyString())).thenReturn(record(TransferStatus.ABANDONED, 5));
    }

    private static TransferRecord record(TransferStatus status, int attempts) {
        return new TransferRecord(KEY, status, attempts, null, 2_345,
                TransferEndpoint.account("acc_current"), TransferEndpoint.pot("pot_cc"), "Top up credit-cards",
                status == TransferStatus.COMMITTED ? KEY : null, NOW, NOW,
                status == TransferStatus.COMMITTED ? NOW : null);
    }

    @Test
    @DisplayName("Should commit on success with the ledger key as the provider dedupe id")
    void shouldCommitOnSuccess() {
        when(transferApi.transfer(any())).thenReturn(new TransferReceipt(KEY, 12_345L));

        TransferRecord result = moneyMover.execute(intent);

        assertEquals(TransferStatus.COMMITTED, result.getStatus());
        verify(transferApi).transfer(new TransferRequest(intent.getSource(), intent.getDestination(), 2_345, KEY));
        verify(ledger).commit(KEY, KEY);
    }

    @Test
    @DisplayName("Should return the existing record for a duplicate intent without calling the API")
    void shouldReturnExistingRecordForDuplicate() {
        TransferRecord existing = record(TransferStatus.COMMITTED, 1);
        when(ledger.reserve(intent)).thenThrow(new DuplicateIntentException(existing));

        TransferRecord result = moneyMover.execute(intent);

        assertSame(existing, result);
        verify(transferApi, never()).transfer(any());
    }

    @Test
    @DisplayName("Should fail, not abandon, when a rejection follows ambiguous timeouts")
    void shouldFailWhenRejectionFollowsTimeouts() {
        when(transferApi.transfer(any()))
                .thenThrow(new AmbiguousTransferException("read timed out"))
                .thenThrow(new AmbiguousTransferException("read timed out"))
                .thenThrow(new AmbiguousTransferException("read timed out"))
                .thenThrow(new TransferRejectedException("insufficient funds"));

        TransferRecord result = moneyMover.execute(intent);

        assertEquals(TransferStatus.FAILED, result.getStatus());
        verify(transferApi, times(4)).transfer(any());
        verify(ledger).fail(eq(KEY), startsWith("Rejected"));
        verify(ledger, never()).abandon(anyString(), anyString());
        verify(ledger, never()).commit(anyString(), anyString());
    }

    @Test
    @DisplayName("Should abandon and notify when every attempt is ambiguous")
    void shouldAbandonWhenAllAttemptsAmbiguous() {
        when(transferApi.transfer(any())).thenThrow(new AmbiguousTransferException("HTTP 503"));

        TransferRecord result = moneyMover.execute(intent);

        assertEquals(TransferStatus.ABANDONED, result.getStatus());
        verify(transferApi, times(5)).transfer(any());
        verify(ledger, times(5)).recordAttempt(eq(KEY), anyInt(), anyString());
        verify(notifier).notify(eq("Transfer needs checking"), anyString());
        verify(ledger, never()).commit(anyString(), anyString());
    }

    @Test
    @DisplayName("Should fail when retries run out and no attempt reached the provider")
    void shouldFailWhenRetriesExhaustedWithoutAmbiguity() {
        when(transferApi.transfer(any())).thenThrow(new TransientTransferException("HTTP 429"));

        TransferRecord result = moneyMover.execute(intent);

        assertEquals(TransferStatus.FAILED, result.getStatus());
        verify(ledger).fail(eq(KEY), startsWith("Retries exhausted"));
        verify(notifier, never()).notify(anyString(), anyString());
    }

    @Test
    @DisplayName("Should treat an unexpected API error as ambiguous")
    void shouldTreatUnexpectedErrorAsAmbiguous() {
        when(transferApi.transfer(any())).thenThrow(new IllegalStateException("unexpected"));

        TransferRecord result = moneyMover.execute(intent);

        assertEquals(TransferStatus.ABANDONED, result.getStatus());
        verify(transferApi, times(5)).transfer(any());
    }

    @Test
    @DisplayName("Should commit after a transient failure clears")
    void shouldCommitAfterTransientFailure() {
        when(transferApi.transfer(any()))
                .thenThrow(new TransientTransferException("HTTP 429"))
                .thenReturn(new TransferReceipt(KEY, null));

        assertEquals(TransferStatus.COMMITTED, moneyMover.execute(intent).getStatus());
        verify(transferApi, times(2)).transfer(any());
    }

    @Test
    @DisplayName("Should refuse amounts above the safety bound before reserving")
    void shouldRefuseAmountAboveBound() {
        TransferIntent huge = TransferIntent.create("big", TransferEndpoint.account("acc_current"),
                TransferEndpoint.pot("pot_cc"), 1_000_001, "too much", NOW);

        assertThrows(IllegalArgumentException.class, () -> moneyMover.execute(huge));
        verify(ledger, never()).reserve(any());
    }

    @Test
    @DisplayName("Should leave the reservation for recovery when the ledger is unreachable")
    void shouldLeaveReservationWhenLedgerFails() {
        when(transferApi.transfer(any())).thenReturn(new TransferReceipt(KEY, null));
        when(ledger.commit(eq(KEY), anyString())).thenThrow(new DataAccessResourceFailureException("db down"));

        TransferRecord result = moneyMover.execute(intent);

        assertEquals(TransferStatus.RESERVED, result.getStatus());
    }

    @Test
    @DisplayName("Should abandon a resumed reservation whose outcome stays unknown")
    void shouldAbandonResumedReservation() {
        when(transferApi.transfer(any())).thenThrow(new TransientTransferException("HTTP 429"));

        TransferRecord result = moneyMover.resume(record(TransferStatus.RESERVED, 2));

        assertEquals(TransferStatus.ABANDONED, result.getStatus());
    }

    @Test
    @DisplayName("Should refuse to resume a record that is not reserved")
    void shouldRefuseToResumeFinishedRecord() {
        assertThrows(IllegalStateException.class, () -> moneyMover.resume(record(TransferStatus.COMMITTED, 1)));
    }
}
