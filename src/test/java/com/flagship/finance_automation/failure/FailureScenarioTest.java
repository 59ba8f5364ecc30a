package com.flagship.finance_automation.failure;

import com.flagship.finance_automation.autosave.AutoSaveService;
import com.flagship.finance_automation.autosave.TrackChangedEvent;
import com.flagship.finance_automation.balance.BalanceSnapshot;
import com.flagship.finance_automation.balance.BalanceSnapshotStore;
import com.flagship.finance_automation.bank.AccountSource;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.bank.GroupRef;
import com.flagship.finance_automation.pot.PotReconciliationService;
import com.flagship.finance_automation.pot.ReconciliationOutcome;
import com.flagship.finance_automation.pot.ReconciliationResult;
import com.flagship.finance_automation.transfer.AmbiguousTransferException;
import com.flagship.finance_automation.transfer.MoneyMover;
import com.flagship.finance_automation.transfer.TransferApi;
import com.flagship.finance_automation.transfer.TransferEndpoint;
import com.flagship.finance_automation.transfer.TransferIntent;
import com.flagship.finance_automation.transfer.TransferLedger;
import com.flagship.finance_automation.transfer.TransferReceipt;
import com.flagship.finance_automation.transfer.TransferRecord;
import com.flagship.finance_automation.transfer.TransferRejectedException;
import com.flagship.finance_automation.transfer.TransferStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Failure scenarios for money movement.
 *
 * The invariant under test everywhere: a decision moves money at most once,
 * no matter how often it is repeated, raced or retried.
 */
@SpringBootTest
@ActiveProfiles("test")
class FailureScenarioTest {

    private static final TransferEndpoint CURRENT = TransferEndpoint.account("acc_current");
    private static final TransferEndpoint CREDIT_CARDS_POT = TransferEndpoint.pot("pot_credit_cards");

    @Autowired
    private MoneyMover moneyMover;

    @Autowired
    private TransferLedger ledger;

    @Autowired
    private AutoSaveService autoSaveService;

    @Autowired
    private PotReconciliationService reconciliationService;

    @Autowired
    private BalanceSnapshotStore snapshotStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private TransferApi transferApi;

    @MockBean
    private AccountSource accountSource;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM transfer_records");
        jdbcTemplate.update("DELETE FROM balance_snapshots");
        when(transferApi.transfer(any())).thenAnswer(invocation ->
                new TransferReceipt("ext-" + System.nanoTime(), null));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("FAILURE SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInvariant(String invariant) {
        System.out.println("INVARIANT MAINTAINED: " + invariant);
    }

    private TransferIntent topUp(String key, long amount) {
        return TransferIntent.create(key, CURRENT, CREDIT_CARDS_POT, amount, "test top-up", Instant.now());
    }

    // ========================================================================
    // DUPLICATE INTENTS
    // ========================================================================

    @Nested
    @DisplayName("1. Duplicate intents")
    class DuplicateIntents {

        @Test
        @DisplayName("1.1 Executing the same intent twice calls the provider once")
        void sequentialDuplicate() {
            printTestHeader("Same intent executed twice");

            TransferRecord first = moneyMover.execute(topUp("dup-seq", 2_345));
            TransferRecord second = moneyMover.execute(topUp("dup-seq", 2_345));

            assertEquals(TransferStatus.COMMITTED, first.getStatus());
            assertEquals(TransferStatus.COMMITTED, second.getStatus());
            assertEquals(first.getExternalTransferId(), second.getExternalTransferId());
            verify(transferApi, times(1)).transfer(any());
            printInvariant("One key, one provider call");
        }

        @Test
        @DisplayName("1.2 Racing executions of one intent commit exactly once")
        void concurrentDuplicate() throws Exception {
            printTestHeader("Same intent executed concurrently");

            when(transferApi.transfer(any())).thenAnswer(invocation -> {
                Thread.sleep(50);
                return new TransferReceipt("ext-race", null);
            });

            int threads = 6;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<TransferRecord>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return moneyMover.execute(topUp("dup-race", 500));
                }));
            }
            start.countDown();

            int committedResults = 0;
            for (Future<TransferRecord> result : results) {
                if (result.get(30, TimeUnit.SECONDS).getStatus() == TransferStatus.COMMITTED) {
                    committedResults++;
                }
            }
            executor.shutdown();

            assertTrue(committedResults >= 1);
            assertEquals(TransferStatus.COMMITTED, ledger.find("dup-race").orElseThrow().getStatus());
            verify(transferApi, times(1)).transfer(any());
            printInvariant("The database serialized the reservations");
        }
    }

    // ========================================================================
    // REPEATED TRIGGERS
    // ========================================================================

    @Nested
    @DisplayName("2. Repeated triggers")
    class RepeatedTriggers {

        @Test
        @DisplayName("2.1 The same track reported twice within the window saves once")
        void repeatedTrackEvent() {
            printTestHeader("Track event delivered twice");

            Instant playedAt = Instant.parse("2026-03-10T12:00:00Z");
            TrackChangedEvent first = new TrackChangedEvent("evt-1", "track-42", "Song", "Artist", playedAt);
            TrackChangedEvent second = new TrackChangedEvent("evt-2", "track-42", "Song", "Artist",
                    playedAt.plusSeconds(2));

            Optional<TransferRecord> saved = autoSaveService.handle(first);
            Optional<TransferRecord> repeated = autoSaveService.handle(second);

            assertTrue(saved.isPresent());
            assertEquals(TransferStatus.COMMITTED, saved.get().getStatus());
            assertEquals(79, saved.get().getAmountMinorUnits());
            assertTrue(repeated.isEmpty());
            verify(transferApi, times(1)).transfer(any());
        }

        @Test
        @DisplayName("2.2 Reconciling a pot twice moves money once")
        void repeatedReconciliation() {
            printTestHeader("Pot reconciled twice");

            Instant observedAt = Instant.now().minus(1, ChronoUnit.MINUTES);
            snapshotStore.save(BalanceSnapshot.fresh(GroupRef.of(BankRef.AMEX, "no-ref"), 12_345, "GBP", observedAt));
            snapshotStore.save(BalanceSnapshot.fresh(GroupRef.of(BankRef.MONZO, "credit-cards"), 10_000, "GBP",
                    observedAt));
            snapshotStore.save(BalanceSnapshot.fresh(GroupRef.of(BankRef.MONZO, "current-account"), 50_000, "GBP",
                    observedAt));

            ReconciliationResult first = reconciliationService.reconcile("credit-cards", false);
            ReconciliationResult second = reconciliationService.reconcile("credit-cards", false);

            assertEquals(ReconciliationOutcome.EXECUTED, first.getOutcome());
            assertEquals(2_345, first.getAmountMinorUnits());
            assertEquals(TransferStatus.COMMITTED, first.getRecord().getStatus());
            assertEquals(ReconciliationOutcome.NO_CHANGE, second.getOutcome());
            verify(transferApi, times(1)).transfer(any());
            printInvariant("A committed transfer newer than the pot balance blocks a second top-up");
        }
    }

    // ========================================================================
    // PROVIDER FAILURES
    // ========================================================================

    @Nested
    @DisplayName("3. Provider failures")
    class ProviderFailures {

        @Test
        @DisplayName("3.1 Timeouts followed by a rejection end FAILED")
        void timeoutsThenRejection() {
            printTestHeader("Three timeouts then a rejection");

            when(transferApi.transfer(any()))
                    .thenThrow(new AmbiguousTransferException("read timed out"))
                    .thenThrow(new AmbiguousTransferException("read timed out"))
                    .thenThrow(new AmbiguousTransferException("read timed out"))
                    .thenThrow(new TransferRejectedException("insufficient funds"));

            TransferRecord record = moneyMover.execute(topUp("timeouts", 1_000));

            assertEquals(TransferStatus.FAILED, record.getStatus());
            assertEquals(4, record.getAttempts());
            verify(transferApi, times(4)).transfer(any());
        }

        @Test
        @DisplayName("3.2 Persistent timeouts abandon the transfer for a human")
        void persistentTimeouts() {
            printTestHeader("Provider never answers");

            when(transferApi.transfer(any())).thenThrow(new AmbiguousTransferException("read timed out"));

            TransferRecord record = moneyMover.execute(topUp("abandon", 1_000));

            assertEquals(TransferStatus.ABANDONED, record.getStatus());
            assertEquals(5, record.getAttempts());
            assertEquals(1, ledger.findByStatus(TransferStatus.ABANDONED).size());

            TransferRecord retried = moneyMover.execute(topUp("abandon", 1_000));
            assertEquals(TransferStatus.ABANDONED, retried.getStatus());
            printInvariant("An abandoned transfer is retried only with the same dedupe id");
        }

        @Test
        @DisplayName("3.3 A failed transfer can be executed again under the same key")
        void retryAfterFailure() {
            printTestHeader("Rejected transfer retried later");

            when(transferApi.transfer(any()))
                    .thenThrow(new TransferRejectedException("insufficient funds"))
                    .thenReturn(new TransferReceipt("ext-later", null));

            TransferRecord failed = moneyMover.execute(topUp("retry-later", 1_000));
            TransferRecord committed = moneyMover.execute(topUp("retry-later", 1_000));

            assertEquals(TransferStatus.FAILED, failed.getStatus());
            assertEquals(TransferStatus.COMMITTED, committed.getStatus());
            assertEquals("ext-later", committed.getExternalTransferId());
        }
    }

    // ========================================================================
    // OVERSIZED INPUT
    // ========================================================================

    @Nested
    @DisplayName("4. Oversized input")
    class OversizedInput {

        @Test
        @DisplayName("4.1 A track with maximum length fields still saves once")
        void longTrackFields() {
            printTestHeader("Track event with long id, name and artist");

            Instant playedAt = Instant.parse("2026-03-10T12:00:00Z");
            String trackId = "t".repeat(200);
            TrackChangedEvent event = new TrackChangedEvent("evt-long", trackId, "n".repeat(200), "a".repeat(200),
                    playedAt);

            Optional<TransferRecord> saved = autoSaveService.handle(event);
            Optional<TransferRecord> repeated = autoSaveService.handle(event);

            assertTrue(saved.isPresent());
            assertEquals(TransferStatus.COMMITTED, saved.get().getStatus());
            assertTrue(saved.get().getIdempotencyKey().length() <= TransferIntent.MAX_KEY_LENGTH);
            assertFalse(saved.get().getIdempotencyKey().contains(trackId));
            assertTrue(repeated.isEmpty());
            verify(transferApi, times(1)).transfer(any());
            printInvariant("Long event fields never overflow the ledger");
        }

        @Test
        @DisplayName("4.2 An over-long reason is stored truncated")
        void longReason() {
            printTestHeader("Intent with a reason longer than the ledger column");

            TransferIntent intent = TransferIntent.create("long-reason", CURRENT, CREDIT_CARDS_POT, 1_000,
                    "r".repeat(600), Instant.now());

            TransferRecord record = moneyMover.execute(intent);

            assertEquals(TransferStatus.COMMITTED, record.getStatus());
            assertEquals(500, record.getReason().length());
        }

        @Test
        @DisplayName("4.3 An over-long idempotency key is refused before reaching the ledger")
        void longKey() {
            assertThrows(IllegalArgumentException.class, () -> topUp("k".repeat(201), 1_000));
            assertTrue(ledger.findByStatus(TransferStatus.RESERVED).isEmpty());
        }
    }
}
