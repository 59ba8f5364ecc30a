package com.flagship.finance_automation.pot;

import com.flagship.finance_automation.balance.BalanceSnapshot;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.bank.GroupRef;
import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.transfer.TransferEndpoint;
import com.flagship.finance_automation.transfer.TransferIntent;
import com.flagship.finance_automation.transfer.TransferLedger;
import com.flagship.finance_automation.transfer.TransferRecord;
import com.flagship.finance_automation.transfer.TransferStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PotManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T21:00:00Z");
    private static final Instant OBSERVED = NOW.minus(Duration.ofMinutes(5));
    private static final GroupRef POT_GROUP = GroupRef.of(BankRef.MONZO, "credit-cards");
    private static final GroupRef TARGET_GROUP = GroupRef.of(BankRef.AMEX, "no-ref");

    private TransferLedger ledger;
    private PotManager potManager;
    private Pot pot;

    @BeforeEach
    void setUp() {
        ledger = mock(TransferLedger.class);
        FinanceConfiguration configuration = FinanceConfiguration.builder()
                .zone(ZoneId.of("Europe/London"))
                .currency("GBP")
                .pollInterval(Duration.ofMinutes(15))
                .freshnessGrace(Duration.ofMinutes(2))
                .build();
        potManager = new PotManager(ledger, configuration, Clock.fixed(NOW, ZoneOffset.UTC));
        pot = potBuilder().build();
    }

    private static Pot.PotBuilder potBuilder() {
        return Pot.builder()
                .name("credit-cards")
                .potId("pot_cc")
                .fundingAccountId("acc_current")
                .balanceGroup(POT_GROUP)
                .targetGroup(TARGET_GROUP)
                .minimumDelta(500)
                .maximumAutoTopUp(20_000)
                .withdrawalsEnabled(true);
    }

    private static BalanceSnapshot potBalance(long amount) {
        return BalanceSnapshot.fresh(POT_GROUP, amount, "GBP", OBSERVED);
    }

    private static BalanceSnapshot target(long amount) {
        return BalanceSnapshot.fresh(TARGET_GROUP, amount, "GBP", OBSERVED);
    }

    @Test
    @DisplayName("Should top up the pot by the difference to the target")
    void shouldTopUpByDifference() {
        Optional<TransferIntent> intent = potManager.reconcile(pot, potBalance(10_000), target(12_345));

        assertTrue(intent.isPresent());
        assertEquals(2_345, intent.get().getAmountMinorUnits());
        assertEquals(TransferEndpoint.account("acc_current"), intent.get().getSource());
        assertEquals(TransferEndpoint.pot("pot_cc"), intent.get().getDestination());
        assertEquals("pot-reconcile:pot_cc:20260310:12345:10000", intent.get().getIdempotencyKey());
    }

    @Test
    @DisplayName("Should withdraw the surplus when withdrawals are enabled")
    void shouldWithdrawSurplus() {
        Optional<TransferIntent> intent = potManager.reconcile(pot, potBalance(15_000), target(9_000));

        assertTrue(intent.isPresent());
        assertEquals(6_000, intent.get().getAmountMinorUnits());
        assertEquals(TransferEndpoint.pot("pot_cc"), intent.get().getSource());
        assertEquals(TransferEndpoint.account("acc_current"), intent.get().getDestination());
    }

    @Test
    @DisplayName("Should not withdraw when withdrawals are disabled")
    void shouldNotWithdrawWhenDisabled() {
        Pot noWithdrawals = potBuilder().withdrawalsEnabled(false).build();

        assertTrue(potManager.reconcile(noWithdrawals, potBalance(15_000), target(9_000)).isEmpty());
    }

    @Test
    @DisplayName("Should ignore differences below the minimum delta")
    void shouldIgnoreSmallDifferences() {
        assertTrue(potManager.reconcile(pot, potBalance(10_000), target(10_499)).isEmpty());
        assertTrue(potManager.reconcile(pot, potBalance(10_499), target(10_000)).isEmpty());
        assertTrue(potManager.reconcile(pot, potBalance(10_000), target(10_500)).isPresent());
    }

    @Test
    @DisplayName("Should do nothing on a stale balance")
    void shouldSkipStaleBalances() {
        assertTrue(potManager.reconcile(pot, potBalance(10_000).asStale(), target(12_345)).isEmpty());
        assertTrue(potManager.reconcile(pot, potBalance(10_000), target(12_345).asStale()).isEmpty());
        verify(ledger, never()).isCommitted(anyString());
    }

    @Test
    @DisplayName("Should do nothing when a balance is older than one poll interval plus grace")
    void shouldSkipOldBalances() {
        BalanceSnapshot old = BalanceSnapshot.fresh(TARGET_GROUP, 12_345, "GBP", NOW.minus(Duration.ofMinutes(18)));

        assertTrue(potManager.reconcile(pot, potBalance(10_000), old).isEmpty());
    }

    @Test
    @DisplayName("Should do nothing for a pot without a target")
    void shouldSkipPotWithoutTarget() {
        Pot savings = potBuilder().targetGroup(null).build();

        assertTrue(potManager.reconcile(savings, potBalance(0), target(12_345)).isEmpty());
    }

    @Test
    @DisplayName("Should wait while the pot balance does not yet reflect a committed transfer")
    void shouldWaitForCommittedTransferToShowUp() {
        TransferRecord recent = new TransferRecord("pot-reconcile:pot_cc:20260310:12000:9000",
                TransferStatus.COMMITTED, 1, null, 3_000,
                TransferEndpoint.account("acc_current"), TransferEndpoint.pot("pot_cc"), "Top up",
                "ext-1", OBSERVED, OBSERVED, OBSERVED.plusSeconds(30));
        when(ledger.findLatestCommittedInvolving(TransferEndpoint.pot("pot_cc"))).thenReturn(Optional.of(recent));

        assertTrue(potManager.reconcile(pot, potBalance(10_000), target(12_345)).isEmpty());
    }

    @Test
    @DisplayName("Should reconcile once an earlier transfer is reflected in the pot balance")
    void shouldReconcileAfterEarlierTransferIsReflected() {
        TransferRecord earlier = new TransferRecord("pot-reconcile:pot_cc:20260309:9000:6000",
                TransferStatus.COMMITTED, 1, null, 3_000,
                TransferEndpoint.account("acc_current"), TransferEndpoint.pot("pot_cc"), "Top up",
                "ext-1", OBSERVED.minus(Duration.ofDays(1)), OBSERVED.minus(Duration.ofDays(1)),
                OBSERVED.minus(Duration.ofDays(1)));
        when(ledger.findLatestCommittedInvolving(TransferEndpoint.pot("pot_cc"))).thenReturn(Optional.of(earlier));

        assertTrue(potManager.reconcile(pot, potBalance(10_000), target(12_345)).isPresent());
    }

    @Test
    @DisplayName("Should produce the same intent again only while the first is not committed")
    void shouldNotRepeatCommittedReconciliation() {
        TransferIntent first = potManager.reconcile(pot, potBalance(10_000), target(12_345)).orElseThrow();
        TransferIntent second = potManager.reconcile(pot, potBalance(10_000), target(12_345)).orElseThrow();
        assertEquals(first.getIdempotencyKey(), second.getIdempotencyKey());

        when(ledger.isCommitted(first.getIdempotencyKey())).thenReturn(true);

        assertTrue(potManager.reconcile(pot, potBalance(10_000), target(12_345)).isEmpty());
    }
}
