package com.flagship.finance_automation.autosave;

import com.flagship.finance_automation.bank.AccountGroup;
import com.flagship.finance_automation.bank.AccountIdentifier;
import com.flagship.finance_automation.bank.AccountSource;
import com.flagship.finance_automation.bank.AccountTransaction;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.homeassistant.Notifier;
import com.flagship.finance_automation.homeassistant.StatePublisher;
import com.flagship.finance_automation.homeassistant.StateUpdate;
import com.flagship.finance_automation.observability.FinanceMetrics;
import com.flagship.finance_automation.pot.Pot;
import com.flagship.finance_automation.transfer.MoneyMover;
import com.flagship.finance_automation.transfer.TransferEndpoint;
import com.flagship.finance_automation.transfer.TransferIntent;
import com.flagship.finance_automation.transfer.TransferLedger;
import com.flagship.finance_automation.transfer.TransferRecord;
import com.flagship.finance_automation.transfer.TransferStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SavingsSweepServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-08T09:00:00Z");
    private static final AccountIdentifier CURRENT_ACCOUNT = AccountIdentifier.account("monzo-current");
    private static final AccountIdentifier AMEX_CARD = AccountIdentifier.card("amex-card");

    private AccountSource accountSource;
    private TransferLedger ledger;
    private MoneyMover moneyMover;
    private StatePublisher statePublisher;
    private Notifier notifier;
    private Pot savings;
    private SavingsSweepService service;

    @BeforeEach
    void setUp() {
        accountSource = mock(AccountSource.class);
        ledger = mock(TransferLedger.class);
        moneyMover = mock(MoneyMover.class);
        statePublisher = mock(StatePublisher.class);
        notifier = mock(Notifier.class);
        savings = Pot.builder()
                .name("savings")
                .potId("pot_savings")
                .fundingAccountId("acc_current")
                .build();
        service = service(true);
        when(ledger.findLatestCommittedWithKeyPrefix(anyString())).thenReturn(Optional.empty());
        when(accountSource.fetchTransactions(any(), any(), any(), any())).thenReturn(List.of());
    }

    private SavingsSweepService service(boolean enabled) {
        AccountGroup current = AccountGroup.of(BankRef.MONZO, "current-account", List.of(CURRENT_ACCOUNT));
        AccountGroup cards = AccountGroup.of(BankRef.AMEX, "no-ref", List.of(AMEX_CARD));
        FinanceConfiguration configuration = FinanceConfiguration.builder()
                .zone(ZoneId.of("Europe/London"))
                .currency("GBP")
                .bankGroups(BankRef.MONZO, List.of(current))
                .bankGroups(BankRef.AMEX, List.of(cards))
                .autoSave(FinanceConfiguration.AutoSave.builder()
                        .enabled(true)
                        .pot(savings)
                        .amountPerTrack(79)
                        .debounceWindow(Duration.ofDays(1))
                        .sweep(FinanceConfiguration.SavingsSweep.builder()
                                .enabled(enabled)
                                .pot(savings)
                                .transactionGroup(current.ref())
                                .transactionGroup(cards.ref())
                                .roundUps(true)
                                .debitPercentage(BigDecimal.ZERO)
                                .naughtyPercentage(BigDecimal.ZERO)
                                .minimum(0)
                                .initialLookback(Duration.ofDays(7))
                                .entityId("var.auto_save_amount")
                                .build())
                        .build())
                .build();
        return new SavingsSweepService(configuration, accountSource, new SavingsCalculator(), ledger, moneyMover,
                statePublisher, notifier, mock(FinanceMetrics.class), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AccountTransaction debit(String id, long amount) {
        return new AccountTransaction(id, NOW.minusSeconds(3600), "SHOP " + id, amount, "GBP",
                AccountTransaction.Direction.DEBIT);
    }

    private static TransferRecord record(String key, TransferStatus status, long amount, Instant committedAt) {
        return new TransferRecord(key, status, 1, null, amount, TransferEndpoint.account("acc_current"),
                TransferEndpoint.pot("pot_savings"), "Savings sweep", "ext-1", NOW, NOW, committedAt);
    }

    @Test
    @DisplayName("Should look back the initial window before the first sweep")
    void shouldUseInitialLookback() {
        Instant since = NOW.minus(Duration.ofDays(7));

        SavingsCalculation calculation = service.calculate();

        assertEquals(since, calculation.getSince());
        assertEquals(NOW, calculation.getUntil());
        verify(accountSource).fetchTransactions(BankRef.MONZO, CURRENT_ACCOUNT, since, NOW);
        verify(accountSource).fetchTransactions(BankRef.AMEX, AMEX_CARD, since, NOW);
    }

    @Test
    @DisplayName("Should start the window when the last sweep committed")
    void shouldStartAfterLastSweep() {
        Instant lastSweep = Instant.parse("2026-06-05T21:00:00Z");
        when(ledger.findLatestCommittedWithKeyPrefix("auto-save-sweep:pot_savings:"))
                .thenReturn(Optional.of(record("auto-save-sweep:pot_savings:1", TransferStatus.COMMITTED, 100,
                        lastSweep)));

        assertEquals(lastSweep, service.calculate().getSince());
        assertEquals(Optional.of(lastSweep), service.lastSweepAt());
    }

    @Test
    @DisplayName("Should count a transaction seen on two members once")
    void shouldDeduplicateTransactions() {
        when(accountSource.fetchTransactions(eq(BankRef.MONZO), any(), any(), any()))
                .thenReturn(List.of(debit("tx-1", 250)));
        when(accountSource.fetchTransactions(eq(BankRef.AMEX), any(), any(), any()))
                .thenReturn(List.of(debit("tx-1", 250), debit("tx-2", 110)));

        SavingsCalculation calculation = service.calculate();

        assertEquals(2, calculation.getTransactionCount());
        assertEquals(50 + 90, calculation.getTotalMinorUnits());
    }

    @Test
    @DisplayName("Should publish the pending amount with a breakdown per category")
    void shouldPublishCalculation() {
        when(accountSource.fetchTransactions(eq(BankRef.MONZO), any(), any(), any()))
                .thenReturn(List.of(debit("tx-1", 1_234)));

        service.publish();

        ArgumentCaptor<StateUpdate> update = ArgumentCaptor.forClass(StateUpdate.class);
        verify(statePublisher).publishAsync(update.capture());
        assertEquals("var.auto_save_amount", update.getValue().getEntityId());
        assertEquals("0.66", update.getValue().getValue());
        assertEquals("0.66", update.getValue().getAttributes().get(SavingsCalculation.ROUND_UPS));
        assertEquals(NOW.minus(Duration.ofDays(7)).toString(), update.getValue().getAttributes().get("since"));
        verify(moneyMover, never()).execute(any());
    }

    @Test
    @DisplayName("Should deposit the total under a key fixed by the window start")
    void shouldSweepIntoPot() {
        when(accountSource.fetchTransactions(eq(BankRef.MONZO), any(), any(), any()))
                .thenReturn(List.of(debit("tx-1", 1_234), debit("tx-2", 500)));
        String key = "auto-save-sweep:pot_savings:" + NOW.minus(Duration.ofDays(7)).getEpochSecond();
        when(moneyMover.execute(any())).thenReturn(record(key, TransferStatus.COMMITTED, 166, NOW));

        Optional<TransferRecord> result = service.sweep();

        assertTrue(result.isPresent());
        ArgumentCaptor<TransferIntent> intent = ArgumentCaptor.forClass(TransferIntent.class);
        verify(moneyMover).execute(intent.capture());
        assertEquals(key, intent.getValue().getIdempotencyKey());
        assertEquals(166, intent.getValue().getAmountMinorUnits());
        assertEquals(TransferEndpoint.account("acc_current"), intent.getValue().getSource());
        assertEquals(TransferEndpoint.pot("pot_savings"), intent.getValue().getDestination());
        verify(notifier).notify(eq("Auto-save"), startsWith("Saved £1.66 into savings"));
    }

    @Test
    @DisplayName("Should not notify when the deposit did not commit")
    void shouldNotNotifyFailedSweep() {
        when(accountSource.fetchTransactions(eq(BankRef.MONZO), any(), any(), any()))
                .thenReturn(List.of(debit("tx-1", 1_234)));
        when(moneyMover.execute(any())).thenReturn(record("k", TransferStatus.FAILED, 66, null));

        assertEquals(TransferStatus.FAILED, service.sweep().orElseThrow().getStatus());
        verify(notifier, never()).notify(anyString(), anyString());
    }

    @Test
    @DisplayName("Should move nothing when there is nothing to save")
    void shouldSkipEmptySweep() {
        assertTrue(service.sweep().isEmpty());
        verify(moneyMover, never()).execute(any());
    }

    @Test
    @DisplayName("Should refuse to run while the sweep is disabled")
    void shouldRejectWhenDisabled() {
        SavingsSweepService disabled = service(false);

        assertThrows(IllegalStateException.class, disabled::calculate);
        assertThrows(IllegalStateException.class, disabled::sweep);
        verify(accountSource, never()).fetchTransactions(any(), any(), any(), any());
    }
}
