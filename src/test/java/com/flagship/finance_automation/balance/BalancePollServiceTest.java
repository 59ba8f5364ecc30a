package com.flagship.finance_automation.balance;

import com.flagship.finance_automation.bank.AccountGroup;
import com.flagship.finance_automation.bank.AccountIdentifier;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.config.FinanceConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BalancePollServiceTest {

    private static final AccountGroup CURRENT = AccountGroup.of(BankRef.MONZO, "current-account",
            List.of(AccountIdentifier.account("monzo-current")));
    private static final AccountGroup CARDS = AccountGroup.of(BankRef.AMEX, "no-ref",
            List.of(AccountIdentifier.card("amex-card")));

    private BalanceAggregator aggregator;
    private ThreadPoolTaskExecutor pollExecutor;
    private BalancePollService service;

    @BeforeEach
    void setUp() {
        aggregator = mock(BalanceAggregator.class);
        pollExecutor = new ThreadPoolTaskExecutor();
        pollExecutor.setCorePoolSize(2);
        pollExecutor.setThreadNamePrefix("poll-test-");
        pollExecutor.initialize();

        FinanceConfiguration configuration = FinanceConfiguration.builder()
                .bankGroups(BankRef.MONZO, List.of(CURRENT))
                .bankGroups(BankRef.AMEX, List.of(CARDS))
                .build();
        service = new BalancePollService(aggregator, configuration, pollExecutor);
    }

    @AfterEach
    void tearDown() {
        pollExecutor.shutdown();
    }

    private static Map<AccountGroup, BalanceSnapshot> snapshot(AccountGroup group, long amount) {
        return Map.of(group, BalanceSnapshot.fresh(group.ref(), amount, "GBP", Instant.parse("2026-03-10T12:00:00Z")));
    }

    @Test
    @DisplayName("Should return the aggregated snapshots of an on-demand poll")
    void shouldPollNow() {
        when(aggregator.poll(BankRef.MONZO)).thenReturn(snapshot(CURRENT, 12_345));

        Optional<Map<AccountGroup, BalanceSnapshot>> result = service.pollNow(BankRef.MONZO);

        assertTrue(result.isPresent());
        assertEquals(12_345, result.get().get(CURRENT).getAmountMinorUnits());
    }

    @Test
    @DisplayName("Should not start a second poll of a bank while one is running")
    void shouldNotPollTwiceConcurrently() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(aggregator.poll(BankRef.MONZO)).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return snapshot(CURRENT, 100);
        });

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<Map<AccountGroup, BalanceSnapshot>>> first =
                    caller.submit(() -> service.pollNow(BankRef.MONZO));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            Optional<Map<AccountGroup, BalanceSnapshot>> second = service.pollNow(BankRef.MONZO);
            release.countDown();

            assertTrue(second.isEmpty());
            assertTrue(first.get(5, TimeUnit.SECONDS).isPresent());
            verify(aggregator, times(1)).poll(BankRef.MONZO);
        } finally {
            caller.shutdownNow();
        }

        // The guard is released once the running poll finishes
        assertTrue(service.pollNow(BankRef.MONZO).isPresent());
        verify(aggregator, times(2)).poll(BankRef.MONZO);
    }

    @Test
    @DisplayName("Should release the guard when a poll throws")
    void shouldReleaseGuardAfterFailure() {
        when(aggregator.poll(BankRef.MONZO))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(snapshot(CURRENT, 100));

        assertThrows(IllegalStateException.class, () -> service.pollNow(BankRef.MONZO));
        assertTrue(service.pollNow(BankRef.MONZO).isPresent());
    }

    @Test
    @DisplayName("Should reject a bank that is not configured")
    void shouldRejectUnconfiguredBank() {
        assertThrows(IllegalArgumentException.class, () -> service.pollNow(BankRef.HSBC));
    }

    @Test
    @DisplayName("Should poll every bank independently on the scheduled path")
    void shouldPollAllBanksIndependently() {
        when(aggregator.poll(BankRef.MONZO)).thenThrow(new IllegalStateException("monzo down"));
        when(aggregator.poll(BankRef.AMEX)).thenReturn(snapshot(CARDS, 5_000));

        service.pollAllBanks();

        verify(aggregator, timeout(2_000)).poll(BankRef.MONZO);
        verify(aggregator, timeout(2_000)).poll(BankRef.AMEX);
    }
}
