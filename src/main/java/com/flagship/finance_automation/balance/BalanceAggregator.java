package com.flagship.finance_automation.balance;

import com.flagship.finance_automation.bank.AccountBalance;
import com.flagship.finance_automation.bank.AccountGroup;
import com.flagship.finance_automation.bank.AccountIdentifier;
import com.flagship.finance_automation.bank.AccountSource;
import com.flagship.finance_automation.bank.AccountSourceException;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.bank.FailureKind;
import com.flagship.finance_automation.common.MinorUnits;
import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.homeassistant.Notifier;
import com.flagship.finance_automation.homeassistant.StatePublisher;
import com.flagship.finance_automation.homeassistant.StateUpdate;
import com.flagship.finance_automation.observability.FinanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Polls one bank and produces one snapshot per configured account group.
 *
 * Rules:
 * - Member fetches run concurrently, each bounded by the fetch timeout.
 * - Any member failure makes its group stale: the previous snapshot is
 *   returned unchanged and flagged. Without a previous snapshot the group is
 *   left out.
 * - An UNAUTHORIZED member makes every group of the bank stale and sends one
 *   notification until the bank polls cleanly again.
 * - Mixed currencies inside a group count as a failure.
 * - A result observed before the stored snapshot never replaces it.
 * - Fresh snapshots are persisted, then published without blocking the poll.
 */
@Service
@Slf4j
public class BalanceAggregator {

    private final AccountSource accountSource;
    private final BalanceSnapshotStore store;
    private final StatePublisher statePublisher;
    private final Notifier notifier;
    private final FinanceMetrics metrics;
    private final FinanceConfiguration configuration;
    private final ThreadPoolTaskExecutor fetchExecutor;

    private final Set<BankRef> expiredCredentialsNotified = ConcurrentHashMap.newKeySet();

    public BalanceAggregator(AccountSource accountSource,
                             BalanceSnapshotStore store,
                             StatePublisher statePublisher,
                             Notifier notifier,
                             FinanceMetrics metrics,
                             FinanceConfiguration configuration,
                             @Qualifier("fetchExecutor") ThreadPoolTaskExecutor fetchExecutor) {
        this.accountSource = accountSource;
        this.store = store;
        this.statePublisher = statePublisher;
        this.notifier = notifier;
        this.metrics = metrics;
        this.configuration = configuration;
        this.fetchExecutor = fetchExecutor;
    }

    public Map<AccountGroup, BalanceSnapshot> poll(BankRef bankRef) {
        long startTime = System.currentTimeMillis();
        MDC.put("bank", bankRef.name());
        try {
            List<AccountGroup> groups = configuration.groups(bankRef);
            Map<AccountGroup, List<CompletableFuture<MemberOutcome>>> pending = new LinkedHashMap<>();
            for (AccountGroup group : groups) {
                List<CompletableFuture<MemberOutcome>> fetches = new ArrayList<>();
                for (AccountIdentifier member : group.getMembers()) {
                    fetches.add(fetchAsync(bankRef, member));
                }
                pending.put(group, fetches);
            }

            Map<AccountGroup, List<MemberOutcome>> outcomes = new LinkedHashMap<>();
            pending.forEach((group, fetches) -> outcomes.put(group, fetches.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList())));

            boolean unauthorized = outcomes.values().stream()
                    .flatMap(List::stream)
                    .anyMatch(outcome -> outcome.getFailureKind() == FailureKind.UNAUTHORIZED);

            Map<AccountGroup, BalanceSnapshot> result = new LinkedHashMap<>();
            boolean allFresh = true;
            for (Map.Entry<AccountGroup, List<MemberOutcome>> entry : outcomes.entrySet()) {
                Optional<BalanceSnapshot> snapshot = resolveGroup(entry.getKey(), entry.getValue(), unauthorized);
                snapshot.ifPresent(value -> result.put(entry.getKey(), value));
                allFresh &= snapshot.map(value -> !value.isStale()).orElse(false);
            }

            handleCredentials(bankRef, unauthorized);

            String outcome = unauthorized ? "unauthorized" : allFresh ? "fresh" : "partial";
            metrics.recordPoll(bankRef.name(), outcome);
            metrics.recordPollDuration(bankRef.name(), Duration.ofMillis(System.currentTimeMillis() - startTime));
            log.info("Bank poll finished: outcome={}, groups={}, reported={}, duration={}ms",
                    outcome, groups.size(), result.size(), System.currentTimeMillis() - startTime);
            return result;
        } finally {
            MDC.remove("bank");
        }
    }

    private CompletableFuture<MemberOutcome> fetchAsync(BankRef bankRef, AccountIdentifier member) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> accountSource.fetchBalance(bankRef, member), fetchExecutor)
                    .orTimeout(configuration.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .handle((balance, error) -> error == null
                            ? MemberOutcome.success(member, balance)
                            : MemberOutcome.failure(member, unwrap(error)));
        } catch (TaskRejectedException e) {
            return CompletableFuture.completedFuture(MemberOutcome.failure(member, e));
        }
    }

    private Optional<BalanceSnapshot> resolveGroup(AccountGroup group, List<MemberOutcome> outcomes,
                                                   boolean unauthorized) {
        BankRef bankRef = group.getBankRef();
        Optional<BalanceSnapshot> previous = store.find(group.ref());

        List<MemberOutcome> failures = outcomes.stream()
                .filter(MemberOutcome::isFailed)
                .collect(Collectors.toList());
        for (MemberOutcome failure : failures) {
            logFailure(group, failure);
            metrics.recordFetchFailure(bankRef.name(),
                    failure.getFailureKind() == null ? "error" : failure.getFailureKind().name());
        }

        if (unauthorized || !failures.isEmpty()) {
            return markStale(group, previous, unauthorized ? "bank credentials rejected" : "member fetch failed");
        }

        Set<String> currencies = outcomes.stream()
                .map(outcome -> outcome.getBalance().getCurrency())
                .collect(Collectors.toSet());
        if (currencies.size() > 1) {
            log.error("Currency mismatch in group {}: {}", group.getName(), currencies);
            metrics.recordFetchFailure(bankRef.name(), "currency_mismatch");
            return markStale(group, previous, "currency mismatch");
        }

        long total = 0;
        for (MemberOutcome outcome : outcomes) {
            total = Math.addExact(total, outcome.getBalance().getAmountMinorUnits());
        }
        Instant observedAt = outcomes.stream()
                .map(outcome -> outcome.getBalance().getAsOf())
                .min(Comparator.naturalOrder())
                .orElseThrow();
        BalanceSnapshot fresh = BalanceSnapshot.fresh(group.ref(), total, currencies.iterator().next(), observedAt);

        if (previous.isPresent() && fresh.isObservedBefore(previous.get())) {
            log.warn("Group {} returned data observed at {}, older than stored {}; keeping stored value",
                    group.getName(), fresh.getObservedAt(), previous.get().getObservedAt());
            return markStale(group, previous, "observation regressed");
        }

        BalanceSnapshot saved = store.save(fresh);
        publish(saved);
        log.debug("Group {} balance: amount={}, currency={}, observedAt={}",
                group.getName(), saved.getAmountMinorUnits(), saved.getCurrency(), saved.getObservedAt());
        return Optional.of(saved);
    }

    private Optional<BalanceSnapshot> markStale(AccountGroup group, Optional<BalanceSnapshot> previous, String why) {
        metrics.recordStaleGroup(group.getBankRef().name());
        if (previous.isEmpty()) {
            log.warn("Group {} has no previous snapshot and this poll failed ({}); omitting it",
                    group.getName(), why);
            return Optional.empty();
        }
        log.warn("Group {} is stale ({}); keeping value observed at {}",
                group.getName(), why, previous.get().getObservedAt());
        return Optional.of(store.save(previous.get().asStale()));
    }

    private void publish(BalanceSnapshot snapshot) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("currency", snapshot.getCurrency());
        attributes.put("observed_at", snapshot.getObservedAt().toString());
        attributes.put("amount_minor_units", snapshot.getAmountMinorUnits());
        statePublisher.publishAsync(new StateUpdate(snapshot.entityId(),
                MinorUnits.toMajorString(snapshot.getAmountMinorUnits()), attributes));
    }

    private void handleCredentials(BankRef bankRef, boolean unauthorized) {
        if (!unauthorized) {
            if (expiredCredentialsNotified.remove(bankRef)) {
                log.info("Credentials for {} accepted again", bankRef);
            }
            return;
        }
        if (expiredCredentialsNotified.add(bankRef)) {
            notifier.notify("Bank access expired",
                    String.format("The access token for %s was rejected. Re-authenticate to resume balance updates.",
                            bankRef));
        }
    }

    private void logFailure(AccountGroup group, MemberOutcome failure) {
        if (failure.getFailureKind() == FailureKind.NOT_FOUND) {
            log.error("Member {} of group {} not found at the bank: {}",
                    failure.getMember(), group.getName(), failure.getError());
        } else {
            log.warn("Fetch failed for member {} of group {}: {}",
                    failure.getMember(), group.getName(), failure.getError());
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * Result of fetching one member: either a balance or a failure.
     */
    @lombok.Value
    private static class MemberOutcome {
        AccountIdentifier member;
        AccountBalance balance;
        FailureKind failureKind;
        String error;

        static MemberOutcome success(AccountIdentifier member, AccountBalance balance) {
            return new MemberOutcome(member, balance, null, null);
        }

        static MemberOutcome failure(AccountIdentifier member, Throwable error) {
            if (error instanceof AccountSourceException) {
                AccountSourceException sourceError = (AccountSourceException) error;
                return new MemberOutcome(member, null, sourceError.getKind(), sourceError.getMessage());
            }
            if (error instanceof TimeoutException) {
                return new MemberOutcome(member, null, null, "timed out");
            }
            return new MemberOutcome(member, null, null, String.valueOf(error));
        }

        boolean isFailed() {
            return balance == null;
        }
    }
}
