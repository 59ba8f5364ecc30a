package com.flagship.finance_automation.observability;

import com.flagship.finance_automation.balance.BalanceSnapshotStore;
import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.transfer.TransferLedger;
import com.flagship.finance_automation.transfer.TransferStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Custom health indicators for the finance automation service.
 */
public class HealthIndicators {

    /**
     * DOWN while any transfer is ABANDONED: a human has to check the provider.
     * WARNING while a RESERVED transfer is older than the stale threshold.
     */
    @Component("transferLedgerHealth")
    public static class TransferLedgerHealthIndicator implements HealthIndicator {

        private final TransferLedger ledger;
        private final FinanceConfiguration configuration;
        private final Clock clock;

        public TransferLedgerHealthIndicator(TransferLedger ledger, FinanceConfiguration configuration, Clock clock) {
            this.ledger = ledger;
            this.configuration = configuration;
            this.clock = clock;
        }

        @Override
        public Health health() {
            try {
                Map<TransferStatus, Long> counts = ledger.countByStatus();
                long abandoned = counts.get(TransferStatus.ABANDONED);
                Instant cutoff = clock.instant().minus(configuration.getTransfers().getStaleReservationAfter());
                long staleReserved = ledger.findReservedOlderThan(cutoff).size();

                Health.Builder builder = abandoned > 0
                        ? Health.down()
                        : staleReserved > 0
                        ? Health.status("WARNING")
                        : Health.up();

                return builder
                        .withDetail("abandoned", abandoned)
                        .withDetail("reserved", counts.get(TransferStatus.RESERVED))
                        .withDetail("staleReserved", staleReserved)
                        .withDetail("committed", counts.get(TransferStatus.COMMITTED))
                        .withDetail("failed", counts.get(TransferStatus.FAILED))
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * WARNING while any account group is reporting a stale balance.
     */
    @Component("balanceFreshnessHealth")
    public static class BalanceFreshnessHealthIndicator implements HealthIndicator {

        private final BalanceSnapshotStore store;

        public BalanceFreshnessHealthIndicator(BalanceSnapshotStore store) {
            this.store = store;
        }

        @Override
        public Health health() {
            try {
                long stale = store.countStale();
                Health.Builder builder = stale > 0 ? Health.status("WARNING") : Health.up();
                return builder
                        .withDetail("staleGroups", stale)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
