package com.flagship.finance_automation.balance;

import com.flagship.finance_automation.bank.BankRef;
import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Latest persisted snapshot of an account group.
 *
 * No setters: rows are created with {@link #fromDomain} and changed only
 * through {@link #updateFromDomain}.
 */
@Entity
@Table(name = "balance_snapshots")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BalanceSnapshotEntity {

    @EmbeddedId
    private BalanceSnapshotId id;

    @Column(name = "amount_minor_units", nullable = false)
    private long amountMinorUnits;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    @Column(nullable = false)
    private boolean stale;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void onWrite() {
        this.updatedAt = Instant.now();
    }

    static BalanceSnapshotEntity fromDomain(BalanceSnapshot snapshot) {
        BalanceSnapshotEntity entity = new BalanceSnapshotEntity();
        entity.id = idOf(snapshot);
        entity.updateFromDomain(snapshot);
        return entity;
    }

    void updateFromDomain(BalanceSnapshot snapshot) {
        if (!idOf(snapshot).equals(this.id)) {
            throw new IllegalArgumentException("Snapshot does not belong to " + id.getBankRef() + "/" + id.getGroupName());
        }
        this.amountMinorUnits = snapshot.getAmountMinorUnits();
        this.currency = snapshot.getCurrency();
        this.observedAt = snapshot.getObservedAt();
        this.stale = snapshot.isStale();
    }

    BalanceSnapshot toDomain() {
        return new BalanceSnapshot(BankRef.valueOf(id.getBankRef()), id.getGroupName(), amountMinorUnits,
                currency, observedAt, stale);
    }

    static BalanceSnapshotId idOf(BalanceSnapshot snapshot) {
        return new BalanceSnapshotId(snapshot.getBankRef().name(), snapshot.getGroupName());
    }
}
