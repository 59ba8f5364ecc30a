package com.flagship.finance_automation.balance;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of a balance snapshot: one row per (bank, group).
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class BalanceSnapshotId implements Serializable {

    @Column(name = "bank_ref", nullable = false, length = 32)
    private String bankRef;

    @Column(name = "group_name", nullable = false, length = 100)
    private String groupName;
}
