package com.flagship.finance_automation.pot;

import com.flagship.finance_automation.bank.GroupRef;
import lombok.Builder;
import lombok.Value;

/**
 * A savings pot at the transfer provider.
 *
 * A pot without a target group has no automatic target and only receives
 * discretionary contributions (auto-save).
 */
@Value
@Builder
public class Pot {

    String name;
    String potId;
    String purpose;
    /**
     * Account that funds top-ups and receives withdrawals.
     */
    String fundingAccountId;
    GroupRef balanceGroup;
    GroupRef targetGroup;
    GroupRef fundingGroup;
    long minimumDelta;
    long minimumRemainder;
    long maximumAutoTopUp;
    boolean withdrawalsEnabled;

    public boolean hasTarget() {
        return targetGroup != null;
    }
}
