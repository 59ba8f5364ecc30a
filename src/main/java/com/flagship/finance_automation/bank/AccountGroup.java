package com.flagship.finance_automation.bank;

import lombok.Value;

import java.util.List;

/**
 * Named set of accounts and cards of one bank whose balances are summed.
 */
@Value
public class AccountGroup {

    BankRef bankRef;
    String name;
    List<AccountIdentifier> members;

    public static AccountGroup of(BankRef bankRef, String name, List<AccountIdentifier> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException(
                    String.format("Account group %s/%s has no members", bankRef, name));
        }
        GroupRef ref = GroupRef.of(bankRef, name);
        return new AccountGroup(ref.getBankRef(), ref.getGroupName(), List.copyOf(members));
    }

    public GroupRef ref() {
        return GroupRef.of(bankRef, name);
    }
}
