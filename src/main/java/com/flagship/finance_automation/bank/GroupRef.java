package com.flagship.finance_automation.bank;

import lombok.Value;

/**
 * Reference to an account group, written as {@code BANK/group} in configuration.
 */
@Value
public class GroupRef {

    BankRef bankRef;
    String groupName;

    public static GroupRef of(BankRef bankRef, String groupName) {
        if (bankRef == null) {
            throw new IllegalArgumentException("Bank cannot be null");
        }
        if (groupName == null || groupName.isBlank()) {
            throw new IllegalArgumentException("Group name cannot be blank");
        }
        return new GroupRef(bankRef, groupName.trim());
    }

    /**
     * Parses {@code BANK/group}.
     *
     * @throws IllegalArgumentException on a malformed reference or unknown bank
     */
    public static GroupRef parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Group reference cannot be null");
        }
        int slash = text.indexOf('/');
        if (slash <= 0 || slash == text.length() - 1) {
            throw new IllegalArgumentException("Group reference must be BANK/group: " + text);
        }
        return of(BankRef.fromConfigKey(text.substring(0, slash)), text.substring(slash + 1));
    }

    @Override
    public String toString() {
        return bankRef.name() + "/" + groupName;
    }
}
