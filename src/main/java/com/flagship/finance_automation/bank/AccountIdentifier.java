package com.flagship.finance_automation.bank;

import lombok.Value;

/**
 * One account or card as known to the aggregation API.
 */
@Value
public class AccountIdentifier {

    public enum Kind {
        ACCOUNT,
        CARD
    }

    Kind kind;
    String externalId;

    public static AccountIdentifier account(String externalId) {
        return of(Kind.ACCOUNT, externalId);
    }

    public static AccountIdentifier card(String externalId) {
        return of(Kind.CARD, externalId);
    }

    private static AccountIdentifier of(Kind kind, String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("External id cannot be blank");
        }
        return new AccountIdentifier(kind, externalId.trim());
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + externalId;
    }
}
