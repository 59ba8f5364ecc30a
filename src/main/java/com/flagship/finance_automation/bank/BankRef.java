package com.flagship.finance_automation.bank;

import java.util.Locale;

/**
 * Banks connected through the account aggregation API.
 */
public enum BankRef {
    AMEX,
    HSBC,
    MONZO,
    SANTANDER,
    STARLING,
    STARLING_JOINT;

    /**
     * Resolves a configuration key. Case-insensitive; spaces and hyphens map to underscores.
     *
     * @throws IllegalArgumentException if the key names no known bank
     */
    public static BankRef fromConfigKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Bank key cannot be blank");
        }
        String normalized = key.trim()
                .toUpperCase(Locale.ROOT)
                .replace(' ', '_')
                .replace('-', '_');
        for (BankRef bankRef : values()) {
            if (bankRef.name().equals(normalized)) {
                return bankRef;
            }
        }
        throw new IllegalArgumentException("Unknown bank: " + key);
    }

    /**
     * Lower-case form used in entity ids and metric tags.
     */
    public String slug() {
        return name().toLowerCase(Locale.ROOT);
    }
}
