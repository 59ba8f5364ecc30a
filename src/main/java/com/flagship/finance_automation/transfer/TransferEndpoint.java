package com.flagship.finance_automation.transfer;

import lombok.Value;

import java.util.Locale;

/**
 * One side of a transfer. Written as {@code account:<id>} or {@code pot:<id>}.
 */
@Value
public class TransferEndpoint {

    public enum Type {
        ACCOUNT,
        POT
    }

    Type type;
    String id;

    public static TransferEndpoint account(String id) {
        return of(Type.ACCOUNT, id);
    }

    public static TransferEndpoint pot(String id) {
        return of(Type.POT, id);
    }

    public static TransferEndpoint of(Type type, String id) {
        if (type == null) {
            throw new IllegalArgumentException("Endpoint type cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Endpoint id cannot be blank");
        }
        return new TransferEndpoint(type, id.trim());
    }

    /**
     * Parses the textual form stored in the ledger.
     */
    public static TransferEndpoint parse(String text) {
        int colon = text == null ? -1 : text.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Invalid transfer endpoint: " + text);
        }
        Type type = Type.valueOf(text.substring(0, colon).toUpperCase(Locale.ROOT));
        return of(type, text.substring(colon + 1));
    }

    public boolean isPot() {
        return type == Type.POT;
    }

    @Override
    public String toString() {
        return type.name().toLowerCase(Locale.ROOT) + ":" + id;
    }
}
