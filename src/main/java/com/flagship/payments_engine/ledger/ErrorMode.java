package com.flagship.payments_engine.ledger;

import java.util.Locale;

/**
 * How the ledger reacts when an event's preconditions do not hold.
 */
public enum ErrorMode {
    /**
     * Log at debug level and ignore the event.
     * Suited to untrusted, unordered feeds where one stale event must not stop the stream.
     */
    PERMISSIVE,

    /**
     * Throw a {@link LedgerOperationException} describing the refusal.
     * State is left untouched.
     */
    STRICT;

    public static ErrorMode fromProperty(String value) {
        if (value == null || value.isBlank()) {
            return PERMISSIVE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                String.format("Unknown error mode '%s'. Expected 'permissive' or 'strict'.", value), e);
        }
    }
}
