package com.flagship.payments_engine.event;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The five transaction event kinds accepted by the engine.
 */
public enum EventType {
    DEPOSIT("deposit", true),
    WITHDRAWAL("withdrawal", true),
    DISPUTE("dispute", false),
    RESOLVE("resolve", false),
    CHARGEBACK("chargeback", false);

    private final String code;
    private final boolean carriesAmount;

    EventType(String code, boolean carriesAmount) {
        this.code = code;
        this.carriesAmount = carriesAmount;
    }

    /**
     * Wire name used in the input file's {@code type} column.
     */
    public String getCode() {
        return code;
    }

    /**
     * Whether events of this type require an amount.
     */
    public boolean carriesAmount() {
        return carriesAmount;
    }

    /**
     * Looks up a type by its wire name, ignoring case and surrounding whitespace.
     */
    public static Optional<EventType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.code.equals(normalized))
            .findFirst();
    }
}
