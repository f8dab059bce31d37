package com.flagship.payments_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * The fact kept per deposit or withdrawal so it can be disputed later.
 *
 * The type-adjusted amount is what a dispute moves between available and held funds:
 * positive for a deposit, negative for a withdrawal. Using the signed value means a
 * disputed withdrawal hands its funds back to available on resolve.
 */
@Value
public class TransactionRecord {
    TransactionKind kind;
    BigDecimal amount;

    public static TransactionRecord deposit(PositiveDecimal amount) {
        return new TransactionRecord(TransactionKind.DEPOSIT, amount.getValue());
    }

    public static TransactionRecord withdrawal(PositiveDecimal amount) {
        return new TransactionRecord(TransactionKind.WITHDRAWAL, amount.getValue());
    }

    public BigDecimal typeAdjustedAmount() {
        return switch (kind) {
            case DEPOSIT -> amount;
            case WITHDRAWAL -> amount.negate();
        };
    }
}
