package com.flagship.payments_engine.event;

import com.flagship.payments_engine.ledger.PositiveDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * A validated transaction event, ready to be applied to the ledger.
 *
 * The {@link EventType} is the tag; {@code amount} is present exactly when the type
 * carries one (deposit and withdrawal). Instances are only built through the
 * factory methods, which enforce that pairing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEvent {
    EventType type;
    int clientId;
    long transactionId;
    PositiveDecimal amount;

    public static TransactionEvent deposit(int clientId, long transactionId, PositiveDecimal amount) {
        return new TransactionEvent(EventType.DEPOSIT, clientId, transactionId,
            Objects.requireNonNull(amount, "amount"));
    }

    public static TransactionEvent withdrawal(int clientId, long transactionId, PositiveDecimal amount) {
        return new TransactionEvent(EventType.WITHDRAWAL, clientId, transactionId,
            Objects.requireNonNull(amount, "amount"));
    }

    public static TransactionEvent dispute(int clientId, long transactionId) {
        return new TransactionEvent(EventType.DISPUTE, clientId, transactionId, null);
    }

    public static TransactionEvent resolve(int clientId, long transactionId) {
        return new TransactionEvent(EventType.RESOLVE, clientId, transactionId, null);
    }

    public static TransactionEvent chargeback(int clientId, long transactionId) {
        return new TransactionEvent(EventType.CHARGEBACK, clientId, transactionId, null);
    }

    /**
     * Builds an event of the given type. The amount is required for deposit and
     * withdrawal and dropped for the other types.
     */
    public static TransactionEvent of(EventType type, int clientId, long transactionId, PositiveDecimal amount) {
        return switch (type) {
            case DEPOSIT -> deposit(clientId, transactionId, amount);
            case WITHDRAWAL -> withdrawal(clientId, transactionId, amount);
            case DISPUTE -> dispute(clientId, transactionId);
            case RESOLVE -> resolve(clientId, transactionId);
            case CHARGEBACK -> chargeback(clientId, transactionId);
        };
    }
}
