package com.flagship.payments_engine.ledger;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Mutable state of a single client account.
 *
 * Not thread-safe on its own: {@link InMemoryLedgerStore} holds the account's monitor
 * for every read-modify-write and for every snapshot.
 * A transaction id is in at most one of {@code openTransactions} and {@code heldTransactions}.
 */
class Account {

    private BigDecimal available = BigDecimal.ZERO;
    private BigDecimal held = BigDecimal.ZERO;
    private boolean locked;

    private final Map<Long, TransactionRecord> openTransactions = new HashMap<>();
    private final Map<Long, TransactionRecord> heldTransactions = new HashMap<>();

    BigDecimal getAvailable() {
        return available;
    }

    BigDecimal getHeld() {
        return held;
    }

    boolean isLocked() {
        return locked;
    }

    void credit(BigDecimal amount) {
        available = available.add(amount);
    }

    void debit(BigDecimal amount) {
        available = available.subtract(amount);
    }

    void hold(BigDecimal amount) {
        held = held.add(amount);
        available = available.subtract(amount);
    }

    void release(BigDecimal amount) {
        held = held.subtract(amount);
        available = available.add(amount);
    }

    void forfeit(BigDecimal amount) {
        held = held.subtract(amount);
        locked = true;
    }

    void recordOpen(long transactionId, TransactionRecord transaction) {
        heldTransactions.remove(transactionId);
        openTransactions.put(transactionId, transaction);
    }

    TransactionRecord findOpen(long transactionId) {
        return openTransactions.get(transactionId);
    }

    TransactionRecord findHeld(long transactionId) {
        return heldTransactions.get(transactionId);
    }

    void moveToHeld(long transactionId) {
        TransactionRecord transaction = openTransactions.remove(transactionId);
        heldTransactions.put(transactionId, transaction);
    }

    void moveToOpen(long transactionId) {
        TransactionRecord transaction = heldTransactions.remove(transactionId);
        openTransactions.put(transactionId, transaction);
    }

    void discardHeld(long transactionId) {
        heldTransactions.remove(transactionId);
    }

    AccountSnapshot snapshot(int clientId) {
        return new AccountSnapshot(clientId, available, held, available.add(held), locked);
    }
}
