package com.flagship.payments_engine.ledger;

import com.flagship.payments_engine.event.TransactionEvent;

import java.util.List;

/**
 * Store of client accounts and the transactions that can still be disputed.
 *
 * Every mutating operation returns {@code true} when the ledger changed and {@code false}
 * when the event was ignored. Whether a refused event is ignored or reported as a
 * {@link LedgerOperationException} depends on the store's {@link ErrorMode}.
 *
 * Implementations must serialize mutations per client and give snapshots a consistent
 * per-account view; different clients may be mutated concurrently.
 */
public interface LedgerStore {

    /**
     * Credits available funds. Allowed even on a locked account.
     * Repeating a transaction id for the same client overwrites the retained record.
     */
    boolean deposit(int clientId, long transactionId, PositiveDecimal amount);

    /**
     * Debits available funds if the account exists, is not locked and has enough available.
     */
    boolean withdraw(int clientId, long transactionId, PositiveDecimal amount);

    /**
     * Moves an open transaction's type-adjusted amount from available to held.
     */
    boolean dispute(int clientId, long transactionId);

    /**
     * Reverses a dispute: the held amount goes back to available and the transaction reopens.
     */
    boolean resolve(int clientId, long transactionId);

    /**
     * Finalizes a dispute: the held amount is removed for good and the account is locked.
     */
    boolean chargeback(int clientId, long transactionId);

    /**
     * @return one snapshot per known client, ordered by ascending client id
     */
    List<AccountSnapshot> snapshotAll();

    /**
     * Routes an event to the matching operation.
     */
    default boolean apply(TransactionEvent event) {
        int clientId = event.getClientId();
        long transactionId = event.getTransactionId();
        return switch (event.getType()) {
            case DEPOSIT -> deposit(clientId, transactionId, event.getAmount());
            case WITHDRAWAL -> withdraw(clientId, transactionId, event.getAmount());
            case DISPUTE -> dispute(clientId, transactionId);
            case RESOLVE -> resolve(clientId, transactionId);
            case CHARGEBACK -> chargeback(clientId, transactionId);
        };
    }
}
