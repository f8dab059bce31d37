package com.flagship.payments_engine.ledger;

import lombok.Getter;

/**
 * Thrown by a {@link ErrorMode#STRICT} ledger when an operation's preconditions fail.
 * The ledger has not been modified when this is thrown.
 */
@Getter
public class LedgerOperationException extends IllegalStateException {

    private final LedgerRejection rejection;
    private final String operation;
    private final int clientId;
    private final long transactionId;

    public LedgerOperationException(LedgerRejection rejection, String operation, int clientId, long transactionId) {
        super(String.format("Cannot %s: %s (client=%d, tx=%d)",
            operation, describe(rejection), clientId, transactionId));
        this.rejection = rejection;
        this.operation = operation;
        this.clientId = clientId;
        this.transactionId = transactionId;
    }

    private static String describe(LedgerRejection rejection) {
        return switch (rejection) {
            case UNKNOWN_CLIENT -> "account does not exist";
            case ACCOUNT_LOCKED -> "account is locked";
            case TRANSACTION_NOT_FOUND -> "transaction not found in the required state";
            case INSUFFICIENT_FUNDS -> "insufficient available funds";
        };
    }
}
