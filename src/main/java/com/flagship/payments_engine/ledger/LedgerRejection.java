package com.flagship.payments_engine.ledger;

/**
 * Reason a ledger operation was refused.
 */
public enum LedgerRejection {
    UNKNOWN_CLIENT,
    ACCOUNT_LOCKED,
    TRANSACTION_NOT_FOUND,
    INSUFFICIENT_FUNDS
}
