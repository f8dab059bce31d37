package com.flagship.payments_engine.ledger;

/**
 * Kind of a transaction retained for later disputes.
 * Only money-moving transactions are retained; dispute, resolve and chargeback refer to them.
 */
public enum TransactionKind {
    DEPOSIT,
    WITHDRAWAL
}
