package com.flagship.payments_engine.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link LedgerStore} backed by a concurrent map of accounts.
 *
 * Key principles:
 * - Accounts are created on first deposit and never removed
 * - Each operation runs under the account's monitor, so updates to one client are serialized
 *   while different clients proceed independently
 * - available and held are always changed together under that monitor, so snapshots never
 *   see one without the other
 * - Refused operations never modify state; the {@link ErrorMode} decides whether they are
 *   logged and ignored or thrown
 */
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final ConcurrentMap<Integer, Account> accounts = new ConcurrentHashMap<>();
    private final ErrorMode errorMode;

    public InMemoryLedgerStore(ErrorMode errorMode) {
        this.errorMode = errorMode;
    }

    public InMemoryLedgerStore() {
        this(ErrorMode.PERMISSIVE);
    }

    public ErrorMode getErrorMode() {
        return errorMode;
    }

    @Override
    public boolean deposit(int clientId, long transactionId, PositiveDecimal amount) {
        Account account = accounts.computeIfAbsent(clientId, id -> new Account());
        synchronized (account) {
            account.credit(amount.getValue());
            account.recordOpen(transactionId, TransactionRecord.deposit(amount));
        }
        return true;
    }

    @Override
    public boolean withdraw(int clientId, long transactionId, PositiveDecimal amount) {
        Account account = accounts.get(clientId);
        if (account == null) {
            return refuse(LedgerRejection.UNKNOWN_CLIENT, "withdraw", clientId, transactionId);
        }
        synchronized (account) {
            if (account.isLocked()) {
                return refuse(LedgerRejection.ACCOUNT_LOCKED, "withdraw", clientId, transactionId);
            }
            if (account.getAvailable().compareTo(amount.getValue()) < 0) {
                return refuse(LedgerRejection.INSUFFICIENT_FUNDS, "withdraw", clientId, transactionId);
            }
            account.debit(amount.getValue());
            account.recordOpen(transactionId, TransactionRecord.withdrawal(amount));
        }
        return true;
    }

    @Override
    public boolean dispute(int clientId, long transactionId) {
        Account account = accounts.get(clientId);
        if (account == null) {
            return refuse(LedgerRejection.UNKNOWN_CLIENT, "dispute", clientId, transactionId);
        }
        synchronized (account) {
            if (account.isLocked()) {
                return refuse(LedgerRejection.ACCOUNT_LOCKED, "dispute", clientId, transactionId);
            }
            TransactionRecord transaction = account.findOpen(transactionId);
            if (transaction == null) {
                return refuse(LedgerRejection.TRANSACTION_NOT_FOUND, "dispute", clientId, transactionId);
            }
            account.moveToHeld(transactionId);
            account.hold(transaction.typeAdjustedAmount());
        }
        return true;
    }

    @Override
    public boolean resolve(int clientId, long transactionId) {
        Account account = accounts.get(clientId);
        if (account == null) {
            return refuse(LedgerRejection.UNKNOWN_CLIENT, "resolve", clientId, transactionId);
        }
        synchronized (account) {
            if (account.isLocked()) {
                return refuse(LedgerRejection.ACCOUNT_LOCKED, "resolve", clientId, transactionId);
            }
            TransactionRecord transaction = account.findHeld(transactionId);
            if (transaction == null) {
                return refuse(LedgerRejection.TRANSACTION_NOT_FOUND, "resolve", clientId, transactionId);
            }
            account.moveToOpen(transactionId);
            account.release(transaction.typeAdjustedAmount());
        }
        return true;
    }

    @Override
    public boolean chargeback(int clientId, long transactionId) {
        Account account = accounts.get(clientId);
        if (account == null) {
            return refuse(LedgerRejection.UNKNOWN_CLIENT, "chargeback", clientId, transactionId);
        }
        synchronized (account) {
            if (account.isLocked()) {
                return refuse(LedgerRejection.ACCOUNT_LOCKED, "chargeback", clientId, transactionId);
            }
            TransactionRecord transaction = account.findHeld(transactionId);
            if (transaction == null) {
                return refuse(LedgerRejection.TRANSACTION_NOT_FOUND, "chargeback", clientId, transactionId);
            }
            account.discardHeld(transactionId);
            BigDecimal amount = transaction.typeAdjustedAmount();
            account.forfeit(amount);
            log.info("Account locked after chargeback: client={}, tx={}, amount={}",
                clientId, transactionId, amount.toPlainString());
        }
        return true;
    }

    @Override
    public List<AccountSnapshot> snapshotAll() {
        return accounts.entrySet().stream()
            .map(entry -> {
                Account account = entry.getValue();
                synchronized (account) {
                    return account.snapshot(entry.getKey());
                }
            })
            .sorted(Comparator.comparingInt(AccountSnapshot::getClientId))
            .toList();
    }

    private boolean refuse(LedgerRejection rejection, String operation, int clientId, long transactionId) {
        if (errorMode == ErrorMode.STRICT) {
            throw new LedgerOperationException(rejection, operation, clientId, transactionId);
        }
        log.debug("Ignoring {}: reason={}, client={}, tx={}", operation, rejection, clientId, transactionId);
        return false;
    }
}
