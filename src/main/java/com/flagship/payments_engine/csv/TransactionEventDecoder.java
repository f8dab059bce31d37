package com.flagship.payments_engine.csv;

import com.flagship.payments_engine.event.EventType;
import com.flagship.payments_engine.event.TransactionEvent;
import com.flagship.payments_engine.ledger.InvalidAmountException;
import com.flagship.payments_engine.ledger.PositiveDecimal;
import org.springframework.stereotype.Component;

/**
 * Turns one raw CSV row ({@code type, client, tx, amount}) into a validated {@link TransactionEvent}.
 *
 * Rules enforced here, so the ledger never sees an invalid event:
 * - type must be one of the five known types (case-insensitive)
 * - client must fit an unsigned 16-bit integer, tx an unsigned 32-bit integer
 * - deposit and withdrawal need exactly four fields and a positive amount
 * - dispute, resolve and chargeback may omit the amount column; if an amount is given it must still be valid
 */
@Component
public class TransactionEventDecoder {

    static final int MAX_CLIENT_ID = 0xFFFF;
    static final long MAX_TRANSACTION_ID = 0xFFFF_FFFFL;

    private static final int FIELD_COUNT = 4;

    /**
     * @throws EventDecodingException if the row is malformed or fails validation
     */
    public TransactionEvent decode(String[] row) {
        if (row == null || row.length == 0) {
            throw new EventDecodingException("Empty row");
        }
        if (row.length > FIELD_COUNT || row.length < FIELD_COUNT - 1) {
            throw new EventDecodingException(
                String.format("Expected %d fields but found %d", FIELD_COUNT, row.length));
        }

        EventType type = EventType.fromCode(row[0])
            .orElseThrow(() -> new EventDecodingException("Unknown transaction type: " + row[0]));

        if (type.carriesAmount() && row.length != FIELD_COUNT) {
            throw new EventDecodingException(
                String.format("Expected %d fields for %s but found %d", FIELD_COUNT, type.getCode(), row.length));
        }

        int clientId = parseClientId(row[1]);
        long transactionId = parseTransactionId(row[2]);
        String rawAmount = row.length == FIELD_COUNT ? row[3] : null;

        PositiveDecimal amount = null;
        if (type.carriesAmount() || (rawAmount != null && !rawAmount.isBlank())) {
            try {
                amount = PositiveDecimal.parse(rawAmount);
            } catch (InvalidAmountException e) {
                throw new EventDecodingException(
                    String.format("Invalid amount for %s: %s", type.getCode(), e.getMessage()), e);
            }
        }

        return TransactionEvent.of(type, clientId, transactionId, amount);
    }

    private int parseClientId(String value) {
        long parsed = parseUnsigned("client", value, MAX_CLIENT_ID);
        return (int) parsed;
    }

    private long parseTransactionId(String value) {
        return parseUnsigned("tx", value, MAX_TRANSACTION_ID);
    }

    private long parseUnsigned(String field, String value, long max) {
        if (value == null || value.isBlank()) {
            throw new EventDecodingException("Missing " + field);
        }
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new EventDecodingException(String.format("Invalid %s: %s", field, value), e);
        }
        if (parsed < 0 || parsed > max) {
            throw new EventDecodingException(
                String.format("%s out of range [0, %d]: %s", field, max, value));
        }
        return parsed;
    }
}
