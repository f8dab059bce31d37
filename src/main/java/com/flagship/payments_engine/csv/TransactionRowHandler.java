package com.flagship.payments_engine.csv;

import com.flagship.payments_engine.event.TransactionEvent;

/**
 * Receives the outcome of each data row read by {@link TransactionCsvReader}.
 * Row numbers count non-blank rows, the header being row 1.
 */
public interface TransactionRowHandler {

    void onEvent(long rowNumber, TransactionEvent event);

    void onRejected(long rowNumber, EventDecodingException error);
}
