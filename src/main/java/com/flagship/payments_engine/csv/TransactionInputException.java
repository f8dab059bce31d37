package com.flagship.payments_engine.csv;

/**
 * The input as a whole is unusable (missing or malformed header, broken CSV syntax).
 * Unlike {@link EventDecodingException} this aborts the run.
 */
public class TransactionInputException extends RuntimeException {

    public TransactionInputException(String message) {
        super(message);
    }

    public TransactionInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
