package com.flagship.payments_engine.ledger;

/**
 * Thrown when a deposit or withdrawal amount is missing, zero, negative or not a number.
 */
public class InvalidAmountException extends IllegalArgumentException {

    public InvalidAmountException(String message) {
        super(message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(message, cause);
    }
}
