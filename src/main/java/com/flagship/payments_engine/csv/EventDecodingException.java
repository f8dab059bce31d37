package com.flagship.payments_engine.csv;

/**
 * A single input row could not be turned into a valid event.
 * The row is skipped; processing continues with the next one.
 */
public class EventDecodingException extends IllegalArgumentException {

    public EventDecodingException(String message) {
        super(message);
    }

    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
