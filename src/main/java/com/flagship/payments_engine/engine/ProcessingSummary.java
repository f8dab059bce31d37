package com.flagship.payments_engine.engine;

import lombok.Value;

import java.time.Duration;

/**
 * Counts collected while processing one input.
 */
@Value
public class ProcessingSummary {
    long rowsRead;
    long eventsApplied;
    long eventsIgnored;
    long rowsRejected;
    Duration duration;
}
