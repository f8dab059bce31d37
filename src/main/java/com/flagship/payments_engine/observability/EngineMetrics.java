package com.flagship.payments_engine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for event processing.
 *
 * Metrics exposed:
 * - engine.events.applied: events that changed the ledger, tagged by event_type
 * - engine.events.ignored: events the ledger refused, tagged by event_type and reason
 * - engine.rows.rejected: input rows that could not be decoded
 * - engine.run.duration: time taken to process one input
 */
@Component
public class EngineMetrics {

    private final MeterRegistry registry;
    private final Counter rowsRejected;
    private final Timer runTimer;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.rowsRejected = Counter.builder("engine.rows.rejected")
                .description("Number of input rows rejected before reaching the ledger")
                .register(registry);

        this.runTimer = Timer.builder("engine.run.duration")
                .description("Time taken to process one transaction input")
                .register(registry);
    }

    public void recordEventApplied(String eventType) {
        registry.counter("engine.events.applied",
                "event_type", sanitizeTag(eventType)
        ).increment();
    }

    /**
     * Records a refused event. Permissive stores do not report a reason, so it may be null.
     */
    public void recordEventIgnored(String eventType, String reason) {
        registry.counter("engine.events.ignored",
                "event_type", sanitizeTag(eventType),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordRowRejected() {
        rowsRejected.increment();
    }

    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    /**
     * Keeps tag values to a small, safe character set.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
