package com.flagship.payments_engine.engine;

import com.flagship.payments_engine.csv.EventDecodingException;
import com.flagship.payments_engine.csv.TransactionCsvReader;
import com.flagship.payments_engine.csv.TransactionRowHandler;
import com.flagship.payments_engine.event.TransactionEvent;
import com.flagship.payments_engine.ledger.LedgerOperationException;
import com.flagship.payments_engine.ledger.LedgerStore;
import com.flagship.payments_engine.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.time.Duration;

/**
 * Feeds transaction events from CSV input into the ledger, in arrival order.
 *
 * Key principles:
 * - Rows that fail to decode are logged and skipped; they never reach the ledger
 * - Events the ledger refuses never stop the stream, whatever the ledger's error mode
 * - Only unreadable or structurally broken input aborts processing
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionEventProcessor {

    static final String ROW_MDC_KEY = "row";

    private final TransactionCsvReader csvReader;
    private final LedgerStore ledgerStore;
    private final EngineMetrics metrics;

    /**
     * Applies every valid event in the input to the ledger.
     *
     * @param input CSV input with a {@code type,client,tx,amount} header
     * @return counts for the processed input
     * @throws IOException if the input cannot be read
     */
    public ProcessingSummary process(Reader input) throws IOException {
        long startTime = System.nanoTime();
        Tally tally = new Tally();

        long rowsRead = csvReader.read(input, tally);

        Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
        metrics.recordRunDuration(duration);

        ProcessingSummary summary = new ProcessingSummary(
            rowsRead, tally.applied, tally.ignored, tally.rejected, duration);
        log.info("Processed input: rows={}, applied={}, ignored={}, rejected={}, duration={}ms",
            summary.getRowsRead(), summary.getEventsApplied(), summary.getEventsIgnored(),
            summary.getRowsRejected(), duration.toMillis());
        return summary;
    }

    private class Tally implements TransactionRowHandler {
        private long applied;
        private long ignored;
        private long rejected;

        @Override
        public void onEvent(long rowNumber, TransactionEvent event) {
            String eventType = event.getType().getCode();
            MDC.put(ROW_MDC_KEY, String.valueOf(rowNumber));
            try {
                if (ledgerStore.apply(event)) {
                    applied++;
                    metrics.recordEventApplied(eventType);
                } else {
                    ignored++;
                    metrics.recordEventIgnored(eventType, null);
                }
            } catch (LedgerOperationException e) {
                ignored++;
                metrics.recordEventIgnored(eventType, e.getRejection().name());
                log.warn("Event refused by ledger: {}", e.getMessage());
            } finally {
                MDC.remove(ROW_MDC_KEY);
            }
        }

        @Override
        public void onRejected(long rowNumber, EventDecodingException error) {
            rejected++;
            metrics.recordRowRejected();
            MDC.put(ROW_MDC_KEY, String.valueOf(rowNumber));
            try {
                log.warn("Skipping invalid row: {}", error.getMessage());
            } finally {
                MDC.remove(ROW_MDC_KEY);
            }
        }
    }
}
