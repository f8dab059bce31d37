package com.flagship.payments_engine.engine;

import com.flagship.payments_engine.csv.AccountSnapshotCsvWriter;
import com.flagship.payments_engine.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: {@code payments-engine <input.csv>}.
 *
 * Reads the transaction file, applies it to the ledger and prints one CSV row per account
 * to standard output. Logging goes to standard error, so stdout carries only the result.
 * Disabled with {@code engine.runner.enabled=false} (tests).
 */
@Component
@ConditionalOnProperty(name = "engine.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaymentsEngineRunner implements ApplicationRunner {

    static final String USAGE = "Usage: payments-engine <input.csv>";

    private final TransactionEventProcessor processor;
    private final LedgerStore ledgerStore;
    private final AccountSnapshotCsvWriter snapshotWriter;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> files = args.getNonOptionArgs();
        if (files.size() != 1) {
            throw new IllegalArgumentException(USAGE);
        }
        run(Path.of(files.get(0)), System.out);
    }

    /**
     * Processes one input file and writes the account snapshots to {@code out}.
     *
     * @throws IOException if the file cannot be read or the output cannot be written
     */
    public void run(Path input, PrintStream out) throws IOException {
        log.info("Reading transactions from {}", input);
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            processor.process(reader);
        }

        String csv = snapshotWriter.write(ledgerStore.snapshotAll());
        if (!csv.isEmpty()) {
            out.print(csv);
        }
        out.flush();
        if (out.checkError()) {
            throw new IOException("Failed to write account snapshots");
        }
    }
}
