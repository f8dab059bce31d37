package com.flagship.payments_engine.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.payments_engine.ledger.AccountSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Serializes account snapshots as CSV with a {@code client,available,held,total,locked} header.
 */
@Component
public class AccountSnapshotCsvWriter {

    private final ObjectWriter rowWriter;

    public AccountSnapshotCsvWriter(CsvMapper csvMapper) {
        CsvSchema schema = csvMapper.schemaFor(AccountSnapshotRow.class)
            .withHeader()
            .withLineSeparator("\n");
        this.rowWriter = csvMapper.writer(schema);
    }

    /**
     * Renders the snapshots in the given order. Returns an empty string when there are none,
     * without a header line.
     */
    public String write(List<AccountSnapshot> snapshots) throws JsonProcessingException {
        if (snapshots.isEmpty()) {
            return "";
        }
        List<AccountSnapshotRow> rows = snapshots.stream()
            .map(AccountSnapshotRow::fromSnapshot)
            .toList();
        return rowWriter.writeValueAsString(rows);
    }
}
