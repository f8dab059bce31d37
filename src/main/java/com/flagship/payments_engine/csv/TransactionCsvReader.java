package com.flagship.payments_engine.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.flagship.payments_engine.event.TransactionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Streams transaction rows out of CSV input, one row at a time.
 *
 * The first non-blank row must be the header {@code type,client,tx,amount}. Every following row
 * is handed to the {@link TransactionEventDecoder}; the handler is told whether it produced an
 * event or was rejected. Rows are read as plain string arrays so that rows with the wrong
 * number of fields reach the decoder instead of breaking the stream.
 */
@Component
@Slf4j
public class TransactionCsvReader {

    static final List<String> HEADER = List.of("type", "client", "tx", "amount");

    private final ObjectReader rowReader;
    private final TransactionEventDecoder decoder;

    public TransactionCsvReader(CsvMapper csvMapper, TransactionEventDecoder decoder) {
        this.rowReader = csvMapper.readerFor(String[].class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .with(CsvParser.Feature.TRIM_SPACES)
            .with(CsvParser.Feature.SKIP_EMPTY_LINES)
            .without(CsvParser.Feature.ALLOW_TRAILING_COMMA);
        this.decoder = decoder;
    }

    /**
     * Reads all rows from the input, reporting each one to the handler.
     *
     * @return number of data rows read (excluding the header)
     * @throws TransactionInputException if the header is missing or wrong, or the CSV cannot be parsed
     * @throws IOException if the input cannot be read
     */
    public long read(Reader input, TransactionRowHandler handler) throws IOException {
        try (MappingIterator<String[]> rows = rowReader.readValues(input)) {
            if (!rows.hasNextValue()) {
                throw new TransactionInputException("Input is empty, expected header " + String.join(",", HEADER));
            }
            verifyHeader(rows.nextValue());

            long rowNumber = 1;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                rowNumber++;
                TransactionEvent event;
                try {
                    event = decoder.decode(row);
                } catch (EventDecodingException e) {
                    handler.onRejected(rowNumber, e);
                    continue;
                }
                handler.onEvent(rowNumber, event);
            }
            return rowNumber - 1;
        } catch (JsonProcessingException e) {
            throw new TransactionInputException("Malformed CSV input: " + e.getOriginalMessage(), e);
        }
    }

    private void verifyHeader(String[] header) {
        List<String> actual = Arrays.stream(header)
            .map(column -> column.trim().toLowerCase(Locale.ROOT))
            .toList();
        if (!HEADER.equals(actual)) {
            throw new TransactionInputException(
                String.format("Unexpected header %s, expected %s", actual, HEADER));
        }
        log.debug("Header verified: {}", actual);
    }
}
