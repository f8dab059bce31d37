package com.flagship.payments_engine.csv;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.payments_engine.event.TransactionEvent;
import com.flagship.payments_engine.ledger.PositiveDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionCsvReaderTest {

    private final TransactionCsvReader reader = new TransactionCsvReader(new CsvMapper(), new TransactionEventDecoder());

    private static class CollectingHandler implements TransactionRowHandler {
        final List<TransactionEvent> events = new ArrayList<>();
        final List<Long> rejectedRows = new ArrayList<>();

        @Override
        public void onEvent(long rowNumber, TransactionEvent event) {
            events.add(event);
        }

        @Override
        public void onRejected(long rowNumber, EventDecodingException error) {
            rejectedRows.add(rowNumber);
        }
    }

    private CollectingHandler read(String csv) throws IOException {
        CollectingHandler handler = new CollectingHandler();
        reader.read(new StringReader(csv), handler);
        return handler;
    }

    @Test
    @DisplayName("Header and well-formed rows produce events in order")
    void testRead_ValidInput() throws IOException {
        CollectingHandler handler = read("""
            type,client,tx,amount
            deposit,1,101,123.45
            withdrawal,2,102,67.89
            dispute,1,101,
            dispute,2,102,
            resolve,1,101,
            chargeback,2,102,
            """);

        assertEquals(List.of(
            TransactionEvent.deposit(1, 101, PositiveDecimal.parse("123.45")),
            TransactionEvent.withdrawal(2, 102, PositiveDecimal.parse("67.89")),
            TransactionEvent.dispute(1, 101),
            TransactionEvent.dispute(2, 102),
            TransactionEvent.resolve(1, 101),
            TransactionEvent.chargeback(2, 102)
        ), handler.events);
        assertTrue(handler.rejectedRows.isEmpty());
    }

    @Test
    @DisplayName("Whitespace around fields is trimmed and blank lines are skipped")
    void testRead_WhitespaceAndBlankLines() throws IOException {
        CollectingHandler handler = read("type, client, tx, amount\n\ndeposit, 1, 1, 1.0\n\n  withdrawal ,1 ,2 , 0.5\n");

        assertEquals(List.of(
            TransactionEvent.deposit(1, 1, PositiveDecimal.parse("1.0")),
            TransactionEvent.withdrawal(1, 2, PositiveDecimal.parse("0.5"))
        ), handler.events);
    }

    @Test
    @DisplayName("Invalid rows are reported with their row number and do not stop reading")
    void testRead_InvalidRowsSkipped() throws IOException {
        CollectingHandler handler = read("""
            type,client,tx,amount
            deposit,1,101,
            deposit,1,102,20,
            deposit,1,abc,def
            __BOGUS__,1,103,3
            deposit,2,104,5
            """);

        assertEquals(List.of(2L, 3L, 4L, 5L), handler.rejectedRows);
        assertEquals(List.of(TransactionEvent.deposit(2, 104, PositiveDecimal.parse("5"))), handler.events);
    }

    @Test
    @DisplayName("Row numbers count non-blank rows only, the header being row 1")
    void testRead_RowNumbersSkipBlankLines() throws IOException {
        CollectingHandler handler = read("type,client,tx,amount\n\ndeposit,1,1,\n\n\nbogus,1,2,1\ndeposit,1,3,1\n");

        assertEquals(List.of(2L, 3L), handler.rejectedRows);
        assertEquals(1, handler.events.size());
    }

    @Test
    @DisplayName("Returns the number of data rows read")
    void testRead_RowCount() throws IOException {
        long rows = reader.read(new StringReader("type,client,tx,amount\ndeposit,1,1,1\nbogus,1,1,1\n"),
            new CollectingHandler());

        assertEquals(2, rows);
    }

    @Test
    @DisplayName("Empty input fails as a whole")
    void testRead_EmptyInput() {
        assertThrows(TransactionInputException.class, () -> read(""));
    }

    @Test
    @DisplayName("Wrong header fails as a whole")
    void testRead_WrongHeader() {
        TransactionInputException e = assertThrows(TransactionInputException.class,
            () -> read("bogus_headers\ndeposit,1,101,123.45\n"));

        assertTrue(e.getMessage().contains("header"));
    }

    @Test
    @DisplayName("Header matching ignores case")
    void testRead_HeaderCaseInsensitive() throws IOException {
        CollectingHandler handler = read("Type,Client,TX,Amount\ndeposit,1,1,1\n");

        assertEquals(1, handler.events.size());
    }
}
