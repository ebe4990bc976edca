package io.aggregator.parse;

import io.aggregator.core.AmountRecord;
import io.aggregator.core.Row;
import io.aggregator.diagnostics.CollectingDiagnosticSink;
import io.aggregator.diagnostics.DiagnosticEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RowParserTest {
    private CollectingDiagnosticSink diagnostics;
    private RowParser parser;

    @BeforeEach
    void setUp() {
        diagnostics = new CollectingDiagnosticSink();
        parser = new RowParser(diagnostics);
    }

    private String rejectReason(String... fields) {
        ParseOutcome out = parser.parse(new Row(7, fields));
        assertFalse(out.isAccepted(), "expected rejection for " + List.of(fields));
        return out.reason().orElseThrow();
    }

    @Test
    void accepts_and_trims_valid_row() {
        ParseOutcome out = parser.parse(new Row(2, " 1 ", "  Alice ", " Engineering", "90000.50 "));
        assertTrue(out.isAccepted());
        assertEquals(new AmountRecord(1, "Alice", "Engineering", 90000.5), out.record().orElseThrow());
        assertTrue(diagnostics.events().isEmpty());
    }

    @Test
    void accepts_zero_and_exponent_amounts() {
        assertEquals(0.0, parser.parse(new Row(2, "1", "A", "G", "0")).record().orElseThrow().amount());
        assertEquals(1500.0, parser.parse(new Row(3, "2", "B", "G", "1.5e3")).record().orElseThrow().amount());
    }

    @Test
    void rejects_wrong_field_count() {
        assertEquals("expected 4 fields but found 3", rejectReason("1", "Alice", "Engineering"));
        assertEquals("expected 4 fields but found 5", rejectReason("1", "Alice", "Engineering", "1", "x"));
    }

    @Test
    void rejects_non_integer_identifier() {
        assertTrue(rejectReason("one", "Alice", "Eng", "1").contains("identifier 'one'"));
        assertTrue(rejectReason("1.5", "Alice", "Eng", "1").contains("not an integer"));
    }

    @Test
    void rejects_blank_name_or_group() {
        assertEquals("name is empty", rejectReason("1", "   ", "Eng", "1"));
        assertEquals("group is empty", rejectReason("1", "Alice", "", "1"));
    }

    @Test
    void rejects_bad_amounts() {
        assertTrue(rejectReason("1", "Bob", "Sales", "Eighty Thousand").contains("not a number"));
        assertTrue(rejectReason("1", "Bob", "Sales", "-1").contains("negative"));
        assertTrue(rejectReason("1", "Bob", "Sales", "NaN").contains("not a number"));
        assertTrue(rejectReason("1", "Bob", "Sales", "Infinity").contains("not a number"));
        assertTrue(rejectReason("1", "Bob", "Sales", "100d").contains("not a number"));
        assertTrue(rejectReason("1", "Bob", "Sales", "1e400").contains("not finite"));
        assertTrue(rejectReason("1", "Bob", "Sales", "").contains("not a number"));
    }

    @Test
    void rejection_emits_row_warning() {
        parser.parse(new Row(12, "x", "Bob", "Sales", "10"));
        List<DiagnosticEvent> events = diagnostics.events();
        assertEquals(1, events.size());
        DiagnosticEvent e = events.get(0);
        assertEquals(DiagnosticEvent.Level.WARN, e.level());
        assertEquals(12L, e.rowNumber());
        assertEquals(List.of("x", "Bob", "Sales", "10"), e.rawRow());
        assertEquals("identifier 'x' is not an integer", e.message());
    }

    @Test
    void distinguishes_out_of_range_identifier() {
        assertEquals("identifier '12345678901234567890' is out of the 64-bit integer range",
                rejectReason("12345678901234567890", "Alice", "Eng", "1"));
        assertEquals(Long.MAX_VALUE, parser.parse(new Row(2, "9223372036854775807", "A", "G", "1")).record().orElseThrow().identifier());
    }
}
