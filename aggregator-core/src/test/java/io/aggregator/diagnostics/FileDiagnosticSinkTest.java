package io.aggregator.diagnostics;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileDiagnosticSinkTest {
    @Test
    void appends_one_json_line_per_event() throws Exception {
        Path tmp = Files.createTempDirectory("diag-test");
        try {
            Path file = tmp.resolve("nested").resolve("diagnostics.jsonl");
            FileDiagnosticSink sink = new FileDiagnosticSink(file);
            sink.accept(DiagnosticEvent.info("Processing in.csv"));
            sink.accept(DiagnosticEvent.rowWarning("amount 'x' is not a number", 3, List.of("2", "Bob \"B\"", "Sales", "x")));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            assertEquals(2, lines.size());
            assertTrue(lines.get(0).contains("\"level\":\"INFO\""));
            assertTrue(lines.get(0).contains("\"message\":\"Processing in.csv\""));
            assertFalse(lines.get(0).contains("\"row\""));
            assertTrue(lines.get(1).contains("\"level\":\"WARN\""));
            assertTrue(lines.get(1).contains("\"message\":\"amount 'x' is not a number\""));
            assertTrue(lines.get(1).contains("\"row\":3"));
            assertTrue(lines.get(1).endsWith(",\"raw\":[\"2\",\"Bob \\\"B\\\"\",\"Sales\",\"x\"]}"));
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }

    @Test
    void escapes_control_characters_and_nulls() {
        assertEquals("a\\nb\\tc\\\\d\\u0001", FileDiagnosticSink.escape("a\nb\tc\\d\u0001"));
        var e = DiagnosticEvent.rowWarning("bad", 2, Arrays.asList("1", null));
        assertEquals(Arrays.asList("1", null), e.rawRow());
    }

    @Test
    void composite_fans_out_in_order() {
        var a = new CollectingDiagnosticSink();
        var b = new CollectingDiagnosticSink();
        var composite = new CompositeDiagnosticSink(List.of(a, b));
        composite.accept(DiagnosticEvent.error("broken"));
        assertEquals(1, a.events().size());
        assertEquals(a.events(), b.events());
    }
}
