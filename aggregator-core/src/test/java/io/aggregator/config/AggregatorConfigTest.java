package io.aggregator.config;

import io.aggregator.source.CsvParserFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class AggregatorConfigTest {
    @AfterEach
    void clearProperties() {
        System.clearProperty("aggregator.input");
        System.clearProperty("aggregator.delimiter");
        System.clearProperty("aggregator.charset");
        System.clearProperty("aggregator.diagnostics");
        System.clearProperty("aggregator.maxColumns");
        System.clearProperty("aggregator.maxCharsPerColumn");
    }

    @Test
    void reads_system_properties() {
        System.setProperty("aggregator.input", "data/employees.csv");
        System.setProperty("aggregator.delimiter", "tab");
        System.setProperty("aggregator.charset", "ISO-8859-1");
        System.setProperty("aggregator.diagnostics", "out/diag.jsonl");
        AggregatorConfig cfg = AggregatorConfig.fromEnv();
        assertEquals(Path.of("data/employees.csv"), cfg.input());
        assertEquals('\t', cfg.delimiter());
        assertEquals(StandardCharsets.ISO_8859_1, cfg.charset());
        assertEquals(Path.of("out/diag.jsonl"), cfg.diagnosticsFile());
    }

    @Test
    void parses_delimiter_names() {
        assertEquals(',', AggregatorConfig.parseDelimiter(","));
        assertEquals(';', AggregatorConfig.parseDelimiter("semicolon"));
        assertEquals('|', AggregatorConfig.parseDelimiter("pipe"));
        assertEquals('\t', AggregatorConfig.parseDelimiter("\\t"));
        assertThrows(IllegalArgumentException.class, () -> AggregatorConfig.parseDelimiter(",,"));
    }

    @Test
    void withers_replace_single_settings() {
        AggregatorConfig cfg = AggregatorConfig.defaults().withInput(Path.of("a.csv")).withDelimiter(';');
        assertEquals(Path.of("a.csv"), cfg.input());
        assertEquals(';', cfg.delimiter());
        assertEquals(StandardCharsets.UTF_8, cfg.charset());
        assertNull(cfg.diagnosticsFile());
    }

    @Test
    void column_limits_default_and_override() {
        AggregatorConfig defaults = AggregatorConfig.fromEnv();
        assertEquals(CsvParserFactory.UNLIMITED, defaults.maxCharsPerColumn());
        assertEquals(CsvParserFactory.DEFAULT_MAX_COLUMNS, defaults.maxColumns());

        System.setProperty("aggregator.maxColumns", "64");
        assertEquals(64, AggregatorConfig.fromEnv().maxColumns());

        System.setProperty("aggregator.maxCharsPerColumn", "lots");
        assertThrows(IllegalArgumentException.class, AggregatorConfig::fromEnv);
    }
}
