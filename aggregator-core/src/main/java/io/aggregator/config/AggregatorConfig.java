package io.aggregator.config;

import io.aggregator.source.CsvParserFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Settings for one aggregation run. {@code input} and {@code diagnosticsFile} may be null; a
 * {@code maxCharsPerColumn} of zero or less means no limit. Malformed values fail with
 * {@link IllegalArgumentException}.
 */
public record AggregatorConfig(
        Path input,
        char delimiter,
        Charset charset,
        int maxCharsPerColumn,
        int maxColumns,
        Path diagnosticsFile
) {
    public static AggregatorConfig defaults() {
        return new AggregatorConfig(null, CsvParserFactory.DEFAULT_DELIMITER, StandardCharsets.UTF_8,
                CsvParserFactory.DEFAULT_MAX_CHARS_PER_COLUMN, CsvParserFactory.DEFAULT_MAX_COLUMNS, null);
    }

    public static AggregatorConfig fromEnv() {
        String in = setting("aggregator.input", "AGGREGATOR_INPUT", "");
        String delimiter = setting("aggregator.delimiter", "AGGREGATOR_DELIMITER", ",");
        String charset = setting("aggregator.charset", "AGGREGATOR_CHARSET", "UTF-8");
        int maxChars = Integer.parseInt(setting("aggregator.maxCharsPerColumn", "AGGREGATOR_MAX_CHARS_PER_COLUMN",
                String.valueOf(CsvParserFactory.DEFAULT_MAX_CHARS_PER_COLUMN)));
        int maxColumns = Integer.parseInt(setting("aggregator.maxColumns", "AGGREGATOR_MAX_COLUMNS",
                String.valueOf(CsvParserFactory.DEFAULT_MAX_COLUMNS)));
        String diagnostics = setting("aggregator.diagnostics", "AGGREGATOR_DIAGNOSTICS", "");
        return new AggregatorConfig(
                in.isBlank() ? null : Path.of(in),
                parseDelimiter(delimiter),
                Charset.forName(charset),
                maxChars,
                maxColumns,
                diagnostics.isBlank() ? null : Path.of(diagnostics));
    }

    public AggregatorConfig withInput(Path p) { return new AggregatorConfig(p, delimiter, charset, maxCharsPerColumn, maxColumns, diagnosticsFile); }
    public AggregatorConfig withDelimiter(char d) { return new AggregatorConfig(input, d, charset, maxCharsPerColumn, maxColumns, diagnosticsFile); }
    public AggregatorConfig withCharset(Charset c) { return new AggregatorConfig(input, delimiter, c, maxCharsPerColumn, maxColumns, diagnosticsFile); }
    public AggregatorConfig withMaxColumns(int n) { return new AggregatorConfig(input, delimiter, charset, maxCharsPerColumn, n, diagnosticsFile); }
    public AggregatorConfig withDiagnosticsFile(Path p) { return new AggregatorConfig(input, delimiter, charset, maxCharsPerColumn, maxColumns, p); }

    /**
     * Accepts a single character, or the names {@code tab}, {@code \t}, {@code semicolon} and {@code pipe}.
     */
    public static char parseDelimiter(String value) {
        return switch (value) {
            case "tab", "\\t" -> '\t';
            case "semicolon" -> ';';
            case "pipe" -> '|';
            default -> {
                if (value.length() != 1) throw new IllegalArgumentException("Delimiter must be a single character: '" + value + "'");
                yield value.charAt(0);
            }
        };
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }
}
