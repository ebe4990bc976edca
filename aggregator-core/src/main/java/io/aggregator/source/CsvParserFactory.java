package io.aggregator.source;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import io.aggregator.parse.RowParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates univocity CSV parsers configured for header-first delimited input. Fields are handed out
 * untrimmed; empty and missing values come back as empty strings. Comment lines are not recognised,
 * every non-blank line is a row. Field length is unlimited unless configured; a record with more than
 * {@code maxColumns} fields cannot be read and fails the run.
 */
public class CsvParserFactory {
    private static final Logger log = LoggerFactory.getLogger(CsvParserFactory.class);

    public static final char DEFAULT_DELIMITER = ',';
    public static final int UNLIMITED = -1;
    public static final int DEFAULT_MAX_CHARS_PER_COLUMN = UNLIMITED;
    public static final int DEFAULT_MAX_COLUMNS = 4096;

    private final char delimiter;
    private final int maxCharsPerColumn;
    private final int maxColumns;

    public CsvParserFactory() {
        this(DEFAULT_DELIMITER, DEFAULT_MAX_CHARS_PER_COLUMN, DEFAULT_MAX_COLUMNS);
    }

    public CsvParserFactory(char delimiter, int maxCharsPerColumn) {
        this(delimiter, maxCharsPerColumn, DEFAULT_MAX_COLUMNS);
    }

    /**
     * @param maxCharsPerColumn zero or negative for no limit
     */
    public CsvParserFactory(char delimiter, int maxCharsPerColumn, int maxColumns) {
        this.delimiter = delimiter;
        this.maxCharsPerColumn = maxCharsPerColumn <= 0 ? UNLIMITED : maxCharsPerColumn;
        this.maxColumns = Math.max(RowParser.EXPECTED_FIELDS + 1, maxColumns);
    }

    public char delimiter() { return delimiter; }
    public int maxCharsPerColumn() { return maxCharsPerColumn; }
    public int maxColumns() { return maxColumns; }

    public CsvParser newParser() {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(delimiter);
        settings.getFormat().setComment('\0');
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setHeaderExtractionEnabled(false);
        settings.setSkipEmptyLines(true);
        settings.setIgnoreLeadingWhitespaces(false);
        settings.setIgnoreTrailingWhitespaces(false);
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setMaxCharsPerColumn(maxCharsPerColumn);
        settings.setMaxColumns(maxColumns);
        settings.setColumnReorderingEnabled(false);
        log.debug("Created CsvParser with delimiter='{}' maxCharsPerColumn={} maxColumns={}",
                delimiter, maxCharsPerColumn, maxColumns);
        return new CsvParser(settings);
    }
}
