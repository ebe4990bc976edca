package io.aggregator.source;

import com.univocity.parsers.csv.CsvParser;
import io.aggregator.core.Row;
import io.aggregator.core.RowSource;

import java.io.IOException;
import java.io.Reader;
import java.util.Objects;
import java.util.Optional;

/**
 * Streams delimited rows from a Reader, one {@link Row} per record. Quoted fields may contain the
 * delimiter and line breaks. Blank lines are not rows.
 */
public class CsvRowSource implements RowSource {
    private final Reader reader;
    private final String location;
    private final CsvParser parser;
    private boolean started = false;
    private boolean exhausted = false;
    private boolean closed = false;
    private long rowNumber = 0;

    public CsvRowSource(Reader reader, String location) {
        this(reader, location, new CsvParserFactory());
    }

    public CsvRowSource(Reader reader, String location, CsvParserFactory parsers) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.location = Objects.requireNonNull(location, "location");
        this.parser = parsers.newParser();
    }

    @Override
    public Optional<Row> next() throws IOException {
        if (closed) throw new IOException("Source already closed: " + location);
        if (exhausted) return Optional.empty();
        String[] fields;
        try {
            if (!started) {
                started = true;
                parser.beginParsing(reader);
            }
            fields = parser.parseNext();
        } catch (RuntimeException e) {
            // univocity reports read failures unchecked, usually as TextParsingException
            throw new IOException("Failed to read row " + (rowNumber + 1) + " of " + location, e);
        }
        if (fields == null) {
            exhausted = true;
            return Optional.empty();
        }
        return Optional.of(new Row(++rowNumber, fields));
    }

    @Override
    public String location() { return location; }

    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        try {
            if (started) parser.stopParsing();
        } finally {
            reader.close();
        }
    }
}
