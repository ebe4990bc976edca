package io.aggregator.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Structured diagnostic emitted while aggregating. rowNumber and rawRow are only set for row-level events.
 */
public record DiagnosticEvent(Level level, String message, Long rowNumber, List<String> rawRow) {
    public enum Level { INFO, WARN, ERROR }

    public DiagnosticEvent {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
        rawRow = rawRow == null ? null : Collections.unmodifiableList(new ArrayList<>(rawRow));
    }

    public static DiagnosticEvent info(String message) {
        return new DiagnosticEvent(Level.INFO, message, null, null);
    }

    public static DiagnosticEvent error(String message) {
        return new DiagnosticEvent(Level.ERROR, message, null, null);
    }

    public static DiagnosticEvent rowWarning(String message, long rowNumber, List<String> rawRow) {
        return new DiagnosticEvent(Level.WARN, message, rowNumber, rawRow);
    }

    public boolean hasRow() { return rowNumber != null; }
}
