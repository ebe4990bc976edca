package io.aggregator.parse;

import io.aggregator.core.AmountRecord;
import io.aggregator.core.Row;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of parsing one row: either an accepted record or the reason the row was skipped.
 */
public final class ParseOutcome {
    private final Row row;
    private final AmountRecord record;
    private final String reason;

    private ParseOutcome(Row row, AmountRecord record, String reason) {
        this.row = row;
        this.record = record;
        this.reason = reason;
    }

    public static ParseOutcome accepted(Row row, AmountRecord record) {
        return new ParseOutcome(row, Objects.requireNonNull(record, "record"), null);
    }

    public static ParseOutcome rejected(Row row, String reason) {
        return new ParseOutcome(row, null, Objects.requireNonNull(reason, "reason"));
    }

    public Row row() { return row; }
    public boolean isAccepted() { return record != null; }
    public Optional<AmountRecord> record() { return Optional.ofNullable(record); }
    public Optional<String> reason() { return Optional.ofNullable(reason); }

    @Override
    public String toString() {
        return isAccepted()
                ? "ParseOutcome{accepted row=" + row.number() + ", record=" + record + '}'
                : "ParseOutcome{rejected row=" + row.number() + ", reason=" + reason + '}';
    }
}
