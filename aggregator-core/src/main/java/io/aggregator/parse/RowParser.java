package io.aggregator.parse;

import io.aggregator.core.AmountRecord;
import io.aggregator.core.Row;
import io.aggregator.diagnostics.DiagnosticEvent;
import io.aggregator.diagnostics.DiagnosticSink;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Converts raw rows of the form {@code identifier,name,group,amount} into {@link AmountRecord}s.
 * Rows that fail validation are reported to the diagnostic sink and come back as rejected outcomes;
 * parsing never throws for bad input.
 */
public class RowParser {
    public static final int EXPECTED_FIELDS = 4;

    private final DiagnosticSink diagnostics;

    public RowParser(DiagnosticSink diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public ParseOutcome parse(Row row) {
        ParseOutcome outcome = validate(row);
        if (!outcome.isAccepted()) {
            diagnostics.accept(DiagnosticEvent.rowWarning(outcome.reason().orElseThrow(), row.number(), row.fields()));
        }
        return outcome;
    }

    private static ParseOutcome validate(Row row) {
        if (row.size() != EXPECTED_FIELDS) {
            return ParseOutcome.rejected(row, "expected " + EXPECTED_FIELDS + " fields but found " + row.size());
        }
        String rawId = safeTrim(row.field(0));
        String name = safeTrim(row.field(1));
        String group = safeTrim(row.field(2));
        String rawAmount = safeTrim(row.field(3));

        long identifier;
        try {
            identifier = Long.parseLong(rawId);
        } catch (NumberFormatException e) {
            return ParseOutcome.rejected(row, isInteger(rawId)
                    ? "identifier '" + rawId + "' is out of the 64-bit integer range"
                    : "identifier '" + rawId + "' is not an integer");
        }
        if (name.isEmpty()) return ParseOutcome.rejected(row, "name is empty");
        if (group.isEmpty()) return ParseOutcome.rejected(row, "group is empty");

        BigDecimal decimal;
        try {
            decimal = new BigDecimal(rawAmount);
        } catch (NumberFormatException e) {
            return ParseOutcome.rejected(row, "amount '" + rawAmount + "' is not a number");
        }
        if (decimal.signum() < 0) {
            return ParseOutcome.rejected(row, "amount '" + rawAmount + "' is negative");
        }
        double amount = decimal.doubleValue();
        if (!Double.isFinite(amount)) {
            return ParseOutcome.rejected(row, "amount '" + rawAmount + "' is not finite");
        }
        return ParseOutcome.accepted(row, new AmountRecord(identifier, name, group, amount));
    }

    private static boolean isInteger(String value) {
        try {
            new BigInteger(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String safeTrim(String value) {
        return value == null ? "" : value.trim();
    }
}
