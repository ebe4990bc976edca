package io.aggregator.core;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Summary statistics over one input. Amounts are rounded to 2 decimals; groupAverages keeps
 * the order in which groups were first seen.
 */
public record AggregationResult(
        BigDecimal totalAmount,
        AmountRecord topRecord,
        Map<String, BigDecimal> groupAverages,
        long validCount,
        long skippedCount
) {
    public AggregationResult {
        Objects.requireNonNull(totalAmount, "totalAmount");
        groupAverages = Collections.unmodifiableMap(new LinkedHashMap<>(groupAverages));
    }

    /** Record with the greatest amount, empty when no row was valid. */
    public Optional<AmountRecord> top() { return Optional.ofNullable(topRecord); }

    /** Number of data rows read, header excluded. */
    public long rowsRead() { return validCount + skippedCount; }
}
