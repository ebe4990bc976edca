package io.aggregator.runtime;

import io.aggregator.core.AggregationResult;
import io.aggregator.core.AmountRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running totals for one aggregation call. Sums are kept in decimal so rounding happens once, at the end.
 */
final class Accumulator {
    static final int SCALE = 2;
    static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    private final Map<String, GroupTotals> groups = new LinkedHashMap<>();
    private BigDecimal total = BigDecimal.ZERO;
    private AmountRecord top;
    private long valid;
    private long skipped;

    void accept(AmountRecord record) {
        BigDecimal amount = BigDecimal.valueOf(record.amount());
        total = total.add(amount);
        groups.computeIfAbsent(record.group(), g -> new GroupTotals()).add(amount);
        // strictly greater, so the first of equal amounts stays on top
        if (top == null || record.amount() > top.amount()) {
            top = record;
        }
        valid++;
    }

    void skip() {
        skipped++;
    }

    boolean noDataRows() {
        return valid == 0 && skipped == 0;
    }

    long valid() { return valid; }
    long skipped() { return skipped; }

    AggregationResult toResult() {
        Map<String, BigDecimal> averages = new LinkedHashMap<>();
        groups.forEach((group, totals) -> averages.put(group, totals.average()));
        return new AggregationResult(total.setScale(SCALE, ROUNDING), top, averages, valid, skipped);
    }

    private static final class GroupTotals {
        private BigDecimal sum = BigDecimal.ZERO;
        private long count;

        void add(BigDecimal amount) {
            sum = sum.add(amount);
            count++;
        }

        BigDecimal average() {
            return sum.divide(BigDecimal.valueOf(count), SCALE, ROUNDING);
        }
    }
}
