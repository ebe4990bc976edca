package io.aggregator.employee;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import io.aggregator.core.AggregationResult;
import io.aggregator.core.AmountRecord;
import io.aggregator.diagnostics.DiagnosticEvent;
import io.aggregator.metrics.Metrics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders aggregation results in employee terms: groups are departments, amounts are salaries.
 */
public final class EmployeeReport {
    private static final String NL = System.lineSeparator();

    private EmployeeReport() {}

    public static String format(String source, AggregationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Employee salary report: ").append(source).append(NL);
        sb.append(line("Total salary:", result.totalAmount().toPlainString()));
        sb.append(line("Highest paid:", result.top().map(EmployeeReport::describe).orElse("n/a")));
        sb.append("Average salary by department:").append(NL);
        if (result.groupAverages().isEmpty()) {
            sb.append("  (none)").append(NL);
        }
        for (Map.Entry<String, BigDecimal> e : result.groupAverages().entrySet()) {
            sb.append(String.format(Locale.ROOT, "  %-20s %s", e.getKey(), e.getValue().toPlainString())).append(NL);
        }
        sb.append("Rows: ").append(result.validCount()).append(" valid, ")
                .append(result.skippedCount()).append(" skipped").append(NL);
        return sb.toString();
    }

    public static String formatSkipped(List<DiagnosticEvent> skipped) {
        StringBuilder sb = new StringBuilder("Skipped rows:").append(NL);
        if (skipped.isEmpty()) sb.append("  (none)").append(NL);
        for (DiagnosticEvent e : skipped) {
            sb.append("  row ").append(e.rowNumber()).append(": ").append(e.message())
                    .append(' ').append(e.rawRow()).append(NL);
        }
        return sb.toString();
    }

    public static String formatMetrics(MetricRegistry r) {
        Snapshot time = r.timer(Metrics.TIME).getSnapshot();
        return "Metrics:" +
                " runs=" + r.counter(Metrics.RUNS).getCount() +
                " failures=" + r.counter(Metrics.FAILURES).getCount() +
                " validRows=" + r.meter(Metrics.ROWS_VALID).getCount() +
                " skippedRows=" + r.meter(Metrics.ROWS_SKIPPED).getCount() +
                " t.max(ms)=" + String.format(Locale.ROOT, "%.3f", time.getMax() / 1_000_000.0) +
                NL;
    }

    static String describe(AmountRecord r) {
        return r.name() + " (" + r.group() + ", ID " + r.identifier() + ") "
                + BigDecimal.valueOf(r.amount()).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static String line(String label, String value) {
        return String.format(Locale.ROOT, "%-22s %s", label, value) + NL;
    }
}
