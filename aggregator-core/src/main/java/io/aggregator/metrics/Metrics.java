package io.aggregator.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String ROWS_VALID = "aggregator.rows.valid";
    public static final String ROWS_SKIPPED = "aggregator.rows.skipped";
    public static final String RUNS = "aggregator.runs";
    public static final String FAILURES = "aggregator.failures";
    public static final String TIME = "aggregator.time";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Meter validRows() { return registry.meter(ROWS_VALID); }
    public Meter skippedRows() { return registry.meter(ROWS_SKIPPED); }
    public Counter runs() { return registry.counter(RUNS); }
    public Counter failures() { return registry.counter(FAILURES); }
    public Timer time() { return registry.timer(TIME); }
}
