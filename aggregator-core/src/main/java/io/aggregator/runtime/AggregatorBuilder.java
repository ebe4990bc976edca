package io.aggregator.runtime;

import com.codahale.metrics.MetricRegistry;
import io.aggregator.core.RowSourceProvider;
import io.aggregator.diagnostics.DiagnosticSink;
import io.aggregator.diagnostics.Slf4jDiagnosticSink;
import io.aggregator.metrics.Metrics;
import io.aggregator.source.FileRowSourceProvider;

public class AggregatorBuilder {
    private RowSourceProvider sources = new FileRowSourceProvider();
    private DiagnosticSink diagnostics = new Slf4jDiagnosticSink();
    private MetricRegistry metricRegistry = new MetricRegistry();

    public AggregatorBuilder sources(RowSourceProvider p) { this.sources = p; return this; }
    public AggregatorBuilder diagnostics(DiagnosticSink d) { this.diagnostics = d; return this; }
    public AggregatorBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public Aggregator build() {
        return new Aggregator(sources, diagnostics, new Metrics(metricRegistry));
    }
}
