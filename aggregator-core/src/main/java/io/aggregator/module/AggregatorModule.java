package io.aggregator.module;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.aggregator.config.AggregatorConfig;
import io.aggregator.core.RowSourceProvider;
import io.aggregator.diagnostics.CompositeDiagnosticSink;
import io.aggregator.diagnostics.DiagnosticSink;
import io.aggregator.diagnostics.FileDiagnosticSink;
import io.aggregator.diagnostics.Slf4jDiagnosticSink;
import io.aggregator.metrics.Metrics;
import io.aggregator.runtime.Aggregator;
import io.aggregator.source.CsvParserFactory;
import io.aggregator.source.FileRowSourceProvider;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class AggregatorModule extends AbstractModule {
    private final AggregatorConfig config;
    private final List<DiagnosticSink> extraSinks;

    public AggregatorModule(AggregatorConfig config, DiagnosticSink... extraSinks) {
        this.config = config;
        this.extraSinks = List.of(extraSinks);
    }

    @Override
    protected void configure() {
        bind(AggregatorConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton CsvParserFactory csvParserFactory() { return new CsvParserFactory(config.delimiter(), config.maxCharsPerColumn(), config.maxColumns()); }

    @Provides @Singleton RowSourceProvider rowSourceProvider(CsvParserFactory parsers) { return new FileRowSourceProvider(config.charset(), parsers); }

    @Provides @Singleton DiagnosticSink diagnosticSink() throws IOException {
        List<DiagnosticSink> sinks = new ArrayList<>();
        sinks.add(new Slf4jDiagnosticSink());
        if (config.diagnosticsFile() != null) sinks.add(new FileDiagnosticSink(config.diagnosticsFile()));
        sinks.addAll(extraSinks);
        return new CompositeDiagnosticSink(sinks);
    }

    @Provides @Singleton Aggregator aggregator(RowSourceProvider sources, DiagnosticSink diagnostics, Metrics metrics) {
        return new Aggregator(sources, diagnostics, metrics);
    }
}
