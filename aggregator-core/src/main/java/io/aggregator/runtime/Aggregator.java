package io.aggregator.runtime;

import com.codahale.metrics.Timer;
import io.aggregator.core.AggregationResult;
import io.aggregator.core.Row;
import io.aggregator.core.RowSource;
import io.aggregator.core.RowSourceProvider;
import io.aggregator.diagnostics.DiagnosticEvent;
import io.aggregator.diagnostics.DiagnosticSink;
import io.aggregator.error.AggregationException;
import io.aggregator.error.EmptySourceException;
import io.aggregator.error.HeaderOnlyException;
import io.aggregator.error.ProcessingException;
import io.aggregator.error.SourceNotFoundException;
import io.aggregator.metrics.Metrics;
import io.aggregator.parse.ParseOutcome;
import io.aggregator.parse.RowParser;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads a header-first delimited source and computes totals, the top record and per-group averages.
 *
 * <p>Bad data rows are skipped and reported through the {@link DiagnosticSink}; they never stop a run.
 * Everything else (missing input, empty input, header-only input, read failures) aborts the call with an
 * {@link AggregationException} and no partial result. The source is closed exactly once on every path.
 *
 * <p>Instances hold no per-run state and can be reused; a single run is not meant to be shared between threads.
 */
public class Aggregator {
    private final RowSourceProvider sources;
    private final DiagnosticSink diagnostics;
    private final RowParser parser;
    private final Metrics metrics;

    public Aggregator(RowSourceProvider sources, DiagnosticSink diagnostics, Metrics metrics) {
        this.sources = Objects.requireNonNull(sources, "sources");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.parser = new RowParser(diagnostics);
    }

    /**
     * Open {@code location} through the configured provider and aggregate it.
     */
    public AggregationResult aggregate(String location) throws AggregationException {
        RowSource source;
        try {
            source = sources.open(location);
        } catch (SourceNotFoundException e) {
            metrics.runs().inc();
            fail(e);
            throw e;
        }
        return aggregate(source);
    }

    /**
     * Aggregate an already opened source. The source is closed before this method returns.
     */
    public AggregationResult aggregate(RowSource source) throws AggregationException {
        metrics.runs().inc();
        try (Timer.Context ignored = metrics.time().time()) {
            return run(source);
        } catch (AggregationException e) {
            fail(e);
            throw e;
        }
    }

    private AggregationResult run(RowSource source) throws AggregationException {
        String location = source.location();
        AggregationResult result;
        try (source) {
            diagnostics.accept(DiagnosticEvent.info("Processing " + location));

            Optional<Row> header = source.next();
            if (header.isEmpty()) throw new EmptySourceException(location);
            diagnostics.accept(DiagnosticEvent.info("Header of " + location + ": " + header.get().fields()));

            Accumulator acc = new Accumulator();
            Optional<Row> next;
            while ((next = source.next()).isPresent()) {
                ParseOutcome outcome = parser.parse(next.get());
                if (outcome.isAccepted()) {
                    acc.accept(outcome.record().orElseThrow());
                } else {
                    acc.skip();
                }
            }
            if (acc.noDataRows()) throw new HeaderOnlyException(location);
            result = acc.toResult();
        } catch (IOException e) {
            throw new ProcessingException(location, e);
        }

        metrics.validRows().mark(result.validCount());
        metrics.skippedRows().mark(result.skippedCount());
        diagnostics.accept(DiagnosticEvent.info("Finished " + location + ": valid=" + result.validCount()
                + " skipped=" + result.skippedCount()));
        return result;
    }

    private void fail(AggregationException e) {
        metrics.failures().inc();
        diagnostics.accept(DiagnosticEvent.error(e.getMessage()));
    }
}
