package io.aggregator.diagnostics;

/**
 * Receives diagnostic events. Implementations decide storage and formatting and must not throw.
 */
public interface DiagnosticSink extends AutoCloseable {
    void accept(DiagnosticEvent event);

    @Override default void close() {}
}
