package io.aggregator.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards diagnostic events to an SLF4J logger.
 */
public class Slf4jDiagnosticSink implements DiagnosticSink {
    private final Logger logger;

    public Slf4jDiagnosticSink() {
        this(LoggerFactory.getLogger("io.aggregator.diagnostics"));
    }

    public Slf4jDiagnosticSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void accept(DiagnosticEvent event) {
        switch (event.level()) {
            case INFO -> logger.info(event.message());
            case WARN -> {
                if (event.hasRow()) {
                    logger.warn("Skipping row {} {}: {}", event.rowNumber(), event.rawRow(), event.message());
                } else {
                    logger.warn(event.message());
                }
            }
            case ERROR -> logger.error(event.message());
        }
    }
}
