package io.aggregator.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A RowSource yields the rows of one input in order until it is exhausted.
 */
public interface RowSource extends Closeable {
    /**
     * Read the next row. Returns empty once the input is exhausted and keeps returning empty afterwards.
     */
    Optional<Row> next() throws IOException;

    /**
     * Logical location of the input (a path, a name), used for diagnostics only.
     */
    String location();

    /**
     * Release the underlying input. Calling close more than once has no further effect.
     */
    @Override
    void close() throws IOException;
}
