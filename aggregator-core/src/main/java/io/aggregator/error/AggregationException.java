package io.aggregator.error;

/**
 * Fatal failure of one aggregation run. No partial result is produced when one of these is thrown.
 */
public abstract class AggregationException extends Exception {
    private final String location;

    protected AggregationException(String location, String message) {
        super(message);
        this.location = location;
    }

    protected AggregationException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public String location() { return location; }
}
