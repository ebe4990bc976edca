package io.aggregator.error;

/**
 * The named input does not exist or cannot be opened.
 */
public class SourceNotFoundException extends AggregationException {
    public SourceNotFoundException(String location, String reason) {
        super(location, "Input not found or not readable: " + location + " (" + reason + ")");
    }

    public SourceNotFoundException(String location, Throwable cause) {
        super(location, "Input not found or not readable: " + location, cause);
    }
}
