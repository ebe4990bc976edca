package io.aggregator.error;

public class EmptySourceException extends AggregationException {
    public EmptySourceException(String location) {
        super(location, "Input is empty: " + location);
    }
}
