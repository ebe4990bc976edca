package io.aggregator.error;

public class ProcessingException extends AggregationException {
    public ProcessingException(String location, Throwable cause) {
        super(location, "Failed to process " + location + ": " + cause.getMessage(), cause);
    }
}
