package io.aggregator.error;

public class HeaderOnlyException extends AggregationException {
    public HeaderOnlyException(String location) {
        super(location, "Input contains only a header row: " + location);
    }
}
