package io.aggregator.core;

import io.aggregator.error.SourceNotFoundException;

public interface RowSourceProvider {
    RowSource open(String location) throws SourceNotFoundException;
}
