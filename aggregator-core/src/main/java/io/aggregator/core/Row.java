package io.aggregator.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One raw row as read from a source, before any validation. Ordered by row number.
 */
public final class Row implements Comparable<Row> {
    private final long number; // 1-based, the header is row 1
    private final List<String> fields;

    public Row(long number, String... fields) {
        this.number = number;
        this.fields = Collections.unmodifiableList(Arrays.asList(fields.clone()));
    }

    public long number() { return number; }
    public List<String> fields() { return fields; }
    public int size() { return fields.size(); }
    public String field(int index) { return fields.get(index); }

    @Override
    public int compareTo(Row o) {
        return Long.compare(this.number, o.number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row that)) return false;
        return number == that.number && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, fields);
    }

    @Override
    public String toString() {
        return "Row{" +
                "number=" + number +
                ", fields=" + fields +
                '}';
    }
}
