package io.aggregator.core;

import java.util.Objects;

/**
 * A validated input row: integer identifier, non-empty name and group, non-negative finite amount.
 */
public record AmountRecord(long identifier, String name, String group, double amount) {
    public AmountRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(group, "group");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (group.isBlank()) throw new IllegalArgumentException("group must not be blank");
        if (!Double.isFinite(amount) || amount < 0) {
            throw new IllegalArgumentException("amount must be finite and non-negative: " + amount);
        }
    }
}
