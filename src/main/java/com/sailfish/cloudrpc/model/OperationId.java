package com.sailfish.cloudrpc.model;

/**
 * Identifies one outstanding operation on a completion queue.
 * A queue assigns identifiers in increasing order, so a later operation always compares greater.
 */
public final class OperationId implements Comparable<OperationId> {

    private final long value;

    public OperationId(long value) {
        if (value <= 0) throw new IllegalArgumentException("value must be positive");
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(OperationId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperationId)) return false;
        return value == ((OperationId) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "op-" + value;
    }
}
