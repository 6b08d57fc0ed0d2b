package com.sailfish.cloudrpc.bigtable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Column families and initial split points of a table to be created.
 */
public final class TableConfig {

    private final Map<String, GcRule> columnFamilies;
    private final List<String> initialSplits;

    public TableConfig(Map<String, GcRule> columnFamilies, List<String> initialSplits) {
        Objects.requireNonNull(columnFamilies, "columnFamilies cannot be null");
        Objects.requireNonNull(initialSplits, "initialSplits cannot be null");
        Map<String, GcRule> families = new LinkedHashMap<>();
        columnFamilies.forEach((name, rule) -> {
            if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("column family name cannot be blank");
            families.put(name, Objects.requireNonNull(rule, "GC rule for column family " + name + " cannot be null"));
        });
        List<String> splits = new ArrayList<>(initialSplits);
        if (splits.contains(null)) throw new IllegalArgumentException("initialSplits cannot contain null");

        this.columnFamilies = Collections.unmodifiableMap(families);
        this.initialSplits = Collections.unmodifiableList(splits);
    }

    public Map<String, GcRule> getColumnFamilies() {
        return columnFamilies;
    }

    public List<String> getInitialSplits() {
        return initialSplits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableConfig)) return false;
        TableConfig other = (TableConfig) o;
        return columnFamilies.equals(other.columnFamilies) && initialSplits.equals(other.initialSplits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnFamilies, initialSplits);
    }

    @Override
    public String toString() {
        return "TableConfig{columnFamilies=" + columnFamilies + ", initialSplits=" + initialSplits + '}';
    }
}
