package com.sailfish.cloudrpc.bigtable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Garbage collection rule of a column family.
 */
public final class GcRule {

    public enum Kind {
        MAX_NUM_VERSIONS,
        MAX_AGE,
        INTERSECTION,
        UNION
    }

    private final Kind kind;
    private final int maxNumVersions;
    private final Duration maxAge;
    private final List<GcRule> rules;

    private GcRule(Kind kind, int maxNumVersions, Duration maxAge, List<GcRule> rules) {
        this.kind = kind;
        this.maxNumVersions = maxNumVersions;
        this.maxAge = maxAge;
        this.rules = rules;
    }

    /**
     * Keeps at most {@code versions} cells per column.
     */
    public static GcRule maxNumVersions(int versions) {
        if (versions < 1) throw new IllegalArgumentException("versions must be at least 1");
        return new GcRule(Kind.MAX_NUM_VERSIONS, versions, null, Collections.emptyList());
    }

    /**
     * Deletes cells older than {@code age}.
     */
    public static GcRule maxAge(Duration age) {
        if (age == null || age.isNegative() || age.isZero()) throw new IllegalArgumentException("age must be positive");
        return new GcRule(Kind.MAX_AGE, 0, age, Collections.emptyList());
    }

    /**
     * Deletes cells that match all the given rules.
     */
    public static GcRule intersection(GcRule... rules) {
        return new GcRule(Kind.INTERSECTION, 0, null, nested(rules));
    }

    /**
     * Deletes cells that match any of the given rules.
     */
    public static GcRule union(GcRule... rules) {
        return new GcRule(Kind.UNION, 0, null, nested(rules));
    }

    private static List<GcRule> nested(GcRule... rules) {
        Objects.requireNonNull(rules, "rules cannot be null");
        List<GcRule> copy = new ArrayList<>(Arrays.asList(rules));
        if (copy.contains(null)) throw new IllegalArgumentException("rules cannot contain null");
        return Collections.unmodifiableList(copy);
    }

    public Kind getKind() { return kind; }

    /**
     * @return The version limit; only meaningful for {@link Kind#MAX_NUM_VERSIONS}.
     */
    public int getMaxNumVersions() { return maxNumVersions; }

    /**
     * @return The age limit, or null unless this is a {@link Kind#MAX_AGE} rule.
     */
    public Duration getMaxAge() { return maxAge; }

    /**
     * @return The nested rules of an intersection or union; empty otherwise.
     */
    public List<GcRule> getRules() { return rules; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GcRule)) return false;
        GcRule other = (GcRule) o;
        return kind == other.kind
                && maxNumVersions == other.maxNumVersions
                && Objects.equals(maxAge, other.maxAge)
                && rules.equals(other.rules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, maxNumVersions, maxAge, rules);
    }

    @Override
    public String toString() {
        switch (kind) {
            case MAX_NUM_VERSIONS:
                return "MaxNumVersions(" + maxNumVersions + ")";
            case MAX_AGE:
                return "MaxAge(" + maxAge + ")";
            case INTERSECTION:
                return "Intersection" + rules;
            default:
                return "Union" + rules;
        }
    }
}
