package com.sailfish.cloudrpc.bigtable;

import java.util.Objects;
import java.util.Optional;

/**
 * One change in a modify-column-families request: create, update or drop a family.
 */
public final class ColumnFamilyModification {

    public enum Type {
        CREATE,
        UPDATE,
        DROP
    }

    private final Type type;
    private final String familyId;
    private final GcRule gcRule;

    private ColumnFamilyModification(Type type, String familyId, GcRule gcRule) {
        if (familyId == null || familyId.trim().isEmpty()) {
            throw new IllegalArgumentException("familyId cannot be blank");
        }
        this.type = type;
        this.familyId = familyId;
        this.gcRule = gcRule;
    }

    public static ColumnFamilyModification create(String familyId, GcRule gcRule) {
        return new ColumnFamilyModification(Type.CREATE, familyId, Objects.requireNonNull(gcRule, "gcRule cannot be null"));
    }

    public static ColumnFamilyModification update(String familyId, GcRule gcRule) {
        return new ColumnFamilyModification(Type.UPDATE, familyId, Objects.requireNonNull(gcRule, "gcRule cannot be null"));
    }

    public static ColumnFamilyModification drop(String familyId) {
        return new ColumnFamilyModification(Type.DROP, familyId, null);
    }

    public Type getType() { return type; }
    public String getFamilyId() { return familyId; }

    /**
     * @return The new GC rule; empty for a drop.
     */
    public Optional<GcRule> getGcRule() { return Optional.ofNullable(gcRule); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnFamilyModification)) return false;
        ColumnFamilyModification other = (ColumnFamilyModification) o;
        return type == other.type && familyId.equals(other.familyId) && Objects.equals(gcRule, other.gcRule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, familyId, gcRule);
    }

    @Override
    public String toString() {
        return type + "(" + familyId + (gcRule == null ? "" : ", " + gcRule) + ")";
    }
}
