package com.sailfish.cloudrpc.bigtable;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class GcRuleTest {

    @Test
    void nestedRulesKeepTheirOrder() {
        GcRule rule = GcRule.union(GcRule.maxNumVersions(3),
                GcRule.intersection(GcRule.maxAge(Duration.ofDays(7)), GcRule.maxNumVersions(1)));

        assertEquals(GcRule.Kind.UNION, rule.getKind());
        assertEquals(2, rule.getRules().size());
        assertEquals(3, rule.getRules().get(0).getMaxNumVersions());
        assertEquals(Duration.ofDays(7), rule.getRules().get(1).getRules().get(0).getMaxAge());
        assertThrows(UnsupportedOperationException.class, () -> rule.getRules().clear());
    }

    @Test
    void equalRulesAreEqual() {
        GcRule first = GcRule.intersection(GcRule.maxAge(Duration.ofHours(1)), GcRule.maxNumVersions(2));
        GcRule second = GcRule.intersection(GcRule.maxAge(Duration.ofHours(1)), GcRule.maxNumVersions(2));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, GcRule.union(GcRule.maxAge(Duration.ofHours(1)), GcRule.maxNumVersions(2)));
        assertEquals("Intersection[MaxAge(PT1H), MaxNumVersions(2)]", first.toString());
    }

    @Test
    void rejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> GcRule.maxNumVersions(0));
        assertThrows(IllegalArgumentException.class, () -> GcRule.maxAge(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> GcRule.union(GcRule.maxNumVersions(1), null));
    }

    @Test
    void columnFamilyModifications() {
        ColumnFamilyModification create = ColumnFamilyModification.create("fam", GcRule.maxNumVersions(1));
        ColumnFamilyModification drop = ColumnFamilyModification.drop("old");

        assertEquals(ColumnFamilyModification.Type.CREATE, create.getType());
        assertEquals(GcRule.maxNumVersions(1), create.getGcRule().orElseThrow());
        assertTrue(drop.getGcRule().isEmpty());
        assertEquals(Arrays.asList(create, drop),
                Arrays.asList(ColumnFamilyModification.create("fam", GcRule.maxNumVersions(1)), ColumnFamilyModification.drop("old")));
        assertThrows(IllegalArgumentException.class, () -> ColumnFamilyModification.drop(""));
        assertThrows(NullPointerException.class, () -> ColumnFamilyModification.update("fam", null));
    }
}
