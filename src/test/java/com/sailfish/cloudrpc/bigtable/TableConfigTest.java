package com.sailfish.cloudrpc.bigtable;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TableConfigTest {

    @Test
    void copiesFamiliesAndSplits() {
        Map<String, GcRule> families = new LinkedHashMap<>();
        families.put("fam", GcRule.maxNumVersions(5));
        families.put("foo", GcRule.maxAge(Duration.ofHours(24)));
        List<String> splits = new ArrayList<>(Arrays.asList("a1000", "a2000", "b3000", "m5000"));

        TableConfig config = new TableConfig(families, splits);
        families.clear();
        splits.clear();

        assertEquals(Arrays.asList("fam", "foo"), new ArrayList<>(config.getColumnFamilies().keySet()));
        assertEquals(4, config.getInitialSplits().size());
        assertThrows(UnsupportedOperationException.class, () -> config.getInitialSplits().add("z"));
    }

    @Test
    void rejectsInvalidEntries() {
        Map<String, GcRule> blankName = new HashMap<>();
        blankName.put(" ", GcRule.maxNumVersions(1));
        assertThrows(IllegalArgumentException.class, () -> new TableConfig(blankName, Collections.emptyList()));

        Map<String, GcRule> nullRule = new HashMap<>();
        nullRule.put("fam", null);
        assertThrows(NullPointerException.class, () -> new TableConfig(nullRule, Collections.emptyList()));

        assertThrows(IllegalArgumentException.class,
                () -> new TableConfig(Collections.emptyMap(), Arrays.asList("a", null)));
    }
}
