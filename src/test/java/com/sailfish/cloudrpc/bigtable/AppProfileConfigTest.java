package com.sailfish.cloudrpc.bigtable;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AppProfileConfigTest {

    @Test
    void multiClusterRouting() {
        AppProfileConfig config = AppProfileConfig.multiClusterUseAny("analytics")
                .setDescription("batch jobs")
                .setIgnoreWarnings(true);

        assertEquals("analytics", config.getProfileId());
        assertEquals(AppProfileConfig.Routing.MULTI_CLUSTER_USE_ANY, config.getRouting());
        assertNull(config.getClusterId());
        assertTrue(config.isIgnoreWarnings());
        assertEquals("batch jobs", config.getDescription());
        assertEquals("", config.getEtag());
    }

    @Test
    void singleClusterRouting() {
        AppProfileConfig config = AppProfileConfig.singleClusterRouting("serving", "cluster-a", true).setEtag("abc");

        assertEquals(AppProfileConfig.Routing.SINGLE_CLUSTER, config.getRouting());
        assertEquals("cluster-a", config.getClusterId());
        assertTrue(config.isAllowTransactionalWrites());
        assertFalse(config.isIgnoreWarnings());
        assertEquals("abc", config.getEtag());
    }

    @Test
    void rejectsBlankIds() {
        assertThrows(IllegalArgumentException.class, () -> AppProfileConfig.multiClusterUseAny(""));
        assertThrows(IllegalArgumentException.class, () -> AppProfileConfig.singleClusterRouting("p", " ", false));
    }
}
