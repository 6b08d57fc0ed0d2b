package com.sailfish.cloudrpc.bigtable;

import java.util.Objects;

/**
 * Configuration of an app profile to be created: its ID and how its requests are routed to clusters.
 */
public final class AppProfileConfig {

    public enum Routing {
        /**
         * Requests go to the nearest available cluster.
         */
        MULTI_CLUSTER_USE_ANY,
        /**
         * Requests go to one designated cluster.
         */
        SINGLE_CLUSTER
    }

    private final String profileId;
    private final Routing routing;
    private final String clusterId;
    private final boolean allowTransactionalWrites;
    private boolean ignoreWarnings;
    private String description = "";
    private String etag = "";

    private AppProfileConfig(String profileId, Routing routing, String clusterId, boolean allowTransactionalWrites) {
        if (profileId == null || profileId.trim().isEmpty()) {
            throw new IllegalArgumentException("profileId cannot be blank");
        }
        this.profileId = profileId;
        this.routing = routing;
        this.clusterId = clusterId;
        this.allowTransactionalWrites = allowTransactionalWrites;
    }

    public static AppProfileConfig multiClusterUseAny(String profileId) {
        return new AppProfileConfig(profileId, Routing.MULTI_CLUSTER_USE_ANY, null, false);
    }

    public static AppProfileConfig singleClusterRouting(String profileId, String clusterId, boolean allowTransactionalWrites) {
        if (clusterId == null || clusterId.trim().isEmpty()) {
            throw new IllegalArgumentException("clusterId cannot be blank");
        }
        return new AppProfileConfig(profileId, Routing.SINGLE_CLUSTER, clusterId, allowTransactionalWrites);
    }

    public AppProfileConfig setIgnoreWarnings(boolean ignoreWarnings) {
        this.ignoreWarnings = ignoreWarnings;
        return this;
    }

    public AppProfileConfig setDescription(String description) {
        this.description = Objects.requireNonNull(description, "description cannot be null");
        return this;
    }

    public AppProfileConfig setEtag(String etag) {
        this.etag = Objects.requireNonNull(etag, "etag cannot be null");
        return this;
    }

    public String getProfileId() { return profileId; }
    public Routing getRouting() { return routing; }

    /**
     * @return The target cluster, or null for multi-cluster routing.
     */
    public String getClusterId() { return clusterId; }
    public boolean isAllowTransactionalWrites() { return allowTransactionalWrites; }
    public boolean isIgnoreWarnings() { return ignoreWarnings; }
    public String getDescription() { return description; }
    public String getEtag() { return etag; }

    @Override
    public String toString() {
        return "AppProfileConfig{" +
                "profileId='" + profileId + '\'' +
                ", routing=" + routing +
                (clusterId == null ? "" : ", clusterId='" + clusterId + '\'' + ", allowTransactionalWrites=" + allowTransactionalWrites) +
                ", ignoreWarnings=" + ignoreWarnings +
                '}';
    }
}
