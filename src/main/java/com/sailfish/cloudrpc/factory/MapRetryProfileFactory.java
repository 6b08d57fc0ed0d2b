package com.sailfish.cloudrpc.factory;

import com.sailfish.cloudrpc.retry.RetryProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A simple implementation of {@link RetryProfileFactory} using a Map.
 * Profiles should be registered during application startup.
 */
public class MapRetryProfileFactory implements RetryProfileFactory {

    private static final Logger log = LoggerFactory.getLogger(MapRetryProfileFactory.class);

    private final Map<String, RetryProfile> profiles = new ConcurrentHashMap<>();

    /**
     * Registers a retry profile under a name, replacing any profile previously registered under it.
     */
    public void registerProfile(String name, RetryProfile profile) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (profile == null) {
            throw new IllegalArgumentException("profile cannot be null");
        }
        log.info("Registering retry profile '{}': {}", name, profile);
        profiles.put(name, profile);
    }

    @Override
    public Optional<RetryProfile> getProfile(String name) {
        if (name == null) {
            return Optional.empty();
        }
        RetryProfile profile = profiles.get(name);
        if (profile == null) {
            log.warn("No retry profile registered under name: {}", name);
        }
        return Optional.ofNullable(profile);
    }
}
