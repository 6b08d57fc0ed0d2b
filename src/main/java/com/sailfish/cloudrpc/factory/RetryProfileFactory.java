package com.sailfish.cloudrpc.factory;

import com.sailfish.cloudrpc.retry.RetryProfile;

import java.util.Optional;

/**
 * Provides the retry profile configured under a given name, e.g. "admin" or "data".
 */
public interface RetryProfileFactory {

    /**
     * @param name The profile name.
     * @return An Optional containing the profile if one is registered, empty otherwise.
     */
    Optional<RetryProfile> getProfile(String name);
}
