package com.sailfish.cloudrpc.storage;

/**
 * Credentials backed by an access token obtained elsewhere.
 */
public final class AccessTokenCredentials implements Credentials {

    private final String accessToken;

    public AccessTokenCredentials(String accessToken) {
        if (accessToken == null || accessToken.trim().isEmpty()) {
            throw new IllegalArgumentException("accessToken cannot be blank");
        }
        this.accessToken = accessToken.trim();
    }

    @Override
    public String authorizationHeader() {
        return "Bearer " + accessToken;
    }

    @Override
    public String toString() {
        return "AccessTokenCredentials{accessToken=<redacted>}";
    }
}
