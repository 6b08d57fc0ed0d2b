package com.sailfish.cloudrpc.storage;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Adds credentials to outgoing request headers.
 */
public final class AuthorizedHeaders {

    public static final String AUTHORIZATION = "Authorization";

    private AuthorizedHeaders() {
    }

    /**
     * Sets the Authorization header from the credentials, replacing any existing value whatever its case.
     *
     * @param headers Mutable request headers.
     * @param credentials Source of the header value.
     * @return The same headers map.
     * @throws IllegalStateException if the credentials return a blank header.
     */
    public static Map<String, String> inject(Map<String, String> headers, Credentials credentials) {
        Objects.requireNonNull(headers, "headers cannot be null");
        Objects.requireNonNull(credentials, "credentials cannot be null");
        String value = credentials.authorizationHeader();
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalStateException("Credentials returned a blank authorization header");
        }
        for (Iterator<String> names = headers.keySet().iterator(); names.hasNext(); ) {
            if (AUTHORIZATION.equalsIgnoreCase(names.next())) {
                names.remove();
            }
        }
        headers.put(AUTHORIZATION, value);
        return headers;
    }
}
