package com.sailfish.cloudrpc.storage;

/**
 * Represents a credential to access the object storage service.
 */
public interface Credentials {

    /**
     * Returns the value for the Authorization header in HTTP requests.
     */
    String authorizationHeader();
}
