package com.sailfish.cloudrpc.error;

import com.sailfish.cloudrpc.model.StatusCode;

import java.util.Objects;

/**
 * An error returned by a remote call or produced by the execution core, classified by status code.
 */
public class RpcException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final StatusCode statusCode;

    public RpcException(StatusCode statusCode, String message) {
        this(statusCode, message, null);
    }

    public RpcException(StatusCode statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = Objects.requireNonNull(statusCode, "statusCode cannot be null");
        if (statusCode.isOk()) {
            throw new IllegalArgumentException("statusCode cannot be OK for an error");
        }
    }

    public StatusCode getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + statusCode + "]: " + getMessage();
    }
}
