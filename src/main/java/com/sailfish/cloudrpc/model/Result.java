package com.sailfish.cloudrpc.model;

import com.sailfish.cloudrpc.error.RpcException;

import java.util.Objects;

/**
 * The outcome of an operation: either a value or the error that ended it.
 *
 * @param <T> The type of the payload carried on success.
 */
public final class Result<T> {

    private final T value;
    private final RpcException error;

    private Result(T value, RpcException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(RpcException error) {
        return new Result<>(null, Objects.requireNonNull(error, "error cannot be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return The payload; may be null for calls without a response body.
     * @throws IllegalStateException if this result is a failure.
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error.getMessage(), error);
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this result is a success.
     */
    public RpcException getError() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    public StatusCode getStatusCode() {
        return error == null ? StatusCode.OK : error.getStatusCode();
    }

    /**
     * Returns the payload or rethrows the error carried by this result.
     */
    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "Success{" + value + "}" : "Failure{" + error.getStatusCode() + ": " + error.getMessage() + "}";
    }
}
