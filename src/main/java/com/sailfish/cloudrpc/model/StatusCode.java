package com.sailfish.cloudrpc.model;

/**
 * Canonical status codes reported by the remote services.
 */
public enum StatusCode {
    OK(0),
    CANCELLED(1),
    UNKNOWN(2),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    ABORTED(10),
    OUT_OF_RANGE(11),
    UNIMPLEMENTED(12),
    INTERNAL(13),
    UNAVAILABLE(14),
    DATA_LOSS(15),
    UNAUTHENTICATED(16);

    private final int value;

    StatusCode(int value) {
        this.value = value;
    }

    /**
     * @return The numeric value used on the wire.
     */
    public int value() {
        return value;
    }

    public boolean isOk() {
        return this == OK;
    }

    /**
     * Looks up a code by its numeric value. Unrecognized values map to {@link #UNKNOWN}.
     */
    public static StatusCode fromValue(int value) {
        for (StatusCode code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        return UNKNOWN;
    }
}
