package com.sailfish.cloudrpc.error;

import com.sailfish.cloudrpc.model.StatusCode;

/**
 * Thrown when new work is submitted to a completion queue that has been shut down.
 */
public class QueueShutdownException extends RpcException {

    private static final long serialVersionUID = 1L;

    public QueueShutdownException(String message) {
        super(StatusCode.UNAVAILABLE, message);
    }
}
