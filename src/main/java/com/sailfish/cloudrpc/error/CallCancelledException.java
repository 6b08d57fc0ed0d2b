package com.sailfish.cloudrpc.error;

import com.sailfish.cloudrpc.model.StatusCode;

/**
 * The operation was cancelled by its caller before it produced a result.
 */
public class CallCancelledException extends RpcException {

    private static final long serialVersionUID = 1L;

    public CallCancelledException(String message) {
        super(StatusCode.CANCELLED, message);
    }
}
