package com.sailfish.cloudrpc.service.impl;

import com.sailfish.cloudrpc.RemoteCall;
import com.sailfish.cloudrpc.error.RpcException;
import com.sailfish.cloudrpc.model.Result;
import com.sailfish.cloudrpc.model.StatusCode;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Remote call stub that completes immediately with the next scripted result. The last result repeats.
 */
final class ScriptedRemoteCall<T> implements RemoteCall<T> {

    private final List<Result<T>> script;
    private final AtomicInteger starts = new AtomicInteger();

    @SafeVarargs
    ScriptedRemoteCall(Result<T>... script) {
        if (script.length == 0) throw new IllegalArgumentException("script cannot be empty");
        this.script = Arrays.asList(script);
    }

    static <T> ScriptedRemoteCall<T> alwaysFailing(StatusCode code) {
        return new ScriptedRemoteCall<>(failure(code));
    }

    static <T> Result<T> failure(StatusCode code) {
        return Result.failure(new RpcException(code, "scripted " + code));
    }

    @Override
    public Future<?> start(Consumer<Result<T>> callback) {
        int attempt = starts.getAndIncrement();
        callback.accept(script.get(Math.min(attempt, script.size() - 1)));
        return null;
    }

    int getStarts() {
        return starts.get();
    }
}
