package com.bitcoin.bitcoin_exporter.core.rpc;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a single RPC call: either a value or the reason the call failed.
 * There are no partial results.
 *
 * @param <T> type of the decoded result
 */
public final class RpcResult<T> {

    private final T value;
    private final String failureReason;

    private RpcResult(T value, String failureReason) {
        this.value = value;
        this.failureReason = failureReason;
    }

    public static <T> RpcResult<T> success(T value) {
        return new RpcResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> RpcResult<T> failure(String reason) {
        return new RpcResult<>(null, reason == null ? "unknown error" : reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public boolean isFailure() {
        return !isSuccess();
    }

    /**
     * @throws NoSuchElementException if this is a failure
     */
    public T getValue() {
        if (isFailure()) {
            throw new NoSuchElementException("RPC call failed: " + failureReason);
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this is a success
     */
    public String getFailureReason() {
        if (isSuccess()) {
            throw new IllegalStateException("RPC call succeeded; there is no failure reason.");
        }
        return failureReason;
    }

    public <R> RpcResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return failure(failureReason);
        }
        return success(mapper.apply(value));
    }

    public T orElse(T other) {
        return isSuccess() ? value : other;
    }

    @Override
    public String toString() {
        return isSuccess() ? "RpcResult{success=" + value + '}' : "RpcResult{failure='" + failureReason + "'}";
    }
}
