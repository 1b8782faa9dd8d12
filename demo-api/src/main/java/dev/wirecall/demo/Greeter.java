package dev.wirecall.demo;

import dev.wirecall.rpc.RpcResult;

/**
 * Sample remote service. Every method reports application failures through the error arm of its
 * result, and the client stubs fold protocol failures into the same arm.
 */
public interface Greeter {

    /**
     * @return {@code "<subject> is <value>"}
     */
    RpcResult<String, GreeterError> describe(String subject, int value);

    /**
     * Always fails with {@code reason}.
     */
    RpcResult<String, GreeterError> fail(String reason);

    /**
     * @return the sum, or an error on overflow
     */
    RpcResult<Long, GreeterError> add(long a, long b);
}
