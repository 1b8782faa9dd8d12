package dev.wirecall.rpc.server;

import dev.wirecall.rpc.RpcException;

/**
 * Invokes one service method: reads its parameters in declaration order and returns the value sent
 * back as the response.
 *
 * @param <I> service implementation type
 */
@FunctionalInterface
public interface MethodHandler<I> {

    Object invoke(I service, CallParams params) throws RpcException;
}
