package dev.wirecall.rpc.transport;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;

/**
 * Client side of a transport. One call is performed by invoking, strictly in this order,
 * {@link #beginCall}, {@link #addParam} once per declared parameter, {@link #finalizeCall} and
 * {@link #readResponse}. Instances are not safe for concurrent calls.
 *
 * @param <TX> state accumulated while the call is built
 * @param <F> state returned by {@link #finalizeCall} and consumed by {@link #readResponse}
 */
public interface ClientTransport<TX, F> {

    /**
     * Begin calling the given method. The transport may start transmitting immediately or wait
     * until {@link #finalizeCall}.
     * @param method method to call
     * @return fresh call state
     * @throws RpcException {@code TRANSPORT_ERROR} on channel failure
     */
    TX beginCall(MethodId method) throws RpcException;

    /**
     * Add the next parameter. Parameters are always added in declaration order, so a transport may
     * ignore the name.
     * @param name declared parameter name
     * @param value parameter value
     * @param state state returned by {@link #beginCall}
     * @throws RpcException {@code SERIALIZATION_ERROR} when the value cannot be encoded
     */
    void addParam(String name, Object value, TX state) throws RpcException;

    /**
     * Finish the call. All bytes of the call are written and flushed when this returns.
     * @param state state returned by {@link #beginCall}
     * @return state for reading the response
     * @throws RpcException {@code TRANSPORT_ERROR} or {@code SERIALIZATION_ERROR}
     */
    F finalizeCall(TX state) throws RpcException;

    /**
     * Block until the response is available and decode it.
     * @param state state returned by {@link #finalizeCall}
     * @param type result type
     * @param <T> result type
     * @return decoded response
     * @throws RpcException {@code SERIALIZATION_ERROR} on a malformed payload, {@code TRANSPORT_EOF}
     * when the peer closed before a complete response, {@code TRANSPORT_ERROR} otherwise
     */
    <T> T readResponse(F state, RpcType<T> type) throws RpcException;
}
