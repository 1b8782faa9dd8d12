package dev.wirecall.rpc.transport;

import dev.wirecall.rpc.PartialMethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;

/**
 * Server side of a transport. Per call the dispatcher invokes {@link #beginReceive}, then
 * {@link #readParam} once per declared parameter in order, then {@link #sendResponse} exactly once.
 *
 * @param <RX> state used while reading the parameters of one call
 */
public interface ServerTransport<RX> {

    /**
     * Block until a complete call is available.
     * @return method identifier and reception state
     * @throws RpcException {@code TRANSPORT_EOF} when the peer closed the channel,
     * {@code SERIALIZATION_ERROR} when the method identifier cannot be decoded
     */
    Received<RX> beginReceive() throws RpcException;

    /**
     * Read the next parameter. The name is a hint; positional transports keep their own cursor.
     */
    <T> T readParam(String name, RpcType<T> type, RX state) throws RpcException;

    /**
     * Transmit the response of the current call. Application errors are ordinary values here.
     */
    void sendResponse(Object value) throws RpcException;

    /**
     * A call that has begun arriving.
     *
     * @param method method identifier as recovered from the wire
     * @param state transport state for reading parameters
     * @param <RX> transport state type
     */
    record Received<RX>(PartialMethodId method, RX state) {
    }
}
