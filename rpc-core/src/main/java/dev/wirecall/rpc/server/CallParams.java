package dev.wirecall.rpc.server;

import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;

/**
 * Parameter source of the call being served. Parameters must be read in declaration order.
 */
public interface CallParams {

    <T> T read(String name, RpcType<T> type) throws RpcException;

    default <T> T read(String name, Class<T> type) throws RpcException {
        return read(name, RpcType.of(type));
    }
}
