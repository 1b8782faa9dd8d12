package dev.wirecall.rpc.client;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.transport.ClientTransport;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking client that may be shared between threads. Each call holds a fair lock from
 * {@code beginCall} to {@code readResponse}, so at most one call is in flight on the transport and
 * waiting callers proceed in arrival order.
 *
 * @param <TX> transport call state
 * @param <F> transport final state
 */
public final class RpcClient<TX, F> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RpcClient.class);

    private final ClientTransport<TX, F> transport;
    private final ReentrantLock lock = new ReentrantLock(true);

    public RpcClient(ClientTransport<TX, F> transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public static <TX, F> RpcClient<TX, F> of(ClientTransport<TX, F> transport) {
        return new RpcClient<>(transport);
    }

    public ClientTransport<TX, F> transport() {
        return transport;
    }

    public <T> T call(MethodId method, Class<T> resultType, Param... params) throws RpcException {
        return call(method, RpcType.of(resultType), params);
    }

    public <T> T call(MethodId method, RpcType<T> resultType, Param... params) throws RpcException {
        lock.lock();
        try {
            LOGGER.trace("Calling {} with {} params", method, params.length);
            TX state = transport.beginCall(method);
            for (Param param : params) {
                transport.addParam(param.name(), param.value(), state);
            }
            F pending = transport.finalizeCall(state);
            return transport.readResponse(pending, resultType);
        } finally {
            lock.unlock();
        }
    }
}
