package dev.wirecall.demo;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcResult;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.client.Param;
import dev.wirecall.rpc.client.RpcClient;
import dev.wirecall.rpc.transport.ClientTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking {@link Greeter} stub. Safe to share between threads; calls are serialized on the
 * transport.
 */
public final class GreeterClient implements Greeter {

    private static final Logger LOGGER = LoggerFactory.getLogger(GreeterClient.class);

    private final RpcClient<?, ?> client;

    public GreeterClient(ClientTransport<?, ?> transport) {
        this.client = RpcClient.of(transport);
    }

    @Override
    public RpcResult<String, GreeterError> describe(String subject, int value) {
        return invoke(GreeterRpc.DESCRIBE, GreeterRpc.TEXT_RESULT, Param.of("subject", subject), Param.of("value", value));
    }

    @Override
    public RpcResult<String, GreeterError> fail(String reason) {
        return invoke(GreeterRpc.FAIL, GreeterRpc.TEXT_RESULT, Param.of("reason", reason));
    }

    @Override
    public RpcResult<Long, GreeterError> add(long a, long b) {
        return invoke(GreeterRpc.ADD, GreeterRpc.NUMBER_RESULT, Param.of("a", a), Param.of("b", b));
    }

    private <T> RpcResult<T, GreeterError> invoke(MethodId method, RpcType<RpcResult<T, GreeterError>> type,
                                                  Param... params) {
        try {
            return client.call(method, type, params);
        } catch (RpcException e) {
            LOGGER.debug("Call {} failed", method, e);
            return RpcResult.err(GreeterError.from(e));
        }
    }
}
