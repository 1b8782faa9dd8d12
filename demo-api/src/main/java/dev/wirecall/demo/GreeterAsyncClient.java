package dev.wirecall.demo;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcResult;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.client.AsyncRpcClient;
import dev.wirecall.rpc.client.Param;
import dev.wirecall.rpc.transport.AsyncClientTransport;
import reactor.core.publisher.Mono;

/**
 * Reactive counterpart of {@link GreeterClient}.
 */
public final class GreeterAsyncClient {

    private final AsyncRpcClient<?, ?> client;

    public GreeterAsyncClient(AsyncClientTransport<?, ?> transport) {
        this.client = AsyncRpcClient.of(transport);
    }

    public Mono<RpcResult<String, GreeterError>> describe(String subject, int value) {
        return invoke(GreeterRpc.DESCRIBE, GreeterRpc.TEXT_RESULT, Param.of("subject", subject), Param.of("value", value));
    }

    public Mono<RpcResult<String, GreeterError>> fail(String reason) {
        return invoke(GreeterRpc.FAIL, GreeterRpc.TEXT_RESULT, Param.of("reason", reason));
    }

    public Mono<RpcResult<Long, GreeterError>> add(long a, long b) {
        return invoke(GreeterRpc.ADD, GreeterRpc.NUMBER_RESULT, Param.of("a", a), Param.of("b", b));
    }

    private <T> Mono<RpcResult<T, GreeterError>> invoke(MethodId method, RpcType<RpcResult<T, GreeterError>> type,
                                                        Param... params) {
        return client.call(method, type, params)
            .onErrorResume(RpcException.class, e -> Mono.just(RpcResult.<T, GreeterError>err(GreeterError.from(e))));
    }
}
