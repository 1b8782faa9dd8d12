package dev.wirecall.rpc.transport;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcType;
import reactor.core.publisher.Mono;

/**
 * Asynchronous counterpart of {@link ClientTransport}. Every operation is deferred until
 * subscription and signals failures as {@link dev.wirecall.rpc.RpcException}. Cancelling a
 * subscription abandons the transport: bytes already written stay written and later calls fail with
 * {@code ILLEGAL_STATE}.
 *
 * @param <TX> state accumulated while the call is built
 * @param <F> state consumed by {@link #readResponse}
 */
public interface AsyncClientTransport<TX, F> {

    Mono<TX> beginCall(MethodId method);

    Mono<Void> addParam(String name, Object value, TX state);

    Mono<F> finalizeCall(TX state);

    <T> Mono<T> readResponse(F state, RpcType<T> type);
}
