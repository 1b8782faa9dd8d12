package dev.wirecall.rpc.client;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.transport.AsyncClientTransport;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive client that may be shared between concurrent pipelines. Each call holds an
 * {@link AsyncMutex} from {@code beginCall} until its response has been read; waiting for the
 * mutex never blocks a thread.
 *
 * @param <TX> transport call state
 * @param <F> transport final state
 */
public final class AsyncRpcClient<TX, F> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncRpcClient.class);

    private final AsyncClientTransport<TX, F> transport;
    private final AsyncMutex mutex = new AsyncMutex();

    public AsyncRpcClient(AsyncClientTransport<TX, F> transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public static <TX, F> AsyncRpcClient<TX, F> of(AsyncClientTransport<TX, F> transport) {
        return new AsyncRpcClient<>(transport);
    }

    public AsyncClientTransport<TX, F> transport() {
        return transport;
    }

    public <T> Mono<T> call(MethodId method, Class<T> resultType, Param... params) {
        return call(method, RpcType.of(resultType), params);
    }

    public <T> Mono<T> call(MethodId method, RpcType<T> resultType, Param... params) {
        return mutex.withLock(() -> {
            LOGGER.trace("Calling {} with {} params", method, params.length);
            return transport.beginCall(method)
                .flatMap(state -> Flux.fromIterable(Arrays.asList(params))
                    .concatMap(param -> transport.addParam(param.name(), param.value(), state))
                    .then(Mono.defer(() -> transport.finalizeCall(state))))
                .flatMap(pending -> transport.readResponse(pending, resultType));
        });
    }
}
