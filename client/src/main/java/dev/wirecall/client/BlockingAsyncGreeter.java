package dev.wirecall.client;

import dev.wirecall.demo.Greeter;
import dev.wirecall.demo.GreeterAsyncClient;
import dev.wirecall.demo.GreeterError;
import dev.wirecall.rpc.RpcResult;

/**
 * Presents the reactive stub as a {@link Greeter} by blocking on each call.
 */
final class BlockingAsyncGreeter implements Greeter {

    private final GreeterAsyncClient client;

    BlockingAsyncGreeter(GreeterAsyncClient client) {
        this.client = client;
    }

    @Override
    public RpcResult<String, GreeterError> describe(String subject, int value) {
        return client.describe(subject, value).block();
    }

    @Override
    public RpcResult<String, GreeterError> fail(String reason) {
        return client.fail(reason).block();
    }

    @Override
    public RpcResult<Long, GreeterError> add(long a, long b) {
        return client.add(a, b).block();
    }
}
