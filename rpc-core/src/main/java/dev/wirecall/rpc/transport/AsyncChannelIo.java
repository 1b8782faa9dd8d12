package dev.wirecall.rpc.transport;

import dev.wirecall.rpc.RpcException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousByteChannel;
import java.nio.channels.CompletionHandler;
import reactor.core.publisher.Mono;

/**
 * Reactor adapters over {@link AsynchronousByteChannel}. Only one read and one write may be
 * outstanding per channel, which callers guarantee by serializing calls.
 */
public final class AsyncChannelIo {

    private AsyncChannelIo() {
    }

    /**
     * Single read into {@code buffer}.
     * @return number of bytes read, or -1 at end of stream
     */
    public static Mono<Integer> read(AsynchronousByteChannel channel, ByteBuffer buffer) {
        return Mono.<Integer>create(sink -> channel.read(buffer, null, new CompletionHandler<Integer, Void>() {
            @Override
            public void completed(Integer result, Void attachment) {
                sink.success(result);
            }

            @Override
            public void failed(Throwable failure, Void attachment) {
                sink.error(failure);
            }
        })).onErrorMap(failure -> TransportFailures.map(failure, "channel read failed"));
    }

    /**
     * Fill {@code buffer} completely.
     * @param eofMessage message of the {@code TRANSPORT_EOF} error raised if the stream ends first
     */
    public static Mono<ByteBuffer> readFully(AsynchronousByteChannel channel, ByteBuffer buffer, String eofMessage) {
        if (!buffer.hasRemaining()) {
            return Mono.just(buffer);
        }
        return read(channel, buffer)
            .<Integer>handle((count, sink) -> {
                if (count < 0) {
                    sink.error(RpcException.eof(eofMessage + " after " + buffer.position() + " bytes"));
                } else {
                    sink.next(count);
                }
            })
            .repeat(buffer::hasRemaining)
            .then(Mono.just(buffer));
    }

    /**
     * Write all remaining bytes of {@code buffer}.
     */
    public static Mono<Void> writeFully(AsynchronousByteChannel channel, ByteBuffer buffer) {
        if (!buffer.hasRemaining()) {
            return Mono.empty();
        }
        return Mono.<Integer>create(sink -> channel.write(buffer, null, new CompletionHandler<Integer, Void>() {
                @Override
                public void completed(Integer result, Void attachment) {
                    sink.success(result);
                }

                @Override
                public void failed(Throwable failure, Void attachment) {
                    sink.error(failure);
                }
            }))
            .onErrorMap(failure -> TransportFailures.map(failure, "channel write failed"))
            .repeat(buffer::hasRemaining)
            .then();
    }
}
