package dev.wirecall.rpc.transport.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.transport.AsyncChannelIo;
import dev.wirecall.rpc.transport.AsyncClientTransport;
import dev.wirecall.rpc.transport.TransportFailures;
import dev.wirecall.rpc.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousByteChannel;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Like {@link JsonTransport}, as an {@link AsyncClientTransport} over an
 * {@link AsynchronousByteChannel}. Response boundaries are found with {@link JsonValueAssembler}.
 */
public class JsonAsyncClientTransport implements AsyncClientTransport<JsonCall, JsonPendingResponse>, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonAsyncClientTransport.class);

    private static final int READ_CHUNK = 8192;

    private final AsynchronousByteChannel channel;
    private final String label;
    private final JsonValues values;
    private final JsonValueAssembler assembler;

    private volatile boolean abandoned;

    public JsonAsyncClientTransport(AsynchronousByteChannel channel) {
        this(channel, "async-channel", new ObjectMapper());
    }

    public JsonAsyncClientTransport(AsynchronousByteChannel channel, String label, ObjectMapper mapper) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.label = Objects.requireNonNull(label, "label");
        this.values = new JsonValues(Objects.requireNonNull(mapper, "mapper"));
        try {
            this.assembler = new JsonValueAssembler(mapper);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create non-blocking json parser", e);
        }
    }

    @Override
    public Mono<JsonCall> beginCall(MethodId method) {
        return Mono.fromCallable(() -> {
            if (abandoned) {
                throw RpcException.illegalState("Transport " + label + " was abandoned by a cancelled call");
            }
            return new JsonCall(method, values.mapper().createObjectNode());
        });
    }

    @Override
    public Mono<Void> addParam(String name, Object value, JsonCall state) {
        return Mono.fromCallable(() -> {
            state.checkOpen("addParam(" + name + ")");
            values.putParam(state.params(), name, value);
            return state;
        }).then();
    }

    @Override
    public Mono<JsonPendingResponse> finalizeCall(JsonCall state) {
        return Mono.fromCallable(() -> {
                state.consume("finalizeCall");
                return state.toRequest();
            })
            .flatMap(request -> Mono.fromCallable(() -> values.encode(request))
                .flatMap(bytes -> AsyncChannelIo.writeFully(channel, ByteBuffer.wrap(bytes))
                    .then(Mono.fromCallable(() -> {
                        Wire.tx(label, "call " + state.method(), bytes);
                        return new JsonPendingResponse(state.method(), request.id());
                    }))))
            .doOnCancel(this::abandon);
    }

    @Override
    public <T> Mono<T> readResponse(JsonPendingResponse state, RpcType<T> type) {
        return Mono.fromCallable(() -> {
                state.consume("readResponse");
                return state;
            })
            .then(nextValue())
            .flatMap(tokens -> Mono.fromCallable(() -> {
                Wire.rx(label, "response " + state.method() + " to request " + state.requestId());
                try {
                    return values.mapper().<T>readValue(tokens.asParser(values.mapper()), type.javaType());
                } catch (IOException e) {
                    throw TransportFailures.map(e, "json deserialization of response failed");
                }
            }))
            .doOnCancel(this::abandon);
    }

    private Mono<TokenBuffer> nextValue() {
        return Mono.defer(() -> {
            try {
                TokenBuffer value = assembler.poll();
                if (value != null) {
                    return Mono.just(value);
                }
            } catch (IOException e) {
                return Mono.error(TransportFailures.map(e, "json deserialization of response failed"));
            }
            if (assembler.ended()) {
                return Mono.error(RpcException.eof("EOF during json deserialization"));
            }
            ByteBuffer chunk = ByteBuffer.allocate(READ_CHUNK);
            return AsyncChannelIo.read(channel, chunk).flatMap(count -> {
                try {
                    if (count < 0) {
                        assembler.endOfInput();
                    } else {
                        assembler.feed(Arrays.copyOf(chunk.array(), count), count);
                    }
                } catch (IOException e) {
                    return Mono.error(TransportFailures.map(e, "json deserialization of response failed"));
                }
                return nextValue();
            });
        });
    }

    public boolean isAbandoned() {
        return abandoned;
    }

    private void abandon() {
        abandoned = true;
        LOGGER.warn("Call on {} cancelled mid-flight, transport abandoned", label);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
