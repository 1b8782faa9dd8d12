package dev.wirecall.rpc.transport.binary;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.transport.AsyncChannelIo;
import dev.wirecall.rpc.transport.AsyncClientTransport;
import dev.wirecall.rpc.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousByteChannel;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Like {@link BinaryTransport}, as an {@link AsyncClientTransport} over an
 * {@link AsynchronousByteChannel}.
 */
public class BinaryAsyncClientTransport implements AsyncClientTransport<OutgoingCall, PendingResponse>, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinaryAsyncClientTransport.class);

    private final AsynchronousByteChannel channel;
    private final String label;
    private final int maxFrameLength;
    private final BinaryValues values;

    private volatile boolean abandoned;

    public BinaryAsyncClientTransport(AsynchronousByteChannel channel) {
        this(channel, "async-channel", FrameCodec.DEFAULT_MAX_FRAME_LENGTH);
    }

    public BinaryAsyncClientTransport(AsynchronousByteChannel channel, String label, int maxFrameLength) {
        this(channel, label, maxFrameLength, BinaryValues.defaultMapper());
    }

    public BinaryAsyncClientTransport(AsynchronousByteChannel channel, String label, int maxFrameLength,
        ObjectMapper cborMapper) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.label = Objects.requireNonNull(label, "label");
        this.maxFrameLength = maxFrameLength;
        this.values = new BinaryValues(cborMapper);
    }

    @Override
    public Mono<OutgoingCall> beginCall(MethodId method) {
        return Mono.fromCallable(() -> {
            if (abandoned) {
                throw RpcException.illegalState("Transport " + label + " was abandoned by a cancelled call");
            }
            OutgoingCall call = new OutgoingCall(method);
            values.append(call.payload(), method.index());
            return call;
        });
    }

    @Override
    public Mono<Void> addParam(String name, Object value, OutgoingCall state) {
        return Mono.fromCallable(() -> {
            state.checkOpen("addParam(" + name + ")");
            values.append(state.payload(), value);
            return state;
        }).then();
    }

    @Override
    public Mono<PendingResponse> finalizeCall(OutgoingCall state) {
        return Mono.fromCallable(() -> {
                state.consume("finalizeCall");
                byte[] payload = state.payload().toByteArray();
                if (payload.length > maxFrameLength) {
                    throw RpcException.serialization("Frame too large: " + payload.length + " > " + maxFrameLength);
                }
                return payload;
            })
            .flatMap(payload -> AsyncChannelIo.writeFully(channel, FrameCodec.frame(payload))
                .then(Mono.fromCallable(() -> {
                    Wire.tx(label, "call " + state.method(), payload.length);
                    return new PendingResponse(state.method());
                })))
            .doOnCancel(this::abandon);
    }

    @Override
    public <T> Mono<T> readResponse(PendingResponse state, RpcType<T> type) {
        return Mono.fromCallable(() -> {
                state.consume("readResponse");
                return ByteBuffer.allocate(FrameCodec.HEADER_LENGTH);
            })
            .flatMap(header -> AsyncChannelIo.readFully(channel, header, "Channel closed while reading frame header"))
            .flatMap(header -> Mono.fromCallable(() -> FrameCodec.parseHeader(header, maxFrameLength)))
            .flatMap(length -> AsyncChannelIo.readFully(channel, ByteBuffer.allocate(length),
                "Channel closed while reading frame payload of length " + length))
            .flatMap(payload -> Mono.fromCallable(() -> {
                Wire.rx(label, "response " + state.method(), payload.capacity());
                return values.cursor(payload.array()).next(type, "response of " + state.method());
            }))
            .doOnCancel(this::abandon);
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
