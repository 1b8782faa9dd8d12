package dev.wirecall.rpc.transport.binary;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.PartialMethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.transport.ClientTransport;
import dev.wirecall.rpc.transport.ServerTransport;
import dev.wirecall.rpc.transport.TransportFailures;
import dev.wirecall.rpc.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking transport using the positional CBOR encoding inside length-prefixed frames. Works over
 * any pair of streams (socket, pipe, in-memory buffers). No buffering is performed beyond one frame.
 */
public class BinaryTransport implements ClientTransport<OutgoingCall, PendingResponse>,
    ServerTransport<IncomingCall>, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinaryTransport.class);

    private final InputStream in;
    private final OutputStream out;
    private final String label;
    private final int maxFrameLength;
    private final BinaryValues values;

    private IncomingCall current;

    public BinaryTransport(InputStream in, OutputStream out) {
        this(in, out, "stream", FrameCodec.DEFAULT_MAX_FRAME_LENGTH);
    }

    public BinaryTransport(InputStream in, OutputStream out, String label, int maxFrameLength) {
        this(in, out, label, maxFrameLength, BinaryValues.defaultMapper());
    }

    /**
     * @param cborMapper mapper built on a CBOR factory, for custom modules or features
     */
    public BinaryTransport(InputStream in, OutputStream out, String label, int maxFrameLength, ObjectMapper cborMapper) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.label = Objects.requireNonNull(label, "label");
        if (maxFrameLength < 0) {
            throw new IllegalArgumentException("Invalid max frame length: " + maxFrameLength);
        }
        this.maxFrameLength = maxFrameLength;
        this.values = new BinaryValues(cborMapper);
    }

    public static BinaryTransport over(Socket socket) throws IOException {
        return over(socket, FrameCodec.DEFAULT_MAX_FRAME_LENGTH);
    }

    public static BinaryTransport over(Socket socket, int maxFrameLength) throws IOException {
        return new BinaryTransport(socket.getInputStream(), socket.getOutputStream(),
            String.valueOf(socket.getRemoteSocketAddress()), maxFrameLength);
    }

    @Override
    public OutgoingCall beginCall(MethodId method) throws RpcException {
        OutgoingCall call = new OutgoingCall(method);
        values.append(call.payload(), method.index());
        return call;
    }

    @Override
    public void addParam(String name, Object value, OutgoingCall state) throws RpcException {
        state.checkOpen("addParam(" + name + ")");
        values.append(state.payload(), value);
    }

    @Override
    public PendingResponse finalizeCall(OutgoingCall state) throws RpcException {
        state.consume("finalizeCall");
        byte[] payload = state.payload().toByteArray();
        writeFrame(payload);
        Wire.tx(label, "call " + state.method(), payload.length);
        return new PendingResponse(state.method());
    }

    @Override
    public <T> T readResponse(PendingResponse state, RpcType<T> type) throws RpcException {
        state.consume("readResponse");
        byte[] payload = FrameCodec.readFrame(in, maxFrameLength);
        Wire.rx(label, "response " + state.method(), payload.length);
        return values.cursor(payload).next(type, "response of " + state.method());
    }

    @Override
    public Received<IncomingCall> beginReceive() throws RpcException {
        byte[] payload = FrameCodec.readFrame(in, maxFrameLength);
        BinaryValues.Cursor cursor = values.cursor(payload);
        long index = cursor.nextIndex("method index");
        if (index < 0 || index > MethodId.MAX_INDEX) {
            throw RpcException.serialization("Invalid method index: " + index);
        }
        Wire.rx(label, "call #" + index, payload.length);
        current = new IncomingCall(index, cursor);
        return new Received<>(PartialMethodId.index(index), current);
    }

    @Override
    public <T> T readParam(String name, RpcType<T> type, IncomingCall state) throws RpcException {
        state.checkOpen("readParam(" + name + ")");
        return state.cursor().next(type, "parameter " + name);
    }

    @Override
    public void sendResponse(Object value) throws RpcException {
        if (current == null) {
            throw RpcException.illegalState("sendResponse without a received call");
        }
        current.consume("sendResponse");
        current = null;
        byte[] payload = values.encode(value);
        writeFrame(payload);
        Wire.tx(label, "response", payload.length);
    }

    private void writeFrame(byte[] payload) throws RpcException {
        if (payload.length > maxFrameLength) {
            throw RpcException.serialization("Frame too large: " + payload.length + " > " + maxFrameLength);
        }
        try {
            FrameCodec.writeFrame(out, payload);
        } catch (IOException e) {
            throw TransportFailures.map(e, "Failed to write frame");
        }
    }

    @Override
    public void close() throws IOException {
        try {
            in.close();
        } finally {
            out.close();
        }
        LOGGER.debug("Closed binary transport {}", label);
    }
}
