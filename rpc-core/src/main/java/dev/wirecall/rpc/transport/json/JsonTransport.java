package dev.wirecall.rpc.transport.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.transport.ClientTransport;
import dev.wirecall.rpc.transport.ServerTransport;
import dev.wirecall.rpc.transport.TransportFailures;
import dev.wirecall.rpc.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking transport over a JSON-RPC style request envelope. Messages are not length-prefixed:
 * each side reads exactly one complete JSON value per message with a single streaming parser kept
 * for the lifetime of the transport.
 */
public class JsonTransport implements ClientTransport<JsonCall, JsonPendingResponse>,
    ServerTransport<JsonIncomingCall>, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonTransport.class);

    private final InputStream in;
    private final OutputStream out;
    private final String label;
    private final JsonValues values;

    private JsonParser parser;
    private JsonIncomingCall current;

    public JsonTransport(InputStream in, OutputStream out) {
        this(in, out, "stream", new ObjectMapper());
    }

    public JsonTransport(InputStream in, OutputStream out, String label, ObjectMapper mapper) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.label = Objects.requireNonNull(label, "label");
        this.values = new JsonValues(Objects.requireNonNull(mapper, "mapper"));
    }

    public static JsonTransport over(Socket socket) throws IOException {
        return new JsonTransport(socket.getInputStream(), socket.getOutputStream(),
            String.valueOf(socket.getRemoteSocketAddress()), new ObjectMapper());
    }

    @Override
    public JsonCall beginCall(MethodId method) {
        return new JsonCall(method, values.mapper().createObjectNode());
    }

    @Override
    public void addParam(String name, Object value, JsonCall state) throws RpcException {
        state.checkOpen("addParam(" + name + ")");
        values.putParam(state.params(), name, value);
    }

    @Override
    public JsonPendingResponse finalizeCall(JsonCall state) throws RpcException {
        state.consume("finalizeCall");
        JsonRequest request = state.toRequest();
        byte[] bytes = values.encode(request);
        write(bytes);
        Wire.tx(label, "call " + state.method(), bytes);
        return new JsonPendingResponse(state.method(), request.id());
    }

    @Override
    public <T> T readResponse(JsonPendingResponse state, RpcType<T> type) throws RpcException {
        state.consume("readResponse");
        T value = readValue(type.javaType(), "response");
        Wire.rx(label, "response " + state.method() + " to request " + state.requestId());
        return value;
    }

    @Override
    public Received<JsonIncomingCall> beginReceive() throws RpcException {
        JsonNode request = readValue(values.mapper().constructType(JsonNode.class), "request");
        JsonIncomingCall call = values.toIncomingCall(request);
        Wire.rx(label, "call " + call.method());
        current = call;
        return new Received<>(JsonValues.methodOf(call), call);
    }

    @Override
    public <T> T readParam(String name, RpcType<T> type, JsonIncomingCall state) throws RpcException {
        state.checkOpen("readParam(" + name + ")");
        return values.param(state, name, type);
    }

    @Override
    public void sendResponse(Object value) throws RpcException {
        if (current == null) {
            throw RpcException.illegalState("sendResponse without a received call");
        }
        current.consume("sendResponse");
        current = null;
        byte[] bytes = values.encode(value);
        write(bytes);
        Wire.tx(label, "response", bytes);
    }

    private <T> T readValue(JavaType type, String what) throws RpcException {
        try {
            JsonParser p = parser();
            if (p.nextToken() == null) {
                throw RpcException.eof("EOF during json deserialization of " + what);
            }
            JsonNode tree = values.mapper().readTree(p);
            return values.mapper().readerFor(type).readValue(tree == null ? NullNode.getInstance() : tree);
        } catch (IOException e) {
            throw TransportFailures.map(e, "json deserialization of " + what + " failed");
        }
    }

    private JsonParser parser() throws IOException {
        if (parser == null) {
            // byte-level detection would wait for four bytes before the first token
            parser = values.mapper().getFactory().createParser(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
        return parser;
    }

    private void write(byte[] bytes) throws RpcException {
        try {
            out.write(bytes);
            out.flush();
        } catch (IOException e) {
            throw TransportFailures.map(e, "cannot write to underlying channel");
        }
    }

    @Override
    public void close() throws IOException {
        try {
            in.close();
        } finally {
            out.close();
        }
        LOGGER.debug("Closed json transport {}", label);
    }
}
