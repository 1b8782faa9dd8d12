package dev.wirecall.rpc.transport.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.wirecall.rpc.PartialMethodId;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Encoding rules shared by the blocking and asynchronous JSON transports.
 */
final class JsonValues {

    private final ObjectMapper mapper;

    JsonValues(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    void putParam(ObjectNode params, String name, Object value) throws RpcException {
        try {
            params.set(name, mapper.valueToTree(value));
        } catch (IllegalArgumentException e) {
            throw RpcException.serialization("json serialization failed for parameter " + name, e);
        }
    }

    /**
     * Serialize one top-level value followed by a newline.
     */
    byte[] encode(Object value) throws RpcException {
        try {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            bytes.writeBytes(mapper.writeValueAsBytes(value));
            bytes.write('\n');
            return bytes.toByteArray();
        } catch (JsonProcessingException e) {
            throw RpcException.serialization("json serialization failed", e);
        }
    }

    JsonIncomingCall toIncomingCall(JsonNode request) throws RpcException {
        if (request == null || !request.isObject()) {
            throw RpcException.serialization("json is not expected object");
        }
        JsonNode method = request.get("method");
        if (method == null) {
            throw RpcException.serialization("json is not expected object: no method");
        }
        if (!method.isTextual()) {
            throw RpcException.serialization("json method was not string");
        }
        return new JsonIncomingCall(method.asText(), request.get("params"), request.get("id"));
    }

    static PartialMethodId methodOf(JsonIncomingCall call) {
        return PartialMethodId.name(call.method());
    }

    <T> T param(JsonIncomingCall call, String name, RpcType<T> type) throws RpcException {
        JsonNode params = call.params();
        if (params == null || !params.isObject()) {
            throw RpcException.serialization("json is not expected object: no params");
        }
        JsonNode value = params.get(name);
        if (value == null) {
            throw RpcException.serialization("parameters do not contain " + name);
        }
        try {
            return mapper.readerFor(type.javaType()).readValue(value);
        } catch (IOException e) {
            throw RpcException.serialization("json deserialization failed for parameter " + name, e);
        }
    }
}
