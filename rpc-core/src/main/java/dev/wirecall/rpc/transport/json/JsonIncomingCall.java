package dev.wirecall.rpc.transport.json;

import com.fasterxml.jackson.databind.JsonNode;
import dev.wirecall.rpc.transport.CallState;

/**
 * A received request envelope. Parameters are looked up by name, so extra or reordered entries are
 * tolerated.
 */
public final class JsonIncomingCall extends CallState {

    private final String method;

    private final JsonNode params;

    private final JsonNode id;

    JsonIncomingCall(String method, JsonNode params, JsonNode id) {
        this.method = method;
        this.params = params;
        this.id = id;
    }

    public String method() {
        return method;
    }

    /**
     * @return the {@code id} member of the envelope, or {@code null} when absent
     */
    public JsonNode id() {
        return id;
    }

    JsonNode params() {
        return params;
    }
}
