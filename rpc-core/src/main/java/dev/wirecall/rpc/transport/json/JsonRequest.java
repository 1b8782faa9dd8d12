package dev.wirecall.rpc.transport.json;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.UUID;

/**
 * Request envelope of the JSON codec. Parameters are keyed by name; the response is the bare
 * result value with no envelope.
 */
@JsonPropertyOrder({"jsonrpc", "method", "params", "id"})
public record JsonRequest(
    String jsonrpc,
    String method,
    ObjectNode params,
    String id
) {

    public static final String VERSION = "2.0";

    public static JsonRequest of(String method, ObjectNode params) {
        return new JsonRequest(VERSION, method, params, UUID.randomUUID().toString());
    }
}
