package dev.wirecall.rpc.transport.json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.transport.CallState;

/**
 * Request under construction. Nothing is written before {@code finalizeCall}.
 */
public final class JsonCall extends CallState {

    private final MethodId method;

    private final ObjectNode params;

    JsonCall(MethodId method, ObjectNode params) {
        this.method = method;
        this.params = params;
    }

    public MethodId method() {
        return method;
    }

    ObjectNode params() {
        return params;
    }

    JsonRequest toRequest() {
        return JsonRequest.of(method.name(), params);
    }
}
