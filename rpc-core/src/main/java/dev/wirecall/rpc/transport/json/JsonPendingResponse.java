package dev.wirecall.rpc.transport.json;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.transport.CallState;

public final class JsonPendingResponse extends CallState {

    private final MethodId method;

    private final String requestId;

    JsonPendingResponse(MethodId method, String requestId) {
        this.method = method;
        this.requestId = requestId;
    }

    public MethodId method() {
        return method;
    }

    public String requestId() {
        return requestId;
    }
}
