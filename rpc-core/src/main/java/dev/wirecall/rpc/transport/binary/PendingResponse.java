package dev.wirecall.rpc.transport.binary;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.transport.CallState;

/**
 * A call whose frame has been written and whose response frame has not been read yet.
 */
public final class PendingResponse extends CallState {

    private final MethodId method;

    PendingResponse(MethodId method) {
        this.method = method;
    }

    public MethodId method() {
        return method;
    }
}
