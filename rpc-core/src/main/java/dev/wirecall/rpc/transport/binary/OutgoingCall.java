package dev.wirecall.rpc.transport.binary;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.transport.CallState;
import java.io.ByteArrayOutputStream;

/**
 * Call payload under construction: the method index followed by the parameters added so far.
 */
public final class OutgoingCall extends CallState {

    private final MethodId method;

    private final ByteArrayOutputStream payload = new ByteArrayOutputStream();

    OutgoingCall(MethodId method) {
        this.method = method;
    }

    public MethodId method() {
        return method;
    }

    ByteArrayOutputStream payload() {
        return payload;
    }
}
