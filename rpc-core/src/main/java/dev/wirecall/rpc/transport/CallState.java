package dev.wirecall.rpc.transport;

import dev.wirecall.rpc.RpcException;

/**
 * Base for transport call states. A state belongs to one call and is consumed by the operation
 * that ends its phase.
 */
public abstract class CallState {

    private boolean consumed;

    public void checkOpen(String operation) throws RpcException {
        if (consumed) {
            throw RpcException.illegalState(operation + " on a call state that was already consumed");
        }
    }

    public void consume(String operation) throws RpcException {
        checkOpen(operation);
        consumed = true;
    }

    public boolean isConsumed() {
        return consumed;
    }
}
