package dev.wirecall.rpc.transport.binary;

import dev.wirecall.rpc.transport.CallState;

/**
 * A received call frame with its read cursor positioned after the method index.
 */
public final class IncomingCall extends CallState {

    private final long methodIndex;

    private final BinaryValues.Cursor cursor;

    private int paramsRead;

    IncomingCall(long methodIndex, BinaryValues.Cursor cursor) {
        this.methodIndex = methodIndex;
        this.cursor = cursor;
    }

    public long methodIndex() {
        return methodIndex;
    }

    public int paramsRead() {
        return paramsRead;
    }

    BinaryValues.Cursor cursor() {
        paramsRead++;
        return cursor;
    }
}
