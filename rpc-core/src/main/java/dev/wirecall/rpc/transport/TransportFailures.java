package dev.wirecall.rpc.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonEOFException;
import dev.wirecall.rpc.RpcErrorKind;
import dev.wirecall.rpc.RpcException;
import java.io.EOFException;
import java.io.IOException;

/**
 * Maps low-level failures onto {@link RpcException} kinds.
 */
public final class TransportFailures {

    private TransportFailures() {
    }

    public static RpcException map(Throwable failure, String context) {
        if (failure instanceof RpcException rpc) {
            return rpc;
        }
        if (failure instanceof EOFException || failure instanceof JsonEOFException) {
            return RpcException.eof(context + ": unexpected end of stream", failure);
        }
        if (failure instanceof JsonProcessingException) {
            return RpcException.serialization(context, failure);
        }
        if (failure instanceof IOException) {
            return RpcException.transport(context, failure);
        }
        return new RpcException(RpcErrorKind.OTHER, context, failure);
    }
}
