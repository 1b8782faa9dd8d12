package dev.wirecall.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * Wire form of an {@link RpcException}.
 *
 * @param kind failure category
 * @param message human-readable message
 * @param cause serializable cause chain, or {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcError(RpcErrorKind kind, String message, GenericError cause) {

    public RpcError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public RpcException toException() {
        return new RpcException(this);
    }

    @Override
    public String toString() {
        if (cause == null) {
            return kind + ": " + message;
        }
        return kind + ": " + message + " caused by:\n " + cause;
    }
}
