package dev.wirecall.demo;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.wirecall.rpc.RpcErrorKind;
import dev.wirecall.rpc.RpcException;

/**
 * Application error of {@link Greeter}.
 *
 * @param message description of the failure
 * @param kind protocol failure kind when the call itself failed, {@code null} for errors reported
 * by the service
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GreeterError(String message, RpcErrorKind kind) {

    public static GreeterError of(String message) {
        return new GreeterError(message, null);
    }

    public static GreeterError from(RpcException failure) {
        return new GreeterError(failure.getMessage(), failure.kind());
    }

    public boolean protocolFailure() {
        return kind != null;
    }

    @Override
    public String toString() {
        return kind == null ? message : kind + ": " + message;
    }
}
