package dev.wirecall.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Optional;
import java.util.function.Function;

/**
 * Success or failure outcome of an application method. Both arms are serialized as the call's
 * response payload; the transports never inspect them.
 *
 * @param ok success value, when {@code err} is {@code null}
 * @param err application error, or {@code null} on success
 * @param <T> success type
 * @param <E> application error type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcResult<T, E>(T ok, E err) {

    public RpcResult {
        if (ok != null && err != null) {
            throw new IllegalArgumentException("A result holds either a value or an error");
        }
    }

    public static <T, E> RpcResult<T, E> ok(T value) {
        return new RpcResult<>(value, null);
    }

    public static <T, E> RpcResult<T, E> err(E error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new RpcResult<>(null, error);
    }

    public boolean failed() {
        return err != null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(ok);
    }

    public Optional<E> error() {
        return Optional.ofNullable(err);
    }

    public <U> RpcResult<U, E> map(Function<? super T, ? extends U> mapper) {
        return failed() ? new RpcResult<>(null, err) : new RpcResult<>(mapper.apply(ok), null);
    }
}
