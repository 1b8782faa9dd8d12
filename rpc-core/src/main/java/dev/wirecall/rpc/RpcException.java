package dev.wirecall.rpc;

import java.util.Objects;
import java.util.Optional;

/**
 * Protocol or transport level failure of a remote call. Application errors are never represented by
 * this type; they travel as ordinary response values.
 */
public class RpcException extends Exception {

    private static final long serialVersionUID = 1L;

    private final RpcErrorKind kind;

    private final transient GenericError remoteCause;

    public RpcException(RpcErrorKind kind, String message) {
        this(kind, message, null);
    }

    public RpcException(RpcErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.remoteCause = null;
    }

    /**
     * Rebuild an exception from its wire form. The cause chain is available through
     * {@link #remoteCause()} only.
     * @param error deserialized error
     */
    public RpcException(RpcError error) {
        super(error.message());
        this.kind = error.kind();
        this.remoteCause = error.cause();
    }

    public static RpcException serialization(String message, Throwable cause) {
        return new RpcException(RpcErrorKind.SERIALIZATION_ERROR, message, cause);
    }

    public static RpcException serialization(String message) {
        return new RpcException(RpcErrorKind.SERIALIZATION_ERROR, message);
    }

    public static RpcException transport(String message, Throwable cause) {
        return new RpcException(RpcErrorKind.TRANSPORT_ERROR, message, cause);
    }

    public static RpcException eof(String message) {
        return new RpcException(RpcErrorKind.TRANSPORT_EOF, message);
    }

    public static RpcException eof(String message, Throwable cause) {
        return new RpcException(RpcErrorKind.TRANSPORT_EOF, message, cause);
    }

    public static RpcException unknownMethod(PartialMethodId method) {
        return new RpcException(RpcErrorKind.UNKNOWN_METHOD, "Unknown rpc method " + method);
    }

    public static RpcException illegalState(String message) {
        return new RpcException(RpcErrorKind.ILLEGAL_STATE, message);
    }

    public RpcErrorKind kind() {
        return kind;
    }

    /**
     * Cause chain received from a peer, when this exception was rebuilt from an {@link RpcError}.
     * @return the remote cause, if any
     */
    public Optional<GenericError> remoteCause() {
        return Optional.ofNullable(remoteCause);
    }

    /**
     * Project this exception into its serializable form.
     * @return wire form carrying kind, message and cause chain
     */
    public RpcError toError() {
        GenericError cause = getCause() != null ? GenericError.from(getCause()) : remoteCause;
        return new RpcError(kind, getMessage(), cause);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
    }
}
