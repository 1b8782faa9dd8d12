package dev.wirecall.rpc;

/**
 * Categories of {@link RpcException}.
 */
public enum RpcErrorKind {
    /** A value could not be encoded or decoded. */
    SERIALIZATION_ERROR,
    /** The server could not resolve the method identifier of a call. */
    UNKNOWN_METHOD,
    /** The underlying channel failed. Only raised by concrete transports. */
    TRANSPORT_ERROR,
    /** The peer closed the channel while a read was expected. Only raised by concrete transports. */
    TRANSPORT_EOF,
    /** A call state was used out of order or more than once. */
    ILLEGAL_STATE,
    OTHER
}
