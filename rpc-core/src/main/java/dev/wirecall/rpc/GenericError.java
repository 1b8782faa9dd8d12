package dev.wirecall.rpc;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Serializable projection of a {@link Throwable} and its cause chain. The concrete exception types
 * and stack traces are lost; descriptions and chain depth are kept.
 *
 * @param description message of the throwable, or its class name when it has no message
 * @param cause projection of the throwable's cause, or {@code null}
 */
public record GenericError(String description, GenericError cause) {

    public static GenericError from(Throwable throwable) {
        if (throwable == null) {
            return null;
        }
        return from(throwable, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static GenericError from(Throwable throwable, Set<Throwable> seen) {
        if (throwable == null || !seen.add(throwable)) {
            return null;
        }
        if (throwable instanceof RpcException rpc && rpc.getCause() == null) {
            return new GenericError(describe(throwable), rpc.remoteCause().orElse(null));
        }
        return new GenericError(describe(throwable), from(throwable.getCause(), seen));
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getName();
    }

    /**
     * Number of errors in the chain, this one included.
     * @return chain length, at least one
     */
    public int depth() {
        return cause == null ? 1 : 1 + cause.depth();
    }

    @Override
    public String toString() {
        if (cause == null) {
            return description;
        }
        return description + " caused by:\n " + cause;
    }
}
