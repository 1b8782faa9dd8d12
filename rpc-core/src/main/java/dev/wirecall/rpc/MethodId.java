package dev.wirecall.rpc;

import java.util.Objects;

/**
 * Identifies a remote method by name and by its 0-based declaration index. Both are fixed when the
 * service is declared and never recomputed.
 *
 * @param name method name
 * @param index declaration index, in the unsigned 32-bit range
 */
public record MethodId(String name, long index) {

    public static final long MAX_INDEX = 0xFFFF_FFFFL;

    public MethodId {
        Objects.requireNonNull(name, "name");
        if (index < 0 || index > MAX_INDEX) {
            throw new IllegalArgumentException("Method index out of range: " + index);
        }
    }

    @Override
    public String toString() {
        return name + "#" + index;
    }
}
