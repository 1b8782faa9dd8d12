package dev.wirecall.rpc.client;

import java.util.Objects;

/**
 * One named argument of a call.
 *
 * @param name declared parameter name
 * @param value argument value, may be {@code null}
 */
public record Param(String name, Object value) {

    public Param {
        Objects.requireNonNull(name, "name");
    }

    public static Param of(String name, Object value) {
        return new Param(name, value);
    }
}
