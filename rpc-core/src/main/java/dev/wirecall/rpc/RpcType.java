package dev.wirecall.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.util.Objects;

/**
 * Deserialization target of a parameter or a response, carrying the full generic type.
 *
 * @param <T> Java type values are read as
 */
public final class RpcType<T> {

    private final JavaType javaType;

    private RpcType(JavaType javaType) {
        this.javaType = Objects.requireNonNull(javaType, "javaType");
    }

    public static <T> RpcType<T> of(Class<T> type) {
        return new RpcType<>(TypeFactory.defaultInstance().constructType(type));
    }

    public static <T> RpcType<T> of(TypeReference<T> type) {
        return new RpcType<>(TypeFactory.defaultInstance().constructType(type));
    }

    public JavaType javaType() {
        return javaType;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof RpcType<?> that && javaType.equals(that.javaType);
    }

    @Override
    public int hashCode() {
        return javaType.hashCode();
    }

    @Override
    public String toString() {
        return javaType.toCanonical();
    }
}
