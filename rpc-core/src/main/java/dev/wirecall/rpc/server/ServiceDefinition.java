package dev.wirecall.rpc.server;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.PartialMethodId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered method table of a service. Indices follow declaration order starting at 0 and are fixed
 * once the definition is built.
 *
 * @param <I> service implementation type
 */
public final class ServiceDefinition<I> {

    private final String serviceName;
    private final List<Entry<I>> entries;
    private final Map<String, Entry<I>> byName;

    private ServiceDefinition(String serviceName, List<Entry<I>> entries) {
        this.serviceName = serviceName;
        this.entries = Collections.unmodifiableList(entries);
        Map<String, Entry<I>> names = new HashMap<>();
        for (Entry<I> entry : entries) {
            names.put(entry.id().name(), entry);
        }
        this.byName = Collections.unmodifiableMap(names);
    }

    public static <I> Builder<I> builder(String serviceName) {
        return new Builder<>(serviceName);
    }

    public String serviceName() {
        return serviceName;
    }

    public List<Entry<I>> entries() {
        return entries;
    }

    /**
     * Identifier of a declared method.
     * @throws IllegalArgumentException when no method has that name
     */
    public MethodId method(String name) {
        Entry<I> entry = byName.get(name);
        if (entry == null) {
            throw new IllegalArgumentException(serviceName + " declares no method " + name);
        }
        return entry.id();
    }

    /**
     * Look up the method a transport received. Indices are bounds checked, names go through the
     * name table.
     */
    public Optional<Entry<I>> resolve(PartialMethodId method) {
        if (method instanceof PartialMethodId.Index index) {
            long value = index.index();
            if (value < 0 || value >= entries.size()) {
                return Optional.empty();
            }
            return Optional.of(entries.get((int) value));
        }
        return Optional.ofNullable(byName.get(((PartialMethodId.Name) method).name()));
    }

    /**
     * A declared method and its handler.
     *
     * @param id method identifier
     * @param handler invocation of the implementation
     * @param <I> service implementation type
     */
    public record Entry<I>(MethodId id, MethodHandler<I> handler) {
    }

    public static final class Builder<I> {

        private final String serviceName;
        private final List<Entry<I>> entries = new ArrayList<>();

        private Builder(String serviceName) {
            this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        }

        public Builder<I> method(String name, MethodHandler<I> handler) {
            Objects.requireNonNull(handler, "handler");
            for (Entry<I> entry : entries) {
                if (entry.id().name().equals(name)) {
                    throw new IllegalArgumentException("Duplicate method " + name + " in " + serviceName);
                }
            }
            entries.add(new Entry<>(new MethodId(name, entries.size()), handler));
            return this;
        }

        public ServiceDefinition<I> build() {
            return new ServiceDefinition<>(serviceName, new ArrayList<>(entries));
        }
    }
}
