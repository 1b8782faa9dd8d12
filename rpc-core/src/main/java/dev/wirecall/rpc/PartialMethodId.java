package dev.wirecall.rpc;

import java.util.Objects;

/**
 * Method identifier as recovered by a server transport, which may only know the name or only the
 * index of the called method.
 */
public sealed interface PartialMethodId {

    static PartialMethodId name(String name) {
        return new Name(name);
    }

    static PartialMethodId index(long index) {
        return new Index(index);
    }

    record Name(String name) implements PartialMethodId {

        public Name {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return "name=" + name;
        }
    }

    record Index(long index) implements PartialMethodId {

        @Override
        public String toString() {
            return "index=" + index;
        }
    }
}
