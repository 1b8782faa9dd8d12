package dev.wirecall.rpc.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.wirecall.rpc.MethodId;
import dev.wirecall.rpc.PartialMethodId;
import dev.wirecall.rpc.fixtures.Foo;
import org.junit.jupiter.api.Test;

class ServiceDefinitionTest {

    @Test
    void indicesFollowDeclarationOrder() {
        assertEquals(new MethodId("bar", 0), Foo.BAR);
        assertEquals(new MethodId("expectError", 1), Foo.EXPECT_ERROR);
        assertEquals(2, Foo.DEFINITION.entries().size());
    }

    @Test
    void resolvesByIndexAndByName() {
        assertEquals(Foo.BAR, Foo.DEFINITION.resolve(PartialMethodId.index(0)).orElseThrow().id());
        assertEquals(Foo.EXPECT_ERROR, Foo.DEFINITION.resolve(PartialMethodId.name("expectError")).orElseThrow().id());
    }

    @Test
    void unresolvedIdsAreEmpty() {
        assertTrue(Foo.DEFINITION.resolve(PartialMethodId.index(2)).isEmpty());
        assertTrue(Foo.DEFINITION.resolve(PartialMethodId.index(-1)).isEmpty());
        assertTrue(Foo.DEFINITION.resolve(PartialMethodId.name("baz")).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> Foo.DEFINITION.method("baz"));
    }

    @Test
    void duplicateNamesAreRejected() {
        ServiceDefinition.Builder<Object> builder = ServiceDefinition.builder("Dup").method("x", (s, p) -> null);

        assertThrows(IllegalArgumentException.class, () -> builder.method("x", (s, p) -> null));
    }
}
