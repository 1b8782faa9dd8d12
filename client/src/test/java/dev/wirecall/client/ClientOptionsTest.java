package dev.wirecall.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.wirecall.rpc.transport.WireFormat;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClientOptionsTest {

    @Test
    void defaultsApplyWithoutFlags() {
        ClientOptions options = ClientOptions.parse("add", "1", "2");

        assertEquals("localhost", options.host());
        assertEquals(7071, options.port());
        assertEquals(WireFormat.BINARY, options.format());
        assertFalse(options.async());
        assertEquals("add", options.command());
        assertEquals(List.of("1", "2"), options.arguments());
    }

    @Test
    void flagsPrecedeTheCommand() {
        ClientOptions options = ClientOptions.parse("--host", "example.org", "--port", "9000", "--format", "json",
            "--async", "fail", "--not-a-flag");

        assertEquals("example.org", options.host());
        assertEquals(9000, options.port());
        assertEquals(WireFormat.JSON, options.format());
        assertTrue(options.async());
        assertEquals(List.of("--not-a-flag"), options.arguments());
    }

    @Test
    void invalidInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ClientOptions.parse("--port"));
        assertThrows(IllegalArgumentException.class, () -> ClientOptions.parse("--port", "http", "add"));
        assertThrows(IllegalArgumentException.class, () -> ClientOptions.parse("--port", "70000", "add"));
        assertThrows(IllegalArgumentException.class, () -> ClientOptions.parse("--format", "xml", "add"));
        assertThrows(IllegalArgumentException.class, () -> ClientOptions.parse("--verbose", "add"));
        assertThrows(IllegalArgumentException.class, () -> ClientOptions.parse("--host", "h"));
    }
}
