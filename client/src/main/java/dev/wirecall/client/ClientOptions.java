package dev.wirecall.client;

import dev.wirecall.rpc.transport.WireFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parsed command line: connection flags, then a command and its arguments.
 */
public record ClientOptions(
    String host,
    int port,
    WireFormat format,
    boolean async,
    String command,
    List<String> arguments
) {

    public static final String DEFAULT_HOST = "localhost";

    public static final int DEFAULT_PORT = 7071;

    /**
     * @throws IllegalArgumentException on an unknown flag, a flag without value or a missing command
     */
    public static ClientOptions parse(String... args) {
        List<String> remaining = new ArrayList<>(Arrays.asList(args));
        String host = DEFAULT_HOST;
        int port = DEFAULT_PORT;
        WireFormat format = WireFormat.BINARY;
        boolean async = false;
        while (!remaining.isEmpty() && remaining.get(0).startsWith("--")) {
            String flag = remaining.remove(0);
            switch (flag) {
                case "--host" -> host = value(flag, remaining);
                case "--port" -> port = parsePort(value(flag, remaining));
                case "--format" -> format = parseFormat(value(flag, remaining));
                case "--async" -> async = true;
                default -> throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }
        if (remaining.isEmpty()) {
            throw new IllegalArgumentException("Missing command");
        }
        String command = remaining.remove(0);
        return new ClientOptions(host, port, format, async, command, List.copyOf(remaining));
    }

    private static String value(String flag, List<String> remaining) {
        if (remaining.isEmpty()) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return remaining.remove(0);
    }

    private static int parsePort(String value) {
        try {
            int port = Integer.parseInt(value);
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value, e);
        }
    }

    private static WireFormat parseFormat(String value) {
        try {
            return WireFormat.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown format: " + value + ", expected binary or json", e);
        }
    }
}
