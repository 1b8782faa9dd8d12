package dev.wirecall.client;

import dev.wirecall.demo.Greeter;
import dev.wirecall.demo.GreeterError;
import dev.wirecall.rpc.RpcResult;
import java.util.List;

/**
 * Runs one CLI command against a {@link Greeter} and renders its result as a single line.
 */
final class Commands {

    private Commands() {
    }

    static String run(Greeter greeter, String command, List<String> arguments) {
        return switch (command) {
            case "describe" -> {
                require(command, arguments, 2, "<subject> <value>");
                yield render(greeter.describe(arguments.get(0), parseInt(arguments.get(1))));
            }
            case "fail" -> {
                require(command, arguments, 1, "<reason>");
                yield render(greeter.fail(arguments.get(0)));
            }
            case "add" -> {
                require(command, arguments, 2, "<a> <b>");
                yield render(greeter.add(parseLong(arguments.get(0)), parseLong(arguments.get(1))));
            }
            default -> throw new IllegalArgumentException("Unknown command: " + command);
        };
    }

    static String render(RpcResult<?, GreeterError> result) {
        if (result.failed()) {
            return "ERROR: " + result.err();
        }
        return "OK: " + result.ok();
    }

    private static void require(String command, List<String> arguments, int count, String usage) {
        if (arguments.size() != count) {
            throw new IllegalArgumentException(command + " requires " + usage);
        }
    }

    private static int parseInt(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + value, e);
        }
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + value, e);
        }
    }
}
