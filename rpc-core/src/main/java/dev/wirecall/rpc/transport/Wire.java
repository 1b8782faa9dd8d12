package dev.wirecall.rpc.transport;

import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging framed traffic in a consistent format so that client and server logs
 * look identical.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private Wire() {
    }

    public static void rx(String channel, String message) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX ch={} msg={}", channel, message);
        }
    }

    public static void rx(String channel, String message, int bytes) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX ch={} msg={} bytes={}", channel, message, bytes);
        }
    }

    public static void tx(String channel, String message, int bytes) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX ch={} msg={} bytes={}", channel, message, bytes);
        }
    }

    public static void tx(String channel, String message, byte[] text) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX ch={} msg={} bytes={} json={}", channel, message, text.length,
                truncate(new String(text, StandardCharsets.UTF_8), 200));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
