package dev.wirecall.rpc.transport.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.async.ByteArrayFeeder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import java.io.IOException;

/**
 * Splits an unframed byte stream into complete top-level JSON values. Bytes are fed as they arrive;
 * a value is complete once its brackets balance and its last token has been decoded. Bytes past the
 * end of a value are kept for the next one.
 */
final class JsonValueAssembler {

    private final JsonParser parser;
    private final ByteArrayFeeder feeder;

    private TokenBuffer current;
    private int depth;
    private boolean ended;

    JsonValueAssembler(ObjectMapper mapper) throws IOException {
        this.parser = mapper.getFactory().createNonBlockingByteArrayParser();
        this.feeder = (ByteArrayFeeder) parser.getNonBlockingInputFeeder();
    }

    /**
     * Decode as far as the fed bytes allow.
     * @return the next complete value, or {@code null} when more input is needed or input ended
     * @throws IOException when the input is not valid JSON, or ends inside a value
     */
    TokenBuffer poll() throws IOException {
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.NOT_AVAILABLE) {
            if (token == null) {
                ended = true;
                return null;
            }
            if (current == null) {
                current = new TokenBuffer(parser);
            }
            current.copyCurrentEvent(parser);
            if (token.isStructStart()) {
                depth++;
            } else if (token.isStructEnd()) {
                depth--;
            }
            if (depth == 0) {
                TokenBuffer complete = current;
                current = null;
                return complete;
            }
        }
        return null;
    }

    void feed(byte[] bytes, int length) throws IOException {
        feeder.feedInput(bytes, 0, length);
    }

    void endOfInput() {
        feeder.endOfInput();
    }

    /**
     * @return {@code true} once the input ended with no partial value pending
     */
    boolean ended() {
        return ended;
    }

    /**
     * @return {@code true} while a value has started but is not complete
     */
    boolean inValue() {
        return current != null;
    }
}
