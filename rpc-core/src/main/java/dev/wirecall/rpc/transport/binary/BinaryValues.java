package dev.wirecall.rpc.transport.binary;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcType;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Positional value encoding: every value is one CBOR data item, appended in the order it is
 * written and read back in the same order. Names are never written.
 */
final class BinaryValues {

    private final ObjectMapper mapper;

    BinaryValues(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    static ObjectMapper defaultMapper() {
        return new CBORMapper();
    }

    void append(ByteArrayOutputStream payload, Object value) throws RpcException {
        payload.writeBytes(encode(value));
    }

    byte[] encode(Object value) throws RpcException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw RpcException.serialization("binary serialization failure", e);
        }
    }

    Cursor cursor(byte[] payload) throws RpcException {
        try {
            return new Cursor(mapper.getFactory().createParser(payload));
        } catch (IOException e) {
            throw RpcException.serialization("binary deserialization failure", e);
        }
    }

    /**
     * Reads the values of one payload in order.
     */
    final class Cursor {

        private final JsonParser parser;

        private Cursor(JsonParser parser) {
            this.parser = parser;
        }

        /**
         * Read an unsigned integer item. Text and floating point items are rejected rather than
         * coerced.
         */
        long nextIndex(String what) throws RpcException {
            try {
                JsonToken token = parser.nextToken();
                if (token == null) {
                    throw RpcException.serialization("Payload exhausted before " + what);
                }
                if (token != JsonToken.VALUE_NUMBER_INT) {
                    throw RpcException.serialization("Expected integer " + what + " but found " + token);
                }
                return parser.getLongValue();
            } catch (IOException e) {
                throw RpcException.serialization("binary deserialization failure reading " + what, e);
            }
        }

        <T> T next(RpcType<T> type, String what) throws RpcException {
            try {
                if (parser.nextToken() == null) {
                    throw RpcException.serialization("Payload exhausted before " + what);
                }
                return mapper.readValue(parser, type.javaType());
            } catch (IOException e) {
                throw RpcException.serialization("binary deserialization failure reading " + what, e);
            }
        }
    }
}
