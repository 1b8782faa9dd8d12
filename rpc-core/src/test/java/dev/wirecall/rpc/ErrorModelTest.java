package dev.wirecall.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class ErrorModelTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void genericErrorKeepsCauseChain() {
        Exception root = new IOException("disk gone");
        Exception middle = new IllegalStateException("cannot load", root);
        Exception top = new RuntimeException("request failed", middle);

        GenericError error = GenericError.from(top);

        assertEquals(3, error.depth());
        assertEquals("request failed", error.description());
        assertEquals("cannot load", error.cause().description());
        assertEquals("disk gone", error.cause().cause().description());
        assertEquals("request failed caused by:\n cannot load caused by:\n disk gone", error.toString());
    }

    @Test
    void genericErrorUsesClassNameWithoutMessage() {
        assertEquals(NullPointerException.class.getName(), GenericError.from(new NullPointerException()).description());
    }

    @Test
    void genericErrorStopsOnCycles() {
        IllegalStateException first = new IllegalStateException("first");
        IllegalArgumentException second = new IllegalArgumentException("second", first);
        first.initCause(second);

        assertEquals(2, GenericError.from(first).depth());
    }

    @Test
    void rpcErrorSurvivesJson() throws Exception {
        RpcException failure = RpcException.transport("write failed", new IOException("broken pipe"));

        String json = mapper.writeValueAsString(failure.toError());
        RpcException rebuilt = mapper.readValue(json, RpcError.class).toException();

        assertEquals(RpcErrorKind.TRANSPORT_ERROR, rebuilt.kind());
        assertEquals("write failed", rebuilt.getMessage());
        assertEquals("broken pipe", rebuilt.remoteCause().orElseThrow().description());
        assertEquals(2, GenericError.from(rebuilt).depth());
    }

    @Test
    void unknownMethodNamesTheMethod() {
        RpcException failure = RpcException.unknownMethod(PartialMethodId.name("nope"));

        assertEquals(RpcErrorKind.UNKNOWN_METHOD, failure.kind());
        assertTrue(failure.getMessage().contains("nope"));
    }

    @Test
    void resultHoldsOneArm() throws Exception {
        RpcResult<String, String> ok = RpcResult.ok("fine");
        RpcResult<String, String> err = RpcResult.err("iamerror");

        assertFalse(ok.failed());
        assertTrue(err.failed());
        assertEquals("{\"ok\":\"fine\"}", mapper.writeValueAsString(ok));
        assertEquals("{\"err\":\"iamerror\"}", mapper.writeValueAsString(err));
        assertEquals(Integer.valueOf(4), ok.map(String::length).value().orElseThrow());
        assertNull(err.map(String::length).ok());
        assertThrows(IllegalArgumentException.class, () -> new RpcResult<>("a", "b"));
        assertThrows(IllegalArgumentException.class, () -> RpcResult.err(null));
    }

    @Test
    void methodIdRejectsIndicesOutsideU32() {
        assertEquals("bar#0", new MethodId("bar", 0).toString());
        assertThrows(IllegalArgumentException.class, () -> new MethodId("bar", -1));
        assertThrows(IllegalArgumentException.class, () -> new MethodId("bar", MethodId.MAX_INDEX + 1));
    }
}
