package dev.wirecall.rpc.transport.binary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import dev.wirecall.rpc.RpcErrorKind;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcResult;
import dev.wirecall.rpc.RpcType;
import dev.wirecall.rpc.client.Param;
import dev.wirecall.rpc.client.RpcClient;
import dev.wirecall.rpc.fixtures.Foo;
import dev.wirecall.rpc.fixtures.Loopback;
import dev.wirecall.rpc.server.RpcServer;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class BinaryTransportTest {

    private final CBORMapper cbor = new CBORMapper();

    @Test
    void callRoundTripsOverSocket() throws Exception {
        try (Loopback loopback = Loopback.blocking()) {
            Loopback.serveInBackground(RpcServer.create(Foo.DEFINITION, Foo.impl(), BinaryTransport.over(loopback.serverSocket())));
            RpcClient<OutgoingCall, PendingResponse> client = RpcClient.of(BinaryTransport.over(loopback.clientSocket()));

            assertEquals("the answer is 42",
                client.call(Foo.BAR, String.class, Param.of("a", "the answer"), Param.of("b", 42)));
            RpcResult<String, String> error = client.call(Foo.EXPECT_ERROR, Foo.RESULT);
            assertEquals("iamerror", error.error().orElseThrow());
        }
    }

    @Test
    void largeArgumentsAreFramedIntact() throws Exception {
        String big = "x".repeat(256 * 1024);
        try (Loopback loopback = Loopback.blocking()) {
            Loopback.serveInBackground(RpcServer.create(Foo.DEFINITION, Foo.impl(), BinaryTransport.over(loopback.serverSocket())));
            RpcClient<OutgoingCall, PendingResponse> client = RpcClient.of(BinaryTransport.over(loopback.clientSocket()));

            assertEquals(big + " is 7", client.call(Foo.BAR, String.class, Param.of("a", big), Param.of("b", 7)));
        }
    }

    @Test
    void serverEndsWithEofAfterClientLeaves() throws Exception {
        try (Loopback loopback = Loopback.blocking()) {
            CompletableFuture<RpcException> ended = Loopback.serveInBackground(
                RpcServer.create(Foo.DEFINITION, Foo.impl(), BinaryTransport.over(loopback.serverSocket())));
            RpcClient<OutgoingCall, PendingResponse> client = RpcClient.of(BinaryTransport.over(loopback.clientSocket()));
            for (int i = 0; i < 3; i++) {
                assertEquals("n is " + i, client.call(Foo.BAR, String.class, Param.of("a", "n"), Param.of("b", i)));
            }

            loopback.clientSocket().close();

            assertEquals(RpcErrorKind.TRANSPORT_EOF, ended.get(5, TimeUnit.SECONDS).kind());
        }
    }

    @Test
    void clientSeesEofWhenServerHangsUp() throws Exception {
        try (Loopback loopback = Loopback.blocking()) {
            BinaryTransport serverSide = BinaryTransport.over(loopback.serverSocket());
            CompletableFuture<Void> hungUp = CompletableFuture.runAsync(() -> {
                try {
                    serverSide.beginReceive();
                    loopback.serverSocket().close();
                } catch (RpcException | IOException e) {
                    throw new IllegalStateException(e);
                }
            });
            RpcClient<OutgoingCall, PendingResponse> client = RpcClient.of(BinaryTransport.over(loopback.clientSocket()));

            RpcException failure = assertThrows(RpcException.class,
                () -> client.call(Foo.BAR, String.class, Param.of("a", "n"), Param.of("b", 1)));

            assertEquals(RpcErrorKind.TRANSPORT_EOF, failure.kind());
            hungUp.get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void unknownIndexIsRaisedLocallyAndNothingIsSent() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        BinaryTransport server = new BinaryTransport(frames(cbor.writeValueAsBytes(7)), out);

        RpcException failure = assertThrows(RpcException.class,
            () -> RpcServer.create(Foo.DEFINITION, Foo.impl(), server).serveSingleCall());

        assertEquals(RpcErrorKind.UNKNOWN_METHOD, failure.kind());
        assertEquals(0, out.size());
    }

    @Test
    void methodIndexMustBeAnInteger() throws Exception {
        for (Object index : new Object[] {"0", 0.0, true}) {
            BinaryTransport server = new BinaryTransport(frames(cbor.writeValueAsBytes(index)), new ByteArrayOutputStream());

            RpcException failure = assertThrows(RpcException.class, server::beginReceive, String.valueOf(index));

            assertEquals(RpcErrorKind.SERIALIZATION_ERROR, failure.kind(), String.valueOf(index));
        }
    }

    @Test
    void missingPositionalParameterIsASerializationError() throws Exception {
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        payload.writeBytes(cbor.writeValueAsBytes(0));
        payload.writeBytes(cbor.writeValueAsBytes("the answer"));
        BinaryTransport server = new BinaryTransport(frames(payload.toByteArray()), new ByteArrayOutputStream());

        RpcException failure = assertThrows(RpcException.class,
            () -> RpcServer.create(Foo.DEFINITION, Foo.impl(), server).serveSingleCall());

        assertEquals(RpcErrorKind.SERIALIZATION_ERROR, failure.kind());
        assertTrue(failure.getMessage().contains("parameter b"), failure.getMessage());
    }

    @Test
    void callPayloadIsIndexThenParametersWithoutNames() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        BinaryTransport client = new BinaryTransport(InputStream.nullInputStream(), out);

        OutgoingCall call = client.beginCall(Foo.BAR);
        client.addParam("a", 42, call);
        client.addParam("b", "hi", call);
        client.finalizeCall(call);

        BinaryTransport server = new BinaryTransport(new ByteArrayInputStream(out.toByteArray()), new ByteArrayOutputStream());
        IncomingCall incoming = server.beginReceive().state();
        assertEquals(0, incoming.methodIndex());
        assertEquals(42, server.readParam("ignored", RpcType.of(Integer.class), incoming));
        assertEquals("hi", server.readParam("ignored", RpcType.of(String.class), incoming));
        assertEquals(2, incoming.paramsRead());
    }

    @Test
    void callStatesAreSingleUse() throws Exception {
        ByteArrayOutputStream response = new ByteArrayOutputStream();
        FrameCodec.writeFrame(response, cbor.writeValueAsBytes("ok"));
        BinaryTransport client = new BinaryTransport(new ByteArrayInputStream(response.toByteArray()), new ByteArrayOutputStream());

        OutgoingCall call = client.beginCall(Foo.EXPECT_ERROR);
        PendingResponse pending = client.finalizeCall(call);
        assertEquals(RpcErrorKind.ILLEGAL_STATE, assertThrows(RpcException.class, () -> client.finalizeCall(call)).kind());
        assertEquals(RpcErrorKind.ILLEGAL_STATE, assertThrows(RpcException.class, () -> client.addParam("late", 1, call)).kind());

        assertEquals("ok", client.readResponse(pending, RpcType.of(String.class)));
        assertEquals(RpcErrorKind.ILLEGAL_STATE,
            assertThrows(RpcException.class, () -> client.readResponse(pending, RpcType.of(String.class))).kind());
    }

    @Test
    void responseRequiresAReceivedCall() {
        BinaryTransport server = new BinaryTransport(InputStream.nullInputStream(), new ByteArrayOutputStream());

        assertEquals(RpcErrorKind.ILLEGAL_STATE, assertThrows(RpcException.class, () -> server.sendResponse("x")).kind());
    }

    @Test
    void sendingTheResponseClosesTheIncomingCall() throws Exception {
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        payload.writeBytes(cbor.writeValueAsBytes(0));
        payload.writeBytes(cbor.writeValueAsBytes("x"));
        payload.writeBytes(cbor.writeValueAsBytes(1));
        BinaryTransport server = new BinaryTransport(frames(payload.toByteArray()), new ByteArrayOutputStream());
        IncomingCall incoming = server.beginReceive().state();
        assertEquals("x", server.readParam("a", RpcType.of(String.class), incoming));

        server.sendResponse("x is 1");

        assertEquals(RpcErrorKind.ILLEGAL_STATE,
            assertThrows(RpcException.class, () -> server.readParam("b", RpcType.of(Integer.class), incoming)).kind());
        assertEquals(RpcErrorKind.ILLEGAL_STATE, assertThrows(RpcException.class, () -> server.sendResponse("again")).kind());
    }

    @Test
    void outgoingFrameAboveLimitIsRejected() throws Exception {
        BinaryTransport client = new BinaryTransport(InputStream.nullInputStream(), new ByteArrayOutputStream(), "small", 8);

        OutgoingCall call = client.beginCall(Foo.BAR);
        client.addParam("b", "far more than eight bytes", call);

        assertEquals(RpcErrorKind.SERIALIZATION_ERROR, assertThrows(RpcException.class, () -> client.finalizeCall(call)).kind());
    }

    private static InputStream frames(byte[] payload) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        FrameCodec.writeFrame(out, payload);
        return new ByteArrayInputStream(out.toByteArray());
    }
}
