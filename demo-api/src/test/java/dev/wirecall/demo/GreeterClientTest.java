package dev.wirecall.demo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.wirecall.rpc.RpcErrorKind;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.RpcResult;
import dev.wirecall.rpc.server.RpcServer;
import dev.wirecall.rpc.transport.WireFormat;
import dev.wirecall.rpc.transport.binary.FrameCodec;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.channels.AsynchronousSocketChannel;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import reactor.test.StepVerifier;

class GreeterClientTest {

    private static final int MAX = FrameCodec.DEFAULT_MAX_FRAME_LENGTH;

    private final Greeter service = new Greeter() {
        @Override
        public RpcResult<String, GreeterError> describe(String subject, int value) {
            return RpcResult.ok(subject + " is " + value);
        }

        @Override
        public RpcResult<String, GreeterError> fail(String reason) {
            return RpcResult.err(GreeterError.of(reason));
        }

        @Override
        public RpcResult<Long, GreeterError> add(long a, long b) {
            return RpcResult.ok(a + b);
        }
    };

    private ServerSocket listener;
    private Socket accepted;

    @AfterEach
    void close() throws Exception {
        if (accepted != null) {
            accepted.close();
        }
        if (listener != null) {
            listener.close();
        }
    }

    @ParameterizedTest
    @EnumSource(WireFormat.class)
    void blockingStubCallsEveryMethod(WireFormat format) throws Exception {
        CompletableFuture<RpcErrorKind> served;
        try (Socket socket = connect()) {
            served = serve(format);
            GreeterClient client = new GreeterClient(format.clientTransport(socket, MAX));

            assertEquals("the answer is 42", client.describe("the answer", 42).value().orElseThrow());
            GreeterError error = client.fail("iamerror").error().orElseThrow();
            assertEquals("iamerror", error.message());
            assertFalse(error.protocolFailure());
            assertEquals(5L, client.add(2, 3).value().orElseThrow());
        }
        assertEquals(RpcErrorKind.TRANSPORT_EOF, served.get(5, TimeUnit.SECONDS));
    }

    @ParameterizedTest
    @EnumSource(WireFormat.class)
    void asyncStubCallsEveryMethod(WireFormat format) throws Exception {
        CompletableFuture<RpcErrorKind> served;
        try (AsynchronousSocketChannel channel = connectAsync()) {
            served = serve(format);
            GreeterAsyncClient client = new GreeterAsyncClient(format.asyncClientTransport(channel, MAX));

            StepVerifier.create(client.describe("the answer", 42))
                .assertNext(result -> assertEquals("the answer is 42", result.ok()))
                .expectComplete()
                .verify(Duration.ofSeconds(10));
            StepVerifier.create(client.fail("iamerror"))
                .assertNext(result -> assertEquals("iamerror", result.err().message()))
                .expectComplete()
                .verify(Duration.ofSeconds(10));
            StepVerifier.create(client.add(40, 2))
                .assertNext(result -> assertEquals(42L, result.ok()))
                .expectComplete()
                .verify(Duration.ofSeconds(10));
        }
        assertEquals(RpcErrorKind.TRANSPORT_EOF, served.get(5, TimeUnit.SECONDS));
    }

    @ParameterizedTest
    @EnumSource(WireFormat.class)
    void protocolFailuresBecomeApplicationErrors(WireFormat format) throws Exception {
        try (Socket socket = connect()) {
            accepted.close();
            GreeterClient client = new GreeterClient(format.clientTransport(socket, MAX));

            GreeterError error = client.describe("x", 1).error().orElseThrow();

            assertTrue(error.protocolFailure());
            assertTrue(error.kind() == RpcErrorKind.TRANSPORT_EOF || error.kind() == RpcErrorKind.TRANSPORT_ERROR,
                error.toString());
        }
    }

    private Socket connect() throws Exception {
        InetAddress address = InetAddress.getLoopbackAddress();
        listener = new ServerSocket(0, 1, address);
        Socket socket = new Socket(address, listener.getLocalPort());
        accepted = listener.accept();
        return socket;
    }

    private AsynchronousSocketChannel connectAsync() throws Exception {
        InetAddress address = InetAddress.getLoopbackAddress();
        listener = new ServerSocket(0, 1, address);
        AsynchronousSocketChannel channel = AsynchronousSocketChannel.open();
        channel.connect(new InetSocketAddress(address, listener.getLocalPort())).get(5, TimeUnit.SECONDS);
        accepted = listener.accept();
        return channel;
    }

    /**
     * Serve until the peer hangs up. The returned future holds the kind that ended the serve loop.
     */
    private CompletableFuture<RpcErrorKind> serve(WireFormat format) throws Exception {
        RpcServer<Greeter, ?> server = RpcServer.create(GreeterRpc.DEFINITION, service, format.serverTransport(accepted, MAX));
        CompletableFuture<RpcErrorKind> ended = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                server.serve();
            } catch (RpcException e) {
                ended.complete(e.kind());
            } catch (RuntimeException e) {
                ended.completeExceptionally(e);
            }
        }, "greeter-serve");
        thread.setDaemon(true);
        thread.start();
        return ended;
    }
}
