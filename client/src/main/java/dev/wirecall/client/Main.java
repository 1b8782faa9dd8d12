package dev.wirecall.client;

import dev.wirecall.demo.GreeterAsyncClient;
import dev.wirecall.demo.GreeterClient;
import dev.wirecall.rpc.transport.binary.FrameCodec;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.channels.AsynchronousSocketChannel;

public final class Main {

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            printUsage();
            return;
        }
        ClientOptions options;
        try {
            options = ClientOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            return;
        }

        try {
            System.out.println(options.async() ? runAsync(options) : runBlocking(options));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
        }
    }

    private static String runBlocking(ClientOptions options) throws Exception {
        try (Socket socket = new Socket(options.host(), options.port())) {
            socket.setTcpNoDelay(true);
            GreeterClient client = new GreeterClient(
                options.format().clientTransport(socket, FrameCodec.DEFAULT_MAX_FRAME_LENGTH));
            return Commands.run(client, options.command(), options.arguments());
        }
    }

    private static String runAsync(ClientOptions options) throws Exception {
        try (AsynchronousSocketChannel channel = AsynchronousSocketChannel.open()) {
            channel.connect(new InetSocketAddress(options.host(), options.port())).get();
            GreeterAsyncClient client = new GreeterAsyncClient(
                options.format().asyncClientTransport(channel, FrameCodec.DEFAULT_MAX_FRAME_LENGTH));
            return Commands.run(new BlockingAsyncGreeter(client), options.command(), options.arguments());
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar wirecall-client.jar [--host <host>] [--port <port>] "
            + "[--format binary|json] [--async] <command> [args]\n"
            + "Commands:\n"
            + "  describe <subject> <value>\n"
            + "  fail <reason>\n"
            + "  add <a> <b>");
    }
}
