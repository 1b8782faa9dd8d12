package dev.wirecall.server.transport;

import dev.wirecall.demo.Greeter;
import dev.wirecall.demo.GreeterRpc;
import dev.wirecall.rpc.RpcErrorKind;
import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.server.RpcServer;
import dev.wirecall.rpc.transport.WireFormat;
import java.io.Closeable;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts TCP connections and serves {@link Greeter} on each, one thread and one serve loop per
 * connection.
 */
public class TcpServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpServer.class);

    private final int port;
    private final WireFormat format;
    private final int maxFrameLength;
    private final Greeter greeter;
    private final ExecutorService clientExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "tcp-server-client");
        t.setDaemon(true);
        return t;
    });
    private final Set<ClientConnection> connections = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;

    public TcpServer(int port, WireFormat format, int maxFrameLength, Greeter greeter) {
        this.port = port;
        this.format = format;
        this.maxFrameLength = maxFrameLength;
        this.greeter = greeter;
    }

    public void start() throws IOException {
        if (running) {
            return;
        }
        serverSocket = new ServerSocket(port);
        running = true;
        acceptThread = new Thread(this::acceptLoop, "tcp-server-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOGGER.info("TCP server listening on port {}", getLocalPort());
    }

    /**
     * @return bound port, useful when configured with port 0; -1 before {@link #start()}
     */
    public int getLocalPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    public int connectionCount() {
        return connections.size();
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                ClientConnection connection = new ClientConnection(socket);
                connections.add(connection);
                clientExecutor.submit(connection::serve);
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Client executor rejected connection", e);
            }
        }
    }

    public void stop() {
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing server socket", e);
            }
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (ClientConnection connection : new ArrayList<>(connections)) {
            try {
                connection.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing connection", e);
            }
        }
        clientExecutor.shutdown();
        try {
            if (!clientExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                clientExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("TCP server stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private final class ClientConnection implements Closeable {

        private final Socket socket;
        private final String connectionId;

        ClientConnection(Socket socket) {
            this.socket = socket;
            this.connectionId = socket.getRemoteSocketAddress().toString();
            LOGGER.info("Accepted connection {}", connectionId);
        }

        void serve() {
            try {
                RpcServer.create(GreeterRpc.DEFINITION, greeter, format.serverTransport(socket, maxFrameLength)).serve();
            } catch (RpcException e) {
                if (e.kind() == RpcErrorKind.TRANSPORT_EOF) {
                    LOGGER.info("Connection {} closed by peer", connectionId);
                } else if (running) {
                    LOGGER.warn("Connection {} failed: {}", connectionId, e.toError(), e);
                }
            } catch (IOException e) {
                LOGGER.error("Cannot open streams of connection {}", connectionId, e);
            } finally {
                try {
                    close();
                } catch (IOException e) {
                    LOGGER.warn("Error closing connection {}", connectionId, e);
                }
            }
        }

        @Override
        public void close() throws IOException {
            connections.remove(this);
            if (!socket.isClosed()) {
                socket.close();
            }
        }
    }
}
