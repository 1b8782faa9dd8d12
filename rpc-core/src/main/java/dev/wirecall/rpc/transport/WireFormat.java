package dev.wirecall.rpc.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.wirecall.rpc.transport.binary.BinaryAsyncClientTransport;
import dev.wirecall.rpc.transport.binary.BinaryTransport;
import dev.wirecall.rpc.transport.json.JsonAsyncClientTransport;
import dev.wirecall.rpc.transport.json.JsonTransport;
import java.io.IOException;
import java.net.Socket;
import java.nio.channels.AsynchronousSocketChannel;

/**
 * Available codecs, with factories binding a codec to a connected socket. The frame limit is
 * ignored by codecs without framing.
 */
public enum WireFormat {

    BINARY {
        @Override
        public ClientTransport<?, ?> clientTransport(Socket socket, int maxFrameLength) throws IOException {
            return BinaryTransport.over(socket, maxFrameLength);
        }

        @Override
        public ServerTransport<?> serverTransport(Socket socket, int maxFrameLength) throws IOException {
            return BinaryTransport.over(socket, maxFrameLength);
        }

        @Override
        public AsyncClientTransport<?, ?> asyncClientTransport(AsynchronousSocketChannel channel, int maxFrameLength)
            throws IOException {
            return new BinaryAsyncClientTransport(channel, String.valueOf(channel.getRemoteAddress()), maxFrameLength);
        }
    },

    JSON {
        @Override
        public ClientTransport<?, ?> clientTransport(Socket socket, int maxFrameLength) throws IOException {
            return JsonTransport.over(socket);
        }

        @Override
        public ServerTransport<?> serverTransport(Socket socket, int maxFrameLength) throws IOException {
            return JsonTransport.over(socket);
        }

        @Override
        public AsyncClientTransport<?, ?> asyncClientTransport(AsynchronousSocketChannel channel, int maxFrameLength)
            throws IOException {
            return new JsonAsyncClientTransport(channel, String.valueOf(channel.getRemoteAddress()), new ObjectMapper());
        }
    };

    public abstract ClientTransport<?, ?> clientTransport(Socket socket, int maxFrameLength) throws IOException;

    public abstract ServerTransport<?> serverTransport(Socket socket, int maxFrameLength) throws IOException;

    public abstract AsyncClientTransport<?, ?> asyncClientTransport(AsynchronousSocketChannel channel, int maxFrameLength)
        throws IOException;
}
