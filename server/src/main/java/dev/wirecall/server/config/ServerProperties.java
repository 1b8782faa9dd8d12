package dev.wirecall.server.config;

import dev.wirecall.rpc.transport.WireFormat;
import dev.wirecall.rpc.transport.binary.FrameCodec;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "wirecall.server")
public class ServerProperties {

    /**
     * TCP port to listen on, 0 for an ephemeral port.
     */
    private int port = 7071;

    private WireFormat format = WireFormat.BINARY;

    /**
     * Largest accepted frame payload in bytes. Only the binary format is framed.
     */
    private int maxFrameLength = FrameCodec.DEFAULT_MAX_FRAME_LENGTH;

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public WireFormat getFormat() {
        return format;
    }

    public void setFormat(WireFormat format) {
        this.format = format;
    }

    public int getMaxFrameLength() {
        return maxFrameLength;
    }

    public void setMaxFrameLength(int maxFrameLength) {
        this.maxFrameLength = maxFrameLength;
    }
}
