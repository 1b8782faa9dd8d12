package dev.wirecall.rpc.transport.binary;

import dev.wirecall.rpc.RpcException;
import dev.wirecall.rpc.transport.TransportFailures;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Codec that writes and reads frames that start with a six-byte magic tag and a four-byte
 * little-endian unsigned length, followed by the payload.
 */
public final class FrameCodec {

    public static final byte[] MAGIC = "WCRPC1".getBytes(StandardCharsets.US_ASCII);

    public static final int HEADER_LENGTH = MAGIC.length + Integer.BYTES;

    public static final int DEFAULT_MAX_FRAME_LENGTH = 64 * 1024 * 1024;

    private FrameCodec() {
    }

    public static ByteBuffer header(int payloadLength) {
        ByteBuffer header = ByteBuffer.allocate(HEADER_LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        header.put(MAGIC).putInt(payloadLength);
        return header.flip();
    }

    /**
     * Header and payload in a single buffer, ready to be written.
     */
    public static ByteBuffer frame(byte[] payload) {
        ByteBuffer frame = ByteBuffer.allocate(HEADER_LENGTH + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        frame.put(MAGIC).putInt(payload.length).put(payload);
        return frame.flip();
    }

    public static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        out.write(header(payload.length).array());
        out.write(payload);
        out.flush();
    }

    /**
     * Validate a header and extract the payload length.
     * @param header exactly {@link #HEADER_LENGTH} bytes
     * @param maxFrameLength largest accepted payload length
     * @return payload length
     * @throws RpcException {@code SERIALIZATION_ERROR} when the magic does not match or the length
     * exceeds {@code maxFrameLength}
     */
    public static int parseHeader(ByteBuffer header, int maxFrameLength) throws RpcException {
        ByteBuffer view = header.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        view.rewind();
        byte[] magic = new byte[MAGIC.length];
        view.get(magic);
        if (!Arrays.equals(MAGIC, magic)) {
            throw RpcException.serialization("Frame magic mismatch: " + Arrays.toString(magic));
        }
        long length = Integer.toUnsignedLong(view.getInt());
        if (length > maxFrameLength) {
            throw RpcException.serialization("Frame too large: " + length + " > " + maxFrameLength);
        }
        return (int) length;
    }

    public static byte[] readFrame(InputStream in, int maxFrameLength) throws RpcException {
        byte[] header = readFully(in, HEADER_LENGTH, "frame header");
        int length = parseHeader(ByteBuffer.wrap(header), maxFrameLength);
        return readFully(in, length, "frame payload of length " + length);
    }

    private static byte[] readFully(InputStream in, int length, String what) throws RpcException {
        byte[] buffer = new byte[length];
        int offset = 0;
        try {
            while (offset < length) {
                int read = in.read(buffer, offset, length - offset);
                if (read == -1) {
                    if (offset == 0) {
                        throw RpcException.eof("Channel closed before " + what);
                    }
                    throw RpcException.eof("Channel closed while reading " + what + " after " + offset + " bytes");
                }
                offset += read;
            }
        } catch (IOException e) {
            throw TransportFailures.map(e, "Failed to read " + what);
        }
        return buffer;
    }
}
