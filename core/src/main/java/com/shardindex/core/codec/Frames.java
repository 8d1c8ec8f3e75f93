package com.shardindex.core.codec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;

/**
 * Length-prefixed framing: {@code u32 little-endian length || payload}.
 */
public final class Frames {
    private Frames() {
    }

    public static final int LENGTH_FIELD_BYTES = 4;

    /**
     * Largest frame any peer may send.
     */
    public static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    public static final int DEFAULT_MAX_FRAME_BYTES = 32 * 1024 * 1024;

    /**
     * Cap for the first frame of a connection (the worker hello).
     */
    public static final int MAX_HELLO_BYTES = 1024 * 1024;

    /**
     * Clamps a configured limit into {@code [1, MAX_FRAME_BYTES]}.
     */
    public static int clampMaxFrameBytes(int configured) {
        return Math.max(1, Math.min(configured, MAX_FRAME_BYTES));
    }

    /**
     * Builds a framed buffer ready to be written to a Netty channel.
     */
    public static ByteBuf frame(ByteBufAllocator alloc, byte[] payload) {
        ByteBuf buf = alloc.buffer(LENGTH_FIELD_BYTES + payload.length);
        buf.writeIntLE(payload.length);
        buf.writeBytes(payload);
        return buf;
    }

    /**
     * Writes one frame to a blocking channel.
     */
    public static void writeFrame(WritableByteChannel channel, byte[] payload) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(LENGTH_FIELD_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(payload.length).flip();
        ByteBuffer body = ByteBuffer.wrap(payload);
        while (header.hasRemaining()) {
            channel.write(header);
        }
        while (body.hasRemaining()) {
            channel.write(body);
        }
    }

    /**
     * Reads one frame from a blocking channel.
     *
     * @param channel       Source channel (blocking mode)
     * @param maxFrameBytes Largest accepted payload
     * @return Payload, or null if the stream ended cleanly before a new frame
     * @throws EOFException      if the stream ends inside a frame
     * @throws ProtocolException if the declared length exceeds {@code maxFrameBytes}
     */
    public static byte[] readFrame(ReadableByteChannel channel, int maxFrameBytes) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(LENGTH_FIELD_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        if (!readFully(channel, header, true)) {
            return null;
        }
        long length = Integer.toUnsignedLong(header.flip().getInt());
        if (length > maxFrameBytes) {
            throw new ProtocolException("frame of " + length + " bytes exceeds limit of " + maxFrameBytes);
        }
        ByteBuffer body = ByteBuffer.allocate((int) length);
        readFully(channel, body, false);
        return body.array();
    }

    private static boolean readFully(ReadableByteChannel channel, ByteBuffer buf, boolean eofAllowedAtStart)
            throws IOException {
        while (buf.hasRemaining()) {
            int n = channel.read(buf);
            if (n < 0) {
                if (eofAllowedAtStart && buf.position() == 0) {
                    return false;
                }
                throw new EOFException("stream closed after " + buf.position() + " of "
                        + buf.capacity() + " bytes");
            }
        }
        return true;
    }
}
