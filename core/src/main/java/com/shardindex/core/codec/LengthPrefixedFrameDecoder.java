package com.shardindex.core.codec;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

import java.util.List;

/**
 * Netty inbound handler splitting the byte stream into frame payloads.
 * <p>
 * Emits one retained {@link ByteBuf} slice per frame, without the length prefix. A channel that
 * closes in the middle of a frame raises {@link CorruptedFrameException} instead of completing
 * quietly.
 * </p>
 */
public class LengthPrefixedFrameDecoder extends ByteToMessageDecoder {
    private final int maxFrameBytes;

    public LengthPrefixedFrameDecoder(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.readableBytes() >= Frames.LENGTH_FIELD_BYTES) {
            long length = in.getUnsignedIntLE(in.readerIndex());
            if (length > maxFrameBytes) {
                in.skipBytes(in.readableBytes());
                throw new TooLongFrameException("frame of " + length + " bytes exceeds limit of " + maxFrameBytes);
            }
            if (in.readableBytes() < Frames.LENGTH_FIELD_BYTES + length) {
                return;
            }
            in.skipBytes(Frames.LENGTH_FIELD_BYTES);
            out.add(in.readRetainedSlice((int) length));
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (in.isReadable()) {
            decode(ctx, in, out);
        }
        if (in.isReadable()) {
            int pending = in.readableBytes();
            in.skipBytes(pending);
            ctx.fireExceptionCaught(new CorruptedFrameException(
                    "connection closed with " + pending + " bytes of an incomplete frame"));
        }
    }
}
