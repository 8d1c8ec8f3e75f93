package com.shardindex.core.transport;

import com.shardindex.core.codec.Frames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link FrameStream} over a blocking JDK {@link SocketChannel}, used for domain sockets when
 * no native Netty transport is available and for named pipes.
 * <p>
 * Reads and writes go straight to the channel (never through {@code Channels.newInputStream}),
 * so a pending read does not block a concurrent write. Both run on the bounded-elastic scheduler.
 * </p>
 */
public class ChannelFrameStream implements FrameStream {
    private static final Logger log = LoggerFactory.getLogger(ChannelFrameStream.class);

    private final SocketChannel channel;
    private final int maxFrameBytes;
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Sinks.Empty<Void> closeSink = Sinks.empty();

    public ChannelFrameStream(SocketChannel channel, int maxFrameBytes) {
        this.channel = channel;
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    public Flux<byte[]> frames() {
        return Flux.<byte[]>generate(sink -> {
                    try {
                        byte[] frame = Frames.readFrame(channel, maxFrameBytes);
                        if (frame == null) {
                            sink.complete();
                        } else {
                            sink.next(frame);
                        }
                    } catch (IOException e) {
                        if (closed.get()) {
                            sink.complete();
                        } else {
                            sink.error(e);
                        }
                    } catch (RuntimeException e) {
                        sink.error(e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doFinally(signal -> close());
    }

    @Override
    public Mono<Void> send(byte[] payload) {
        return Mono.<Void>fromCallable(() -> {
                    synchronized (writeLock) {
                        Frames.writeFrame(channel, payload);
                    }
                    return null;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public PeerIdentity identity() {
        return PeerIdentity.unauthenticated();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Error closing channel: {}", e.getMessage());
        }
        closeSink.tryEmitEmpty();
    }

    @Override
    public Mono<Void> onClose() {
        return closeSink.asMono();
    }
}
