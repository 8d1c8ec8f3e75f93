package com.shardindex.router.transport;

import com.shardindex.core.transport.FrameStream;
import com.shardindex.router.config.ListenAddress;
import io.netty.channel.epoll.Epoll;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Picks the accept loop implementation for a listen address.
 */
public final class AcceptLoops {
    private static final Logger log = LoggerFactory.getLogger(AcceptLoops.class);

    private AcceptLoops() {
    }

    /**
     * @param listen        Address and TLS settings
     * @param maxFrameBytes Largest inbound frame
     * @param handler       Serves each accepted connection
     * @param shutdown      Completes when the router shuts down; the loop stops accepting then
     */
    public static AcceptLoop create(ListenAddress listen,
                                    int maxFrameBytes,
                                    Function<FrameStream, Mono<Void>> handler,
                                    Mono<Void> shutdown) {
        AcceptLoop loop;
        switch (listen.kind()) {
            case TCP:
            case TCP_TLS:
                loop = new NettyAcceptLoop(listen, maxFrameBytes, handler);
                break;
            case UNIX:
                if (Epoll.isAvailable()) {
                    loop = new NettyAcceptLoop(listen, maxFrameBytes, handler);
                } else {
                    log.info("Native epoll transport unavailable, serving {} with JDK channels", listen);
                    loop = new LocalChannelAcceptLoop(listen.getAddress(), maxFrameBytes, handler);
                }
                break;
            case NAMED_PIPE:
                loop = new LocalChannelAcceptLoop(listen.getAddress(), maxFrameBytes, handler);
                break;
            default:
                throw new IllegalArgumentException("unsupported listen address " + listen);
        }
        shutdown.subscribe(null, e -> loop.stop(), loop::stop);
        return loop;
    }
}
