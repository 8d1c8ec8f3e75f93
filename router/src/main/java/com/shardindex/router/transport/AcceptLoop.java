package com.shardindex.router.transport;

import com.shardindex.core.transport.TransportAddress;
import reactor.core.publisher.Mono;

/**
 * Accepts worker connections on one listen address and hands each to the connection handler
 * as a {@link com.shardindex.core.transport.FrameStream}.
 */
public interface AcceptLoop {
    /**
     * Binds and starts accepting.
     *
     * @return Address actually bound (an ephemeral TCP port resolved)
     */
    Mono<TransportAddress> start();

    /**
     * Stops accepting. Connections already handed over are not waited for.
     */
    void stop();

    /**
     * Completes once the loop has exited.
     */
    Mono<Void> terminated();
}
