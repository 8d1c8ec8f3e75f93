package com.shardindex.core.transport;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One established router/worker connection, seen as a stream of frame payloads.
 */
public interface FrameStream {
    /**
     * Inbound frame payloads, without length prefixes. Completes on a clean close at a frame
     * boundary and errors when the connection drops inside a frame or exceeds the frame limit.
     * Subscribe once.
     */
    Flux<byte[]> frames();

    /**
     * Frames and writes one payload; completes once it was flushed.
     */
    Mono<Void> send(byte[] payload);

    PeerIdentity identity();

    void close();

    /**
     * Completes when the connection is closed from either side.
     */
    Mono<Void> onClose();
}
