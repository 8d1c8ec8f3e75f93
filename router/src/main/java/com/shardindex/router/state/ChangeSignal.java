package com.shardindex.router.state;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Broadcast "something changed" wake-up.
 * <p>
 * Subscribers immediately receive the latest version, then every later one, so a waiter that
 * re-checks state on each signal cannot miss a change made between its check and its subscription.
 * </p>
 */
public class ChangeSignal {
    private final Sinks.Many<Long> sink = Sinks.many().replay().latestOrDefault(0L);
    private long version;

    public synchronized void fire() {
        version++;
        sink.tryEmitNext(version);
    }

    public Flux<Long> changes() {
        return sink.asFlux();
    }

    public synchronized void complete() {
        sink.tryEmitComplete();
    }
}
