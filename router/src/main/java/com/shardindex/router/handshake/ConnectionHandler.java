package com.shardindex.router.handshake;

import com.shardindex.core.codec.Frames;
import com.shardindex.core.codec.MessageCodec;
import com.shardindex.core.codec.ProtocolException;
import com.shardindex.core.model.ShardIndex;
import com.shardindex.core.msg.RpcMessage;
import com.shardindex.core.msg.RpcMessages;
import com.shardindex.core.msg.RpcMessages.WorkerHello;
import com.shardindex.core.transport.FrameStream;
import com.shardindex.router.config.DistributedRouterConfig;
import com.shardindex.router.error.HandshakeRejectedException;
import com.shardindex.router.error.RouterShutdownException;
import com.shardindex.router.metrics.RouterMetrics;
import com.shardindex.router.state.RouterState;
import com.shardindex.router.worker.WorkerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves one accepted worker connection: handshake, admission, then the worker's request loop.
 * <p>
 * Shared by every accept loop. Connections beyond the configured connection or in-flight
 * handshake limits are dropped on arrival.
 * </p>
 */
public class ConnectionHandler {
    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    private final RouterState state;
    private final WorkerAdmission admission;
    private final DistributedRouterConfig config;
    private final RouterMetrics metrics;

    private final AtomicInteger connections = new AtomicInteger();
    private final AtomicInteger handshakes = new AtomicInteger();

    public ConnectionHandler(RouterState state, WorkerAdmission admission) {
        this.state = state;
        this.admission = admission;
        this.config = state.getConfig();
        this.metrics = state.getMetrics();
    }

    /**
     * Runs the connection to completion. Never errors; failures are logged and close the
     * connection.
     */
    public Mono<Void> handle(FrameStream stream) {
        if (connections.incrementAndGet() > config.getMaxWorkerConnections()) {
            connections.decrementAndGet();
            log.warn("Dropping connection {}: {} worker connections already open",
                stream, config.getMaxWorkerConnections());
            stream.close();
            return Mono.empty();
        }
        if (handshakes.incrementAndGet() > config.getMaxInflightHandshakes()) {
            handshakes.decrementAndGet();
            connections.decrementAndGet();
            log.warn("Dropping connection {}: {} handshakes already in flight",
                stream, config.getMaxInflightHandshakes());
            stream.close();
            return Mono.empty();
        }

        AtomicBoolean handshaking = new AtomicBoolean(true);
        Runnable handshakeDone = () -> {
            if (handshaking.compareAndSet(true, false)) {
                handshakes.decrementAndGet();
            }
        };

        return stream.frames()
            .timeout(Mono.delay(config.getHandshakeTimeout()), frame -> Mono.never())
            .switchOnFirst((first, frames) -> {
                if (!first.hasValue()) {
                    return frames.then();
                }
                return handshake(stream, first.get())
                    .doFinally(signal -> handshakeDone.run())
                    .flatMap(handle -> handle.serve(frames.skip(1))
                        .doFinally(signal -> state.removeWorker(handle.getShardId(), handle.getWorkerId())));
            })
            .then()
            .onErrorResume(e -> {
                logFailure(stream, e);
                return Mono.empty();
            })
            .doFinally(signal -> {
                handshakeDone.run();
                connections.decrementAndGet();
                stream.close();
            });
    }

    private Mono<WorkerHandle> handshake(FrameStream stream, byte[] frame) {
        return Mono.defer(() -> {
            if (frame.length > Frames.MAX_HELLO_BYTES) {
                throw new ProtocolException("hello of " + frame.length + " bytes exceeds "
                    + Frames.MAX_HELLO_BYTES);
            }
            RpcMessage message = MessageCodec.decode(frame);
            if (!(message instanceof WorkerHello)) {
                throw new ProtocolException("expected WorkerHello, got " + message.getClass().getSimpleName());
            }
            WorkerHello hello = (WorkerHello) message;
            int shardId = hello.getShardId();

            int workerId;
            try {
                workerId = admission.admit(hello, stream.identity());
            } catch (HandshakeRejectedException e) {
                return reject(stream, shardId, e);
            }

            if (hello.getCachedIndex() != null) {
                applyCachedIndex(shardId, hello.getCachedIndex());
            }

            RpcMessages.RouterHello welcome = new RpcMessages.RouterHello(
                workerId, shardId, state.revision(), RpcMessages.PROTOCOL_VERSION);
            WorkerHandle handle = new WorkerHandle(workerId, shardId, stream, config.getRpcTimeout());
            return stream.send(MessageCodec.encode(welcome))
                .then(Mono.fromCallable(() -> {
                    if (!state.installWorker(handle)) {
                        throw new RouterShutdownException("router shut down during handshake");
                    }
                    return handle;
                }))
                .doOnError(e -> state.releasePending(shardId, workerId))
                .doOnNext(h -> {
                    metrics.recordHandshakeAccepted();
                    log.info("Worker {} connected for shard {} ({}, peer {})",
                        workerId, shardId, stream, stream.identity());
                    if (hello.getCachedIndex() != null) {
                        refreshFiles(h);
                    }
                });
        });
    }

    private Mono<WorkerHandle> reject(FrameStream stream, int shardId, HandshakeRejectedException e) {
        metrics.recordHandshakeRejected(e.getReason());
        log.warn("Rejecting worker hello for shard {} from {}: {}", shardId, stream, e.getMessage());
        return stream.send(MessageCodec.encode(new RpcMessages.Error(e.getMessage())))
            .onErrorResume(sendError -> {
                log.debug("Could not deliver rejection to {}: {}", stream, sendError.toString());
                return Mono.empty();
            })
            .then(Mono.error(e));
    }

    private void applyCachedIndex(int shardId, ShardIndex cached) {
        if (cached.getShardId() != shardId) {
            log.warn("Ignoring cached index for shard {} sent by a worker for shard {}",
                cached.getShardId(), shardId);
            return;
        }
        state.foldRevision(cached.getRevision());
        if (state.applyShardIndex(cached)) {
            log.info("Installed cached index for shard {} at revision {} ({} symbols)",
                shardId, cached.getRevision(), cached.getSymbols().size());
        }
    }

    /**
     * Ships the shard's current files to a worker that started from a cached index.
     */
    private void refreshFiles(WorkerHandle handle) {
        int shardId = handle.getShardId();
        state.collectFiles(shardId)
            .flatMap(files -> handle.request(new RpcMessages.LoadFiles(state.revision(), files)))
            .subscribe(
                reply -> {
                    if (reply instanceof RpcMessages.Error) {
                        log.warn("Worker {} rejected file refresh for shard {}: {}",
                            handle.getWorkerId(), shardId, ((RpcMessages.Error) reply).getMessage());
                    }
                },
                e -> log.warn("Failed to refresh files for shard {}: {}", shardId, e.toString()));
    }

    private void logFailure(FrameStream stream, Throwable e) {
        if (e instanceof HandshakeRejectedException) {
            return;
        }
        if (e instanceof TimeoutException) {
            metrics.recordHandshakeRejected("timeout");
            log.warn("Worker connection {} sent no hello within {}", stream, config.getHandshakeTimeout());
        } else if (e instanceof ProtocolException) {
            metrics.recordHandshakeRejected("protocol");
            log.warn("Protocol error on worker connection {}: {}", stream, e.getMessage());
        } else {
            log.warn("Worker connection {} failed: {}", stream, e.toString());
        }
    }
}
