package com.shardindex.router.worker;

import com.shardindex.core.codec.MessageCodec;
import com.shardindex.core.codec.ProtocolException;
import com.shardindex.core.msg.RpcMessage;
import com.shardindex.core.transport.FrameStream;
import com.shardindex.router.error.WorkerDisconnectedException;
import com.shardindex.router.error.WorkerTimeoutException;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One connected worker: multiplexes concurrent callers onto the connection.
 * <p>
 * Submissions are queued and written strictly in order by a single drain loop. A request holds
 * the loop until the worker's single reply frame arrives; a notification is written and
 * forgotten. When the connection fails or closes, the pending call and every queued call fail
 * with {@link WorkerDisconnectedException}, and later submissions fail immediately.
 * </p>
 */
public class WorkerHandle {
    private static final Logger log = LoggerFactory.getLogger(WorkerHandle.class);

    @Getter
    private final int workerId;
    @Getter
    private final int shardId;

    private final FrameStream stream;
    private final Duration rpcTimeout;
    private final Sinks.Many<Outbound> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicReference<Outbound> awaiting = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public WorkerHandle(int workerId, int shardId, FrameStream stream, Duration rpcTimeout) {
        this.workerId = workerId;
        this.shardId = shardId;
        this.stream = stream;
        this.rpcTimeout = rpcTimeout;
    }

    /**
     * Runs the connection: drains the outbound queue and routes inbound frames to waiting
     * callers. Completes when the connection ends, for whatever reason; queued calls left at
     * that point are failed by the drain loop.
     *
     * @param inbound Frames received after the handshake
     */
    public Mono<Void> serve(Flux<byte[]> inbound) {
        return Mono.defer(() -> {
            queue.asFlux()
                .concatMap(this::dispatch)
                .subscribe(
                    v -> { },
                    e -> fail(new WorkerDisconnectedException("writer for worker " + workerId + " failed", e)));
            return inbound
                .doOnNext(this::onFrame)
                .then()
                .onErrorResume(e -> {
                    log.warn("Connection to worker {} (shard {}) failed: {}", workerId, shardId, e.toString());
                    fail(new WorkerDisconnectedException("connection to worker " + workerId + " failed", e));
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    fail(new WorkerDisconnectedException("worker " + workerId + " disconnected"));
                    stream.close();
                });
        });
    }

    /**
     * Sends {@code message} and waits for the worker's reply.
     * <p>
     * Fails with {@link WorkerDisconnectedException} if the connection is or becomes unusable and
     * with {@link WorkerTimeoutException} (closing the connection) when no reply arrives within
     * the RPC timeout.
     * </p>
     */
    public Mono<RpcMessage> request(RpcMessage message) {
        return Mono.defer(() -> {
            Outbound outbound = new Outbound(MessageCodec.encode(message), Sinks.one());
            if (!enqueue(outbound)) {
                return Mono.error(new WorkerDisconnectedException("worker " + workerId + " is disconnected"));
            }
            return outbound.reply.asMono()
                .timeout(rpcTimeout)
                .onErrorMap(TimeoutException.class, e -> {
                    stream.close();
                    return new WorkerTimeoutException("worker " + workerId + " (shard " + shardId
                        + ") did not answer " + message.getClass().getSimpleName() + " within " + rpcTimeout);
                });
        });
    }

    /**
     * Queues {@code message} without expecting a reply.
     *
     * @return false if the connection is already closed
     */
    public boolean notifyWorker(RpcMessage message) {
        return enqueue(new Outbound(MessageCodec.encode(message), null));
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void close() {
        stream.close();
    }

    public Mono<Void> onClose() {
        return stream.onClose();
    }

    private boolean enqueue(Outbound outbound) {
        if (closed.get()) {
            return false;
        }
        synchronized (queue) {
            return queue.tryEmitNext(outbound).isSuccess();
        }
    }

    private Mono<Void> dispatch(Outbound outbound) {
        if (closed.get()) {
            outbound.fail(new WorkerDisconnectedException("worker " + workerId + " disconnected"));
            return Mono.empty();
        }
        if (outbound.reply == null) {
            return stream.send(outbound.payload)
                .onErrorResume(e -> {
                    fail(new WorkerDisconnectedException("write to worker " + workerId + " failed", e));
                    stream.close();
                    return Mono.empty();
                });
        }
        awaiting.set(outbound);
        if (closed.get() && awaiting.compareAndSet(outbound, null)) {
            // closed between the check above and the hand-off
            outbound.fail(new WorkerDisconnectedException("worker " + workerId + " disconnected"));
            return Mono.empty();
        }
        return stream.send(outbound.payload)
            .then(outbound.reply.asMono())
            .then()
            .onErrorResume(e -> {
                if (e instanceof WorkerDisconnectedException) {
                    return Mono.empty();
                }
                fail(new WorkerDisconnectedException("write to worker " + workerId + " failed", e));
                stream.close();
                return Mono.empty();
            });
    }

    private void onFrame(byte[] frame) {
        Outbound outbound = awaiting.getAndSet(null);
        if (outbound == null) {
            throw new ProtocolException("unsolicited frame from worker " + workerId);
        }
        RpcMessage reply;
        try {
            reply = MessageCodec.decode(frame);
        } catch (ProtocolException e) {
            outbound.fail(new WorkerDisconnectedException("undecodable reply from worker " + workerId, e));
            throw e;
        }
        outbound.reply.tryEmitValue(reply);
    }

    private void fail(Throwable error) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (queue) {
            queue.tryEmitComplete();
        }
        Outbound pending = awaiting.getAndSet(null);
        if (pending != null) {
            pending.fail(error);
        }
    }

    @Override
    public String toString() {
        return "WorkerHandle{workerId=" + workerId + ", shardId=" + shardId + "}";
    }

    private static final class Outbound {
        final byte[] payload;
        final Sinks.One<RpcMessage> reply;

        Outbound(byte[] payload, Sinks.One<RpcMessage> reply) {
            this.payload = payload;
            this.reply = reply;
        }

        void fail(Throwable error) {
            if (reply != null) {
                reply.tryEmitError(error);
            }
        }
    }
}
