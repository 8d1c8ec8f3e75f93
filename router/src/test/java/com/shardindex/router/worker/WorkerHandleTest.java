package com.shardindex.router.worker;

import com.shardindex.core.model.WorkerStats;
import com.shardindex.core.msg.RpcMessage;
import com.shardindex.core.msg.RpcMessages.Ack;
import com.shardindex.core.msg.RpcMessages.GetWorkerStats;
import com.shardindex.core.msg.RpcMessages.LoadFiles;
import com.shardindex.core.msg.RpcMessages.Shutdown;
import com.shardindex.core.msg.RpcMessages.WorkerStatsResult;
import com.shardindex.router.Await;
import com.shardindex.router.InMemoryFrameStream;
import com.shardindex.router.error.WorkerDisconnectedException;
import com.shardindex.router.error.WorkerTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerHandleTest {

    private final InMemoryFrameStream stream = new InMemoryFrameStream();
    private Disposable serving;

    @AfterEach
    void tearDown() {
        stream.close();
        if (serving != null) {
            serving.dispose();
        }
    }

    private WorkerHandle serve(Duration rpcTimeout) {
        WorkerHandle handle = new WorkerHandle(7, 0, stream, rpcTimeout);
        serving = handle.serve(stream.frames()).subscribe();
        return handle;
    }

    private static WorkerStatsResult stats(long revision) {
        return new WorkerStatsResult(WorkerStats.builder()
                .shardId(0)
                .revision(revision)
                .indexGeneration(1)
                .fileCount(3)
                .build());
    }

    private static Throwable failure(CompletableFuture<RpcMessage> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    // ========== Request Tests ==========

    @Test
    @DisplayName("Each reply goes to the request that was sent before it")
    void testRequestsAnsweredInOrder() throws Exception {
        WorkerHandle handle = serve(Duration.ofMinutes(1));

        CompletableFuture<RpcMessage> first = handle.request(new GetWorkerStats()).toFuture();
        CompletableFuture<RpcMessage> second = handle.request(new LoadFiles(2, List.of())).toFuture();

        Await.until("first request is written", () -> stream.sent().size() == 1);
        Thread.sleep(50);
        assertEquals(1, stream.sent().size(), "second request must wait for the first reply");

        stream.reply(stats(1));
        assertEquals(stats(1), first.get(5, TimeUnit.SECONDS));

        Await.until("second request is written", () -> stream.sent().size() == 2);
        assertInstanceOf(LoadFiles.class, stream.sent().get(1));
        stream.reply(new Ack());
        assertEquals(new Ack(), second.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("A notification is written without waiting for a reply")
    void testNotification() throws Exception {
        WorkerHandle handle = serve(Duration.ofMinutes(1));

        assertTrue(handle.notifyWorker(new Shutdown()));
        CompletableFuture<RpcMessage> stats = handle.request(new GetWorkerStats()).toFuture();

        Await.until("both frames are written", () -> stream.sent().size() == 2);
        assertInstanceOf(Shutdown.class, stream.sent().get(0));
        stream.reply(stats(4));
        assertEquals(stats(4), stats.get(5, TimeUnit.SECONDS));
    }

    // ========== Failure Tests ==========

    @Test
    @DisplayName("Closing the connection fails the pending and the queued requests")
    void testDisconnectFailsCallers() {
        WorkerHandle handle = serve(Duration.ofMinutes(1));
        CompletableFuture<RpcMessage> pending = handle.request(new GetWorkerStats()).toFuture();
        CompletableFuture<RpcMessage> queued = handle.request(new GetWorkerStats()).toFuture();
        Await.until("first request is written", () -> stream.sent().size() == 1);

        stream.close();

        assertInstanceOf(WorkerDisconnectedException.class, failure(pending));
        assertInstanceOf(WorkerDisconnectedException.class, failure(queued));
        Await.until("handle is closed", handle::isClosed);
        StepVerifier.create(handle.request(new GetWorkerStats()))
                .expectError(WorkerDisconnectedException.class)
                .verify(Duration.ofSeconds(5));
        assertFalse(handle.notifyWorker(new Shutdown()));
    }

    @Test
    @DisplayName("A frame nobody asked for closes the connection")
    void testUnsolicitedFrame() {
        WorkerHandle handle = serve(Duration.ofMinutes(1));

        stream.reply(new Ack());

        Await.until("stream is closed", stream::isClosed);
        Await.until("handle is closed", handle::isClosed);
    }

    @Test
    @DisplayName("An undecodable reply fails its request and closes the connection")
    void testUndecodableReply() {
        WorkerHandle handle = serve(Duration.ofMinutes(1));
        CompletableFuture<RpcMessage> pending = handle.request(new GetWorkerStats()).toFuture();
        Await.until("request is written", () -> stream.sent().size() == 1);

        stream.pushRaw("{not json".getBytes(StandardCharsets.UTF_8));

        assertInstanceOf(WorkerDisconnectedException.class, failure(pending));
        Await.until("stream is closed", stream::isClosed);
    }

    @Test
    @DisplayName("A request without a reply times out and closes the connection")
    void testRequestTimeout() {
        WorkerHandle handle = serve(Duration.ofMillis(100));

        StepVerifier.create(handle.request(new GetWorkerStats()))
                .expectError(WorkerTimeoutException.class)
                .verify(Duration.ofSeconds(5));

        assertTrue(stream.isClosed());
        Await.until("handle is closed", handle::isClosed);
    }
}
