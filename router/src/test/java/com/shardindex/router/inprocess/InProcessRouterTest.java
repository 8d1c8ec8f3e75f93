package com.shardindex.router.inprocess;

import com.shardindex.core.indexer.JavaSymbolIndexer;
import com.shardindex.core.indexer.RegexJavaSymbolIndexer;
import com.shardindex.core.model.Symbol;
import com.shardindex.router.config.WorkspaceLayout;
import com.shardindex.router.error.RouterException;
import com.shardindex.router.metrics.RouterMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InProcessRouterTest {

    @TempDir
    Path workspace;

    private Path rootA;
    private Path rootB;

    @BeforeEach
    void setUp() throws IOException {
        rootA = Files.createDirectories(workspace.resolve("a"));
        rootB = Files.createDirectories(workspace.resolve("b/src"));
        Files.writeString(rootA.resolve("Alpha.java"), "class Alpha { void run() {} }");
        Files.writeString(rootB.resolve("Beta.java"), "interface Beta {}");
    }

    private InProcessRouter router(JavaSymbolIndexer indexer) {
        return new InProcessRouter(WorkspaceLayout.of(rootA, rootB), indexer, RouterMetrics.inMemory());
    }

    private static List<String> names(List<Symbol> symbols) {
        return symbols.stream().map(Symbol::getName).collect(Collectors.toList());
    }

    // ========== Indexing Tests ==========

    @Test
    @DisplayName("Indexing the workspace publishes the symbols of every root")
    void testIndexWorkspace() {
        InProcessRouter router = router(new RegexJavaSymbolIndexer());

        router.indexWorkspace().block(Duration.ofSeconds(10));

        assertEquals(1, router.revision());
        assertEquals(List.of("Alpha"), names(router.workspaceSymbols("Alpha", 10)));
        assertEquals(List.of("Beta"), names(router.workspaceSymbols("Beta", 10)));
        assertEquals(1, router.shardIndex(1).orElseThrow().getRevision());
        assertEquals(1, router.shardIndex(1).orElseThrow().getIndexGeneration());
    }

    @Test
    @DisplayName("Nothing is searchable before the first index")
    void testEmptyBeforeIndexing() {
        InProcessRouter router = router(new RegexJavaSymbolIndexer());

        assertTrue(router.workspaceSymbols("Alpha", 10).isEmpty());
        assertEquals(0, router.revision());
    }

    @Test
    @DisplayName("Updating a file replaces its symbols and bumps the revision")
    void testUpdateFileReplacesSymbols() {
        InProcessRouter router = router(new RegexJavaSymbolIndexer());
        router.indexWorkspace().block(Duration.ofSeconds(10));

        router.updateFile(rootA.resolve("Alpha.java"), "class Omega {}").block(Duration.ofSeconds(10));

        assertEquals(2, router.revision());
        assertTrue(router.workspaceSymbols("Alpha", 10).isEmpty());
        assertEquals(List.of("Omega"), names(router.workspaceSymbols("Omega", 10)));
        assertEquals(List.of("Beta"), names(router.workspaceSymbols("Beta", 10)));
        assertEquals(1, router.shardIndex(1).orElseThrow().getRevision());
    }

    @Test
    @DisplayName("Updating a file that is not on disk adds it to its shard")
    void testUpdateFileAddsNewFile() {
        InProcessRouter router = router(new RegexJavaSymbolIndexer());
        router.indexWorkspace().block(Duration.ofSeconds(10));

        router.updateFile(rootB.resolve("pkg/Gamma.java"), "enum Gamma { ONE }").block(Duration.ofSeconds(10));

        assertEquals(List.of("Beta", "Gamma"), names(router.shardIndex(1).orElseThrow().getSymbols()));
        assertEquals(List.of("Alpha"), names(router.workspaceSymbols("Alpha", 10)));
    }

    @Test
    @DisplayName("Updating a file outside every root fails without changing the revision")
    void testUpdateOutsideRoots() {
        InProcessRouter router = router(new RegexJavaSymbolIndexer());

        StepVerifier.create(router.updateFile(workspace.resolve("Stray.java"), "class Stray {}"))
                .expectError(RouterException.class)
                .verify(Duration.ofSeconds(5));
        assertEquals(0, router.revision());
    }

    @Test
    @DisplayName("Worker stats are empty in-process")
    void testWorkerStatsEmpty() {
        StepVerifier.create(router(new RegexJavaSymbolIndexer()).workerStats())
                .expectNextMatches(Map::isEmpty)
                .verifyComplete();
    }

    // ========== Cancellation Tests ==========

    @Test
    @DisplayName("A newer token cancels the previous one")
    void testTokenSupersession() {
        InProcessRouter router = router(new RegexJavaSymbolIndexer());

        CancellationToken first = router.nextIndexToken();
        CancellationToken second = router.nextIndexToken();

        assertTrue(first.isCancelled());
        assertFalse(second.isCancelled());
    }

    @Test
    @DisplayName("A superseded pass publishes nothing even when it finishes last")
    void testSupersededPassDiscarded() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean blockNext = new AtomicBoolean(true);
        RegexJavaSymbolIndexer regex = new RegexJavaSymbolIndexer();
        JavaSymbolIndexer blocking = (path, text) -> {
            if (blockNext.compareAndSet(true, false)) {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(new Symbol("Stale", path));
            }
            return regex.index(path, text);
        };
        InProcessRouter router = new InProcessRouter(WorkspaceLayout.of(rootA), blocking, RouterMetrics.inMemory(),
                Schedulers.boundedElastic());

        CompletableFuture<Void> slow = router.indexWorkspace().toFuture();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        router.indexWorkspace().block(Duration.ofSeconds(10));
        release.countDown();
        slow.get(10, TimeUnit.SECONDS);

        assertEquals(2, router.revision());
        assertEquals(2, router.shardIndex(0).orElseThrow().getRevision());
        assertTrue(router.workspaceSymbols("Stale", 10).isEmpty());
        assertEquals(List.of("Alpha"), names(router.workspaceSymbols("Alpha", 10)));
    }

    @Test
    @DisplayName("Shutdown cancels the running pass")
    void testShutdownCancels() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        JavaSymbolIndexer blocking = (path, text) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(new Symbol("Late", path));
        };
        InProcessRouter router = new InProcessRouter(WorkspaceLayout.of(rootA), blocking, RouterMetrics.inMemory());

        CompletableFuture<Void> pass = router.indexWorkspace().toFuture();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        router.shutdown().block(Duration.ofSeconds(5));
        release.countDown();
        pass.get(10, TimeUnit.SECONDS);

        assertTrue(router.workspaceSymbols("Late", 10).isEmpty());
        assertTrue(router.shardIndex(0).isEmpty());
    }
}
