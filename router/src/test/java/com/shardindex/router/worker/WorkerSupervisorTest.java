package com.shardindex.router.worker;

import com.shardindex.core.metrics.MetricsNames;
import com.shardindex.core.transport.TransportAddress;
import com.shardindex.router.Await;
import com.shardindex.router.config.DistributedRouterConfig;
import com.shardindex.router.config.ListenAddress;
import com.shardindex.router.config.WorkspaceLayout;
import com.shardindex.router.metrics.RouterMetrics;
import com.shardindex.router.state.RouterState;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WorkerSupervisorTest {

    private static final TransportAddress CONNECT = TransportAddress.tcp("127.0.0.1", 4711);

    @TempDir
    Path cacheDir;

    private RouterState state;
    private WorkerSupervisor supervisor;

    @AfterEach
    void tearDown() {
        if (supervisor != null) {
            supervisor.cancel();
        }
        if (state != null) {
            state.dispose();
        }
    }

    private DistributedRouterConfig config(List<String> command) {
        return DistributedRouterConfig.builder()
                .listenAddress(ListenAddress.of(CONNECT))
                .workerCommand(command)
                .cacheDir(cacheDir)
                .spawnWorkers(true)
                .workerWaitTimeout(Duration.ofMillis(300))
                .build();
    }

    private WorkerSupervisor supervise(List<String> command, RouterMetrics metrics) {
        state = new RouterState(WorkspaceLayout.of(Path.of("/ws/a")), config(command), metrics);
        supervisor = new WorkerSupervisor(0, state, CONNECT);
        supervisor.start();
        return supervisor;
    }

    private static double restarts(RouterMetrics metrics) {
        return metrics.getRegistry().find(MetricsNames.WORKER_RESTARTS_TOTAL).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    // ========== Command Tests ==========

    @Test
    @DisplayName("Launch command appends the connection parameters to the configured prefix")
    void testBuildCommand() {
        DistributedRouterConfig config = config(List.of("java", "-jar", "worker.jar")).toBuilder()
                .authToken("tok")
                .maxFrameBytes(1024)
                .build();

        List<String> command = WorkerSupervisor.buildCommand(config, TransportAddress.unix(Path.of("/tmp/r.sock")), 3);

        assertEquals(List.of("java", "-jar", "worker.jar",
                "--connect", "unix:/tmp/r.sock",
                "--shard-id", "3",
                "--cache-dir", cacheDir.toString(),
                "--max-frame-bytes", "1024",
                "--auth-token", "tok"), command);
    }

    @Test
    @DisplayName("Launch command omits the token when none is configured")
    void testBuildCommandWithoutToken() {
        List<String> command = WorkerSupervisor.buildCommand(config(List.of("shard-worker")), CONNECT, 0);

        assertEquals("shard-worker", command.get(0));
        assertEquals("tcp:127.0.0.1:4711", command.get(2));
        assertEquals(-1, command.indexOf("--auth-token"));
        assertEquals(-1, command.indexOf("--allow-insecure"));
    }

    @Test
    @DisplayName("Plaintext TCP workers are told that insecure transport was allowed")
    void testBuildCommandAllowInsecure() {
        DistributedRouterConfig config = config(List.of("shard-worker")).toBuilder()
                .allowInsecureTcp(true)
                .authToken("tok")
                .build();

        List<String> tcp = WorkerSupervisor.buildCommand(config, CONNECT, 0);
        List<String> unix = WorkerSupervisor.buildCommand(config, TransportAddress.unix(Path.of("/tmp/r.sock")), 0);

        assertEquals("--allow-insecure", tcp.get(tcp.size() - 1));
        assertEquals(-1, unix.indexOf("--allow-insecure"));
    }

    // ========== Restart Tests ==========

    @Test
    @DisplayName("A worker that cannot be spawned is retried with backoff until shutdown")
    void testSpawnFailureRetried() {
        RouterMetrics metrics = RouterMetrics.inMemory();
        WorkerSupervisor supervisor = supervise(List.of("/nonexistent/shard-worker-binary"), metrics);

        Await.until("two restarts were scheduled", () -> restarts(metrics) >= 2);
        state.beginShutdown();

        supervisor.terminated().block(Duration.ofSeconds(5));
        assertEquals(SupervisorPhase.STOPPED, supervisor.phase());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("A worker that exits before connecting is restarted")
    void testEarlyExitRestarted() {
        RouterMetrics metrics = RouterMetrics.inMemory();
        WorkerSupervisor supervisor = supervise(List.of("/bin/sh", "-c", "exit 3"), metrics);

        Await.until("two restarts were scheduled", () -> restarts(metrics) >= 2);
        state.beginShutdown();

        supervisor.terminated().block(Duration.ofSeconds(5));
        assertEquals(SupervisorPhase.STOPPED, supervisor.phase());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("A worker that never connects is killed after the wait timeout and restarted")
    void testConnectTimeoutKills() {
        RouterMetrics metrics = RouterMetrics.inMemory();
        WorkerSupervisor supervisor = supervise(List.of("/bin/sh", "-c", "sleep 30"), metrics);

        Await.until("a restart was scheduled", Duration.ofSeconds(10), () -> restarts(metrics) >= 1);
        state.beginShutdown();

        supervisor.terminated().block(Duration.ofSeconds(10));
        assertEquals(SupervisorPhase.STOPPED, supervisor.phase());
    }
}
