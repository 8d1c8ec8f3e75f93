package com.shardindex.router;

import com.shardindex.router.config.RouterConfig;
import com.shardindex.router.config.RouterMode;
import com.shardindex.router.metrics.RouterMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Main entry point for the router.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Load configuration from the environment</li>
 *   <li>Start the in-process or distributed router</li>
 *   <li>Index the workspace once and report the result</li>
 *   <li>Shut down workers on JVM exit</li>
 * </ul>
 * </p>
 */
public class RouterApp {
    private static final Logger log = LoggerFactory.getLogger(RouterApp.class);

    public static void main(String[] args) {
        RouterConfig config = RouterConfig.fromEnv();
        MDC.put("role", "router");

        log.info("Starting router: mode={}, shards={}", config.getMode(), config.getLayout().shardCount());
        config.getLayout().getSourceRoots().forEach(root -> log.info("  Source root: {}", root.getPath()));

        RouterMetrics metrics = RouterMetrics.inMemory();
        QueryRouter router;
        if (config.getMode() == RouterMode.DISTRIBUTED) {
            log.info("  Listen: {}", config.getDistributed().getListenAddress());
            router = QueryRouter.distributed(config.getDistributed(), config.getLayout(), metrics)
                .doOnNext(r -> log.info("Router listening on {}", r.boundListenAddress().orElse(null)))
                .doOnError(err -> log.error("Failed to start router", err))
                .block(Duration.ofSeconds(45));
        } else {
            router = QueryRouter.inProcess(config.getLayout(), metrics);
        }

        handleShutdown(router);

        router.indexWorkspace()
            .doOnSuccess(v -> log.info("Workspace indexed at revision {}", router.revision()))
            .doOnError(err -> log.error("Initial workspace index failed", err))
            .onErrorResume(err -> Mono.empty())
            .block();

        log.info("Router is ready");

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(QueryRouter router) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("role", "router");
            log.info("Shutdown signal received, stopping router...");
            router.shutdown().block(Duration.ofSeconds(10));
            log.info("Shutdown complete");
        }));
    }
}
