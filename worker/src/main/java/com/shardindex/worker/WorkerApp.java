package com.shardindex.worker;

import com.shardindex.core.cache.ShardCache;
import com.shardindex.core.codec.Frames;
import com.shardindex.core.indexer.RegexJavaSymbolIndexer;
import com.shardindex.core.transport.TransportAddress;
import com.shardindex.worker.config.TlsClientSettings;
import com.shardindex.worker.config.WorkerConfig;
import com.shardindex.worker.connect.RouterConnector;
import com.shardindex.worker.error.HandshakeFailedException;
import com.shardindex.worker.error.WorkerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Entry point of the shard worker process started by the router's supervisor (or by hand).
 * <p>
 * Exit codes: 0 after the router's {@code Shutdown}, 2 when the router refuses the hello or the
 * command line is invalid, 1 for any other failure.
 * </p>
 */
@Command(
    name = "shard-worker",
    mixinStandardHelpOptions = true,
    description = "Indexes one source root of a workspace on behalf of a shard index router"
)
public class WorkerApp implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(WorkerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_REJECTED = 2;

    @Option(names = "--connect", required = true, paramLabel = "ADDRESS",
        description = "Router address: unix:<path>, pipe:<name>, tcp:<host>:<port> or tcp+tls:<host>:<port>")
    String connect;

    @Option(names = "--shard-id", required = true, description = "Shard this worker serves")
    int shardId;

    @Option(names = "--cache-dir", required = true, description = "Directory of the persisted shard index")
    Path cacheDir;

    @Option(names = "--auth-token", description = "Shared secret expected by the router")
    String authToken;

    @Option(names = "--auth-token-env", paramLabel = "VAR",
        description = "Read the shared secret from this environment variable instead")
    String authTokenEnv;

    @Option(names = "--allow-insecure", description = "Allow sending the auth token over plaintext TCP")
    boolean allowInsecure;

    @Option(names = "--max-frame-bytes", defaultValue = "" + Frames.DEFAULT_MAX_FRAME_BYTES,
        description = "Largest frame accepted from the router (default: ${DEFAULT-VALUE})")
    int maxFrameBytes;

    @Option(names = "--tls-ca", description = "PEM CA bundle the router certificate must chain to")
    Path tlsCa;

    @Option(names = "--tls-cert", description = "PEM client certificate chain")
    Path tlsCert;

    @Option(names = "--tls-key", description = "PEM private key of the client certificate")
    Path tlsKey;

    @Option(names = "--tls-server-name", defaultValue = "localhost",
        description = "Name the router certificate is verified against (default: ${DEFAULT-VALUE})")
    String tlsServerName;

    public static void main(String[] args) {
        System.exit(new CommandLine(new WorkerApp()).execute(args));
    }

    @Override
    public Integer call() {
        MDC.put("shardId", String.valueOf(shardId));
        WorkerConfig config;
        try {
            config = toConfig(System::getenv).validated();
        } catch (WorkerException e) {
            log.error("Invalid worker configuration: {}", e.getMessage());
            return EXIT_REJECTED;
        }
        log.info("Starting worker for shard {}: router {}, cache {}",
            config.getShardId(), config.getConnect().toConnectArg(), config.getCacheDir());
        return run(config);
    }

    static int run(WorkerConfig config) {
        ShardWorker worker = new ShardWorker(
            config.getShardId(), new ShardCache(config.getCacheDir()), new RegexJavaSymbolIndexer());
        try {
            RouterConnector.connect(config)
                .flatMap(stream -> worker.run(stream, config.getAuthToken())
                    .doFinally(signal -> stream.close()))
                .block();
            log.info("Worker for shard {} stopped", config.getShardId());
            return EXIT_OK;
        } catch (HandshakeFailedException e) {
            log.error("Handshake failed: {}", e.getMessage());
            return EXIT_REJECTED;
        } catch (RuntimeException e) {
            log.error("Worker for shard {} failed", config.getShardId(), e);
            return EXIT_FAILED;
        }
    }

    /**
     * Builds the worker config from the parsed options.
     *
     * @param env Environment lookup for {@code --auth-token-env}
     * @throws WorkerException if the options contradict each other
     */
    WorkerConfig toConfig(Function<String, String> env) {
        TransportAddress address;
        try {
            address = TransportAddress.parse(connect);
        } catch (IllegalArgumentException e) {
            throw new WorkerException("invalid --connect address: " + e.getMessage(), e);
        }
        TlsClientSettings tls = null;
        if (tlsCa != null || tlsCert != null || tlsKey != null) {
            tls = TlsClientSettings.builder()
                .trustedCa(tlsCa)
                .certificateChain(tlsCert)
                .privateKey(tlsKey)
                .serverName(tlsServerName)
                .build();
        }
        return WorkerConfig.builder()
            .connect(address)
            .shardId(shardId)
            .cacheDir(cacheDir)
            .authToken(resolveAuthToken(env))
            .allowInsecure(allowInsecure)
            .maxFrameBytes(maxFrameBytes)
            .tls(tls)
            .build();
    }

    private String resolveAuthToken(Function<String, String> env) {
        if (authToken != null && authTokenEnv != null) {
            throw new WorkerException("--auth-token and --auth-token-env are mutually exclusive");
        }
        if (authTokenEnv == null) {
            return authToken;
        }
        String value = env.apply(authTokenEnv);
        if (value == null || value.trim().isEmpty()) {
            throw new WorkerException("environment variable " + authTokenEnv + " named by --auth-token-env is empty");
        }
        return value.trim();
    }
}
