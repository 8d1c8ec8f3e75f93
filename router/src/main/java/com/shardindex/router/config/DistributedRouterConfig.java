package com.shardindex.router.config;

import com.shardindex.core.codec.Frames;
import com.shardindex.core.transport.TransportKind;
import com.shardindex.router.error.ConfigException;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * Settings of the distributed router mode.
 */
@Value
@Builder(toBuilder = true)
public class DistributedRouterConfig {
    public static final int DEFAULT_MAX_INFLIGHT_HANDSHAKES = 128;
    public static final int DEFAULT_MAX_WORKER_CONNECTIONS = 1024;

    ListenAddress listenAddress;

    /**
     * Worker executable followed by any fixed leading arguments (e.g. {@code java -jar worker.jar}).
     */
    List<String> workerCommand;

    Path cacheDir;

    /**
     * Shared secret every worker hello must present; null disables the check.
     */
    @ToString.Exclude
    String authToken;

    @Builder.Default
    FingerprintAllowlist fingerprintAllowlist = FingerprintAllowlist.empty();

    /**
     * Spawn and supervise one worker process per shard, or wait for externally started workers.
     */
    boolean spawnWorkers;

    /**
     * Permit plaintext TCP on non-loopback addresses or together with an auth token.
     */
    boolean allowInsecureTcp;

    @Builder.Default
    int maxFrameBytes = Frames.DEFAULT_MAX_FRAME_BYTES;

    @Builder.Default
    int maxInflightHandshakes = DEFAULT_MAX_INFLIGHT_HANDSHAKES;

    @Builder.Default
    int maxWorkerConnections = DEFAULT_MAX_WORKER_CONNECTIONS;

    @Builder.Default
    Duration handshakeTimeout = Duration.ofSeconds(5);

    @Builder.Default
    Duration workerWaitTimeout = Duration.ofSeconds(10);

    @Builder.Default
    Duration rpcTimeout = Duration.ofMinutes(10);

    /**
     * Checks the configuration and fills in derived values.
     * <p>
     * A supervised setup without a token gets a random one before the checks run, so spawning
     * workers over plaintext TCP needs {@code allowInsecureTcp}. Allowlist entries are normalised.
     * </p>
     *
     * @return Config the router runs with
     * @throws ConfigException if the combination is unsafe or inconsistent
     */
    public DistributedRouterConfig validated() {
        if (listenAddress == null) {
            throw new ConfigException("listen address is required");
        }
        if (spawnWorkers && (workerCommand == null || workerCommand.isEmpty())) {
            throw new ConfigException("spawnWorkers requires a worker command");
        }
        if (spawnWorkers && cacheDir == null) {
            throw new ConfigException("spawnWorkers requires a cache directory");
        }
        String token = authToken;
        if (spawnWorkers && token == null) {
            token = generateAuthToken();
        }
        TransportKind kind = listenAddress.kind();
        if (spawnWorkers && kind == TransportKind.TCP_TLS) {
            throw new ConfigException("spawnWorkers is not supported with a tcp+tls listen address: "
                    + "spawned workers have no TLS client configuration. Use a local transport, or start "
                    + "remote workers yourself with spawnWorkers=false");
        }
        if (fingerprintAllowlist.isConfigured()) {
            if (kind != TransportKind.TCP_TLS) {
                throw new ConfigException("TLS client certificate allowlist requires a tcp+tls listen address, got "
                        + listenAddress);
            }
            if (!listenAddress.getTls().verifiesClients()) {
                throw new ConfigException("TLS client certificate allowlist requires client certificate "
                        + "verification: configure a client CA and require client auth");
            }
        }
        if (kind == TransportKind.TCP && !allowInsecureTcp) {
            if (token != null) {
                throw new ConfigException("refusing plaintext TCP while an auth token is configured: the token "
                        + "and shard sources would travel unencrypted. Use tcp+tls or set allowInsecureTcp");
            }
            if (!listenAddress.getAddress().isLoopback()) {
                throw new ConfigException("refusing to listen on non-loopback plaintext TCP address "
                        + listenAddress + ". Use tcp+tls or set allowInsecureTcp");
            }
        }

        return toBuilder()
                .authToken(token)
                .fingerprintAllowlist(fingerprintAllowlist.normalized())
                .maxFrameBytes(Frames.clampMaxFrameBytes(maxFrameBytes))
                .maxInflightHandshakes(Math.max(1, maxInflightHandshakes))
                .maxWorkerConnections(Math.max(1, maxWorkerConnections))
                .build();
    }

    static String generateAuthToken() {
        byte[] bytes = new byte[32];
        new SecureRandom().nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
