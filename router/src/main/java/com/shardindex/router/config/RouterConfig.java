package com.shardindex.router.config;

import com.shardindex.core.codec.Frames;
import com.shardindex.core.transport.TransportAddress;
import com.shardindex.core.transport.TransportKind;
import com.shardindex.router.error.ConfigException;
import lombok.Builder;
import lombok.Value;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Configuration for the router process, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class RouterConfig {

    RouterMode mode;
    WorkspaceLayout layout;

    /**
     * Null in {@link RouterMode#IN_PROCESS} mode.
     */
    DistributedRouterConfig distributed;

    public static RouterConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    public static RouterConfig fromEnv(Function<String, String> env) {
        RouterMode mode = parseMode(getEnv(env, "ROUTER_MODE", "in-process"));
        WorkspaceLayout layout = parseLayout(getEnv(env, "SOURCE_ROOTS", ""));
        RouterConfigBuilder builder = RouterConfig.builder()
                .mode(mode)
                .layout(layout);
        if (mode == RouterMode.DISTRIBUTED) {
            builder.distributed(distributedFromEnv(env));
        }
        return builder.build();
    }

    private static DistributedRouterConfig distributedFromEnv(Function<String, String> env) {
        String tmp = System.getProperty("java.io.tmpdir");
        TransportAddress address = parseAddress(getEnv(env, "LISTEN_ADDR",
                "unix:" + Path.of(tmp, "shard-index-router.sock")));
        TlsServerSettings tls = null;
        if (address.getKind() == TransportKind.TCP_TLS) {
            String clientCa = getEnv(env, "TLS_CLIENT_CA", null);
            tls = TlsServerSettings.builder()
                    .certificateChain(Path.of(required(env, "TLS_CERT")))
                    .privateKey(Path.of(required(env, "TLS_KEY")))
                    .clientCa(clientCa == null ? null : Path.of(clientCa))
                    .requireClientAuth(Boolean.parseBoolean(getEnv(env, "TLS_REQUIRE_CLIENT_AUTH",
                            String.valueOf(clientCa != null))))
                    .build();
        }
        return DistributedRouterConfig.builder()
                .listenAddress(new ListenAddress(address, tls))
                .workerCommand(Arrays.asList(getEnv(env, "WORKER_COMMAND", "shard-worker").trim().split("\\s+")))
                .cacheDir(Path.of(getEnv(env, "CACHE_DIR", Path.of(tmp, "shard-index-cache").toString())))
                .authToken(getEnv(env, "AUTH_TOKEN", null))
                .spawnWorkers(Boolean.parseBoolean(getEnv(env, "SPAWN_WORKERS", "true")))
                .allowInsecureTcp(Boolean.parseBoolean(getEnv(env, "ALLOW_INSECURE_TCP", "false")))
                .maxFrameBytes(parseInt(env, "MAX_FRAME_BYTES", String.valueOf(Frames.DEFAULT_MAX_FRAME_BYTES)))
                .workerWaitTimeout(Duration.ofMillis(parseInt(env, "WORKER_WAIT_TIMEOUT_MS", "10000")))
                .fingerprintAllowlist(new FingerprintAllowlist(
                        parseList(getEnv(env, "TLS_CLIENT_FINGERPRINTS", "")),
                        parseShardLists(getEnv(env, "TLS_SHARD_FINGERPRINTS", ""))))
                .build();
    }

    static RouterMode parseMode(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "in-process":
            case "in_process":
            case "local":
                return RouterMode.IN_PROCESS;
            case "distributed":
                return RouterMode.DISTRIBUTED;
            default:
                throw new ConfigException("unknown ROUTER_MODE: " + value);
        }
    }

    static WorkspaceLayout parseLayout(String value) {
        List<SourceRoot> roots = new ArrayList<>();
        for (String part : value.split(File.pathSeparator)) {
            if (!part.isBlank()) {
                roots.add(new SourceRoot(Path.of(part.trim())));
            }
        }
        return new WorkspaceLayout(roots);
    }

    /**
     * Parses {@code "0=fp1,fp2;1=fp3"}.
     */
    static Map<Integer, Set<String>> parseShardLists(String value) {
        Map<Integer, Set<String>> out = new HashMap<>();
        for (String entry : value.split(";")) {
            if (entry.isBlank()) {
                continue;
            }
            int eq = entry.indexOf('=');
            if (eq <= 0) {
                throw new ConfigException("expected <shard>=<fingerprints> in TLS_SHARD_FINGERPRINTS: " + entry);
            }
            int shard;
            try {
                shard = Integer.parseInt(entry.substring(0, eq).trim());
            } catch (NumberFormatException e) {
                throw new ConfigException("bad shard id in TLS_SHARD_FINGERPRINTS: " + entry, e);
            }
            out.computeIfAbsent(shard, s -> new LinkedHashSet<>()).addAll(parseList(entry.substring(eq + 1)));
        }
        return out;
    }

    private static Set<String> parseList(String value) {
        Set<String> out = new LinkedHashSet<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    private static TransportAddress parseAddress(String value) {
        try {
            return TransportAddress.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("invalid LISTEN_ADDR: " + e.getMessage(), e);
        }
    }

    private static int parseInt(Function<String, String> env, String key, String defaultValue) {
        String value = getEnv(env, key, defaultValue);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("invalid " + key + ": " + value, e);
        }
    }

    private static String required(Function<String, String> env, String key) {
        String value = getEnv(env, key, null);
        if (value == null) {
            throw new ConfigException(key + " is required for a tcp+tls listen address");
        }
        return value;
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }
}
