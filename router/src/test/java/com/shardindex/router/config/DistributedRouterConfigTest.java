package com.shardindex.router.config;

import com.shardindex.core.codec.Frames;
import com.shardindex.core.transport.TransportAddress;
import com.shardindex.router.error.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DistributedRouterConfigTest {

    private static final String FINGERPRINT = "ab".repeat(32);

    private static final TlsServerSettings MUTUAL_TLS = TlsServerSettings.builder()
            .certificateChain(Path.of("server.pem"))
            .privateKey(Path.of("server.key"))
            .clientCa(Path.of("ca.pem"))
            .requireClientAuth(true)
            .build();

    private static DistributedRouterConfig.DistributedRouterConfigBuilder base(ListenAddress listen) {
        return DistributedRouterConfig.builder()
                .listenAddress(listen)
                .workerCommand(List.of("shard-worker"))
                .cacheDir(Path.of("cache"));
    }

    // ========== Token Tests ==========

    @Test
    @DisplayName("Spawning workers without a token generates a URL-safe 32-byte token")
    void testTokenGenerated() {
        DistributedRouterConfig config = base(ListenAddress.of(TransportAddress.unix(Path.of("router.sock"))))
                .spawnWorkers(true)
                .build()
                .validated();

        assertNotNull(config.getAuthToken());
        assertEquals(43, config.getAuthToken().length());
        assertTrue(config.getAuthToken().matches("[A-Za-z0-9_-]+"));
    }

    @Test
    @DisplayName("External workers without a token stay token-less")
    void testNoTokenWithoutSpawn() {
        DistributedRouterConfig config = base(ListenAddress.of(TransportAddress.unix(Path.of("router.sock"))))
                .build()
                .validated();

        assertNull(config.getAuthToken());
    }

    // ========== Transport Safety Tests ==========

    @Test
    @DisplayName("Spawning workers over tcp+tls is refused")
    void testSpawnWithTlsRefused() {
        DistributedRouterConfig config = base(ListenAddress.tls(TransportAddress.tcpTls("127.0.0.1", 0), MUTUAL_TLS))
                .spawnWorkers(true)
                .build();

        assertThrows(ConfigException.class, config::validated);
    }

    @Test
    @DisplayName("Spawning workers over loopback plaintext TCP needs allowInsecureTcp because of the generated token")
    void testSpawnOverPlainTcpNeedsOptIn() {
        DistributedRouterConfig refused = base(ListenAddress.of(TransportAddress.tcp("127.0.0.1", 0)))
                .spawnWorkers(true)
                .build();
        DistributedRouterConfig allowed = refused.toBuilder().allowInsecureTcp(true).build();

        assertThrows(ConfigException.class, refused::validated);
        assertNotNull(allowed.validated().getAuthToken());
    }

    @Test
    @DisplayName("Plaintext TCP on a non-loopback address is refused")
    void testNonLoopbackPlainTcpRefused() {
        DistributedRouterConfig config = base(ListenAddress.of(TransportAddress.tcp("0.0.0.0", 7000))).build();

        assertThrows(ConfigException.class, config::validated);
        config.toBuilder().allowInsecureTcp(true).build().validated();
    }

    @Test
    @DisplayName("Token-less loopback TCP is accepted")
    void testLoopbackPlainTcpAccepted() {
        DistributedRouterConfig config = base(ListenAddress.of(TransportAddress.tcp("127.0.0.1", 0))).build();

        assertEquals(TransportAddress.tcp("127.0.0.1", 0), config.validated().getListenAddress().getAddress());
    }

    // ========== Allowlist Tests ==========

    @Test
    @DisplayName("An allowlist requires a tcp+tls listener")
    void testAllowlistRequiresTls() {
        DistributedRouterConfig config = base(ListenAddress.of(TransportAddress.unix(Path.of("router.sock"))))
                .fingerprintAllowlist(new FingerprintAllowlist(Set.of(FINGERPRINT), Map.of()))
                .build();

        assertThrows(ConfigException.class, config::validated);
    }

    @Test
    @DisplayName("An allowlist requires client certificate verification")
    void testAllowlistRequiresClientAuth() {
        TlsServerSettings noClientAuth = MUTUAL_TLS.toBuilder().requireClientAuth(false).build();
        DistributedRouterConfig config = base(ListenAddress.tls(TransportAddress.tcpTls("127.0.0.1", 0), noClientAuth))
                .fingerprintAllowlist(new FingerprintAllowlist(Set.of(), Map.of(0, Set.of(FINGERPRINT))))
                .build();

        assertThrows(ConfigException.class, config::validated);
    }

    @Test
    @DisplayName("Allowlist fingerprints are normalised")
    void testAllowlistNormalised() {
        String openSslStyle = "SHA256 Fingerprint=" + "AB:".repeat(31) + "AB";
        DistributedRouterConfig config = base(ListenAddress.tls(TransportAddress.tcpTls("127.0.0.1", 0), MUTUAL_TLS))
                .fingerprintAllowlist(new FingerprintAllowlist(Set.of(openSslStyle), Map.of()))
                .build()
                .validated();

        assertEquals(Set.of(FINGERPRINT), config.getFingerprintAllowlist().getGlobal());
    }

    @Test
    @DisplayName("A malformed fingerprint is rejected")
    void testBadFingerprintRejected() {
        DistributedRouterConfig config = base(ListenAddress.tls(TransportAddress.tcpTls("127.0.0.1", 0), MUTUAL_TLS))
                .fingerprintAllowlist(new FingerprintAllowlist(Set.of("not-a-fingerprint"), Map.of()))
                .build();

        assertThrows(ConfigException.class, config::validated);
    }

    // ========== Limits Tests ==========

    @Test
    @DisplayName("Frame limit is clamped to the hard ceiling")
    void testFrameLimitClamped() {
        DistributedRouterConfig config = base(ListenAddress.of(TransportAddress.unix(Path.of("router.sock"))))
                .maxFrameBytes(Integer.MAX_VALUE)
                .build()
                .validated();

        assertEquals(Frames.MAX_FRAME_BYTES, config.getMaxFrameBytes());
    }

    @Test
    @DisplayName("TLS settings are required exactly for tcp+tls")
    void testListenAddressTlsConsistency() {
        assertThrows(ConfigException.class, () -> ListenAddress.of(TransportAddress.tcpTls("127.0.0.1", 0)));
        assertThrows(ConfigException.class,
                () -> ListenAddress.tls(TransportAddress.tcp("127.0.0.1", 0), MUTUAL_TLS));
    }

    @Test
    @DisplayName("Spawning workers requires a worker command")
    void testSpawnNeedsCommand() {
        DistributedRouterConfig config = base(ListenAddress.of(TransportAddress.unix(Path.of("router.sock"))))
                .workerCommand(List.of())
                .spawnWorkers(true)
                .build();

        assertThrows(ConfigException.class, config::validated);
    }
}
