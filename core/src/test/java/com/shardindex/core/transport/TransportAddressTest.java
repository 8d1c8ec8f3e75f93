package com.shardindex.core.transport;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransportAddressTest {

    // ========== Parsing Tests ==========

    @Test
    @DisplayName("Every scheme parses back to its connect string")
    void testConnectArgsRoundTrip() {
        for (String arg : new String[]{
                "unix:/tmp/router.sock", "pipe:\\\\.\\pipe\\shard-index",
                "tcp:127.0.0.1:7000", "tcp+tls:router.example.com:7443", "tcp:[::1]:7000"}) {
            assertEquals(arg, TransportAddress.parse(arg).toConnectArg());
        }
    }

    @Test
    void testParsedParts() {
        TransportAddress tls = TransportAddress.parse("tcp+tls:10.0.0.5:9443");
        TransportAddress unix = TransportAddress.parse("unix:/run/shard.sock");
        TransportAddress v6 = TransportAddress.parse("tcp:[::1]:7000");

        assertEquals(TransportKind.TCP_TLS, tls.getKind());
        assertEquals("10.0.0.5", tls.getLocation());
        assertEquals(9443, tls.getPort());
        assertEquals(Path.of("/run/shard.sock"), unix.path());
        assertEquals("::1", v6.getLocation());
    }

    @Test
    @DisplayName("Malformed addresses are rejected")
    void testInvalidAddresses() {
        assertThrows(IllegalArgumentException.class, () -> TransportAddress.parse("/tmp/no-scheme"));
        assertThrows(IllegalArgumentException.class, () -> TransportAddress.parse("udp:127.0.0.1:7000"));
        assertThrows(IllegalArgumentException.class, () -> TransportAddress.parse("tcp:127.0.0.1"));
        assertThrows(IllegalArgumentException.class, () -> TransportAddress.parse("tcp:127.0.0.1:http"));
        assertThrows(IllegalArgumentException.class, () -> TransportAddress.parse("tcp:127.0.0.1:70000"));
        assertThrows(IllegalArgumentException.class, () -> TransportAddress.parse("unix:"));
    }

    // ========== Helpers Tests ==========

    @Test
    @DisplayName("Bound port replaces an ephemeral request")
    void testWithPort() {
        TransportAddress requested = TransportAddress.tcp("127.0.0.1", 0);

        assertEquals("tcp:127.0.0.1:41234", requested.withPort(41234).toConnectArg());
        assertEquals(TransportAddress.namedPipe("x"), TransportAddress.namedPipe("x").withPort(5));
    }

    @Test
    void testLoopback() {
        assertTrue(TransportAddress.tcp("127.0.0.1", 1).isLoopback());
        assertTrue(TransportAddress.tcp("localhost", 1).isLoopback());
        assertTrue(TransportAddress.tcp("::1", 1).isLoopback());
        assertFalse(TransportAddress.tcp("0.0.0.0", 1).isLoopback());
        assertFalse(TransportAddress.unix(Path.of("/tmp/a.sock")).isLoopback());
    }

    @Test
    @DisplayName("Pipe names map to a socket file in the temp directory")
    void testNamedPipePath() {
        Path fromWindowsName = NamedPipes.socketPath("\\\\.\\pipe\\shard-index");
        Path fromBareName = NamedPipes.socketPath("shard-index");

        assertEquals(fromWindowsName, fromBareName);
        assertEquals("shard-index.pipe", fromBareName.getFileName().toString());
        assertEquals(Path.of(System.getProperty("java.io.tmpdir")), fromBareName.getParent());
        assertEquals("a_b.pipe", NamedPipes.socketPath("a/b").getFileName().toString());
    }
}
