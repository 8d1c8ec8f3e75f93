package com.shardindex.core.transport;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CertificateFingerprintsTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void testSha256Hex() {
        assertEquals(ABC_SHA256, CertificateFingerprints.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    @DisplayName("OpenSSL output, colons and case normalise to plain lower-case hex")
    void testNormalize() {
        StringBuilder colons = new StringBuilder("SHA256 Fingerprint=");
        for (int i = 0; i < ABC_SHA256.length(); i += 2) {
            if (i > 0) {
                colons.append(':');
            }
            colons.append(ABC_SHA256.substring(i, i + 2).toUpperCase());
        }

        assertEquals(ABC_SHA256, CertificateFingerprints.normalize(colons.toString()));
        assertEquals(ABC_SHA256, CertificateFingerprints.normalize("  " + ABC_SHA256.toUpperCase() + "\n"));
        assertEquals(ABC_SHA256, CertificateFingerprints.normalize("sha256 fingerprint=" + ABC_SHA256));
    }

    @Test
    @DisplayName("Wrong length or non-hex characters are rejected")
    void testNormalizeRejects() {
        assertThrows(IllegalArgumentException.class, () -> CertificateFingerprints.normalize("abcd"));
        assertThrows(IllegalArgumentException.class,
                () -> CertificateFingerprints.normalize(ABC_SHA256.substring(1) + "g"));
        assertThrows(IllegalArgumentException.class,
                () -> CertificateFingerprints.normalize(ABC_SHA256 + "00"));
    }

    @Test
    void testPeerIdentity() {
        PeerIdentity cert = PeerIdentity.certificate(ABC_SHA256.toUpperCase());

        assertTrue(cert.isAuthenticated());
        assertEquals(ABC_SHA256, cert.fingerprint().orElseThrow());
        assertFalse(PeerIdentity.unauthenticated().fingerprint().isPresent());
    }
}
