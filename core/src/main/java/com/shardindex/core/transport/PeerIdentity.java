package com.shardindex.core.transport;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;
import java.util.Optional;

/**
 * Who is on the other end of a connection, as far as the transport can tell.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PeerIdentity {
    private static final PeerIdentity UNAUTHENTICATED = new PeerIdentity(null);

    /**
     * Lower-case hex SHA-256 of the verified client certificate, null when unauthenticated.
     */
    String certificateFingerprint;

    public static PeerIdentity unauthenticated() {
        return UNAUTHENTICATED;
    }

    public static PeerIdentity certificate(String sha256Hex) {
        return new PeerIdentity(sha256Hex.toLowerCase(Locale.ROOT));
    }

    public Optional<String> fingerprint() {
        return Optional.ofNullable(certificateFingerprint);
    }

    public boolean isAuthenticated() {
        return certificateFingerprint != null;
    }
}
