package com.shardindex.router.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * PEM files for the {@code tcp+tls} listener.
 */
@Value
@Builder(toBuilder = true)
public class TlsServerSettings {
    Path certificateChain;
    Path privateKey;

    /**
     * CA used to verify worker client certificates; null disables client verification.
     */
    Path clientCa;

    boolean requireClientAuth;

    public boolean verifiesClients() {
        return clientCa != null && requireClientAuth;
    }
}
