package com.shardindex.worker.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * TLS material for a {@code tcp+tls} router connection.
 */
@Value
@Builder(toBuilder = true)
public class TlsClientSettings {
    /**
     * PEM bundle the router's certificate must chain to.
     */
    Path trustedCa;

    /**
     * PEM client certificate chain presented to the router, optional.
     */
    Path certificateChain;

    Path privateKey;

    /**
     * Name the router certificate is verified against and sent as SNI.
     */
    @Builder.Default
    String serverName = "localhost";

    public boolean hasClientCertificate() {
        return certificateChain != null;
    }
}
