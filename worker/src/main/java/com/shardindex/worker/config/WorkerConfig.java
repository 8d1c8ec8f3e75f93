package com.shardindex.worker.config;

import com.shardindex.core.codec.Frames;
import com.shardindex.core.transport.TransportAddress;
import com.shardindex.core.transport.TransportKind;
import com.shardindex.worker.error.WorkerException;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.nio.file.Path;

/**
 * Settings of one worker process.
 */
@Value
@Builder(toBuilder = true)
public class WorkerConfig {
    TransportAddress connect;

    int shardId;

    Path cacheDir;

    @ToString.Exclude
    String authToken;

    /**
     * Send the auth token over plaintext TCP anyway.
     */
    boolean allowInsecure;

    @Builder.Default
    int maxFrameBytes = Frames.DEFAULT_MAX_FRAME_BYTES;

    /**
     * Required for {@code tcp+tls}, rejected for every other transport.
     */
    TlsClientSettings tls;

    /**
     * @return Config the worker runs with, frame limit clamped
     * @throws WorkerException if the combination is unsafe or inconsistent
     */
    public WorkerConfig validated() {
        if (connect == null) {
            throw new WorkerException("a router address is required");
        }
        if (shardId < 0) {
            throw new WorkerException("shard id must not be negative: " + shardId);
        }
        if (cacheDir == null) {
            throw new WorkerException("a cache directory is required");
        }
        TransportKind kind = connect.getKind();
        if (kind == TransportKind.TCP_TLS) {
            if (tls == null || tls.getTrustedCa() == null) {
                throw new WorkerException("tcp+tls needs a trusted CA (--tls-ca)");
            }
            if ((tls.getCertificateChain() == null) != (tls.getPrivateKey() == null)) {
                throw new WorkerException("--tls-cert and --tls-key must be given together");
            }
        } else if (tls != null) {
            throw new WorkerException("TLS options given for non-TLS router address " + connect.toConnectArg());
        }
        if (kind == TransportKind.TCP && authToken != null && !allowInsecure) {
            throw new WorkerException("refusing to send the auth token over plaintext TCP to "
                    + connect.toConnectArg() + ". Use tcp+tls or pass --allow-insecure");
        }
        return toBuilder()
                .maxFrameBytes(Frames.clampMaxFrameBytes(maxFrameBytes))
                .build();
    }
}
