package com.shardindex.core.transport;

/**
 * Connection kinds between router and workers, with the scheme used in connect strings.
 */
public enum TransportKind {
    UNIX("unix"),
    NAMED_PIPE("pipe"),
    TCP("tcp"),
    TCP_TLS("tcp+tls");

    private final String scheme;

    TransportKind(String scheme) {
        this.scheme = scheme;
    }

    public String scheme() {
        return scheme;
    }

    public boolean isTcp() {
        return this == TCP || this == TCP_TLS;
    }

    public static TransportKind fromScheme(String scheme) {
        for (TransportKind kind : values()) {
            if (kind.scheme.equals(scheme)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown transport scheme: " + scheme);
    }
}
