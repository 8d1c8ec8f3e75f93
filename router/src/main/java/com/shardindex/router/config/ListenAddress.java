package com.shardindex.router.config;

import com.shardindex.core.transport.TransportAddress;
import com.shardindex.core.transport.TransportKind;
import com.shardindex.router.error.ConfigException;
import lombok.Value;

/**
 * Where the router accepts worker connections.
 */
@Value
public class ListenAddress {
    TransportAddress address;

    /**
     * Present exactly when {@link #address} is {@code tcp+tls}.
     */
    TlsServerSettings tls;

    public ListenAddress(TransportAddress address, TlsServerSettings tls) {
        if (address.getKind() == TransportKind.TCP_TLS && tls == null) {
            throw new ConfigException("tcp+tls listen address " + address + " needs TLS server settings");
        }
        if (address.getKind() != TransportKind.TCP_TLS && tls != null) {
            throw new ConfigException("TLS settings given for non-TLS listen address " + address);
        }
        this.address = address;
        this.tls = tls;
    }

    public static ListenAddress of(TransportAddress address) {
        return new ListenAddress(address, null);
    }

    public static ListenAddress tls(TransportAddress address, TlsServerSettings tls) {
        return new ListenAddress(address, tls);
    }

    public TransportKind kind() {
        return address.getKind();
    }

    public ListenAddress withBoundPort(int port) {
        return new ListenAddress(address.withPort(port), tls);
    }

    @Override
    public String toString() {
        return address.toConnectArg();
    }
}
