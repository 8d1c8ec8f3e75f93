package com.shardindex.core.transport;

import lombok.Value;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;

/**
 * Where a router listens and a worker connects.
 * <p>
 * Connect-string forms: {@code unix:<path>}, {@code pipe:<name>}, {@code tcp:<host:port>} and
 * {@code tcp+tls:<host:port>}. IPv6 hosts are written in brackets ({@code tcp:[::1]:7000}).
 * </p>
 */
@Value
public class TransportAddress {
    TransportKind kind;

    /**
     * Socket path, pipe name or host, depending on {@link #kind}.
     */
    String location;

    /**
     * TCP port; -1 for local transports.
     */
    int port;

    public static TransportAddress unix(Path path) {
        return new TransportAddress(TransportKind.UNIX, path.toString(), -1);
    }

    public static TransportAddress namedPipe(String name) {
        return new TransportAddress(TransportKind.NAMED_PIPE, name, -1);
    }

    public static TransportAddress tcp(String host, int port) {
        return new TransportAddress(TransportKind.TCP, host, checkPort(port));
    }

    public static TransportAddress tcpTls(String host, int port) {
        return new TransportAddress(TransportKind.TCP_TLS, host, checkPort(port));
    }

    /**
     * Parses a connect string.
     *
     * @param value Address such as {@code tcp:127.0.0.1:7000}
     * @return Parsed address
     * @throws IllegalArgumentException on an unknown scheme, a missing separator or a bad port
     */
    public static TransportAddress parse(String value) {
        int colon = value.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("transport address needs a scheme prefix: " + value);
        }
        TransportKind kind = TransportKind.fromScheme(value.substring(0, colon));
        String rest = value.substring(colon + 1);
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("empty transport location: " + value);
        }
        switch (kind) {
            case UNIX:
                return unix(Path.of(rest));
            case NAMED_PIPE:
                return namedPipe(rest);
            default:
                int sep = rest.lastIndexOf(':');
                if (sep <= 0 || sep == rest.length() - 1) {
                    throw new IllegalArgumentException("expected host:port in " + value);
                }
                String host = rest.substring(0, sep);
                if (host.startsWith("[") && host.endsWith("]")) {
                    host = host.substring(1, host.length() - 1);
                }
                int port;
                try {
                    port = Integer.parseInt(rest.substring(sep + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("bad port in " + value, e);
                }
                return kind == TransportKind.TCP ? tcp(host, port) : tcpTls(host, port);
        }
    }

    public String toConnectArg() {
        if (!kind.isTcp()) {
            return kind.scheme() + ":" + location;
        }
        String host = location.indexOf(':') >= 0 ? "[" + location + "]" : location;
        return kind.scheme() + ":" + host + ":" + port;
    }

    public Path path() {
        if (kind != TransportKind.UNIX) {
            throw new IllegalStateException("not a domain socket address: " + toConnectArg());
        }
        return Path.of(location);
    }

    public InetSocketAddress socketAddress() {
        if (!kind.isTcp()) {
            throw new IllegalStateException("not a TCP address: " + toConnectArg());
        }
        return InetSocketAddress.createUnresolved(location, port);
    }

    /**
     * Returns true when the host is a loopback name or address. Unresolvable hosts are not loopback.
     */
    public boolean isLoopback() {
        if (!kind.isTcp()) {
            return false;
        }
        if ("localhost".equalsIgnoreCase(location)) {
            return true;
        }
        try {
            return InetAddress.getByName(location).isLoopbackAddress();
        } catch (UnknownHostException e) {
            return false;
        }
    }

    /**
     * Same address with another port (the port actually bound when 0 was requested).
     */
    public TransportAddress withPort(int boundPort) {
        if (!kind.isTcp()) {
            return this;
        }
        return new TransportAddress(kind, location, checkPort(boundPort));
    }

    @Override
    public String toString() {
        return toConnectArg();
    }

    private static int checkPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        return port;
    }
}
