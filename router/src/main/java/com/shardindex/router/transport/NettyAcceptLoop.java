package com.shardindex.router.transport;

import com.shardindex.core.transport.FrameStream;
import com.shardindex.core.transport.NettyFrameStream;
import com.shardindex.core.transport.TransportAddress;
import com.shardindex.core.transport.TransportKind;
import com.shardindex.router.config.ListenAddress;
import com.shardindex.router.config.TlsServerSettings;
import com.shardindex.router.error.ConfigException;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.Connection;
import reactor.netty.DisposableServer;
import reactor.netty.tcp.TcpServer;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Reactor Netty accept loop for TCP, TCP+TLS and native domain sockets.
 */
public class NettyAcceptLoop implements AcceptLoop {
    private static final Logger log = LoggerFactory.getLogger(NettyAcceptLoop.class);

    private final ListenAddress listen;
    private final int maxFrameBytes;
    private final Function<FrameStream, Mono<Void>> handler;
    private final Sinks.Empty<Void> terminated = Sinks.empty();
    private final AtomicReference<DisposableServer> server = new AtomicReference<>();

    public NettyAcceptLoop(ListenAddress listen, int maxFrameBytes, Function<FrameStream, Mono<Void>> handler) {
        this.listen = listen;
        this.maxFrameBytes = maxFrameBytes;
        this.handler = handler;
    }

    @Override
    public Mono<TransportAddress> start() {
        return Mono.defer(() -> {
                TcpServer tcp = configure(TcpServer.create())
                    .handle((inbound, outbound) -> {
                        AtomicReference<Connection> connection = new AtomicReference<>();
                        inbound.withConnection(connection::set);
                        return NettyFrameStream.open(connection.get(), maxFrameBytes)
                            .flatMap(handler)
                            .onErrorResume(e -> {
                                log.warn("Failed to set up worker connection: {}", e.toString());
                                return Mono.empty();
                            });
                    });
                return tcp.bind();
            })
            .map(bound -> {
                server.set(bound);
                bound.onDispose().subscribe(null, e -> terminated.tryEmitEmpty(), terminated::tryEmitEmpty);
                return boundAddress(bound);
            })
            .doOnNext(address -> log.info("Accepting workers on {}", address))
            .doOnError(e -> log.error("Failed to listen on {}", listen, e));
    }

    private TcpServer configure(TcpServer tcp) {
        TransportAddress address = listen.getAddress();
        if (address.getKind() == TransportKind.UNIX) {
            Path path = address.path();
            deleteSocketFile(path);
            return tcp.bindAddress(() -> new DomainSocketAddress(path.toString()));
        }
        TcpServer bound = tcp.host(address.getLocation()).port(address.getPort());
        if (address.getKind() == TransportKind.TCP_TLS) {
            SslContext sslContext = sslContext(listen.getTls());
            bound = bound.secure(spec -> spec.sslContext(sslContext));
        }
        return bound;
    }

    static SslContext sslContext(TlsServerSettings tls) {
        try {
            SslContextBuilder builder = SslContextBuilder.forServer(
                tls.getCertificateChain().toFile(), tls.getPrivateKey().toFile());
            if (tls.getClientCa() != null) {
                builder.trustManager(tls.getClientCa().toFile())
                    .clientAuth(tls.isRequireClientAuth() ? ClientAuth.REQUIRE : ClientAuth.OPTIONAL);
            }
            return builder.build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new ConfigException("invalid TLS server settings: " + e.getMessage(), e);
        }
    }

    private TransportAddress boundAddress(DisposableServer bound) {
        TransportAddress address = listen.getAddress();
        if (address.getKind().isTcp()) {
            return address.withPort(((InetSocketAddress) bound.address()).getPort());
        }
        return address;
    }

    @Override
    public void stop() {
        DisposableServer bound = server.getAndSet(null);
        if (bound == null) {
            terminated.tryEmitEmpty();
            return;
        }
        bound.dispose();
        if (listen.kind() == TransportKind.UNIX) {
            deleteSocketFile(listen.getAddress().path());
        }
        log.info("Stopped accepting workers on {}", listen);
    }

    @Override
    public Mono<Void> terminated() {
        return terminated.asMono();
    }

    private static void deleteSocketFile(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove socket file {}: {}", path, e.toString());
        }
    }
}
