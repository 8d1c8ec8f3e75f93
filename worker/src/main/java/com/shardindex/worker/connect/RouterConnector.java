package com.shardindex.worker.connect;

import com.shardindex.core.transport.ChannelFrameStream;
import com.shardindex.core.transport.FrameStream;
import com.shardindex.core.transport.NamedPipes;
import com.shardindex.core.transport.NettyFrameStream;
import com.shardindex.core.transport.TransportAddress;
import com.shardindex.core.transport.TransportKind;
import com.shardindex.worker.config.TlsClientSettings;
import com.shardindex.worker.config.WorkerConfig;
import com.shardindex.worker.error.WorkerException;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.tcp.TcpClient;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.util.List;

/**
 * Opens the worker's connection to the router.
 * <p>
 * TCP and TLS go through Reactor Netty; domain sockets and named pipes use a blocking JDK channel.
 * </p>
 */
public final class RouterConnector {
    private static final Logger log = LoggerFactory.getLogger(RouterConnector.class);

    private RouterConnector() {
    }

    public static Mono<FrameStream> connect(WorkerConfig config) {
        TransportAddress address = config.getConnect();
        Mono<FrameStream> stream = address.getKind().isTcp()
            ? connectTcp(config)
            : connectLocal(address, config.getMaxFrameBytes());
        return stream
            .doOnNext(s -> log.info("Connected to router at {}", address.toConnectArg()))
            .onErrorMap(e -> !(e instanceof WorkerException),
                e -> new WorkerException("failed to connect to " + address.toConnectArg() + ": " + e.getMessage(), e));
    }

    private static Mono<FrameStream> connectTcp(WorkerConfig config) {
        TransportAddress address = config.getConnect();
        if (address.getKind() == TransportKind.TCP) {
            log.warn("Connecting to {} over plaintext TCP; traffic is not encrypted", address.toConnectArg());
        }
        TcpClient client = TcpClient.create()
            .host(address.getLocation())
            .port(address.getPort());
        if (address.getKind() == TransportKind.TCP_TLS) {
            TlsClientSettings tls = config.getTls();
            SslContext sslContext = sslContext(tls);
            client = client.secure(spec -> spec.sslContext(sslContext)
                .handlerConfigurator(handler -> verifyServerName(handler.engine(), tls.getServerName())));
        }
        return client.connect()
            .flatMap(connection -> NettyFrameStream.open(connection, config.getMaxFrameBytes()));
    }

    static SslContext sslContext(TlsClientSettings tls) {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient()
                .trustManager(tls.getTrustedCa().toFile());
            if (tls.hasClientCertificate()) {
                builder.keyManager(tls.getCertificateChain().toFile(), tls.getPrivateKey().toFile());
            }
            return builder.build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new WorkerException("invalid TLS client settings: " + e.getMessage(), e);
        }
    }

    private static void verifyServerName(SSLEngine engine, String serverName) {
        SSLParameters parameters = engine.getSSLParameters();
        parameters.setEndpointIdentificationAlgorithm("HTTPS");
        parameters.setServerNames(List.of(new SNIHostName(serverName)));
        engine.setSSLParameters(parameters);
    }

    private static Mono<FrameStream> connectLocal(TransportAddress address, int maxFrameBytes) {
        return Mono.fromCallable(() -> {
                Path path = NamedPipes.localPath(address);
                SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
                try {
                    channel.connect(UnixDomainSocketAddress.of(path));
                } catch (IOException e) {
                    channel.close();
                    throw e;
                }
                return (FrameStream) new ChannelFrameStream(channel, maxFrameBytes);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }
}
