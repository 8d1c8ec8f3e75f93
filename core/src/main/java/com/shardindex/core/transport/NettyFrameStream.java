package com.shardindex.core.transport;

import com.shardindex.core.codec.Frames;
import com.shardindex.core.codec.LengthPrefixedFrameDecoder;
import io.netty.buffer.ByteBufUtil;
import io.netty.handler.ssl.SslHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;

import javax.net.ssl.SSLPeerUnverifiedException;
import java.security.cert.Certificate;

/**
 * {@link FrameStream} over a Reactor Netty connection (TCP, TLS or native domain socket).
 */
public class NettyFrameStream implements FrameStream {
    private static final Logger log = LoggerFactory.getLogger(NettyFrameStream.class);

    public static final String FRAME_DECODER = "frameDecoder";

    private final Connection connection;
    private final PeerIdentity identity;

    private NettyFrameStream(Connection connection, PeerIdentity identity) {
        this.connection = connection;
        this.identity = identity;
    }

    /**
     * Installs the frame decoder on {@code connection} and resolves the peer identity once any TLS
     * handshake has completed.
     *
     * @param connection    Freshly established connection
     * @param maxFrameBytes Largest inbound payload
     * @return Frame stream; errors if the TLS handshake fails
     */
    public static Mono<FrameStream> open(Connection connection, int maxFrameBytes) {
        if (connection.channel().pipeline().get(FRAME_DECODER) == null) {
            connection.addHandlerLast(FRAME_DECODER, new LengthPrefixedFrameDecoder(maxFrameBytes));
        }
        SslHandler ssl = connection.channel().pipeline().get(SslHandler.class);
        if (ssl == null) {
            return Mono.just(new NettyFrameStream(connection, PeerIdentity.unauthenticated()));
        }
        return Mono.<PeerIdentity>create(sink -> ssl.handshakeFuture().addListener(future -> {
                    if (!future.isSuccess()) {
                        sink.error(future.cause());
                        return;
                    }
                    sink.success(peerIdentity(ssl));
                }))
                .map(id -> new NettyFrameStream(connection, id));
    }

    private static PeerIdentity peerIdentity(SslHandler ssl) {
        try {
            Certificate[] chain = ssl.engine().getSession().getPeerCertificates();
            if (chain.length == 0) {
                return PeerIdentity.unauthenticated();
            }
            return PeerIdentity.certificate(CertificateFingerprints.sha256Hex(chain[0]));
        } catch (SSLPeerUnverifiedException e) {
            log.debug("TLS peer presented no certificate");
            return PeerIdentity.unauthenticated();
        }
    }

    @Override
    public Flux<byte[]> frames() {
        return connection.inbound().receive().map(ByteBufUtil::getBytes);
    }

    @Override
    public Mono<Void> send(byte[] payload) {
        return connection.outbound()
                .send(Mono.fromSupplier(() -> Frames.frame(connection.outbound().alloc(), payload)))
                .then();
    }

    @Override
    public PeerIdentity identity() {
        return identity;
    }

    @Override
    public void close() {
        connection.dispose();
    }

    @Override
    public Mono<Void> onClose() {
        return connection.onDispose();
    }

    @Override
    public String toString() {
        return "NettyFrameStream{" + connection.channel().remoteAddress() + "}";
    }
}
