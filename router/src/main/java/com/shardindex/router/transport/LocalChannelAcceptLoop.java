package com.shardindex.router.transport;

import com.shardindex.core.transport.ChannelFrameStream;
import com.shardindex.core.transport.FrameStream;
import com.shardindex.core.transport.NamedPipes;
import com.shardindex.core.transport.TransportAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Accept loop over a JDK domain-socket {@link ServerSocketChannel}.
 * <p>
 * Serves named pipes, mapped onto a socket file by {@link NamedPipes}, and domain sockets when
 * the native Netty transport is missing. Accepting blocks a dedicated thread; each connection is
 * then served as a {@link ChannelFrameStream}.
 * </p>
 */
public class LocalChannelAcceptLoop implements AcceptLoop {
    private static final Logger log = LoggerFactory.getLogger(LocalChannelAcceptLoop.class);

    private final TransportAddress address;
    private final Path socketPath;
    private final int maxFrameBytes;
    private final Function<FrameStream, Mono<Void>> handler;
    private final Sinks.Empty<Void> terminated = Sinks.empty();

    private volatile ServerSocketChannel server;
    private volatile boolean stopped;
    private Scheduler acceptor;

    public LocalChannelAcceptLoop(TransportAddress address, int maxFrameBytes, Function<FrameStream, Mono<Void>> handler) {
        this.address = address;
        this.socketPath = NamedPipes.localPath(address);
        this.maxFrameBytes = maxFrameBytes;
        this.handler = handler;
    }

    @Override
    public Mono<TransportAddress> start() {
        return Mono.fromCallable(() -> {
                Files.deleteIfExists(socketPath);
                ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
                channel.bind(UnixDomainSocketAddress.of(socketPath));
                server = channel;
                acceptor = Schedulers.newSingle("accept-" + address.getKind().scheme(), true);
                acceptor.schedule(this::acceptLoop);
                return address;
            })
            .doOnNext(bound -> log.info("Accepting workers on {} ({})", bound, socketPath))
            .doOnError(e -> log.error("Failed to listen on {}", address, e));
    }

    private void acceptLoop() {
        try {
            while (!stopped) {
                SocketChannel channel = server.accept();
                FrameStream stream = new ChannelFrameStream(channel, maxFrameBytes);
                handler.apply(stream).subscribe(
                    null,
                    e -> log.warn("Worker connection on {} failed: {}", address, e.toString()));
            }
        } catch (ClosedChannelException e) {
            log.debug("Listener on {} closed", address);
        } catch (IOException e) {
            if (!stopped) {
                log.error("Accept loop on {} failed", address, e);
            }
        } finally {
            terminated.tryEmitEmpty();
        }
    }

    @Override
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        ServerSocketChannel channel = server;
        if (channel == null) {
            terminated.tryEmitEmpty();
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Error closing listener on {}: {}", address, e.toString());
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("Could not remove socket file {}: {}", socketPath, e.toString());
        }
        if (acceptor != null) {
            acceptor.dispose();
        }
        log.info("Stopped accepting workers on {}", address);
    }

    @Override
    public Mono<Void> terminated() {
        return terminated.asMono();
    }
}
