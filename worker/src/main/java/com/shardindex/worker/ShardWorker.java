package com.shardindex.worker;

import com.shardindex.core.cache.ShardCache;
import com.shardindex.core.codec.MessageCodec;
import com.shardindex.core.codec.ProtocolException;
import com.shardindex.core.indexer.JavaSymbolIndexer;
import com.shardindex.core.model.FileText;
import com.shardindex.core.model.ShardIndex;
import com.shardindex.core.model.Symbol;
import com.shardindex.core.model.WorkerStats;
import com.shardindex.core.msg.RpcMessage;
import com.shardindex.core.msg.RpcMessages;
import com.shardindex.core.transport.FrameStream;
import com.shardindex.worker.error.HandshakeFailedException;
import com.shardindex.worker.error.WorkerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serves one shard for the router: holds the shard's files, builds its symbol index on request
 * and persists every build to the shard cache.
 * <p>
 * Requests are handled strictly one at a time, in arrival order.
 * </p>
 */
public class ShardWorker {
    private static final Logger log = LoggerFactory.getLogger(ShardWorker.class);

    private final int shardId;
    private final ShardCache cache;
    private final JavaSymbolIndexer indexer;
    private final ShardIndex cachedIndex;

    private final Map<String, String> files = new TreeMap<>();
    private long revision;
    private long indexGeneration;
    private volatile RpcMessages.RouterHello session;

    public ShardWorker(int shardId, ShardCache cache, JavaSymbolIndexer indexer) {
        this.shardId = shardId;
        this.cache = cache;
        this.indexer = indexer;
        this.cachedIndex = cache.load(shardId).orElse(null);
        this.indexGeneration = cachedIndex == null ? 0 : cachedIndex.getIndexGeneration();
        if (cachedIndex != null) {
            log.info("Loaded cached index for shard {} at revision {} (generation {})",
                shardId, cachedIndex.getRevision(), indexGeneration);
        }
    }

    /**
     * Runs the connection: hello, then requests until the router sends {@code Shutdown}.
     *
     * @param authToken Shared secret for the hello, may be null
     * @return Completes on {@code Shutdown}; errors with {@link HandshakeFailedException} when the
     * router refuses the hello and with {@link WorkerException} when it goes away
     */
    public Mono<Void> run(FrameStream stream, String authToken) {
        AtomicBoolean shutdown = new AtomicBoolean();
        RpcMessages.WorkerHello hello = new RpcMessages.WorkerHello(shardId, authToken, cachedIndex);
        return stream.send(MessageCodec.encode(hello))
            .thenMany(stream.frames())
            .map(MessageCodec::decode)
            .concatMap(message -> {
                if (session == null) {
                    accept(message);
                    return Mono.just(true);
                }
                if (message instanceof RpcMessages.Shutdown) {
                    log.info("Router asked shard {} worker to shut down", shardId);
                    shutdown.set(true);
                    return Mono.just(false);
                }
                return Mono.fromCallable(() -> handle(message))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(reply -> stream.send(MessageCodec.encode(reply)))
                    .thenReturn(true);
            })
            .takeWhile(Boolean::booleanValue)
            .then(Mono.defer(() -> {
                if (shutdown.get()) {
                    return Mono.empty();
                }
                return Mono.error(new WorkerException(session == null
                    ? "router closed the connection during the handshake"
                    : "router closed the connection"));
            }));
    }

    private void accept(RpcMessage message) {
        if (message instanceof RpcMessages.Error) {
            throw new HandshakeFailedException("router rejected the hello: "
                + ((RpcMessages.Error) message).getMessage());
        }
        if (!(message instanceof RpcMessages.RouterHello)) {
            throw new ProtocolException("expected RouterHello, got " + message.getClass().getSimpleName());
        }
        RpcMessages.RouterHello welcome = (RpcMessages.RouterHello) message;
        if (welcome.getShardId() != shardId) {
            throw new HandshakeFailedException("router hello is for shard " + welcome.getShardId()
                + ", expected " + shardId);
        }
        if (welcome.getProtocolVersion() != RpcMessages.PROTOCOL_VERSION) {
            throw new HandshakeFailedException("router speaks protocol version " + welcome.getProtocolVersion()
                + ", expected " + RpcMessages.PROTOCOL_VERSION);
        }
        session = welcome;
        MDC.put("workerId", String.valueOf(welcome.getWorkerId()));
        log.info("Connected as worker {} for shard {} (router revision {})",
            welcome.getWorkerId(), shardId, welcome.getRevision());
    }

    /**
     * Answers one request.
     */
    public RpcMessage handle(RpcMessage message) {
        if (message instanceof RpcMessages.IndexShard) {
            RpcMessages.IndexShard request = (RpcMessages.IndexShard) message;
            revision = request.getRevision();
            replaceFiles(request.getFiles());
            return new RpcMessages.ShardIndexResult(build());
        }
        if (message instanceof RpcMessages.LoadFiles) {
            RpcMessages.LoadFiles request = (RpcMessages.LoadFiles) message;
            revision = request.getRevision();
            replaceFiles(request.getFiles());
            log.debug("Loaded {} files for shard {} at revision {}", files.size(), shardId, revision);
            return new RpcMessages.Ack();
        }
        if (message instanceof RpcMessages.UpdateFile) {
            RpcMessages.UpdateFile request = (RpcMessages.UpdateFile) message;
            revision = request.getRevision();
            files.put(request.getFile().getPath(), request.getFile().getText());
            return new RpcMessages.ShardIndexResult(build());
        }
        if (message instanceof RpcMessages.GetWorkerStats) {
            return new RpcMessages.WorkerStatsResult(stats());
        }
        log.warn("Shard {} worker got unexpected {}", shardId, message.getClass().getSimpleName());
        return new RpcMessages.Error("unexpected message: " + message.getClass().getSimpleName());
    }

    public WorkerStats stats() {
        return WorkerStats.builder()
            .shardId(shardId)
            .revision(revision)
            .indexGeneration(indexGeneration)
            .fileCount(files.size())
            .build();
    }

    public Optional<RpcMessages.RouterHello> session() {
        return Optional.ofNullable(session);
    }

    private void replaceFiles(List<FileText> replacement) {
        files.clear();
        for (FileText file : replacement) {
            files.put(file.getPath(), file.getText());
        }
    }

    private ShardIndex build() {
        long start = System.nanoTime();
        indexGeneration++;
        List<FileText> texts = new ArrayList<>(files.size());
        files.forEach((path, text) -> texts.add(new FileText(path, text)));
        List<Symbol> symbols = new ArrayList<>(new TreeSet<>(indexer.indexFiles(texts)));
        ShardIndex index = new ShardIndex(shardId, revision, indexGeneration, symbols);
        try {
            cache.save(index);
        } catch (IOException e) {
            log.warn("Could not save shard {} cache: {}", shardId, e.toString());
        }
        log.info("Indexed shard {} at revision {}: {} files, {} symbols in {} ms",
            shardId, revision, files.size(), symbols.size(), (System.nanoTime() - start) / 1_000_000);
        return index;
    }
}
