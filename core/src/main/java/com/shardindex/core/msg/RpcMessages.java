package com.shardindex.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shardindex.core.model.FileText;
import com.shardindex.core.model.ShardIndex;
import com.shardindex.core.model.WorkerStats;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * Messages exchanged between the router and shard workers.
 * <p>
 * Handshake: the worker opens the connection with {@link WorkerHello}; the router answers with
 * {@link RouterHello} or {@link Error} and closes.
 * </p>
 * <p>
 * After the handshake the router sends one request at a time and the worker answers each with
 * exactly one message; {@link Shutdown} is never answered.
 * </p>
 */
public final class RpcMessages {
    private RpcMessages() {
    }

    public static final int PROTOCOL_VERSION = 1;

    /**
     * First frame on every worker connection.
     */
    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class WorkerHello implements RpcMessage {
        @JsonProperty("shardId")
        int shardId;

        /**
         * Shared secret, when the router requires one.
         */
        @ToString.Exclude
        @JsonProperty("authToken")
        String authToken;

        /**
         * Index persisted by a previous run of this worker, if any.
         */
        @JsonProperty("cachedIndex")
        ShardIndex cachedIndex;

        @JsonCreator
        public WorkerHello(
                @JsonProperty("shardId") int shardId,
                @JsonProperty("authToken") String authToken,
                @JsonProperty("cachedIndex") ShardIndex cachedIndex
        ) {
            this.shardId = shardId;
            this.authToken = authToken;
            this.cachedIndex = cachedIndex;
        }
    }

    /**
     * Router's acceptance of a worker.
     */
    @Value
    public static class RouterHello implements RpcMessage {
        @JsonProperty("workerId")
        int workerId;

        @JsonProperty("shardId")
        int shardId;

        @JsonProperty("revision")
        long revision;

        @JsonProperty("protocolVersion")
        int protocolVersion;

        @JsonCreator
        public RouterHello(
                @JsonProperty("workerId") int workerId,
                @JsonProperty("shardId") int shardId,
                @JsonProperty("revision") long revision,
                @JsonProperty("protocolVersion") int protocolVersion
        ) {
            this.workerId = workerId;
            this.shardId = shardId;
            this.revision = revision;
            this.protocolVersion = protocolVersion;
        }
    }

    /**
     * Replace the worker's file set and index it. Answered with {@link ShardIndexResult}.
     */
    @Value
    public static class IndexShard implements RpcMessage {
        @JsonProperty("revision")
        long revision;

        @ToString.Exclude
        @JsonProperty("files")
        List<FileText> files;

        @JsonCreator
        public IndexShard(
                @JsonProperty("revision") long revision,
                @JsonProperty("files") List<FileText> files
        ) {
            this.revision = revision;
            this.files = files == null ? List.of() : List.copyOf(files);
        }
    }

    /**
     * Insert or replace one file and re-index. Answered with {@link ShardIndexResult}.
     */
    @Value
    public static class UpdateFile implements RpcMessage {
        @JsonProperty("revision")
        long revision;

        @JsonProperty("file")
        FileText file;

        @JsonCreator
        public UpdateFile(
                @JsonProperty("revision") long revision,
                @JsonProperty("file") FileText file
        ) {
            this.revision = revision;
            this.file = file;
        }
    }

    /**
     * Replace the worker's file set without indexing. Answered with {@link Ack}.
     */
    @Value
    public static class LoadFiles implements RpcMessage {
        @JsonProperty("revision")
        long revision;

        @ToString.Exclude
        @JsonProperty("files")
        List<FileText> files;

        @JsonCreator
        public LoadFiles(
                @JsonProperty("revision") long revision,
                @JsonProperty("files") List<FileText> files
        ) {
            this.revision = revision;
            this.files = files == null ? List.of() : List.copyOf(files);
        }
    }

    @Value
    public static class ShardIndexResult implements RpcMessage {
        @JsonProperty("index")
        ShardIndex index;

        @JsonCreator
        public ShardIndexResult(@JsonProperty("index") ShardIndex index) {
            this.index = index;
        }
    }

    @Value
    public static class GetWorkerStats implements RpcMessage {
    }

    @Value
    public static class WorkerStatsResult implements RpcMessage {
        @JsonProperty("stats")
        WorkerStats stats;

        @JsonCreator
        public WorkerStatsResult(@JsonProperty("stats") WorkerStats stats) {
            this.stats = stats;
        }
    }

    /**
     * Asks the worker to exit. Never answered.
     */
    @Value
    public static class Shutdown implements RpcMessage {
    }

    @Value
    public static class Ack implements RpcMessage {
    }

    /**
     * Failure reply: a rejected handshake on the router side, an unsupported request on the
     * worker side.
     */
    @Value
    public static class Error implements RpcMessage {
        @JsonProperty("message")
        String message;

        @JsonCreator
        public Error(@JsonProperty("message") String message) {
            this.message = message;
        }
    }
}
