package com.shardindex.core.msg;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Marker for every message exchanged between the router and a worker.
 * <p>
 * Encoded as a JSON object whose {@code type} property names the concrete message.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RpcMessages.WorkerHello.class, name = "worker_hello"),
        @JsonSubTypes.Type(value = RpcMessages.RouterHello.class, name = "router_hello"),
        @JsonSubTypes.Type(value = RpcMessages.IndexShard.class, name = "index_shard"),
        @JsonSubTypes.Type(value = RpcMessages.UpdateFile.class, name = "update_file"),
        @JsonSubTypes.Type(value = RpcMessages.LoadFiles.class, name = "load_files"),
        @JsonSubTypes.Type(value = RpcMessages.ShardIndexResult.class, name = "shard_index"),
        @JsonSubTypes.Type(value = RpcMessages.GetWorkerStats.class, name = "get_worker_stats"),
        @JsonSubTypes.Type(value = RpcMessages.WorkerStatsResult.class, name = "worker_stats"),
        @JsonSubTypes.Type(value = RpcMessages.Shutdown.class, name = "shutdown"),
        @JsonSubTypes.Type(value = RpcMessages.Ack.class, name = "ack"),
        @JsonSubTypes.Type(value = RpcMessages.Error.class, name = "error")
})
public interface RpcMessage {
}
