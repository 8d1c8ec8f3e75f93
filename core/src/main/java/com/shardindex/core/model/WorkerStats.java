package com.shardindex.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time state reported by a worker.
 */
@Value
@Builder(toBuilder = true)
public class WorkerStats {
    @JsonProperty("shardId")
    int shardId;

    @JsonProperty("revision")
    long revision;

    @JsonProperty("indexGeneration")
    long indexGeneration;

    @JsonProperty("fileCount")
    int fileCount;

    @JsonCreator
    public WorkerStats(
            @JsonProperty("shardId") int shardId,
            @JsonProperty("revision") long revision,
            @JsonProperty("indexGeneration") long indexGeneration,
            @JsonProperty("fileCount") int fileCount
    ) {
        this.shardId = shardId;
        this.revision = revision;
        this.indexGeneration = indexGeneration;
        this.fileCount = fileCount;
    }
}
