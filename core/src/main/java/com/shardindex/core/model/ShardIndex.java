package com.shardindex.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Output of indexing one shard at a given revision.
 */
@Value
@Builder(toBuilder = true)
@With
public class ShardIndex {
    @JsonProperty("shardId")
    int shardId;

    /**
     * Global revision the index was produced for.
     */
    @JsonProperty("revision")
    long revision;

    /**
     * Build counter of the producer. Currently tracks the revision in-process and counts builds
     * in workers; only used together with the revision to order two indexes of the same shard.
     */
    @JsonProperty("indexGeneration")
    long indexGeneration;

    @ToString.Exclude
    @JsonProperty("symbols")
    List<Symbol> symbols;

    @JsonCreator
    public ShardIndex(
            @JsonProperty("shardId") int shardId,
            @JsonProperty("revision") long revision,
            @JsonProperty("indexGeneration") long indexGeneration,
            @JsonProperty("symbols") List<Symbol> symbols
    ) {
        this.shardId = shardId;
        this.revision = revision;
        this.indexGeneration = indexGeneration;
        this.symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }

    /**
     * Returns true when this index must not replace {@code current}: it was produced for an older
     * {@code (revision, indexGeneration)}.
     *
     * @param current Index currently installed for the shard, may be null
     * @return true if this index is stale
     */
    @JsonIgnore
    public boolean isOlderThan(ShardIndex current) {
        if (current == null) {
            return false;
        }
        if (revision != current.revision) {
            return revision < current.revision;
        }
        return indexGeneration < current.indexGeneration;
    }

    @ToString.Include(name = "symbolCount")
    private int symbolCount() {
        return symbols.size();
    }
}
