package com.shardindex.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Comparator;
import java.util.Objects;

/**
 * A named declaration found in a source file.
 * <p>
 * Ordered by {@code (name, path)}; equal when both match. Neither may be null.
 * </p>
 */
@Value
public class Symbol implements Comparable<Symbol> {
    private static final Comparator<Symbol> ORDER = Comparator
            .comparing(Symbol::getName)
            .thenComparing(Symbol::getPath);

    @JsonProperty("name")
    String name;

    @JsonProperty("path")
    String path;

    @JsonCreator
    public Symbol(
            @JsonProperty("name") String name,
            @JsonProperty("path") String path
    ) {
        this.name = Objects.requireNonNull(name, "symbol name");
        this.path = Objects.requireNonNull(path, "symbol path");
    }

    @Override
    public int compareTo(Symbol other) {
        return ORDER.compare(this, other);
    }
}
