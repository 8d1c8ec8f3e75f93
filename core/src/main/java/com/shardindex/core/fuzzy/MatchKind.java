package com.shardindex.core.fuzzy;

/**
 * How a query matched a candidate. Higher rank sorts first.
 */
public enum MatchKind {
    FUZZY(1),
    PREFIX(2);

    private final int rank;

    MatchKind(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
