package com.shardindex.core.fuzzy;

import lombok.Value;

import java.util.Comparator;

/**
 * Total order of match quality: kind rank first, then score. Greater is better.
 */
@Value
public class RankKey implements Comparable<RankKey> {
    private static final Comparator<RankKey> ORDER = Comparator
            .comparingInt(RankKey::getKindRank)
            .thenComparingInt(RankKey::getScore);

    int kindRank;
    int score;

    @Override
    public int compareTo(RankKey other) {
        return ORDER.compare(this, other);
    }
}
