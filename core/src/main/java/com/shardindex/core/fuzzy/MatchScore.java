package com.shardindex.core.fuzzy;

import lombok.Value;

@Value
public class MatchScore {
    MatchKind kind;
    int score;

    public RankKey rankKey() {
        return new RankKey(kind.rank(), score);
    }
}
