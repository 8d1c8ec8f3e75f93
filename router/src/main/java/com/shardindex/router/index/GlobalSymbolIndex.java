package com.shardindex.router.index;

import com.shardindex.core.fuzzy.FuzzyMatcher;
import com.shardindex.core.fuzzy.MatchScore;
import com.shardindex.core.fuzzy.RankKey;
import com.shardindex.core.fuzzy.TrigramIndex;
import com.shardindex.core.model.ShardIndex;
import com.shardindex.core.model.Symbol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Merged, searchable view of every shard's symbols.
 * <p>
 * Immutable: a change to any shard builds a new instance that replaces the old one wholesale.
 * Symbols are sorted by {@code (name, path)} without duplicates; a symbol's position is its id.
 * </p>
 */
public final class GlobalSymbolIndex {
    /**
     * Most symbols scored when neither the trigram index nor the first-byte bucket yields
     * candidates.
     */
    public static final int FULL_SCAN_CAP = 50_000;

    private static final int[] NO_IDS = new int[0];
    private static final GlobalSymbolIndex EMPTY = new GlobalSymbolIndex(List.of());
    private static final FuzzyMatcher MATCHER = new FuzzyMatcher();

    private static final Comparator<Scored> RANKING = Comparator
            .comparing((Scored s) -> s.rank, Comparator.reverseOrder())
            .thenComparingInt(s -> s.symbol.getName().length())
            .thenComparing(s -> s.symbol.getName())
            .thenComparing(s -> s.symbol.getPath())
            .thenComparingInt(s -> s.id);

    private final List<Symbol> symbols;
    private final TrigramIndex trigrams;
    private final int[][] prefixBuckets;

    private GlobalSymbolIndex(List<Symbol> sortedUnique) {
        this.symbols = sortedUnique;
        List<String> names = new ArrayList<>(sortedUnique.size());
        for (Symbol symbol : sortedUnique) {
            names.add(symbol.getName());
        }
        this.trigrams = TrigramIndex.build(names);
        this.prefixBuckets = buildBuckets(names);
    }

    public static GlobalSymbolIndex empty() {
        return EMPTY;
    }

    /**
     * Builds the index from the shards' symbol lists, in the iteration order of {@code shards}.
     */
    public static GlobalSymbolIndex build(Collection<ShardIndex> shards) {
        List<Symbol> all = new ArrayList<>();
        for (ShardIndex shard : shards) {
            all.addAll(shard.getSymbols());
        }
        return of(all);
    }

    public static GlobalSymbolIndex of(List<Symbol> symbols) {
        if (symbols.isEmpty()) {
            return EMPTY;
        }
        List<Symbol> sorted = new ArrayList<>(symbols);
        sorted.sort(null);
        List<Symbol> unique = new ArrayList<>(sorted.size());
        for (Symbol symbol : sorted) {
            if (unique.isEmpty() || !unique.get(unique.size() - 1).equals(symbol)) {
                unique.add(symbol);
            }
        }
        return new GlobalSymbolIndex(List.copyOf(unique));
    }

    public int size() {
        return symbols.size();
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    /**
     * Best matches for {@code query}, best first.
     * <p>
     * An empty query returns the first {@code limit} symbols in index order. Queries shorter than
     * three bytes take candidates from the first-byte bucket; longer ones from the trigram index,
     * falling back to the bucket. With neither, at most {@link #FULL_SCAN_CAP} symbols are scanned.
     * </p>
     */
    public List<Symbol> search(String query, int limit) {
        if (limit <= 0 || symbols.isEmpty()) {
            return List.of();
        }
        if (query.isEmpty()) {
            return symbols.subList(0, Math.min(limit, symbols.size()));
        }

        byte[] queryBytes = query.getBytes(StandardCharsets.UTF_8);
        int[] candidates = queryBytes.length < 3 ? NO_IDS : trigrams.candidates(query);
        if (candidates.length == 0) {
            candidates = prefixBuckets[bucketOf(queryBytes[0])];
        }

        List<Scored> scored = new ArrayList<>();
        if (candidates.length == 0) {
            int scan = Math.min(symbols.size(), FULL_SCAN_CAP);
            for (int id = 0; id < scan; id++) {
                score(queryBytes, id, scored);
            }
        } else {
            for (int id : candidates) {
                score(queryBytes, id, scored);
            }
        }

        scored.sort(RANKING);
        List<Symbol> out = new ArrayList<>(Math.min(limit, scored.size()));
        for (int i = 0; i < scored.size() && i < limit; i++) {
            out.add(scored.get(i).symbol);
        }
        return out;
    }

    private void score(byte[] query, int id, List<Scored> out) {
        Symbol symbol = symbols.get(id);
        Optional<MatchScore> score = MATCHER.score(query, symbol.getName().getBytes(StandardCharsets.UTF_8));
        score.ifPresent(s -> out.add(new Scored(id, symbol, s.rankKey())));
    }

    private static int[][] buildBuckets(List<String> names) {
        int[] counts = new int[256];
        byte[][] firstBytes = new byte[names.size()][];
        for (int id = 0; id < names.size(); id++) {
            byte[] bytes = names.get(id).getBytes(StandardCharsets.UTF_8);
            firstBytes[id] = bytes;
            if (bytes.length > 0) {
                counts[bucketOf(bytes[0])]++;
            }
        }
        int[][] buckets = new int[256][];
        for (int b = 0; b < 256; b++) {
            buckets[b] = counts[b] == 0 ? NO_IDS : new int[counts[b]];
        }
        int[] fill = new int[256];
        for (int id = 0; id < firstBytes.length; id++) {
            if (firstBytes[id].length > 0) {
                int b = bucketOf(firstBytes[id][0]);
                buckets[b][fill[b]++] = id;
            }
        }
        return buckets;
    }

    private static int bucketOf(byte first) {
        int b = first & 0xFF;
        return b >= 'A' && b <= 'Z' ? b + ('a' - 'A') : b;
    }

    @Override
    public String toString() {
        return "GlobalSymbolIndex{symbols=" + symbols.size() + ", trigrams=" + trigrams.size()
                + ", buckets=" + Arrays.stream(prefixBuckets).filter(ids -> ids.length > 0).count() + "}";
    }

    private static final class Scored {
        final int id;
        final Symbol symbol;
        final RankKey rank;

        Scored(int id, Symbol symbol, RankKey rank) {
            this.id = id;
            this.symbol = symbol;
            this.rank = rank;
        }
    }
}
