package com.shardindex.core.fuzzy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable map from ASCII-case-folded byte trigrams to the ids of the names containing them.
 * <p>
 * Ids are the positions in the list the index was built from. Posting lists are sorted and
 * free of duplicates.
 * </p>
 */
public final class TrigramIndex {
    private static final int[] EMPTY = new int[0];

    private final Map<Integer, int[]> postings;

    private TrigramIndex(Map<Integer, int[]> postings) {
        this.postings = postings;
    }

    public static TrigramIndex build(List<String> names) {
        Map<Integer, Postings> building = new HashMap<>();
        for (int id = 0; id < names.size(); id++) {
            byte[] bytes = names.get(id).getBytes(StandardCharsets.UTF_8);
            for (int trigram : trigrams(bytes)) {
                building.computeIfAbsent(trigram, t -> new Postings()).add(id);
            }
        }
        Map<Integer, int[]> frozen = new HashMap<>(building.size() * 2);
        building.forEach((trigram, list) -> frozen.put(trigram, list.toArray()));
        return new TrigramIndex(frozen);
    }

    /**
     * Ids of names that contain every query trigram present in the index.
     * <p>
     * Query trigrams with no postings are skipped. Empty when the query has no trigram or none of
     * its trigrams is indexed.
     * </p>
     */
    public int[] candidates(String query) {
        int[] queryTrigrams = trigrams(query.getBytes(StandardCharsets.UTF_8));
        List<int[]> lists = new ArrayList<>(queryTrigrams.length);
        for (int trigram : queryTrigrams) {
            int[] list = postings.get(trigram);
            if (list != null) {
                lists.add(list);
            }
        }
        if (lists.isEmpty()) {
            return EMPTY;
        }
        lists.sort(Comparator.comparingInt(list -> list.length));
        int[] result = lists.get(0);
        for (int i = 1; i < lists.size() && result.length > 0; i++) {
            result = intersect(result, lists.get(i));
        }
        return result;
    }

    public int size() {
        return postings.size();
    }

    /**
     * Sorted, de-duplicated trigrams of {@code bytes}, each packed as {@code a << 16 | b << 8 | c}.
     */
    static int[] trigrams(byte[] bytes) {
        if (bytes.length < 3) {
            return EMPTY;
        }
        int[] out = new int[bytes.length - 2];
        for (int i = 0; i + 2 < bytes.length; i++) {
            out[i] = pack(bytes[i], bytes[i + 1], bytes[i + 2]);
        }
        Arrays.sort(out);
        int unique = 0;
        for (int i = 0; i < out.length; i++) {
            if (i == 0 || out[i] != out[i - 1]) {
                out[unique++] = out[i];
            }
        }
        return Arrays.copyOf(out, unique);
    }

    private static int pack(byte a, byte b, byte c) {
        return (FuzzyMatcher.toLower(a) & 0xFF) << 16
                | (FuzzyMatcher.toLower(b) & 0xFF) << 8
                | (FuzzyMatcher.toLower(c) & 0xFF);
    }

    private static int[] intersect(int[] a, int[] b) {
        int[] out = new int[Math.min(a.length, b.length)];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < a.length && j < b.length) {
            if (a[i] < b[j]) {
                i++;
            } else if (a[i] > b[j]) {
                j++;
            } else {
                out[k++] = a[i];
                i++;
                j++;
            }
        }
        return Arrays.copyOf(out, k);
    }

    private static final class Postings {
        private int[] ids = new int[4];
        private int size;

        void add(int id) {
            if (size == ids.length) {
                ids = Arrays.copyOf(ids, size * 2);
            }
            ids[size++] = id;
        }

        int[] toArray() {
            return Arrays.copyOf(ids, size);
        }
    }
}
