package com.shardindex.core.fuzzy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TrigramIndexTest {

    private final TrigramIndex index = TrigramIndex.build(List.of("HashMap", "FooBar", "hashCode"));

    @Test
    @DisplayName("Candidates contain every query trigram, ignoring ASCII case")
    void testCaseFoldedLookup() {
        assertArrayEquals(new int[]{0, 2}, index.candidates("Hash"));
        assertArrayEquals(new int[]{0, 2}, index.candidates("HASH"));
        assertArrayEquals(new int[]{1}, index.candidates("oba"));
    }

    @Test
    @DisplayName("Trigrams missing from the index are skipped")
    void testUnknownTrigramsSkipped() {
        assertArrayEquals(new int[]{0, 2}, index.candidates("hashzz"));
    }

    @Test
    @DisplayName("Queries without indexed trigrams have no candidates")
    void testNoCandidates() {
        assertEquals(0, index.candidates("ha").length);
        assertEquals(0, index.candidates("zzz").length);
        assertEquals(0, index.candidates("").length);
    }

    @Test
    @DisplayName("Intersection narrows to names holding all trigrams")
    void testIntersection() {
        assertArrayEquals(new int[]{0}, index.candidates("shMa"));
    }

    @Test
    void testTrigramsAreSortedAndUnique() {
        int[] trigrams = TrigramIndex.trigrams("aaaaa".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, trigrams.length);
        assertEquals('a' << 16 | 'a' << 8 | 'a', trigrams[0]);
    }
}
