package com.shardindex.core.fuzzy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuzzyMatcherTest {

    private final FuzzyMatcher matcher = new FuzzyMatcher();

    // ========== Prefix Tests ==========

    @Test
    @DisplayName("Empty query matches everything as a zero-score prefix")
    void testEmptyQuery() {
        Optional<MatchScore> score = matcher.score("", "Anything");

        assertTrue(score.isPresent());
        assertEquals(MatchKind.PREFIX, score.get().getKind());
        assertEquals(0, score.get().getScore());
    }

    @Test
    @DisplayName("Case-insensitive prefix scores by name length")
    void testPrefixIgnoresCase() {
        MatchScore lower = matcher.score("foo", "foobar").orElseThrow();
        MatchScore upper = matcher.score("FOO", "foobar").orElseThrow();

        assertEquals(MatchKind.PREFIX, lower.getKind());
        assertEquals(FuzzyMatcher.PREFIX_BASE - 6, lower.getScore());
        assertEquals(lower, upper, "Prefix score must not depend on case");
    }

    @Test
    @DisplayName("Shorter names rank higher among prefix matches")
    void testShorterPrefixWins() {
        RankKey shortName = matcher.score("map", "Map").orElseThrow().rankKey();
        RankKey longName = matcher.score("map", "MapEntry").orElseThrow().rankKey();

        assertTrue(shortName.compareTo(longName) > 0);
    }

    // ========== Fuzzy Tests ==========

    @Test
    @DisplayName("Prefix match outranks a fuzzy match")
    void testPrefixBeatsFuzzy() {
        RankKey prefix = matcher.score("foo", "foobar").orElseThrow().rankKey();
        MatchScore fuzzy = matcher.score("foo", "barfoo").orElseThrow();

        assertEquals(MatchKind.FUZZY, fuzzy.getKind());
        assertTrue(prefix.compareTo(fuzzy.rankKey()) > 0);
    }

    @Test
    @DisplayName("Acronym query prefers word starts")
    void testAcronymMatch() {
        MatchScore camel = matcher.score("fb", "FooBar").orElseThrow();
        MatchScore flat = matcher.score("fb", "foobar").orElseThrow();

        assertEquals(MatchKind.FUZZY, camel.getKind());
        assertEquals(MatchKind.FUZZY, flat.getKind());
        assertEquals(46, camel.getScore());
        assertEquals(35, flat.getScore());
        assertTrue(camel.rankKey().compareTo(flat.rankKey()) >= 0,
                "FooBar should rank at least as high as foobar for 'fb'");
    }

    @Test
    @DisplayName("Consecutive matches beat scattered ones")
    void testConsecutiveBonus() {
        int run = matcher.score("ar", "xbarx").orElseThrow().getScore();
        int scattered = matcher.score("ar", "xaxrx").orElseThrow().getScore();

        assertTrue(run > scattered, String.format("run=%d scattered=%d", run, scattered));
    }

    @Test
    @DisplayName("No subsequence means no match")
    void testNoMatch() {
        assertFalse(matcher.score("xyz", "foobar").isPresent());
        assertFalse(matcher.score("ba", "ab").isPresent());
        assertFalse(matcher.score("longer", "long").isPresent());
    }

    @Test
    @DisplayName("Word starts follow separators, case changes and digit boundaries")
    void testWordStarts() {
        byte[] snake = "foo_bar".getBytes(StandardCharsets.UTF_8);
        byte[] mixed = "Foo2Bar".getBytes(StandardCharsets.UTF_8);
        byte[] generic = "List<Item>".getBytes(StandardCharsets.UTF_8);

        assertTrue(FuzzyMatcher.isWordStart(snake, 0));
        assertTrue(FuzzyMatcher.isWordStart(snake, 4));
        assertFalse(FuzzyMatcher.isWordStart(snake, 5));
        assertTrue(FuzzyMatcher.isWordStart(mixed, 3), "letter to digit");
        assertTrue(FuzzyMatcher.isWordStart(mixed, 4), "digit to letter");
        assertFalse(FuzzyMatcher.isWordStart(mixed, 1));
        assertTrue(FuzzyMatcher.isWordStart(generic, 5));
    }
}
