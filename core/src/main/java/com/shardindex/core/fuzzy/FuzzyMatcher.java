package com.shardindex.core.fuzzy;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Scores a query against a symbol name.
 * <p>
 * A case-insensitive prefix match always wins ({@link MatchKind#PREFIX}, shorter names first).
 * Otherwise the query must be an ordered subsequence of the name; the best alignment is found
 * by dynamic programming over UTF-8 bytes and rewards word starts (so {@code fb} finds
 * {@code FooBar}), consecutive runs and exact case, and charges for skipped bytes.
 * </p>
 * Stateless and thread-safe.
 */
public final class FuzzyMatcher {
    static final int PREFIX_BASE = 1_000_000;
    static final int MATCH = 10;
    static final int WORD_START_BONUS = 15;
    static final int CONSECUTIVE_BONUS = 5;
    static final int EXACT_CASE_BONUS = 2;
    static final int GAP_PENALTY = 1;
    static final int LEADING_PENALTY = 1;
    static final int TRAILING_PENALTY = 1;

    private static final int MIN_SCORE = Integer.MIN_VALUE / 4;
    private static final int UNREACHABLE = MIN_SCORE / 2;

    public Optional<MatchScore> score(String query, String candidate) {
        return score(query.getBytes(StandardCharsets.UTF_8), candidate.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<MatchScore> score(byte[] query, byte[] candidate) {
        if (query.length == 0) {
            return Optional.of(new MatchScore(MatchKind.PREFIX, 0));
        }
        if (isPrefixIgnoreCase(query, candidate)) {
            return Optional.of(new MatchScore(MatchKind.PREFIX, PREFIX_BASE - candidate.length));
        }
        if (query.length > candidate.length) {
            return Optional.empty();
        }
        int best = subsequenceScore(query, candidate);
        if (best <= UNREACHABLE) {
            return Optional.empty();
        }
        return Optional.of(new MatchScore(MatchKind.FUZZY, best));
    }

    private static int subsequenceScore(byte[] query, byte[] candidate) {
        int n = candidate.length;
        int[] prev = new int[n];
        int[] cur = new int[n];

        for (int j = 0; j < n; j++) {
            prev[j] = sameIgnoreCase(query[0], candidate[j])
                    ? MATCH + bonus(query[0], candidate, j) - LEADING_PENALTY * j
                    : MIN_SCORE;
        }

        for (int i = 1; i < query.length; i++) {
            int runningMax = MIN_SCORE;
            for (int j = 0; j < n; j++) {
                if (j > 0 && prev[j - 1] > UNREACHABLE) {
                    runningMax = Math.max(runningMax, prev[j - 1] + GAP_PENALTY * j);
                }
                cur[j] = MIN_SCORE;
                if (!sameIgnoreCase(query[i], candidate[j])) {
                    continue;
                }
                int best = MIN_SCORE;
                if (runningMax > UNREACHABLE) {
                    best = runningMax - GAP_PENALTY * j;
                }
                if (j > 0 && prev[j - 1] > UNREACHABLE) {
                    best = Math.max(best, prev[j - 1] + CONSECUTIVE_BONUS);
                }
                if (best <= UNREACHABLE) {
                    continue;
                }
                cur[j] = best + MATCH + bonus(query[i], candidate, j);
            }
            int[] swap = prev;
            prev = cur;
            cur = swap;
        }

        int best = MIN_SCORE;
        for (int j = 0; j < n; j++) {
            if (prev[j] > UNREACHABLE) {
                best = Math.max(best, prev[j] - TRAILING_PENALTY * (n - 1 - j));
            }
        }
        return best;
    }

    private static int bonus(byte q, byte[] candidate, int j) {
        int bonus = isWordStart(candidate, j) ? WORD_START_BONUS : 0;
        if (q == candidate[j]) {
            bonus += EXACT_CASE_BONUS;
        }
        return bonus;
    }

    static boolean isWordStart(byte[] s, int j) {
        if (j == 0) {
            return true;
        }
        byte prev = s[j - 1];
        byte cur = s[j];
        if (isSeparator(prev)) {
            return true;
        }
        if (isLower(prev) && isUpper(cur)) {
            return true;
        }
        if (isAlpha(prev) && isDigit(cur)) {
            return true;
        }
        return isDigit(prev) && isAlpha(cur);
    }

    private static boolean isSeparator(byte b) {
        switch (b) {
            case '_':
            case '-':
            case ' ':
            case '/':
            case '\\':
            case '.':
            case ':':
            case '<':
            case '>':
            case '(':
            case ')':
            case '[':
            case ']':
                return true;
            default:
                return false;
        }
    }

    private static boolean isPrefixIgnoreCase(byte[] query, byte[] candidate) {
        if (query.length > candidate.length) {
            return false;
        }
        for (int i = 0; i < query.length; i++) {
            if (!sameIgnoreCase(query[i], candidate[i])) {
                return false;
            }
        }
        return true;
    }

    static boolean sameIgnoreCase(byte a, byte b) {
        return toLower(a) == toLower(b);
    }

    static byte toLower(byte b) {
        return isUpper(b) ? (byte) (b + ('a' - 'A')) : b;
    }

    private static boolean isUpper(byte b) {
        return b >= 'A' && b <= 'Z';
    }

    private static boolean isLower(byte b) {
        return b >= 'a' && b <= 'z';
    }

    private static boolean isAlpha(byte b) {
        return isUpper(b) || isLower(b);
    }

    private static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }
}
