package com.jobtrail.dedup.tracking.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TextSimilarityTest {

    @Test
    void levenshteinCountsEdits() {
        assertEquals(3, TextSimilarity.levenshtein("kitten", "sitting"));
        assertEquals(0, TextSimilarity.levenshtein("same", "same"));
        assertEquals(4, TextSimilarity.levenshtein("", "four"));
    }

    @Test
    void similarityIsNormalizedByLongerInput() {
        assertEquals(1.0, TextSimilarity.normalizedEditSimilarity("data analyst", "data analyst"), 1e-9);
        assertEquals(1.0 - 3.0 / 7.0, TextSimilarity.normalizedEditSimilarity("kitten", "sitting"), 1e-9);
        assertEquals(0.0, TextSimilarity.normalizedEditSimilarity("", "analyst"), 1e-9);
        assertEquals(0.0, TextSimilarity.normalizedEditSimilarity(null, "analyst"), 1e-9);
    }

    @Test
    void tokenSimilarityComparesWordByWord() {
        assertEquals(
            1.0 - 1.0 / 12.0,
            TextSimilarity.tokenEditSimilarity(List.of("data", "enginer"), List.of("data", "engineer"), 0.7),
            1e-9
        );
        assertEquals(
            0.0,
            TextSimilarity.tokenEditSimilarity(List.of("registered", "nurse", "icu"), List.of("registered", "nurse", "er"), 0.7),
            1e-9
        );
        assertEquals(0.0, TextSimilarity.tokenEditSimilarity(List.of("data"), List.of("data", "analyst"), 0.7), 1e-9);
        assertEquals(0.0, TextSimilarity.tokenEditSimilarity(List.of(), List.of(), 0.7), 1e-9);
    }
}
