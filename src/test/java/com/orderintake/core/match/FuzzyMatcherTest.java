package com.orderintake.core.match;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuzzyMatcherTest {

    @Test
    void ordersByScoreThenCandidateOrder() {
        Map<String, Double> scores = Map.of("a", 0.7, "b", 0.9, "c", 0.7, "d", 0.2);
        FuzzyMatcher matcher = new FuzzyMatcher((word, candidate) -> scores.get(candidate));

        List<String> matches = matcher.closeMatches("x", List.of("a", "b", "c", "d"), 5, 0.6);

        assertEquals(List.of("b", "a", "c"), matches);
    }

    @Test
    void respectsLimitAndCutoff() {
        FuzzyMatcher matcher = FuzzyMatcher.lcsRatio();
        List<String> candidates = List.of("Widget Basic", "SuperWidget", "Gadget Pro");

        assertEquals(List.of("SuperWidget"), matcher.closeMatches("Widget", candidates, 1, 0.6));
        assertEquals(List.of("SuperWidget", "Widget Basic"), matcher.closeMatches("Widget", candidates, 5, 0.6));
        assertTrue(matcher.closeMatches("Widget", candidates, 0, 0.6).isEmpty());
        assertTrue(matcher.closeMatches("zzz", candidates, 3, 0.6).isEmpty());
    }

    @Test
    void bestMatchReturnsTopCandidate() {
        FuzzyMatcher matcher = FuzzyMatcher.lcsRatio();

        assertEquals("Gadget Pro", matcher.bestMatch("gadget pr", List.of("Widget Basic", "Gadget Pro"), 0.8).orElseThrow());
        assertTrue(matcher.bestMatch("lamp shade", List.of("Widget Basic", "Gadget Pro"), 0.8).isEmpty());
    }
}
