package com.droidassist.extraction;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CandidateScorer Tests")
class CandidateScorerTest {

    @Test
    @DisplayName("Should require rules for every value kind")
    void shouldRequireRulesForEveryKind() {
        Map<ValueKind, List<ScoringRule>> rules = Map.of(ValueKind.CURRENCY, List.of(ScoringRules.unitAttachment()));

        assertThrows(IllegalArgumentException.class, () -> new CandidateScorer(rules));
    }

    @Test
    @DisplayName("Should score with a custom rule set and record every reason")
    void shouldScoreWithCustomRules() {
        ScoringRule flat = ctx -> List.of(ScoreAdjustment.of(7, "flat"));
        CandidateScorer scorer = new CandidateScorer(Map.of(
            ValueKind.CURRENCY, List.of(flat, flat),
            ValueKind.DATA, List.of(flat)));

        ValueCandidate candidate = scorer.best(TextElement.sequence("¥3"), ValueKind.CURRENCY).orElseThrow();

        assertEquals(14, candidate.getScore());
        assertEquals(List.of("+7 flat", "+7 flat"), candidate.getReasons());
    }

    @Test
    @DisplayName("Should reject a best candidate with zero score")
    void shouldRejectZeroScore() {
        ScoringRule zero = ctx -> List.of();
        CandidateScorer scorer = new CandidateScorer(Map.of(
            ValueKind.CURRENCY, List.of(zero),
            ValueKind.DATA, List.of(zero)));

        assertTrue(scorer.best(TextElement.sequence("¥3"), ValueKind.CURRENCY).isEmpty());
        assertEquals(1, scorer.rank(TextElement.sequence("¥3"), ValueKind.CURRENCY).size());
    }

    @Test
    @DisplayName("Should produce one candidate per unit token in an element")
    void shouldProduceOneCandidatePerToken() {
        CandidateScorer scorer = CandidateScorer.withDefaultRules(PlausibilityPolicy.defaults(), 15);

        List<ValueCandidate> ranked = scorer.rank(TextElement.sequence("国内通用 10GB 定向 1,024MB"), ValueKind.DATA);

        assertEquals(2, ranked.size());
        assertTrue(ranked.stream().anyMatch(c -> c.getNumericValue() == 1024.0 && c.getUnit() == ValueUnit.DATA_MB));
    }
}
