package com.droidassist.extraction;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ranks the numeric tokens of a text dump as answers for a value kind.
 *
 * Each token becomes a candidate whose score is the fold of a fixed rule list
 * over its context. Ranking is by descending score, ties going to the smaller
 * screenIndex. The scorer holds no mutable state; the same input always gives
 * the same ranking.
 */
@Slf4j
public class CandidateScorer {

    /** Maximum distance at which a standalone unit element is attached to a bare number */
    public static final int UNIT_WINDOW = 2;

    private static final Comparator<ValueCandidate> RANKING = Comparator
        .comparingInt(ValueCandidate::getScore).reversed()
        .thenComparingInt(ValueCandidate::getSourceIndex);

    private final Map<ValueKind, List<ScoringRule>> rules;

    public CandidateScorer(Map<ValueKind, List<ScoringRule>> rules) {
        EnumMap<ValueKind, List<ScoringRule>> copy = new EnumMap<>(ValueKind.class);
        rules.forEach((kind, list) -> copy.put(kind, List.copyOf(list)));
        for (ValueKind kind : ValueKind.values()) {
            if (!copy.containsKey(kind)) {
                throw new IllegalArgumentException("No scoring rules for " + kind);
            }
        }
        this.rules = copy;
    }

    public static CandidateScorer withDefaultRules(PlausibilityPolicy policy, int topRegionSize) {
        Map<ValueKind, List<ScoringRule>> rules = new EnumMap<>(ValueKind.class);
        for (ValueKind kind : ValueKind.values()) {
            rules.put(kind, ScoringRules.defaults(kind, policy, topRegionSize));
        }
        return new CandidateScorer(rules);
    }

    /**
     * All candidates for {@code kind}, best first. Empty when no element holds a number.
     */
    public List<ValueCandidate> rank(List<TextElement> elements, ValueKind kind) {
        List<ValueCandidate> candidates = new ArrayList<>();
        for (int position = 0; position < elements.size(); position++) {
            TextElement element = elements.get(position);
            for (NumberToken token : NumberTokenizer.tokenize(element.getText(), kind)) {
                candidates.add(score(contextFor(token, position, elements, kind)));
            }
        }
        candidates.sort(RANKING);
        if (log.isDebugEnabled()) {
            candidates.forEach(c -> log.debug("{} candidate {} (index {}) scored {}: {}",
                kind, c.getRawText(), c.getSourceIndex(), c.getScore(), c.getReasons()));
        }
        return candidates;
    }

    /**
     * The top candidate, only when its score is strictly positive.
     */
    public Optional<ValueCandidate> best(List<TextElement> elements, ValueKind kind) {
        List<ValueCandidate> ranked = rank(elements, kind);
        if (ranked.isEmpty() || !ranked.get(0).isAcceptable()) {
            return Optional.empty();
        }
        return Optional.of(ranked.get(0));
    }

    private ValueCandidate score(CandidateContext context) {
        ValueCandidate.ValueCandidateBuilder builder = ValueCandidate.builder()
            .rawText(context.getToken().getRawText())
            .amountText(context.getToken().getAmountText())
            .numericValue(context.getToken().getValue())
            .unit(context.getUnit())
            .sourceIndex(context.getElement().getScreenIndex())
            .sourceText(context.getElement().getText());
        int total = 0;
        for (ScoringRule rule : rules.get(context.getKind())) {
            for (ScoreAdjustment adjustment : rule.evaluate(context)) {
                total += adjustment.getDelta();
                builder.reason(adjustment.toString());
            }
        }
        return builder.score(total).build();
    }

    private static CandidateContext contextFor(NumberToken token, int position,
                                               List<TextElement> elements, ValueKind kind) {
        if (token.isSelfContained()) {
            return new CandidateContext(token, position, elements, kind, token.getUnit(), 0);
        }
        for (int distance = 1; distance <= UNIT_WINDOW; distance++) {
            for (int neighbour : new int[] {position + distance, position - distance}) {
                if (neighbour < 0 || neighbour >= elements.size()) {
                    continue;
                }
                Optional<ValueUnit> unit = ValueUnit.fromToken(elements.get(neighbour).getText())
                    .filter(u -> u.getKind() == kind);
                if (unit.isPresent()) {
                    return new CandidateContext(token, position, elements, kind, unit.get(), distance);
                }
            }
        }
        return new CandidateContext(token, position, elements, kind, defaultUnit(kind), -1);
    }

    private static ValueUnit defaultUnit(ValueKind kind) {
        return kind == ValueKind.CURRENCY ? ValueUnit.CURRENCY : ValueUnit.DATA_MB;
    }
}
