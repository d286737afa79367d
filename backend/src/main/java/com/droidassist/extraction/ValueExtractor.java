package com.droidassist.extraction;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure extraction of a balance or data allowance from a text dump.
 *
 * Candidates are unit-normalized before the plausibility check, so "2048MB"
 * and "2GB" are judged against the same policy. No candidate, or only
 * candidates with a non-positive score, is reported as an empty result.
 * An input that breaks the dump invariants (null texts, screen indices not
 * strictly increasing) is rejected with {@link IllegalArgumentException}.
 */
public class ValueExtractor {

    private final CandidateScorer scorer;

    public ValueExtractor(CandidateScorer scorer) {
        this.scorer = scorer;
    }

    public ValueExtractor(PlausibilityPolicy policy, int topRegionSize) {
        this(CandidateScorer.withDefaultRules(policy, topRegionSize));
    }

    public Optional<ExtractedValue> extract(List<TextElement> elements, ValueKind kind) {
        validate(elements, kind);
        return scorer.best(elements, kind).map(ExtractedValue::from);
    }

    /**
     * Full ranking, for diagnostics.
     */
    public List<ValueCandidate> rank(List<TextElement> elements, ValueKind kind) {
        validate(elements, kind);
        return scorer.rank(elements, kind);
    }

    static void validate(List<TextElement> elements, ValueKind kind) {
        Objects.requireNonNull(kind, "kind");
        if (elements == null) {
            throw new IllegalArgumentException("Element list is required");
        }
        int previous = Integer.MIN_VALUE;
        for (TextElement element : elements) {
            if (element == null) {
                throw new IllegalArgumentException("Element list contains null");
            }
            if (element.getScreenIndex() <= previous) {
                throw new IllegalArgumentException(
                    "screenIndex must strictly increase, got " + element.getScreenIndex() + " after " + previous);
            }
            previous = element.getScreenIndex();
        }
    }
}
