package com.droidassist.extraction;

import java.util.List;

/**
 * A scoring signal. Rules are stateless; the scorer folds every rule's
 * adjustments into the candidate's total in rule order.
 */
@FunctionalInterface
public interface ScoringRule {

    List<ScoreAdjustment> evaluate(CandidateContext context);
}
