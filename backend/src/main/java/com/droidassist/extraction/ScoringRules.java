package com.droidassist.extraction;

import java.util.ArrayList;
import java.util.List;

/**
 * The default rule set, in evaluation order.
 */
public final class ScoringRules {

    public static final int UNIT_IN_TEXT_BONUS = 100;
    public static final int ADJACENT_UNIT_BONUS = 80;
    public static final int ADJACENT_UNIT_DECAY = 20;
    public static final int NO_UNIT_PENALTY = -40;

    public static final int CONTEXT_WINDOW = 3;
    public static final int HIGH_KEYWORD_BASE = 150;
    public static final int HIGH_KEYWORD_DECAY = 30;
    public static final int HIGH_KEYWORD_FLOOR = 30;
    public static final int MEDIUM_KEYWORD_BASE = 60;
    public static final int MEDIUM_KEYWORD_DECAY = 15;
    public static final int MEDIUM_KEYWORD_FLOOR = 10;
    public static final int NEGATIVE_KEYWORD_PENALTY = -50;

    public static final int TOP_REGION_BONUS = 40;
    public static final int PLAUSIBLE_BONUS = 15;
    public static final int IMPLAUSIBLE_PENALTY = -30;

    /**
     * Most a number without a unit of its own can collect: a borrowed unit, the best keyword
     * tier in every neighbour of the context window, the top region and plausibility.
     */
    static final int MAX_UNITLESS_SCORE = ADJACENT_UNIT_BONUS + maxKeywordContext() + TOP_REGION_BONUS + PLAUSIBLE_BONUS;

    /**
     * Least a token with its unit written in it scores when no negative keyword surrounds it.
     */
    static final int MIN_CLEAN_UNIT_SCORE = UNIT_IN_TEXT_BONUS + IMPLAUSIBLE_PENALTY;

    /**
     * Lifts a token with its own unit and a clean context above any unitless number.
     */
    public static final int CLEAN_UNIT_DOMINANCE = MAX_UNITLESS_SCORE - MIN_CLEAN_UNIT_SCORE + 1;

    private ScoringRules() {
    }

    public static List<ScoringRule> defaults(ValueKind kind, PlausibilityPolicy policy, int topRegionSize) {
        return List.of(
            unitAttachment(),
            keywordContext(KeywordProfile.defaultsFor(kind)),
            cleanUnitDominance(KeywordProfile.defaultsFor(kind)),
            topRegion(topRegionSize),
            plausibility(policy));
    }

    /**
     * Rewards a unit written in the token, less so one borrowed from a neighbour, and
     * penalizes a number with no unit in reach.
     */
    public static ScoringRule unitAttachment() {
        return ctx -> {
            if (ctx.getUnitDistance() == 0) {
                return List.of(ScoreAdjustment.of(UNIT_IN_TEXT_BONUS, "unit in text"));
            }
            if (ctx.hasUnit()) {
                int bonus = ADJACENT_UNIT_BONUS - ADJACENT_UNIT_DECAY * (ctx.getUnitDistance() - 1);
                return List.of(ScoreAdjustment.of(bonus,
                    "unit " + ctx.getUnit().getSymbol() + " at distance " + ctx.getUnitDistance()));
            }
            return List.of(ScoreAdjustment.of(NO_UNIT_PENALTY, "no unit nearby"));
        };
    }

    /**
     * Keyword signals from the element itself and its neighbours within {@link #CONTEXT_WINDOW}.
     * Each element contributes its best positive tier once; every negative keyword counts.
     */
    public static ScoringRule keywordContext(KeywordProfile profile) {
        return ctx -> {
            List<ScoreAdjustment> adjustments = new ArrayList<>();
            List<TextElement> elements = ctx.getElements();
            int from = Math.max(0, ctx.getPosition() - CONTEXT_WINDOW);
            int to = Math.min(elements.size() - 1, ctx.getPosition() + CONTEXT_WINDOW);
            for (int i = from; i <= to; i++) {
                String text = elements.get(i).getText();
                int distance = Math.abs(i - ctx.getPosition());
                profile.firstHigh(text).ifPresentOrElse(
                    keyword -> adjustments.add(ScoreAdjustment.of(
                        decayed(HIGH_KEYWORD_BASE, HIGH_KEYWORD_DECAY, HIGH_KEYWORD_FLOOR, distance),
                        "keyword " + keyword + " at distance " + distance)),
                    () -> profile.firstMedium(text).ifPresent(keyword -> adjustments.add(ScoreAdjustment.of(
                        decayed(MEDIUM_KEYWORD_BASE, MEDIUM_KEYWORD_DECAY, MEDIUM_KEYWORD_FLOOR, distance),
                        "related " + keyword + " at distance " + distance))));
                for (String keyword : profile.negativesIn(text)) {
                    adjustments.add(ScoreAdjustment.of(NEGATIVE_KEYWORD_PENALTY,
                        "negative " + keyword + " at distance " + distance));
                }
            }
            return adjustments;
        };
    }

    /**
     * A number written with its unit and no negative keyword within {@link #CONTEXT_WINDOW}
     * outranks every unitless number, however many labels sit next to those.
     */
    public static ScoringRule cleanUnitDominance(KeywordProfile profile) {
        return ctx -> {
            if (ctx.getUnitDistance() != 0 || hasNegativeContext(ctx, profile)) {
                return List.of();
            }
            return List.of(ScoreAdjustment.of(CLEAN_UNIT_DOMINANCE, "unit in text, clean context"));
        };
    }

    public static ScoringRule topRegion(int topRegionSize) {
        return ctx -> ctx.getPosition() < topRegionSize
            ? List.of(ScoreAdjustment.of(TOP_REGION_BONUS, "top of screen"))
            : List.of();
    }

    /**
     * Range check on the unit-normalized value. A unitless number is judged in its kind's default unit.
     */
    public static ScoringRule plausibility(PlausibilityPolicy policy) {
        return ctx -> policy.isPlausible(ctx.getToken().getValue(), ctx.getUnit())
            ? List.of(ScoreAdjustment.of(PLAUSIBLE_BONUS, "plausible amount"))
            : List.of(ScoreAdjustment.of(IMPLAUSIBLE_PENALTY, "implausible amount"));
    }

    private static boolean hasNegativeContext(CandidateContext ctx, KeywordProfile profile) {
        List<TextElement> elements = ctx.getElements();
        int from = Math.max(0, ctx.getPosition() - CONTEXT_WINDOW);
        int to = Math.min(elements.size() - 1, ctx.getPosition() + CONTEXT_WINDOW);
        for (int i = from; i <= to; i++) {
            if (!profile.negativesIn(elements.get(i).getText()).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    // A bare number is its element's whole text, so only neighbours carry keywords.
    private static int maxKeywordContext() {
        int total = 0;
        for (int distance = 1; distance <= CONTEXT_WINDOW; distance++) {
            total += 2 * decayed(HIGH_KEYWORD_BASE, HIGH_KEYWORD_DECAY, HIGH_KEYWORD_FLOOR, distance);
        }
        return total;
    }

    static int decayed(int base, int decay, int floor, int distance) {
        return Math.max(base - decay * distance, floor);
    }
}
