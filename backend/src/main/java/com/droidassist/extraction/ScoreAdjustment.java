package com.droidassist.extraction;

import lombok.Value;

/**
 * One signed contribution to a candidate's score, with its explanation.
 */
@Value
public class ScoreAdjustment {

    int delta;
    String reason;

    public static ScoreAdjustment of(int delta, String reason) {
        return new ScoreAdjustment(delta, reason);
    }

    @Override
    public String toString() {
        return (delta >= 0 ? "+" : "") + delta + " " + reason;
    }
}
