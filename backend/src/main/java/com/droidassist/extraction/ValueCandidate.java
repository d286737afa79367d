package com.droidassist.extraction;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A scored numeric token. Lives only for the duration of one extraction call.
 */
@Value
@Builder
public class ValueCandidate {

    String rawText;
    String amountText;
    double numericValue;
    ValueUnit unit;
    /** screenIndex of the element the token came from */
    int sourceIndex;
    String sourceText;
    int score;
    @Singular
    List<String> reasons;

    public boolean isAcceptable() {
        return score > 0;
    }

    public String displayText() {
        return amountText + unit.getSymbol();
    }
}
