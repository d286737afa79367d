package com.droidassist.extraction;

import lombok.Builder;
import lombok.Value;

/**
 * Accepted answer of an extraction.
 */
@Value
@Builder
public class ExtractedValue {

    double value;
    ValueUnit unit;
    /** Value in the kind's base unit: yuan, or megabytes for data */
    double normalizedValue;
    String displayText;
    String sourceText;
    int sourceIndex;
    int score;

    public static ExtractedValue from(ValueCandidate candidate) {
        return ExtractedValue.builder()
            .value(candidate.getNumericValue())
            .unit(candidate.getUnit())
            .normalizedValue(candidate.getUnit().toBase(candidate.getNumericValue()))
            .displayText(candidate.displayText())
            .sourceText(candidate.getSourceText())
            .sourceIndex(candidate.getSourceIndex())
            .score(candidate.getScore())
            .build();
    }
}
