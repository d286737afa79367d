package com.droidassist.extraction;

import lombok.Value;

/**
 * A number found inside one element, with the unit it was written with (if any).
 */
@Value
public class NumberToken {

    /** Matched text, e.g. "66.60元" or "2.5" */
    String rawText;
    /** Numeric part as written, without grouping separators */
    String amountText;
    double value;
    /** Unit written inside the same element; null for a bare number */
    ValueUnit unit;

    public boolean isSelfContained() {
        return unit != null;
    }
}
