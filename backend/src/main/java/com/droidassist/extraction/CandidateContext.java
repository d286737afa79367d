package com.droidassist.extraction;

import lombok.Value;

import java.util.List;

/**
 * Everything a scoring rule may look at for one candidate.
 */
@Value
public class CandidateContext {

    NumberToken token;
    /** Position of the source element in the dump, 0-based */
    int position;
    List<TextElement> elements;
    ValueKind kind;
    /** Unit resolved from the token itself or a neighbouring unit element */
    ValueUnit unit;
    /** 0 when the unit is inside the token, the element distance when borrowed, -1 when absent */
    int unitDistance;

    public TextElement getElement() {
        return elements.get(position);
    }

    public boolean hasUnit() {
        return unitDistance >= 0;
    }
}
