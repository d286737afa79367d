package com.droidassist.extraction;

/**
 * What an extraction is looking for.
 */
public enum ValueKind {
    /** Phone bill balance, in yuan */
    CURRENCY,
    /** Remaining mobile data allowance */
    DATA
}
