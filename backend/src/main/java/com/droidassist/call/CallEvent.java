package com.droidassist.call;

import lombok.Value;

/**
 * A change of telephony state between two consecutive polls.
 */
@Value
public class CallEvent {

    CallState fromState;
    CallState toState;
    /** Monotonic timestamp of the poll that observed the change, in nanoseconds */
    long timestampNanos;

    /**
     * IDLE to RINGING, the only transition that starts a response.
     */
    public boolean isRisingEdge() {
        return fromState == CallState.IDLE && toState == CallState.RINGING;
    }
}
