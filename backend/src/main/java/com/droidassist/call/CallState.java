package com.droidassist.call;

/**
 * Telephony state as classified from one poll.
 */
public enum CallState {
    IDLE,
    RINGING,
    /** Off-hook as reported by telephony: a connected or dialling call */
    ACTIVE,
    /** The audio path is in call mode, i.e. a call is connected and talking */
    ANSWERED,
    /** The poll failed, timed out or gave no unambiguous answer */
    UNKNOWN
}
