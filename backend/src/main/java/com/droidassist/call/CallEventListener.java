package com.droidassist.call;

@FunctionalInterface
public interface CallEventListener {

    CallEventListener NONE = event -> { };

    void onCallEvent(CallEvent event);
}
