package com.droidassist.bridge;

import java.time.Duration;

/**
 * Command-line bridge to a single Android device.
 *
 * Every call is bounded by the supplied timeout and fails with
 * {@link DeviceBridgeException}. The call-control actions are idempotent:
 * hanging up with no call in progress is a no-op on the device.
 */
public interface DeviceBridge {

    /**
     * Raw telephony registry dump (carries mCallState and mCallIncomingNumber)
     */
    String readTelephonyRegistry(Duration timeout);

    /**
     * Raw value of the voice call state system property
     */
    String readCallStateProperty(Duration timeout);

    /**
     * Raw audio service dump, used for the current audio mode
     */
    String readAudioState(Duration timeout);

    void answerCall(Duration timeout);

    void hangUp(Duration timeout);

    void speak(String text, Duration timeout);

    /**
     * uiautomator XML dump of the current screen
     */
    String dumpUiHierarchy(Duration timeout);
}
