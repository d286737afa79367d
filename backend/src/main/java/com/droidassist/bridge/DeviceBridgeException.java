package com.droidassist.bridge;

import lombok.Getter;

import java.time.Duration;

/**
 * Failure of a single device bridge invocation.
 */
@Getter
public class DeviceBridgeException extends RuntimeException {

    private final String command;
    private final boolean timedOut;

    public DeviceBridgeException(String command, String message) {
        this(command, message, false, null);
    }

    public DeviceBridgeException(String command, String message, boolean timedOut, Throwable cause) {
        super(message + " [" + command + "]", cause);
        this.command = command;
        this.timedOut = timedOut;
    }

    public static DeviceBridgeException timeout(String command, Duration timeout) {
        return new DeviceBridgeException(command, "Timed out after " + timeout.toMillis() + " ms", true, null);
    }
}
