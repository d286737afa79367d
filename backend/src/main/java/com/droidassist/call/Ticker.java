package com.droidassist.call;

/**
 * Monotonic time source, in nanoseconds.
 */
@FunctionalInterface
public interface Ticker {

    long read();

    static Ticker system() {
        return System::nanoTime;
    }
}
