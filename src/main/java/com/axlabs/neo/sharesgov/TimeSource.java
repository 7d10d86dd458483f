package com.axlabs.neo.sharesgov;

/**
 * The logical clock of the engine. All voting windows, deadlines and unlock times are compared against it.
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * @return the current time in milliseconds.
     */
    long getTime();

    static TimeSource system() {
        return System::currentTimeMillis;
    }
}
